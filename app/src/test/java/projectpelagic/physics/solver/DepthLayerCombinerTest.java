package projectpelagic.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.GridShape;
import projectpelagic.exception.DimensionMismatchException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DepthLayerCombinerTest {

    private static final double[] LON = {0.0, 1.0};
    private static final double[] LAT = {0.0, 1.0};

    @Test
    @DisplayName("Producto celda a celda entre capas")
    void product_multipliesCellwise() {
        GridLayer a = GridLayer.of(new float[][]{{0.5f, 1f}, {0f, 0.2f}});
        GridLayer b = GridLayer.of(new float[][]{{0.5f, 0.3f}, {1f, 0.5f}});

        GridLayer p = DepthLayerCombiner.product(List.of(a, b));

        assertThat(p.get(0, 0)).isEqualTo(0.25f);
        assertThat(p.get(0, 1)).isEqualTo(0.3f);
        assertThat(p.get(1, 0)).isZero();
        assertThat(p.get(1, 1)).isEqualTo(0.1f);
    }

    @Test
    @DisplayName("Capas de distinta forma en el producto lanzan DimensionMismatchException")
    void product_shapeMismatch_throws() {
        GridLayer a = GridLayer.filled(new GridShape(2, 2), 1f);
        GridLayer b = GridLayer.filled(new GridShape(3, 2), 1f);

        assertThatThrownBy(() -> DepthLayerCombiner.product(List.of(a, b)))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("La máscara batimétrica marca como NaN las celdas sin dato en el nivel profundo")
    void bathymetryMask_followsDeepestLayer() {
        GridLayer surface = GridLayer.of(new float[][]{{20f, 21f}, {22f, 23f}});
        GridLayer deep = GridLayer.of(new float[][]{{10f, Float.NaN}, {11f, 12f}});
        GridField field = GridField.ofLayers(LON, LAT, new double[]{0.0, 200.0}, surface, deep);

        GridLayer mask = DepthLayerCombiner.bathymetryMask(field, 1);
        GridField masked = DepthLayerCombiner.applyMask(field, mask);

        assertThat(mask.get(0, 0)).isEqualTo(1f);
        assertThat(mask.get(0, 1)).isNaN();
        assertThat(masked.getValue(0, 0, 1)).isNaN();
        assertThat(masked.getValue(0, 0, 0)).isEqualTo(20f);
    }

    @Test
    @DisplayName("Las celdas con máscara a 0 pasan a NaN en todas las capas")
    void applyMask_zeroCells_becomeMissing() {
        GridField field = GridField.ofLayers(LON, LAT, new double[]{0.0, 10.0},
                GridLayer.filled(new GridShape(2, 2), 5f), GridLayer.filled(new GridShape(2, 2), 4f));
        GridLayer mask = GridLayer.of(new float[][]{{1f, 0f}, {1f, 1f}});

        GridField masked = DepthLayerCombiner.applyMask(field, mask);

        assertThat(masked.getValue(0, 0, 1)).isNaN();
        assertThat(masked.getValue(1, 0, 1)).isNaN();
        assertThat(masked.getValue(1, 1, 1)).isEqualTo(4f);
    }
}
