package projectpelagic.domain.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunGeometryTest {

    private static RunGeometry geometry(double[] lon, double[] lat) {
        return RunGeometry.builder().shape(new GridShape(2, 2)).longitudes(lon).latitudes(lat)
                .aggregationFactor(1).focalWindowSize(3).build();
    }

    @Test
    @DisplayName("Los ejes no se pueden modificar desde fuera, ni por la entrada ni por los accesores")
    void axes_areDefensivelyCopied() {
        // --- 1. Arrange ---
        double[] lon = {-70.0, -69.5};
        double[] lat = {35.0, 35.5};
        RunGeometry geometry = geometry(lon, lat);

        // --- 2. Act ---
        lon[0] = 0.0;
        geometry.longitudes()[0] = -500.0;
        geometry.latitudes()[1] = -500.0;

        // --- 3. Assert ---
        assertThat(geometry.longitudes()).containsExactly(-70.0, -69.5);
        assertThat(geometry.latitudes()).containsExactly(35.0, 35.5);
    }

    @Test
    @DisplayName("Una ventana par o una máscara de otra forma se rechazan")
    void constructor_invalid_throws() {
        assertThatThrownBy(() -> RunGeometry.builder().shape(new GridShape(2, 2))
                .longitudes(new double[]{0, 1}).latitudes(new double[]{0, 1})
                .aggregationFactor(1).focalWindowSize(4).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunGeometry.builder().shape(new GridShape(2, 2))
                .longitudes(new double[]{0, 1}).latitudes(new double[]{0, 1})
                .aggregationFactor(1).focalWindowSize(3)
                .externalMask(GridLayer.zeros(new GridShape(3, 2))).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
