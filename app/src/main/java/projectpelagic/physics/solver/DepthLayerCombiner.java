package projectpelagic.physics.solver;

import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.exception.DimensionMismatchException;

import java.util.Arrays;
import java.util.List;

/**
 * Operaciones de combinación entre capas de profundidad y de enmascarado del campo.
 */
public final class DepthLayerCombiner {

    private DepthLayerCombiner() {
    }

    /**
     * Producto celda a celda de las verosimilitudes por capa (profundidades como evidencia independiente).
     */
    public static GridLayer product(List<GridLayer> layers) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos una capa para combinar.");
        }
        GridLayer first = layers.get(0);
        int n = first.cellCount();
        double[] acc = new double[n];
        Arrays.fill(acc, 1.0);
        for (GridLayer layer : layers) {
            if (!layer.shape().equals(first.shape())) {
                throw new DimensionMismatchException(first.shape(), layer.shape());
            }
            for (int i = 0; i < n; i++) {
                acc[i] *= layer.getAt(i);
            }
        }
        float[] result = new float[n];
        for (int i = 0; i < n; i++) {
            result[i] = (float) acc[i];
        }
        return new GridLayer(first.nx(), first.ny(), result);
    }

    /**
     * Máscara batimétrica: 1 donde la capa {@code depthIndex} tiene dato, NaN donde no
     * (tierra o fondo más somero que el nivel).
     */
    public static GridLayer bathymetryMask(GridField field, int depthIndex) {
        GridLayer deepest = field.layer(depthIndex);
        float[] mask = new float[deepest.cellCount()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = Float.isNaN(deepest.getAt(i)) ? Float.NaN : 1.0f;
        }
        return new GridLayer(deepest.nx(), deepest.ny(), mask);
    }

    /**
     * Marca como sin dato (NaN), en todas las capas, las celdas cuya máscara es 0 o NaN.
     * Una celda enmascarada acaba siempre con verosimilitud 0.
     */
    public static GridField applyMask(GridField field, GridLayer mask) {
        if (!field.shape().equals(mask.shape())) {
            throw new DimensionMismatchException(field.shape(), mask.shape());
        }
        float[] values = field.toArray();
        int cells = mask.cellCount();
        for (int i = 0; i < cells; i++) {
            float m = mask.getAt(i);
            if (Float.isNaN(m) || m == 0.0f) {
                for (int d = 0; d < field.getLayerCount(); d++) {
                    values[d * cells + i] = Float.NaN;
                }
            }
        }
        return field.withValues(values);
    }
}
