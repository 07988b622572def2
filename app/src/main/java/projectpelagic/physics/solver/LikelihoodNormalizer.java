package projectpelagic.physics.solver;

import projectpelagic.domain.grid.GridLayer;

/**
 * Normalización diaria por el máximo finito.
 */
public final class LikelihoodNormalizer {

    private LikelihoodNormalizer() {
    }

    /**
     * Divide cada celda por el máximo finito de la capa. Las celdas no finitas pasan a 0.
     * Si no existe un máximo finito positivo el resultado es una capa de ceros.
     */
    public static GridLayer normalize(GridLayer layer) {
        float max = layer.finiteMax();
        int n = layer.cellCount();
        float[] result = new float[n];
        if (Float.isNaN(max) || max <= 0.0f) {
            return new GridLayer(layer.nx(), layer.ny(), result);
        }
        for (int i = 0; i < n; i++) {
            float v = layer.getAt(i);
            result[i] = Float.isFinite(v) && v > 0.0f ? v / max : 0.0f;
        }
        return new GridLayer(layer.nx(), layer.ny(), result);
    }
}
