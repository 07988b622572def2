package projectpelagic.physics.solver;

import projectpelagic.domain.grid.GridField;

/**
 * Agregación por bloques (promedio) de rejillas demasiado finas.
 * Los bloques incompletos del borde se conservan; las celdas NaN se ignoran en el promedio.
 */
public final class GridAggregator {

    private GridAggregator() {
    }

    /**
     * Factor entero de agregación para llevar {@code resolution} hasta {@code targetResolution}.
     * Devuelve 1 si la rejilla ya es suficientemente gruesa.
     */
    public static int aggregationFactor(double resolution, double targetResolution) {
        double rounded = Math.round(resolution * 100.0) / 100.0;
        if (rounded >= targetResolution) {
            return 1;
        }
        double effective = rounded > 0 ? rounded : resolution;
        if (!(effective > 0)) {
            return 1;
        }
        return Math.max(1, (int) Math.round(targetResolution / effective));
    }

    public static GridField aggregate(GridField field, int factor) {
        if (factor < 1) {
            throw new IllegalArgumentException("El factor de agregación debe ser >= 1: " + factor);
        }
        if (factor == 1) {
            return field;
        }
        int nx = field.getNx();
        int ny = field.getNy();
        int ax = (nx + factor - 1) / factor;
        int ay = (ny + factor - 1) / factor;
        int layers = field.getLayerCount();
        float[] source = field.toArray();
        float[] packed = new float[layers * ax * ay];

        for (int d = 0; d < layers; d++) {
            int srcOffset = d * nx * ny;
            int dstOffset = d * ax * ay;
            for (int bx = 0; bx < ax; bx++) {
                for (int by = 0; by < ay; by++) {
                    double sum = 0.0;
                    int count = 0;
                    for (int x = bx * factor; x < Math.min(nx, (bx + 1) * factor); x++) {
                        for (int y = by * factor; y < Math.min(ny, (by + 1) * factor); y++) {
                            float v = source[srcOffset + x * ny + y];
                            if (!Float.isNaN(v)) {
                                sum += v;
                                count++;
                            }
                        }
                    }
                    packed[dstOffset + bx * ay + by] = count == 0 ? Float.NaN : (float) (sum / count);
                }
            }
        }
        return new GridField(
                aggregateAxis(field.getLongitudes(), factor),
                aggregateAxis(field.getLatitudes(), factor),
                field.getDepthLevels(),
                packed);
    }

    static double[] aggregateAxis(double[] axis, int factor) {
        int n = (axis.length + factor - 1) / factor;
        double[] result = new double[n];
        for (int b = 0; b < n; b++) {
            int from = b * factor;
            int to = Math.min(axis.length, from + factor);
            double sum = 0.0;
            for (int i = from; i < to; i++) {
                sum += axis[i];
            }
            result[b] = sum / (to - from);
        }
        return result;
    }
}
