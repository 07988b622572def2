package projectpelagic.physics.solver;

import projectpelagic.domain.grid.GridLayer;

/**
 * Desviación típica espacial por ventana deslizante (k x k) sobre una capa de referencia.
 * <p>
 * En los bordes la ventana se trunca al dominio. Las celdas sin dato (NaN) se excluyen del
 * cálculo. Con menos de dos valores definidos en la ventana el resultado es NaN.
 */
public final class SpatialVariabilityEstimator {

    public static final int MIN_WINDOW_SIZE = 3;

    /**
     * Prohibido construir esta clase utilidad
     */
    private SpatialVariabilityEstimator() {
    }

    /**
     * Calcula la desviación típica muestral (n - 1) de la vecindad de cada celda.
     *
     * @param layer      Capa de entrada.
     * @param windowSize Lado de la ventana, impar y positivo.
     * @return Capa con la misma forma que la entrada.
     */
    public static GridLayer focalStandardDeviation(GridLayer layer, int windowSize) {
        if (windowSize < 1 || windowSize % 2 == 0) {
            throw new IllegalArgumentException("El tamaño de ventana debe ser impar y positivo: " + windowSize);
        }
        final int nx = layer.nx();
        final int ny = layer.ny();
        final int half = windowSize / 2;
        float[] result = new float[nx * ny];

        for (int x = 0; x < nx; x++) {
            int x0 = Math.max(0, x - half);
            int x1 = Math.min(nx - 1, x + half);
            for (int y = 0; y < ny; y++) {
                int y0 = Math.max(0, y - half);
                int y1 = Math.min(ny - 1, y + half);

                // Primera pasada: media de los valores definidos
                int count = 0;
                double sum = 0.0;
                for (int i = x0; i <= x1; i++) {
                    int row = i * ny;
                    for (int j = y0; j <= y1; j++) {
                        float v = layer.getAt(row + j);
                        if (!Float.isNaN(v)) {
                            sum += v;
                            count++;
                        }
                    }
                }
                if (count < 2) {
                    result[x * ny + y] = Float.NaN;
                    continue;
                }
                double mean = sum / count;

                // Segunda pasada: suma de cuadrados centrada
                double ss = 0.0;
                for (int i = x0; i <= x1; i++) {
                    int row = i * ny;
                    for (int j = y0; j <= y1; j++) {
                        float v = layer.getAt(row + j);
                        if (!Float.isNaN(v)) {
                            double d = v - mean;
                            ss += d * d;
                        }
                    }
                }
                result[x * ny + y] = (float) Math.sqrt(ss / (count - 1));
            }
        }
        return new GridLayer(nx, ny, result);
    }

    /**
     * Deriva el lado de la ventana para cubrir aproximadamente {@code extentDegrees}
     * con una rejilla de resolución {@code resolutionDegrees}: impar y como mínimo 3.
     */
    public static int windowSizeFor(double resolutionDegrees, double extentDegrees) {
        if (!(resolutionDegrees > 0)) {
            return MIN_WINDOW_SIZE;
        }
        int size = (int) Math.round(extentDegrees / resolutionDegrees);
        if (size % 2 == 0) {
            size -= 1;
        }
        return Math.max(MIN_WINDOW_SIZE, size);
    }
}
