package projectpelagic.domain.grid;

import java.util.Arrays;
import java.util.Objects;

/**
 * Capa 2-D inmutable de valores sobre el dominio espacial.
 * <p>
 * Los valores se almacenan empaquetados en un array plano con índice {@code x * ny + y}
 * (longitud mayor). Las celdas sin dato se representan con {@code NaN}.
 *
 * @param nx     Número de celdas en longitud.
 * @param ny     Número de celdas en latitud.
 * @param values Valores empaquetados, longitud {@code nx * ny}.
 */
public record GridLayer(int nx, int ny, float[] values) {

    public GridLayer {
        Objects.requireNonNull(values, "El array de valores de la capa no puede ser nulo.");
        if (nx <= 0 || ny <= 0) {
            throw new IllegalArgumentException("Las dimensiones de la capa deben ser positivas.");
        }
        if (values.length != nx * ny) {
            throw new IllegalArgumentException(String.format(
                    "El array de valores (%d) no coincide con la forma %dx%d.", values.length, nx, ny));
        }
        values = values.clone();
    }

    public static GridLayer filled(GridShape shape, float value) {
        float[] data = new float[shape.cellCount()];
        Arrays.fill(data, value);
        return new GridLayer(shape.nx(), shape.ny(), data);
    }

    public static GridLayer zeros(GridShape shape) {
        return new GridLayer(shape.nx(), shape.ny(), new float[shape.cellCount()]);
    }

    /**
     * Construye una capa a partir de una matriz indexada {@code [x][y]}.
     */
    public static GridLayer of(float[][] matrix) {
        int nx = matrix.length;
        int ny = matrix[0].length;
        float[] data = new float[nx * ny];
        for (int x = 0; x < nx; x++) {
            if (matrix[x].length != ny) {
                throw new IllegalArgumentException("La matriz no es rectangular en la fila " + x);
            }
            System.arraycopy(matrix[x], 0, data, x * ny, ny);
        }
        return new GridLayer(nx, ny, data);
    }

    public GridShape shape() {
        return new GridShape(nx, ny);
    }

    public int cellCount() {
        return values.length;
    }

    public float get(int x, int y) {
        if (x < 0 || x >= nx || y < 0 || y >= ny) {
            throw new IndexOutOfBoundsException("Celda (" + x + ", " + y + ") fuera de la rejilla " + nx + "x" + ny);
        }
        return values[x * ny + y];
    }

    /**
     * Acceso directo por índice empaquetado, sin validación (ruta rápida para los solvers).
     */
    public float getAt(int index) {
        return values[index];
    }

    /**
     * Copia de los valores empaquetados; la capa no expone su array interno.
     */
    @Override
    public float[] values() {
        return values.clone();
    }

    public float[] toArray() {
        return values.clone();
    }

    /**
     * Máximo de los valores finitos, o {@code NaN} si no existe ninguno.
     */
    public float finiteMax() {
        float max = Float.NaN;
        for (float v : values) {
            if (Float.isFinite(v) && (Float.isNaN(max) || v > max)) {
                max = v;
            }
        }
        return max;
    }

    public boolean isAllZero() {
        for (float v : values) {
            if (v != 0.0f) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridLayer that = (GridLayer) o;
        return nx == that.nx && ny == that.ny && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(nx, ny);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "GridLayer[" + nx + "x" + ny + "]";
    }
}
