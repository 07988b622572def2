package projectpelagic.domain.grid;

import lombok.Builder;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Campo ambiental de referencia para una fecha: una o varias capas de profundidad
 * sobre un dominio espacial fijo, junto con sus ejes de coordenadas.
 * <p>
 * Inmutable. Los valores se almacenan empaquetados con índice
 * {@code depth * (nx * ny) + x * ny + y}. Las celdas sin dato (tierra, fondo) son {@code NaN}.
 */
public final class GridField {

    @Getter
    private final int nx;
    @Getter
    private final int ny;
    @Getter
    private final int layerCount;
    private final double[] longitudes;
    private final double[] latitudes;
    private final double[] depthLevels;
    private final float[] values;

    /**
     * @param longitudes  Eje de longitudes (longitud nx).
     * @param latitudes   Eje de latitudes (longitud ny).
     * @param depthLevels Niveles de profundidad [m]; vacío o nulo para un campo superficial de una sola capa.
     * @param values      Valores empaquetados, longitud {@code max(1, depthLevels) * nx * ny}.
     */
    @Builder
    public GridField(double[] longitudes, double[] latitudes, double[] depthLevels, float[] values) {
        Objects.requireNonNull(longitudes, "El eje de longitudes no puede ser nulo.");
        Objects.requireNonNull(latitudes, "El eje de latitudes no puede ser nulo.");
        Objects.requireNonNull(values, "El array de valores no puede ser nulo.");
        if (longitudes.length == 0 || latitudes.length == 0) {
            throw new IllegalArgumentException("Los ejes de coordenadas no pueden estar vacíos.");
        }
        double[] depths = depthLevels == null ? new double[0] : depthLevels;
        int layers = Math.max(1, depths.length);
        int expected = layers * longitudes.length * latitudes.length;
        if (values.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "El array de valores tiene %d elementos; se esperaban %d (%d capas x %d x %d).",
                    values.length, expected, layers, longitudes.length, latitudes.length));
        }

        this.nx = longitudes.length;
        this.ny = latitudes.length;
        this.layerCount = layers;
        this.longitudes = longitudes.clone();
        this.latitudes = latitudes.clone();
        this.depthLevels = depths.clone();
        this.values = values.clone();
    }

    /**
     * Construye un campo a partir de capas 2-D ya separadas.
     */
    public static GridField ofLayers(double[] longitudes, double[] latitudes, double[] depthLevels, GridLayer... layers) {
        int cells = longitudes.length * latitudes.length;
        float[] packed = new float[layers.length * cells];
        for (int d = 0; d < layers.length; d++) {
            GridLayer layer = layers[d];
            if (layer.nx() != longitudes.length || layer.ny() != latitudes.length) {
                throw new IllegalArgumentException("La capa " + d + " no coincide con los ejes del campo.");
            }
            System.arraycopy(layer.toArray(), 0, packed, d * cells, cells);
        }
        return new GridField(longitudes, latitudes, depthLevels, packed);
    }

    public GridShape shape() {
        return new GridShape(nx, ny);
    }

    public boolean hasDepth() {
        return depthLevels.length > 0;
    }

    public double[] getLongitudes() {
        return longitudes.clone();
    }

    public double[] getLatitudes() {
        return latitudes.clone();
    }

    public double[] getDepthLevels() {
        return depthLevels.clone();
    }

    /**
     * Devuelve la capa de profundidad {@code depthIndex} como rejilla 2-D.
     *
     * @throws IndexOutOfBoundsException si el índice de capa es inválido.
     */
    public GridLayer layer(int depthIndex) {
        if (depthIndex < 0 || depthIndex >= layerCount) {
            throw new IndexOutOfBoundsException("La capa " + depthIndex + " está fuera de [0, " + (layerCount - 1) + "].");
        }
        int cells = nx * ny;
        float[] data = Arrays.copyOfRange(values, depthIndex * cells, (depthIndex + 1) * cells);
        return new GridLayer(nx, ny, data);
    }

    public float getValue(int depthIndex, int x, int y) {
        return layer(depthIndex).get(x, y);
    }

    /**
     * Resolución aproximada en grados, a partir del espaciado medio del eje de longitudes.
     * Para un eje de un solo punto se usa el de latitudes.
     */
    public double resolution() {
        double[] axis = nx > 1 ? longitudes : latitudes;
        if (axis.length < 2) {
            throw new IllegalStateException("No se puede estimar la resolución de un campo de una sola celda.");
        }
        return Math.abs(axis[axis.length - 1] - axis[0]) / (axis.length - 1);
    }

    /**
     * Crea una copia del campo sustituyendo todos los valores empaquetados.
     */
    public GridField withValues(float[] newValues) {
        return new GridField(longitudes, latitudes, depthLevels, newValues);
    }

    /**
     * Copia de los valores empaquetados (todas las capas).
     */
    public float[] toArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "GridField[" + nx + "x" + ny + ", capas=" + layerCount + "]";
    }
}
