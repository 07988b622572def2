package projectpelagic.domain.grid;

import lombok.Builder;

import java.util.Objects;
import java.util.Optional;

/**
 * Geometría fijada para toda una ejecución antes de lanzar ninguna tarea diaria.
 *
 * @param shape             Forma espacial de la salida (tras la posible agregación).
 * @param longitudes        Eje de longitudes de la salida.
 * @param latitudes         Eje de latitudes de la salida.
 * @param aggregationFactor Factor de agregación por bloques aplicado a cada rejilla diaria (1 = ninguno).
 * @param focalWindowSize   Lado de la ventana de vecindad para la desviación típica espacial.
 * @param externalMask      Máscara opcional (0 o NaN = celda excluida) con la forma de la salida.
 */
@Builder
public record RunGeometry(
        GridShape shape,
        double[] longitudes,
        double[] latitudes,
        int aggregationFactor,
        int focalWindowSize,
        GridLayer externalMask
) {
    public RunGeometry {
        Objects.requireNonNull(shape, "La forma de la ejecución no puede ser nula.");
        Objects.requireNonNull(longitudes, "El eje de longitudes no puede ser nulo.");
        Objects.requireNonNull(latitudes, "El eje de latitudes no puede ser nulo.");
        if (aggregationFactor < 1) {
            throw new IllegalArgumentException("El factor de agregación debe ser >= 1.");
        }
        if (focalWindowSize < 1 || focalWindowSize % 2 == 0) {
            throw new IllegalArgumentException("La ventana de vecindad debe ser impar y positiva: " + focalWindowSize);
        }
        if (externalMask != null && !externalMask.shape().equals(shape)) {
            throw new IllegalArgumentException("La máscara externa " + externalMask.shape()
                    + " no coincide con la forma de la ejecución " + shape);
        }
        longitudes = longitudes.clone();
        latitudes = latitudes.clone();
    }

    @Override
    public double[] longitudes() {
        return longitudes.clone();
    }

    @Override
    public double[] latitudes() {
        return latitudes.clone();
    }

    public Optional<GridLayer> mask() {
        return Optional.ofNullable(externalMask);
    }
}
