package projectpelagic.domain.tag;

import lombok.Builder;
import lombok.With;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Una muestra ya procesada de la marca: instante, profundidad opcional y
 * rango de valores (mínimo/máximo) registrado por el sensor.
 *
 * @param timestamp Instante de la muestra.
 * @param depth     Profundidad [m]; {@code null} para observaciones sólo de superficie (SST).
 * @param minValue  Valor mínimo registrado (p.ej. temperatura [°C]).
 * @param maxValue  Valor máximo registrado.
 */
@Builder
@With
public record TagObservation(
        LocalDateTime timestamp,
        Double depth,
        double minValue,
        double maxValue
) {
    public TagObservation {
        Objects.requireNonNull(timestamp, "El instante de la observación no puede ser nulo.");
        if (minValue > maxValue) {
            throw new IllegalArgumentException(String.format(
                    "Observación inválida en %s: mínimo %.3f > máximo %.3f", timestamp, minValue, maxValue));
        }
    }

    public static TagObservation surface(LocalDateTime timestamp, double minValue, double maxValue) {
        return new TagObservation(timestamp, null, minValue, maxValue);
    }

    public static TagObservation atDepth(LocalDateTime timestamp, double depth, double minValue, double maxValue) {
        return new TagObservation(timestamp, depth, minValue, maxValue);
    }

    /**
     * Día natural al que pertenece la muestra.
     */
    public LocalDate date() {
        return timestamp.toLocalDate();
    }

    public boolean hasDepth() {
        return depth != null && !depth.isNaN();
    }
}
