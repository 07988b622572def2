package projectpelagic.domain.likelihood;

import java.time.LocalDate;

/**
 * Entrada del registro de estado por día de una ejecución.
 *
 * @param date         Día procesado.
 * @param slot         Hueco de salida, o -1 si el día no tiene hueco.
 * @param status       Estado final del día.
 * @param message      Detalle legible (vacío si OK).
 * @param rawMaximum   Máximo finito de la verosimilitud combinada antes de normalizar (NaN si no aplica).
 */
public record DayReport(LocalDate date, int slot, DayStatus status, String message, double rawMaximum) {

    public static DayReport ok(LocalDate date, int slot, double rawMaximum) {
        return new DayReport(date, slot, DayStatus.OK, "", rawMaximum);
    }

    public static DayReport failed(LocalDate date, int slot, DayStatus status, String message) {
        return new DayReport(date, slot, status, message == null ? "" : message, Double.NaN);
    }

    @Override
    public String toString() {
        return String.format("%s [hueco %d] %s%s", date, slot, status, message.isEmpty() ? "" : " - " + message);
    }
}
