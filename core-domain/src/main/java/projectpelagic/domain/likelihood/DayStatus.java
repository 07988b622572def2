package projectpelagic.domain.likelihood;

/**
 * Resultado del procesamiento de un día. Todo estado distinto de {@link #OK}
 * implica un hueco de salida a cero.
 */
public enum DayStatus {
    OK,
    DATA_UNAVAILABLE,   // Sin rejilla de referencia para el día (o lectura fallida)
    FIT_FAILURE,        // La regresión del perfil no se pudo ajustar
    DIMENSION_MISMATCH, // La rejilla del día no tiene la forma fijada para la ejecución
    TIMEOUT,            // La lectura de la rejilla superó el tiempo máximo
    FAILED,             // Cualquier otro error dentro de la tarea diaria
    UNASSIGNED;         // Día con observaciones pero sin hueco en el vector maestro

    public boolean isSuccess() {
        return this == OK;
    }
}
