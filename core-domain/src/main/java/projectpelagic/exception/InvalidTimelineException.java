package projectpelagic.exception;

/**
 * El vector maestro de fechas está vacío, desordenado o contiene duplicados. Siempre fatal.
 */
public class InvalidTimelineException extends LikelihoodComputationException {

    public InvalidTimelineException(String message) {
        super(message);
    }
}
