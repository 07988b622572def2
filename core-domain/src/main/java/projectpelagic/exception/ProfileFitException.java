package projectpelagic.exception;

/**
 * La regresión profundidad -> temperatura no se puede ajustar con las muestras del día.
 */
public class ProfileFitException extends LikelihoodComputationException {

    public ProfileFitException(String message) {
        super(message);
    }

    public ProfileFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
