package projectpelagic.exception;

/**
 * Raíz de los errores del motor de verosimilitud.
 * <p>
 * Las subclases que afectan a un único día se capturan en el límite de la tarea diaria
 * y degradan ese día a cero; el resto abortan la ejecución completa.
 */
public class LikelihoodComputationException extends RuntimeException {

    public LikelihoodComputationException(String message) {
        super(message);
    }

    public LikelihoodComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
