package projectpelagic.exception;

import java.time.LocalDate;

/**
 * La lectura de la rejilla de referencia de un día superó el tiempo máximo configurado.
 */
public class FetchTimeoutException extends DataUnavailableException {

    public FetchTimeoutException(LocalDate date, long timeoutSeconds) {
        super("La lectura de la rejilla de " + date + " superó " + timeoutSeconds + " s");
    }
}
