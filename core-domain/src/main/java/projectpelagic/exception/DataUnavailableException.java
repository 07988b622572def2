package projectpelagic.exception;

import java.time.LocalDate;

/**
 * No existe (o no se pudo leer) la rejilla de referencia solicitada.
 * Fatal si no hay ninguna fecha de referencia; en otro caso degrada sólo el día afectado.
 */
public class DataUnavailableException extends LikelihoodComputationException {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DataUnavailableException forDate(LocalDate date) {
        return new DataUnavailableException("No hay datos de referencia para " + date);
    }
}
