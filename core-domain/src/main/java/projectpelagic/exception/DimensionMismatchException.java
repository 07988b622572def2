package projectpelagic.exception;

import projectpelagic.domain.grid.GridShape;

/**
 * La forma espacial de una rejilla no coincide con la fijada para la ejecución.
 */
public class DimensionMismatchException extends LikelihoodComputationException {

    public DimensionMismatchException(GridShape expected, GridShape actual) {
        super("Forma de rejilla inesperada: se esperaba " + expected + " y se obtuvo " + actual);
    }

    public DimensionMismatchException(String message) {
        super(message);
    }
}
