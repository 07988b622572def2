package projectpelagic.physics.i;

import projectpelagic.exception.ProfileFitException;

/**
 * Regresión suave de una variable sobre la profundidad, con error estándar de predicción.
 */
public interface IProfileRegression {

    String getName();

    /**
     * Ajusta {@code y ~ x}.
     *
     * @throws ProfileFitException si los datos no permiten el ajuste (p.ej. menos de dos x distintas).
     */
    FittedCurve fit(double[] x, double[] y);

    /**
     * Curva ajustada, evaluable en cualquier abscisa.
     */
    interface FittedCurve {
        Prediction predict(double x);
    }

    /**
     * @param fit           Estimación puntual.
     * @param standardError Error estándar de la estimación.
     */
    record Prediction(double fit, double standardError) {
    }
}
