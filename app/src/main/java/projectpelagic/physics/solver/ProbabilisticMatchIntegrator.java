package projectpelagic.physics.solver;

import org.apache.commons.math3.special.Erf;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.exception.DimensionMismatchException;

/**
 * Primitiva numérica central: verosimilitud de que el valor de una celda de la rejilla
 * sea compatible con el intervalo observado por la marca.
 * <p>
 * La medida de la marca se modela como una normal de media {@code (minT + maxT) / 2} y
 * desviación típica {@code (maxT - minT) / 2}; la verosimilitud es su masa de probabilidad
 * sobre la ventana {@code [w - wsd, w + wsd]}.
 * <p>
 * Clase utilidad sin estado: es una función pura, compartida por todos los trabajadores (thread safe).
 */
public final class ProbabilisticMatchIntegrator {

    private static final double SQRT2 = Math.sqrt(2.0);

    /**
     * Prohibido construir esta clase utilidad
     */
    private ProbabilisticMatchIntegrator() {
    }

    /**
     * Verosimilitud de una celda.
     *
     * @param w    Valor de la rejilla en la celda (NaN = sin dato).
     * @param wsd  Incertidumbre espacial local; NaN se trata como 0 (ventana nula, masa 0).
     * @param minT Límite inferior del intervalo de la marca.
     * @param maxT Límite superior del intervalo de la marca.
     * @return Masa de probabilidad en [0, 1]; exactamente 0 si {@code w} está fuera de [minT, maxT].
     */
    public static double likelihood(double w, double wsd, double minT, double maxT) {
        // Máscara dura: sin dato, o estimación puntual fuera del rango plausible.
        if (Double.isNaN(w) || Double.isNaN(minT) || Double.isNaN(maxT) || w < minT || w > maxT) {
            return 0.0;
        }
        double halfWindow = Double.isNaN(wsd) ? 0.0 : Math.abs(wsd);

        // Ventana de anchura nula: masa nula, igual que la integral sobre [w, w].
        if (halfWindow == 0.0) {
            return 0.0;
        }

        double mid = (minT + maxT) / 2.0;
        double tagSd = (maxT - minT) / 2.0;

        // Intervalo degenerado: la máscara ya garantiza w == mid, toda la masa cae en la ventana.
        if (tagSd <= 0.0) {
            return 1.0;
        }

        double lower = (w - halfWindow - mid) / (tagSd * SQRT2);
        double upper = (w + halfWindow - mid) / (tagSd * SQRT2);
        double mass = 0.5 * Erf.erf(lower, upper);
        return Math.max(0.0, Math.min(1.0, mass));
    }

    /**
     * Aplica {@link #likelihood} celda a celda.
     *
     * @param values      Capa de valores de referencia.
     * @param uncertainty Capa de desviación típica espacial (misma forma).
     * @throws DimensionMismatchException si las capas no tienen la misma forma.
     */
    public static GridLayer likelihoodGrid(GridLayer values, GridLayer uncertainty, double minT, double maxT) {
        if (!values.shape().equals(uncertainty.shape())) {
            throw new DimensionMismatchException(values.shape(), uncertainty.shape());
        }
        int n = values.cellCount();
        float[] result = new float[n];
        for (int i = 0; i < n; i++) {
            result[i] = (float) likelihood(values.getAt(i), uncertainty.getAt(i), minT, maxT);
        }
        return new GridLayer(values.nx(), values.ny(), result);
    }
}
