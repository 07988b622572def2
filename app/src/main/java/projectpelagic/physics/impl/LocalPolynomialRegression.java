package projectpelagic.physics.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import projectpelagic.exception.ProfileFitException;
import projectpelagic.physics.i.IProfileRegression;

import java.util.Arrays;

/**
 * Regresión polinómica local con núcleo tricúbico y ancho de banda por vecinos más cercanos.
 * <p>
 * Para cada punto de evaluación x0 se ajusta por mínimos cuadrados ponderados un polinomio
 * de grado {@code degree} centrado en x0; la estimación es el término independiente.
 * El ajuste es lineal en y: {@code fit(x0) = l(x0) · y}, de modo que el error estándar es
 * {@code sigma * ||l(x0)||}, con sigma² = RSS / (n - 2·tr(L) + tr(LᵀL)).
 */
@Slf4j
@Getter
public class LocalPolynomialRegression implements IProfileRegression {

    // Ensancha la banda para que el vecino que la define reciba peso positivo.
    private static final double BANDWIDTH_INFLATION = 1.1;

    private final double span;
    private final int degree;

    public LocalPolynomialRegression(double span, int degree) {
        if (span <= 0 || span > 1) {
            throw new IllegalArgumentException("La fracción de vecinos debe estar en (0, 1]: " + span);
        }
        if (degree < 1) {
            throw new IllegalArgumentException("El grado local debe ser >= 1: " + degree);
        }
        this.span = span;
        this.degree = degree;
    }

    @Override
    public String getName() {
        return "LocalPolynomial_deg" + degree;
    }

    @Override
    public FittedCurve fit(double[] x, double[] y) {
        if (x == null || y == null || x.length != y.length) {
            throw new ProfileFitException("Las series x e y deben existir y tener la misma longitud.");
        }
        int valid = 0;
        for (int i = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) valid++;
        }
        double[] xs = new double[valid];
        double[] ys = new double[valid];
        for (int i = 0, k = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                xs[k] = x[i];
                ys[k] = y[i];
                k++;
            }
        }
        double[] distinct = Arrays.stream(xs).distinct().toArray();
        if (distinct.length < 2) {
            throw new ProfileFitException("Se necesitan al menos 2 profundidades distintas; hay " + distinct.length);
        }
        int effectiveDegree = Math.min(degree, distinct.length - 1);
        return new LocalFit(xs, ys, distinct, effectiveDegree, span);
    }

    /**
     * Curva ajustada. Precalcula la varianza residual a partir de los pesos del suavizador
     * en los propios datos.
     */
    private static final class LocalFit implements FittedCurve {

        private final double[] x;
        private final double[] y;
        private final double[] distinctX;
        private final int degree;
        private final double span;
        private final double sigma;

        LocalFit(double[] x, double[] y, double[] distinctX, int degree, double span) {
            this.x = x;
            this.y = y;
            this.distinctX = distinctX;
            this.degree = degree;
            this.span = span;
            this.sigma = residualScale();
        }

        @Override
        public Prediction predict(double x0) {
            double[] l = smootherWeights(x0);
            double fit = 0.0;
            double norm2 = 0.0;
            for (int i = 0; i < l.length; i++) {
                fit += l[i] * y[i];
                norm2 += l[i] * l[i];
            }
            return new Prediction(fit, sigma * Math.sqrt(norm2));
        }

        private double residualScale() {
            int n = x.length;
            double rss = 0.0;
            double traceL = 0.0;
            double traceLtL = 0.0;
            for (int i = 0; i < n; i++) {
                double[] l = smootherWeights(x[i]);
                double fitted = 0.0;
                for (int j = 0; j < n; j++) {
                    fitted += l[j] * y[j];
                    traceLtL += l[j] * l[j];
                }
                traceL += l[i];
                double r = y[i] - fitted;
                rss += r * r;
            }
            double residualDf = n - 2.0 * traceL + traceLtL;
            if (residualDf <= 1e-9) {
                log.debug("Grados de libertad residuales no positivos ({}); error estándar nulo.", residualDf);
                return 0.0;
            }
            return Math.sqrt(rss / residualDf);
        }

        /**
         * Vector l(x0) tal que la estimación local en x0 es l(x0) · y.
         */
        private double[] smootherWeights(double x0) {
            int n = x.length;
            int p = degree + 1;
            double h = bandwidth(x0) * BANDWIDTH_INFLATION;

            double[] w = new double[n];
            double[][] design = new double[n][p];
            for (int i = 0; i < n; i++) {
                double u = Math.abs(x[i] - x0) / h;
                w[i] = u < 1.0 ? Math.pow(1.0 - u * u * u, 3) : 0.0;
                double t = (x[i] - x0) / h;
                double power = 1.0;
                for (int k = 0; k < p; k++) {
                    design[i][k] = power;
                    power *= t;
                }
            }

            // XᵀWX
            double[][] xtwx = new double[p][p];
            for (int i = 0; i < n; i++) {
                if (w[i] == 0.0) continue;
                for (int a = 0; a < p; a++) {
                    for (int b = 0; b < p; b++) {
                        xtwx[a][b] += w[i] * design[i][a] * design[i][b];
                    }
                }
            }
            RealMatrix normal = MatrixUtils.createRealMatrix(xtwx);
            DecompositionSolver solver = new LUDecomposition(normal).getSolver();
            if (!solver.isNonSingular()) {
                throw new ProfileFitException("Sistema local singular en x = " + x0);
            }
            double[] firstRow = solver.getInverse().getRow(0);

            double[] l = new double[n];
            for (int i = 0; i < n; i++) {
                if (w[i] == 0.0) continue;
                double dot = 0.0;
                for (int k = 0; k < p; k++) {
                    dot += firstRow[k] * design[i][k];
                }
                l[i] = dot * w[i];
            }
            return l;
        }

        /**
         * Distancia al k-ésimo vecino (k = ceil(span·n)), ampliada si hace falta para
         * abarcar al menos grado + 1 abscisas distintas.
         */
        private double bandwidth(double x0) {
            int n = x.length;
            double[] d = new double[n];
            for (int i = 0; i < n; i++) {
                d[i] = Math.abs(x[i] - x0);
            }
            Arrays.sort(d);
            int k = Math.min(n, Math.max((int) Math.ceil(span * n), degree + 1));
            double h = d[k - 1];

            double[] dd = new double[distinctX.length];
            for (int i = 0; i < dd.length; i++) {
                dd[i] = Math.abs(distinctX[i] - x0);
            }
            Arrays.sort(dd);
            h = Math.max(h, dd[Math.min(dd.length, degree + 1) - 1]);
            return h > 0 ? h : 1.0;
        }
    }
}
