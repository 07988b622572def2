package projectpelagic.physics.solver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.profile.DepthBound;
import projectpelagic.domain.profile.DepthProfileFit;
import projectpelagic.exception.ProfileFitException;

/**
 * Contenido calorífico oceánico (OHC) por encima de una isoterma, tanto para el perfil
 * reconstruido de la marca como para cada celda del campo de referencia.
 * <p>
 * OHC = cp * rho * Σ (T - isoterma) / escala, sumando sobre los niveles de profundidad del día.
 */
@Slf4j
@Getter
public class HeatContentCalculator {

    private final double heatCapacity;
    private final double density;
    private final double scale;
    private final double bias;

    public HeatContentCalculator(LikelihoodConfig config) {
        this(config.getHeatCapacity(), config.getSeawaterDensity(), config.getHeatContentScale(), config.getHeatContentBias());
    }

    public HeatContentCalculator(double heatCapacity, double density, double scale, double bias) {
        if (scale <= 0) {
            throw new IllegalArgumentException("La escala del contenido calorífico debe ser positiva.");
        }
        this.heatCapacity = heatCapacity;
        this.density = density;
        this.scale = scale;
        this.bias = bias;
    }

    /**
     * Intervalo [min, max] de contenido calorífico observado por la marca.
     */
    public record HeatContentInterval(double min, double max) {
    }

    /**
     * Isoterma efectiva del día: la configurada o, si no existe, el mínimo de las cotas inferiores.
     *
     * @throws ProfileFitException si la isoterma debe derivarse y el perfil no tiene cotas finitas.
     */
    public double resolveIsotherm(DepthProfileFit fit, Double configured) {
        if (configured != null) {
            return configured;
        }
        double iso = fit.minLow();
        if (Double.isNaN(iso)) {
            throw new ProfileFitException("No se puede derivar la isoterma: el perfil no tiene cotas inferiores finitas.");
        }
        return iso;
    }

    public HeatContentInterval tagHeatContent(DepthProfileFit fit, double isotherm) {
        double lowSum = 0.0;
        double highSum = 0.0;
        for (DepthBound b : fit.bounds()) {
            if (Double.isFinite(b.low())) lowSum += b.low() - isotherm;
            if (Double.isFinite(b.high())) highSum += b.high() - isotherm;
        }
        return new HeatContentInterval(toHeatContent(lowSum), toHeatContent(highSum));
    }

    /**
     * Contenido calorífico de cada celda del campo sobre los niveles indicados.
     * Los valores por debajo de la isoterma se descartan; una suma nula marca la celda sin dato (NaN).
     */
    public GridLayer gridHeatContent(GridField field, int[] levelIndices, double isotherm) {
        int cells = field.getNx() * field.getNy();
        double[] sums = new double[cells];
        for (int level : levelIndices) {
            GridLayer layer = field.layer(level);
            for (int i = 0; i < cells; i++) {
                float v = layer.getAt(i);
                if (!Float.isNaN(v) && v >= isotherm) {
                    sums[i] += v - isotherm;
                }
            }
        }
        float[] result = new float[cells];
        for (int i = 0; i < cells; i++) {
            result[i] = sums[i] == 0.0 ? Float.NaN : (float) toHeatContent(sums[i]);
        }
        return new GridLayer(field.getNx(), field.getNy(), result);
    }

    /**
     * Calibración de la verosimilitud OHC: normaliza por su propio máximo, resta el sesgo
     * y recorta los negativos a 0.
     */
    public GridLayer applyBias(GridLayer likelihood) {
        GridLayer normalized = LikelihoodNormalizer.normalize(likelihood);
        int n = normalized.cellCount();
        float[] result = new float[n];
        for (int i = 0; i < n; i++) {
            result[i] = (float) Math.max(0.0, normalized.getAt(i) - bias);
        }
        return new GridLayer(normalized.nx(), normalized.ny(), result);
    }

    private double toHeatContent(double temperatureSum) {
        return heatCapacity * density * temperatureSum / scale;
    }
}
