package projectpelagic.physics.model;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.domain.profile.DepthBound;
import projectpelagic.domain.profile.DepthProfileFit;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.exception.ProfileFitException;
import projectpelagic.physics.i.IProfileRegression;
import projectpelagic.physics.i.IProfileRegression.FittedCurve;
import projectpelagic.physics.i.IProfileRegression.Prediction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reconstruye el perfil diario de la marca en los niveles de profundidad de la rejilla.
 * <p>
 * Ajusta dos regresiones independientes, {@code min ~ profundidad} y {@code max ~ profundidad},
 * y las evalúa en los niveles a los que se ajustan las muestras del día. Las cotas se
 * ensanchan con {@code errorEstándar * sqrt(n)}, siendo n el número de niveles distintos.
 */
@Slf4j
public class ProfileReconstructor {

    private final IProfileRegression regression;

    public ProfileReconstructor(IProfileRegression regression) {
        this.regression = Objects.requireNonNull(regression, "La regresión no puede ser nula.");
    }

    /**
     * @param samples     Muestras de un único día; se ignoran las que no tienen profundidad.
     * @param depthLevels Eje de profundidad de la rejilla de referencia.
     * @throws ProfileFitException si no se puede ajustar el perfil.
     */
    public DepthProfileFit reconstruct(List<TagObservation> samples, double[] depthLevels) {
        if (depthLevels == null || depthLevels.length == 0) {
            throw new ProfileFitException("La rejilla de referencia no tiene niveles de profundidad.");
        }
        List<TagObservation> withDepth = samples.stream().filter(TagObservation::hasDepth).toList();
        if (withDepth.isEmpty()) {
            throw new ProfileFitException("No hay muestras con profundidad para el día.");
        }

        int n = withDepth.size();
        double[] depth = new double[n];
        double[] min = new double[n];
        double[] max = new double[n];
        for (int i = 0; i < n; i++) {
            TagObservation o = withDepth.get(i);
            depth[i] = Math.max(0.0, o.depth());
            min[i] = o.minValue();
            max[i] = o.maxValue();
        }

        FittedCurve low = regression.fit(depth, min);
        FittedCurve high = regression.fit(depth, max);

        int[] levels = snapToLevels(depth, depthLevels);
        double widen = Math.sqrt(levels.length);

        List<DepthBound> bounds = new ArrayList<>(levels.length);
        for (int level : levels) {
            double z = depthLevels[level];
            Prediction pl = low.predict(z);
            Prediction ph = high.predict(z);
            bounds.add(new DepthBound(level, z,
                    pl.fit() - pl.standardError() * widen,
                    ph.fit() + ph.standardError() * widen));
        }
        log.debug("Perfil reconstruido ({}) con {} muestras en {} niveles.", regression.getName(), n, levels.length);
        return new DepthProfileFit(bounds);
    }

    /**
     * Ajusta cada profundidad al nivel de la rejilla de mínima distancia cuadrática.
     * Los niveles repetidos se colapsan conservando el orden de primera aparición.
     */
    public static int[] snapToLevels(double[] depths, double[] levels) {
        Set<Integer> unique = new LinkedHashSet<>();
        for (double d : depths) {
            double z = Math.max(0.0, d);
            int best = 0;
            double bestDist = Double.POSITIVE_INFINITY;
            for (int k = 0; k < levels.length; k++) {
                double dist = (z - levels[k]) * (z - levels[k]);
                if (dist < bestDist) {
                    bestDist = dist;
                    best = k;
                }
            }
            unique.add(best);
        }
        return unique.stream().mapToInt(Integer::intValue).toArray();
    }
}
