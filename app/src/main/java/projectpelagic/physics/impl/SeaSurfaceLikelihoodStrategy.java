package projectpelagic.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.exception.DataUnavailableException;
import projectpelagic.physics.i.IDailyLikelihoodStrategy;
import projectpelagic.physics.solver.DepthLayerCombiner;
import projectpelagic.physics.solver.ProbabilisticMatchIntegrator;
import projectpelagic.physics.solver.SpatialVariabilityEstimator;

import java.util.List;

/**
 * Modo SST: compara la capa superficial con el rango diario de temperatura de la marca,
 * ensanchado por el error del sensor.
 */
@Slf4j
public class SeaSurfaceLikelihoodStrategy implements IDailyLikelihoodStrategy {

    private final double sensorErrorPercent;

    public SeaSurfaceLikelihoodStrategy(LikelihoodConfig config) {
        this.sensorErrorPercent = config.getSensorErrorPercent();
    }

    @Override
    public String getName() {
        return "SeaSurfaceTemperature";
    }

    @Override
    public LikelihoodConfig.Mode getMode() {
        return LikelihoodConfig.Mode.SST;
    }

    /**
     * Intervalo diario [min·(1 - e), max·(1 + e)] con e = error del sensor en tanto por uno.
     */
    public double[] dailyInterval(List<TagObservation> observations) {
        if (observations.isEmpty()) {
            throw new DataUnavailableException("No hay observaciones SST para el día.");
        }
        double min = observations.stream().mapToDouble(TagObservation::minValue).min().getAsDouble();
        double max = observations.stream().mapToDouble(TagObservation::maxValue).max().getAsDouble();
        double e = sensorErrorPercent / 100.0;
        return new double[]{min * (1.0 - e), max * (1.0 + e)};
    }

    @Override
    public GridLayer computeDay(List<TagObservation> observations, GridField field, RunGeometry geometry) {
        double[] interval = dailyInterval(observations);
        GridLayer surface = field.layer(0);
        if (geometry.externalMask() != null) {
            surface = DepthLayerCombiner.applyMask(field, geometry.externalMask()).layer(0);
        }
        log.debug("Intervalo SST del día: [{}, {}]", interval[0], interval[1]);
        GridLayer sd = SpatialVariabilityEstimator.focalStandardDeviation(surface, geometry.focalWindowSize());
        return ProbabilisticMatchIntegrator.likelihoodGrid(surface, sd, interval[0], interval[1]);
    }
}
