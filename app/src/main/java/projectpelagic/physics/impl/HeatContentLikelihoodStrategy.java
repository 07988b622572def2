package projectpelagic.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.profile.DepthProfileFit;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.physics.i.IDailyLikelihoodStrategy;
import projectpelagic.physics.model.ProfileReconstructor;
import projectpelagic.physics.solver.DepthLayerCombiner;
import projectpelagic.physics.solver.HeatContentCalculator;
import projectpelagic.physics.solver.HeatContentCalculator.HeatContentInterval;
import projectpelagic.physics.solver.ProbabilisticMatchIntegrator;
import projectpelagic.physics.solver.SpatialVariabilityEstimator;

import java.util.List;

/**
 * Modo contenido calorífico (OHC): compara un escalar por celda con el intervalo
 * de contenido calorífico derivado del perfil de la marca.
 */
@Slf4j
public class HeatContentLikelihoodStrategy implements IDailyLikelihoodStrategy {

    private final ProfileReconstructor reconstructor;
    private final HeatContentCalculator calculator;
    private final Double isotherm;
    private final boolean bathymetryMask;

    public HeatContentLikelihoodStrategy(ProfileReconstructor reconstructor, HeatContentCalculator calculator,
                                         LikelihoodConfig config) {
        this.reconstructor = reconstructor;
        this.calculator = calculator;
        this.isotherm = config.getIsotherm();
        this.bathymetryMask = config.isBathymetryMask();
    }

    @Override
    public String getName() {
        return "OceanHeatContent";
    }

    @Override
    public LikelihoodConfig.Mode getMode() {
        return LikelihoodConfig.Mode.OHC;
    }

    @Override
    public GridLayer computeDay(List<TagObservation> observations, GridField field, RunGeometry geometry) {
        DepthProfileFit fit = reconstructor.reconstruct(observations, field.getDepthLevels());

        GridField working = field;
        if (bathymetryMask) {
            working = DepthLayerCombiner.applyMask(working,
                    DepthLayerCombiner.bathymetryMask(working, fit.deepestLevelIndex()));
        }
        if (geometry.externalMask() != null) {
            working = DepthLayerCombiner.applyMask(working, geometry.externalMask());
        }

        double iso = calculator.resolveIsotherm(fit, isotherm);
        HeatContentInterval tagOhc = calculator.tagHeatContent(fit, iso);
        GridLayer ohc = calculator.gridHeatContent(working, fit.levelIndices(), iso);
        log.debug("Isoterma {} -> OHC de la marca [{}, {}]", iso, tagOhc.min(), tagOhc.max());

        GridLayer sd = SpatialVariabilityEstimator.focalStandardDeviation(ohc, geometry.focalWindowSize());
        GridLayer likelihood = ProbabilisticMatchIntegrator.likelihoodGrid(ohc, sd, tagOhc.min(), tagOhc.max());
        return calculator.applyBias(likelihood);
    }
}
