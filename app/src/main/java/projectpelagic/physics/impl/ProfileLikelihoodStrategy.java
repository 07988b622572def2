package projectpelagic.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.profile.DepthBound;
import projectpelagic.domain.profile.DepthProfileFit;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.physics.i.IDailyLikelihoodStrategy;
import projectpelagic.physics.model.ProfileReconstructor;
import projectpelagic.physics.solver.DepthLayerCombiner;
import projectpelagic.physics.solver.ProbabilisticMatchIntegrator;
import projectpelagic.physics.solver.SpatialVariabilityEstimator;

import java.util.ArrayList;
import java.util.List;

/**
 * Modo perfil: una verosimilitud por nivel de profundidad del día y producto entre niveles.
 */
@Slf4j
public class ProfileLikelihoodStrategy implements IDailyLikelihoodStrategy {

    private final ProfileReconstructor reconstructor;

    public ProfileLikelihoodStrategy(ProfileReconstructor reconstructor) {
        this.reconstructor = reconstructor;
    }

    @Override
    public String getName() {
        return "DepthProfileProduct";
    }

    @Override
    public LikelihoodConfig.Mode getMode() {
        return LikelihoodConfig.Mode.PROFILE;
    }

    @Override
    public GridLayer computeDay(List<TagObservation> observations, GridField field, RunGeometry geometry) {
        DepthProfileFit fit = reconstructor.reconstruct(observations, field.getDepthLevels());

        GridField masked = geometry.mask()
                .map(mask -> DepthLayerCombiner.applyMask(field, mask))
                .orElse(field);

        List<GridLayer> perDepth = new ArrayList<>(fit.size());
        for (DepthBound bound : fit.bounds()) {
            GridLayer layer = masked.layer(bound.levelIndex());
            GridLayer sd = SpatialVariabilityEstimator.focalStandardDeviation(layer, geometry.focalWindowSize());
            perDepth.add(ProbabilisticMatchIntegrator.likelihoodGrid(layer, sd, bound.low(), bound.high()));
            log.debug("Nivel {} m: cotas [{}, {}]", bound.depth(), bound.low(), bound.high());
        }
        return DepthLayerCombiner.product(perDepth);
    }
}
