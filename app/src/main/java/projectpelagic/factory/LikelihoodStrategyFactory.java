package projectpelagic.factory;

import projectpelagic.config.LikelihoodConfig;
import projectpelagic.physics.i.IDailyLikelihoodStrategy;
import projectpelagic.physics.impl.HeatContentLikelihoodStrategy;
import projectpelagic.physics.impl.LocalPolynomialRegression;
import projectpelagic.physics.impl.ProfileLikelihoodStrategy;
import projectpelagic.physics.impl.SeaSurfaceLikelihoodStrategy;
import projectpelagic.physics.model.ProfileReconstructor;
import projectpelagic.physics.solver.HeatContentCalculator;

/**
 * Construye la estrategia diaria correspondiente al modo configurado.
 */
public class LikelihoodStrategyFactory {

    public static IDailyLikelihoodStrategy create(LikelihoodConfig config) {
        switch (config.getMode()) {
            case PROFILE:
                return new ProfileLikelihoodStrategy(reconstructor(config));
            case OHC:
                return new HeatContentLikelihoodStrategy(reconstructor(config), new HeatContentCalculator(config), config);
            case SST:
                return new SeaSurfaceLikelihoodStrategy(config);
            default:
                throw new IllegalArgumentException("Modo no soportado: " + config.getMode());
        }
    }

    private static ProfileReconstructor reconstructor(LikelihoodConfig config) {
        return new ProfileReconstructor(
                new LocalPolynomialRegression(config.getRegressionSpan(), config.getRegressionDegree()));
    }
}
