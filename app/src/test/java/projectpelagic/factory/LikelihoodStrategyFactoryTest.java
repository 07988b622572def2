package projectpelagic.factory;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.DisplayName;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.physics.i.IDailyLikelihoodStrategy;

import static org.assertj.core.api.Assertions.assertThat;

class LikelihoodStrategyFactoryTest {

    @ParameterizedTest
    @EnumSource(LikelihoodConfig.Mode.class)
    @DisplayName("Cada modo produce la estrategia de su mismo modo")
    void create_matchesMode(LikelihoodConfig.Mode mode) {
        IDailyLikelihoodStrategy strategy = LikelihoodStrategyFactory.create(LikelihoodConfig.defaults(mode));

        assertThat(strategy.getMode()).isEqualTo(mode);
        assertThat(strategy.getName()).isNotBlank();
    }
}
