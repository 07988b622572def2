package projectpelagic.physics.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.GridShape;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.exception.DataUnavailableException;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SeaSurfaceLikelihoodStrategyTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2017, 8, 2, 0, 0);

    private final SeaSurfaceLikelihoodStrategy strategy =
            new SeaSurfaceLikelihoodStrategy(LikelihoodConfig.defaults(LikelihoodConfig.Mode.SST));

    @Test
    @DisplayName("El intervalo diario se ensancha con el error del sensor")
    void dailyInterval_widensBySensorError() {
        List<TagObservation> obs = List.of(
                TagObservation.surface(T0, 20.0, 22.0),
                TagObservation.surface(T0.plusHours(6), 21.0, 23.0));

        double[] interval = strategy.dailyInterval(obs);

        assertThat(interval[0]).isCloseTo(19.8, within(1e-9));
        assertThat(interval[1]).isCloseTo(23.23, within(1e-9));
    }

    @Test
    @DisplayName("Un día sin observaciones no tiene intervalo")
    void dailyInterval_empty_throws() {
        assertThatThrownBy(() -> strategy.dailyInterval(List.of())).isInstanceOf(DataUnavailableException.class);
    }

    @Test
    @DisplayName("Las celdas fuera del intervalo SST quedan a 0")
    void computeDay_usesSurfaceLayer() {
        // --- 1. Arrange ---
        GridLayer sst = GridLayer.of(new float[][]{{21f, 21.5f}, {30f, Float.NaN}});
        GridField field = GridField.ofLayers(new double[]{0, 1}, new double[]{0, 1}, new double[]{0.0}, sst);
        RunGeometry geometry = RunGeometry.builder().shape(new GridShape(2, 2))
                .longitudes(new double[]{0, 1}).latitudes(new double[]{0, 1})
                .aggregationFactor(1).focalWindowSize(3).build();

        // --- 2. Act ---
        GridLayer result = strategy.computeDay(List.of(TagObservation.surface(T0, 20.5, 22.0)), field, geometry);

        // --- 3. Assert ---
        assertThat(result.get(0, 0)).isPositive();
        assertThat(result.get(0, 1)).isPositive();
        assertThat(result.get(1, 0)).isZero();
        assertThat(result.get(1, 1)).isZero();
    }
}
