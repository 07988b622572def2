package projectpelagic.domain.likelihood;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridShape;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LikelihoodResultTest {

    @Test
    @DisplayName("Los ejes del resultado se copian al construir y al leer")
    void axes_areDefensivelyCopied() {
        // --- 1. Arrange ---
        double[] lon = {10.0, 10.5};
        double[] lat = {-5.0};
        LocalDate day = LocalDate.of(2022, 4, 1);
        LikelihoodResult result = LikelihoodResult.builder()
                .mode(LikelihoodConfig.Mode.SST)
                .stack(new LikelihoodStack(new GridShape(2, 1), 1))
                .dates(List.of(day))
                .longitudes(lon)
                .latitudes(lat)
                .reports(List.of(DayReport.ok(day, 0, 1.0)))
                .build();

        // --- 2. Act ---
        lon[1] = 0.0;
        result.getLongitudes()[0] = -500.0;
        result.getLatitudes()[0] = -500.0;

        // --- 3. Assert ---
        assertThat(result.getLongitudes()).containsExactly(10.0, 10.5);
        assertThat(result.getLatitudes()).containsExactly(-5.0);
        assertThat(result.failedDayCount()).isZero();
    }
}
