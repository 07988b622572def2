package projectpelagic.physics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpelagic.domain.profile.DepthBound;
import projectpelagic.domain.profile.DepthProfileFit;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.exception.ProfileFitException;
import projectpelagic.physics.impl.LocalPolynomialRegression;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProfileReconstructorTest {

    private static final double[] LEVELS = {0, 50, 100, 150};
    private static final LocalDateTime T0 = LocalDateTime.of(2015, 6, 1, 12, 0);

    private final ProfileReconstructor reconstructor = new ProfileReconstructor(new LocalPolynomialRegression(0.7, 2));

    @Test
    @DisplayName("Las profundidades se ajustan al nivel más cercano sin repetir niveles")
    void snapToLevels_collapsesDuplicates() {
        int[] snapped = ProfileReconstructor.snapToLevels(new double[]{3, 48, 52, 160, -5}, LEVELS);

        assertThat(snapped).containsExactly(0, 1, 3);
    }

    @Test
    @DisplayName("Perfil lineal: las cotas coinciden con el mínimo y máximo en cada nivel")
    void reconstruct_linearProfile_hasExactBounds() {
        // --- 1. Arrange ---
        List<TagObservation> samples = new ArrayList<>();
        for (double z : LEVELS) {
            double t = 20.0 - 0.05 * z;
            samples.add(TagObservation.atDepth(T0, z, t - 1.0, t + 1.0));
        }

        // --- 2. Act ---
        DepthProfileFit fit = reconstructor.reconstruct(samples, LEVELS);

        // --- 3. Assert ---
        assertThat(fit.levelIndices()).containsExactly(0, 1, 2, 3);
        for (DepthBound b : fit.bounds()) {
            double t = 20.0 - 0.05 * b.depth();
            assertThat(b.low()).isCloseTo(t - 1.0, within(1e-6));
            assertThat(b.high()).isCloseTo(t + 1.0, within(1e-6));
        }
        assertThat(fit.minLow()).isCloseTo(11.5, within(1e-6));
    }

    @Test
    @DisplayName("Un día con todas las muestras a la misma profundidad falla el ajuste")
    void reconstruct_singleDepth_throwsFitFailure() {
        List<TagObservation> samples = List.of(
                TagObservation.atDepth(T0, 50, 15, 16),
                TagObservation.atDepth(T0.plusHours(1), 50, 15.5, 16.2));

        assertThatThrownBy(() -> reconstructor.reconstruct(samples, LEVELS))
                .isInstanceOf(ProfileFitException.class);
    }

    @Test
    @DisplayName("Las muestras sin profundidad no bastan para reconstruir un perfil")
    void reconstruct_surfaceOnly_throwsFitFailure() {
        List<TagObservation> samples = List.of(TagObservation.surface(T0, 15, 16));

        assertThatThrownBy(() -> reconstructor.reconstruct(samples, LEVELS))
                .isInstanceOf(ProfileFitException.class);
    }
}
