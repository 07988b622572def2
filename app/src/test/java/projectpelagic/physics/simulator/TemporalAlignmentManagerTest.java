package projectpelagic.physics.simulator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.domain.timeline.AlignmentPlan;
import projectpelagic.exception.DataUnavailableException;
import projectpelagic.exception.InvalidTimelineException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemporalAlignmentManagerTest {

    private static final LocalDate D1 = LocalDate.of(2015, 1, 1);
    private static final LocalDate D2 = D1.plusDays(1);
    private static final LocalDate D3 = D1.plusDays(2);
    private static final LocalDate D4 = D1.plusDays(3);

    private final TemporalAlignmentManager manager = new TemporalAlignmentManager();

    private static TagObservation on(LocalDate day, int hour) {
        return TagObservation.surface(day.atTime(hour, 0), 20.0, 21.0);
    }

    @Test
    @DisplayName("Los días de proceso son los días únicos con observaciones, con su hueco en el vector maestro")
    void align_assignsSlots() {
        // --- 1. Arrange ---
        List<TagObservation> obs = List.of(on(D3, 10), on(D1, 5), on(D3, 12));
        List<LocalDate> master = List.of(D1, D2, D3, D4);

        // --- 2. Act ---
        AlignmentPlan plan = manager.align(obs, master, new TreeSet<>(master));

        // --- 3. Assert ---
        assertThat(plan.processingDays()).containsExactly(D1, D3);
        assertThat(plan.slotOf(D1)).contains(0);
        assertThat(plan.slotOf(D3)).contains(2);
        assertThat(plan.slotCount()).isEqualTo(4);
        assertThat(plan.observationsOn(D3)).hasSize(2);
    }

    @Test
    @DisplayName("El vector maestro y las observaciones se truncan a la última fecha de referencia")
    void align_truncatesToLastAvailableDate() {
        List<TagObservation> obs = List.of(on(D1, 0), on(D4, 0));

        AlignmentPlan plan = manager.align(obs, List.of(D1, D2, D3, D4), new TreeSet<>(List.of(D1, D2)));

        assertThat(plan.masterDates()).containsExactly(D1, D2);
        assertThat(plan.observations()).hasSize(1);
        assertThat(plan.processingDays()).containsExactly(D1);
    }

    @Test
    @DisplayName("Los días ausentes del vector maestro se descartan y se informan")
    void align_dropsDaysOutsideMaster() {
        List<TagObservation> obs = List.of(on(D1, 0), on(D2, 0));

        AlignmentPlan plan = manager.align(obs, List.of(D1, D3), new TreeSet<>(List.of(D1, D2, D3)));

        assertThat(plan.processingDays()).containsExactly(D1);
        assertThat(plan.unassignedDays()).containsExactly(D2);
    }

    @Test
    @DisplayName("Sin fechas de referencia la ejecución no puede empezar")
    void align_noAvailableDates_throws() {
        assertThatThrownBy(() -> manager.align(List.of(on(D1, 0)), List.of(D1), new TreeSet<>()))
                .isInstanceOf(DataUnavailableException.class);
    }

    @Test
    @DisplayName("Si todo el vector maestro queda fuera del límite la ejecución falla")
    void align_masterAfterLastAvailable_throws() {
        assertThatThrownBy(() -> manager.align(List.of(on(D3, 0)), List.of(D3, D4), new TreeSet<>(List.of(D1))))
                .isInstanceOf(DataUnavailableException.class);
    }

    @Test
    @DisplayName("Un vector maestro vacío o no estrictamente ascendente es inválido")
    void validateMasterDates_rejectsBadTimelines() {
        assertThatThrownBy(() -> TemporalAlignmentManager.validateMasterDates(List.of()))
                .isInstanceOf(InvalidTimelineException.class);
        assertThatThrownBy(() -> TemporalAlignmentManager.validateMasterDates(List.of(D2, D1)))
                .isInstanceOf(InvalidTimelineException.class);
        assertThatThrownBy(() -> TemporalAlignmentManager.validateMasterDates(List.of(D1, D1)))
                .isInstanceOf(InvalidTimelineException.class);
    }
}
