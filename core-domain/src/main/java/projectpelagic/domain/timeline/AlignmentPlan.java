package projectpelagic.domain.timeline;

import projectpelagic.domain.tag.TagObservation;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resultado de la alineación temporal: la lista autoritativa de días a procesar
 * y su posición en el vector maestro de fechas.
 *
 * @param masterDates     Vector maestro truncado a la última fecha de referencia disponible.
 * @param observations    Observaciones de la marca restringidas a ese límite.
 * @param processingDays  Días únicos (ascendentes) con al menos una observación y un hueco asignado.
 * @param slotIndex       Día de proceso -> posición en {@code masterDates}.
 * @param unassignedDays  Días con observaciones que no existen en el vector maestro (sin hueco).
 */
public record AlignmentPlan(
        List<LocalDate> masterDates,
        List<TagObservation> observations,
        List<LocalDate> processingDays,
        Map<LocalDate, Integer> slotIndex,
        List<LocalDate> unassignedDays
) {
    public AlignmentPlan {
        Objects.requireNonNull(masterDates, "El vector maestro no puede ser nulo.");
        Objects.requireNonNull(observations, "Las observaciones no pueden ser nulas.");
        Objects.requireNonNull(processingDays, "Los días de proceso no pueden ser nulos.");
        Objects.requireNonNull(slotIndex, "El índice de huecos no puede ser nulo.");
        masterDates = List.copyOf(masterDates);
        observations = List.copyOf(observations);
        processingDays = List.copyOf(processingDays);
        slotIndex = Collections.unmodifiableMap(new LinkedHashMap<>(slotIndex));
        unassignedDays = unassignedDays == null ? List.of() : List.copyOf(unassignedDays);
    }

    public int slotCount() {
        return masterDates.size();
    }

    public Optional<Integer> slotOf(LocalDate day) {
        return Optional.ofNullable(slotIndex.get(day));
    }

    public boolean hasProcessingDays() {
        return !processingDays.isEmpty();
    }

    /**
     * Observaciones de un único día de proceso, en su orden original.
     */
    public List<TagObservation> observationsOn(LocalDate day) {
        return observations.stream().filter(o -> o.date().equals(day)).toList();
    }
}
