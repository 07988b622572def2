package projectpelagic.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.domain.timeline.AlignmentPlan;
import projectpelagic.exception.DataUnavailableException;
import projectpelagic.exception.InvalidTimelineException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reconcilia las fechas de la marca, la disponibilidad de datos de referencia y el vector
 * maestro de fechas del llamante.
 */
@Slf4j
public class TemporalAlignmentManager {

    /**
     * @param observations   Serie de observaciones de la marca.
     * @param masterDates    Vector maestro (ascendente, sin duplicados).
     * @param availableDates Fechas con campo de referencia.
     * @throws DataUnavailableException si no hay ninguna fecha de referencia, o ninguna fecha maestra
     *                                  queda dentro del límite.
     * @throws InvalidTimelineException si el vector maestro está vacío o desordenado.
     */
    public AlignmentPlan align(List<TagObservation> observations, List<LocalDate> masterDates,
                               SortedSet<LocalDate> availableDates) {
        if (availableDates == null || availableDates.isEmpty()) {
            throw new DataUnavailableException("No existe ninguna fecha con datos de referencia.");
        }
        validateMasterDates(masterDates);

        LocalDate limit = availableDates.last();
        List<LocalDate> truncatedMaster = masterDates.stream().filter(d -> !d.isAfter(limit)).toList();
        if (truncatedMaster.isEmpty()) {
            throw new DataUnavailableException("Todas las fechas maestras son posteriores a la última fecha de referencia " + limit);
        }
        List<TagObservation> truncatedObs = observations.stream().filter(o -> !o.date().isAfter(limit)).toList();
        if (truncatedMaster.size() < masterDates.size()) {
            log.info("Vector maestro truncado a {} ({} de {} fechas).", limit, truncatedMaster.size(), masterDates.size());
        }

        Map<LocalDate, Integer> position = new HashMap<>();
        for (int i = 0; i < truncatedMaster.size(); i++) {
            position.put(truncatedMaster.get(i), i);
        }

        SortedSet<LocalDate> uniqueDays = new TreeSet<>();
        truncatedObs.forEach(o -> uniqueDays.add(o.date()));

        List<LocalDate> processingDays = new ArrayList<>();
        Map<LocalDate, Integer> slotIndex = new LinkedHashMap<>();
        List<LocalDate> unassigned = new ArrayList<>();
        for (LocalDate day : uniqueDays) {
            Integer slot = position.get(day);
            if (slot == null) {
                unassigned.add(day);
            } else {
                processingDays.add(day);
                slotIndex.put(day, slot);
            }
        }
        if (!unassigned.isEmpty()) {
            log.warn("{} días con observaciones no pertenecen al vector maestro y se descartan: {}", unassigned.size(), unassigned);
        }
        if (!processingDays.isEmpty()) {
            log.info("Días de proceso: {} ({} a {}).", processingDays.size(),
                    processingDays.get(0), processingDays.get(processingDays.size() - 1));
        }
        return new AlignmentPlan(truncatedMaster, truncatedObs, processingDays, slotIndex, unassigned);
    }

    static void validateMasterDates(List<LocalDate> masterDates) {
        if (masterDates == null || masterDates.isEmpty()) {
            throw new InvalidTimelineException("El vector maestro de fechas está vacío.");
        }
        for (int i = 1; i < masterDates.size(); i++) {
            if (!masterDates.get(i).isAfter(masterDates.get(i - 1))) {
                throw new InvalidTimelineException(String.format(
                        "El vector maestro debe ser estrictamente ascendente: %s en la posición %d tras %s.",
                        masterDates.get(i), i, masterDates.get(i - 1)));
            }
        }
    }
}
