package projectpelagic.io;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.domain.grid.GridField;
import projectpelagic.exception.DataUnavailableException;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Implementación en memoria a partir de un mapa fecha -> campo.
 * Inmutable tras la construcción, por lo que es segura para lecturas concurrentes.
 */
@Slf4j
public class InMemoryReferenceDataAccessor implements IReferenceDataAccessor {

    private final Map<LocalDate, GridField> fields;
    private final SortedSet<LocalDate> dates;

    public InMemoryReferenceDataAccessor(Map<LocalDate, GridField> fields) {
        Objects.requireNonNull(fields, "El mapa de campos no puede ser nulo.");
        this.fields = Collections.unmodifiableMap(new TreeMap<>(fields));
        this.dates = Collections.unmodifiableSortedSet(new TreeSet<>(fields.keySet()));
        log.debug("Accesor en memoria con {} fechas de referencia.", dates.size());
    }

    @Override
    public SortedSet<LocalDate> availableDates() {
        return dates;
    }

    @Override
    public GridField fetch(LocalDate date) {
        GridField field = fields.get(date);
        if (field == null) {
            throw DataUnavailableException.forDate(date);
        }
        return field;
    }
}
