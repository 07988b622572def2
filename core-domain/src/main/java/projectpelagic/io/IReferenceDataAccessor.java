package projectpelagic.io;

import projectpelagic.domain.grid.GridField;
import projectpelagic.exception.DataUnavailableException;

import java.time.LocalDate;
import java.util.SortedSet;

/**
 * Acceso de sólo lectura a los campos ambientales de referencia (reanálisis o satélite).
 * <p>
 * Las implementaciones deben poder invocarse concurrentemente desde varios trabajadores.
 */
public interface IReferenceDataAccessor {

    /**
     * Fechas para las que existe un campo de referencia.
     */
    SortedSet<LocalDate> availableDates();

    /**
     * Obtiene el campo de referencia de una fecha.
     *
     * @throws DataUnavailableException si no hay datos o no se pueden leer.
     */
    GridField fetch(LocalDate date) throws DataUnavailableException;
}
