package projectpelagic.physics.simulator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.likelihood.DayReport;
import projectpelagic.domain.likelihood.DayResult;
import projectpelagic.domain.likelihood.DayStatus;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.exception.DataUnavailableException;
import projectpelagic.exception.DimensionMismatchException;
import projectpelagic.exception.FetchTimeoutException;
import projectpelagic.exception.ProfileFitException;
import projectpelagic.physics.i.IDailyLikelihoodStrategy;
import projectpelagic.physics.solver.GridAggregator;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Tarea que calcula la verosimilitud combinada de un único día.
 * Está diseñada para ejecutarse en un pool de hilos, sin dependencias con otros días.
 * <p>
 * Cualquier fallo del día se captura aquí y se convierte en una rejilla de ceros con su
 * estado; la tarea nunca propaga excepciones al orquestador.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class DailyLikelihoodTask implements Callable<DayResult> {

    // --- Entradas para la tarea ---
    private final LocalDate day;
    private final int slot;
    private final List<TagObservation> observations;
    private final TimedGridFetcher fetcher;         // Compartido, sólo lectura
    private final IDailyLikelihoodStrategy strategy; // Compartida, sin estado
    private final RunGeometry geometry;

    @Override
    public DayResult call() {
        try {
            GridField field = GridAggregator.aggregate(fetcher.fetch(day), geometry.aggregationFactor());
            if (!field.shape().equals(geometry.shape())) {
                throw new DimensionMismatchException(geometry.shape(), field.shape());
            }

            GridLayer combined = strategy.computeDay(observations, field, geometry);
            if (!combined.shape().equals(geometry.shape())) {
                throw new DimensionMismatchException(geometry.shape(), combined.shape());
            }
            return new DayResult(DayReport.ok(day, slot, combined.finiteMax()), combined);

        } catch (FetchTimeoutException e) {
            return degraded(DayStatus.TIMEOUT, e);
        } catch (DataUnavailableException e) {
            return degraded(DayStatus.DATA_UNAVAILABLE, e);
        } catch (ProfileFitException e) {
            return degraded(DayStatus.FIT_FAILURE, e);
        } catch (DimensionMismatchException e) {
            return degraded(DayStatus.DIMENSION_MISMATCH, e);
        } catch (RuntimeException e) {
            log.error("Error inesperado procesando {}", day, e);
            return degraded(DayStatus.FAILED, e);
        }
    }

    private DayResult degraded(DayStatus status, Exception cause) {
        log.warn("Día {} degradado a cero ({}): {}", day, status, cause.getMessage());
        return new DayResult(DayReport.failed(day, slot, status, cause.getMessage()), GridLayer.zeros(geometry.shape()));
    }
}
