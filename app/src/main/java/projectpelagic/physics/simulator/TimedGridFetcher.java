package projectpelagic.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.domain.grid.GridField;
import projectpelagic.exception.DataUnavailableException;
import projectpelagic.exception.FetchTimeoutException;
import projectpelagic.io.IReferenceDataAccessor;

import java.time.LocalDate;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Envuelve el accesor de referencia acotando cada lectura con un tiempo máximo.
 * La lectura se ejecuta en un pool de E/S propio para que un accesor bloqueado
 * no retenga indefinidamente al trabajador diario.
 */
@Slf4j
public class TimedGridFetcher implements AutoCloseable {

    /**
     * Prefijo de los hilos del pool de lectura.
     */
    public static final String THREAD_PREFIX = "grid-fetch-";

    private final IReferenceDataAccessor accessor;
    private final long timeoutSeconds;
    private final ExecutorService ioPool;

    public TimedGridFetcher(IReferenceDataAccessor accessor, long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("El tiempo máximo de lectura debe ser positivo.");
        }
        this.accessor = accessor;
        this.timeoutSeconds = timeoutSeconds;
        AtomicInteger counter = new AtomicInteger();
        this.ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, THREAD_PREFIX + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws FetchTimeoutException    si la lectura excede el tiempo máximo.
     * @throws DataUnavailableException si el accesor falla o no tiene datos.
     */
    public GridField fetch(LocalDate date) {
        Future<GridField> future = ioPool.submit(() -> accessor.fetch(date));
        try {
            GridField field = future.get(timeoutSeconds, TimeUnit.SECONDS);
            if (field == null) {
                throw DataUnavailableException.forDate(date);
            }
            return field;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchTimeoutException(date, timeoutSeconds);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DataUnavailableException("Lectura de " + date + " interrumpida.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DataUnavailableException dataUnavailable) {
                throw dataUnavailable;
            }
            throw new DataUnavailableException("Error leyendo la rejilla de " + date + ": " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        if (!ioPool.isShutdown()) {
            ioPool.shutdownNow();
        }
        try {
            if (!ioPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("El pool de lectura de rejillas no terminó en 5 s.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Pool de lectura de rejillas cerrado.");
    }
}
