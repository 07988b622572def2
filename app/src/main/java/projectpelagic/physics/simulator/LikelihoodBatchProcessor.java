package projectpelagic.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.likelihood.DayReport;
import projectpelagic.domain.likelihood.DayResult;
import projectpelagic.domain.likelihood.DayStatus;
import projectpelagic.domain.likelihood.LikelihoodResult;
import projectpelagic.domain.likelihood.LikelihoodStack;
import projectpelagic.domain.tag.TagObservation;
import projectpelagic.domain.timeline.AlignmentPlan;
import projectpelagic.exception.LikelihoodComputationException;
import projectpelagic.factory.LikelihoodStackFactory;
import projectpelagic.factory.LikelihoodStrategyFactory;
import projectpelagic.io.IReferenceDataAccessor;
import projectpelagic.physics.i.IDailyLikelihoodStrategy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orquestador del cálculo de verosimilitud de una marca.
 * <p>
 * Responsabilidades:
 * 1. Alinear las observaciones con el vector maestro de fechas.
 * 2. Fijar la geometría de salida con un pre-escaneo y reservar la pila completa.
 * 3. Repartir los días entre un pool fijo de trabajadores independientes.
 * 4. Ensamblar secuencialmente los resultados con {@link LikelihoodStackFactory}.
 */
@Slf4j
public class LikelihoodBatchProcessor implements AutoCloseable {

    /**
     * Prefijo de los hilos del pool de trabajadores diarios.
     */
    public static final String WORKER_THREAD_PREFIX = "likelihood-worker-";

    private final LikelihoodConfig config;
    private final IReferenceDataAccessor accessor;
    private final IDailyLikelihoodStrategy strategy;
    private final ExecutorService threadPool;
    private final TimedGridFetcher fetcher;
    private final TemporalAlignmentManager alignmentManager = new TemporalAlignmentManager();

    public LikelihoodBatchProcessor(LikelihoodConfig config, IReferenceDataAccessor accessor) {
        this(config, accessor, LikelihoodStrategyFactory.create(config));
    }

    public LikelihoodBatchProcessor(LikelihoodConfig config, IReferenceDataAccessor accessor,
                                    IDailyLikelihoodStrategy strategy) {
        this.config = config;
        this.accessor = accessor;
        this.strategy = strategy;
        // El lector valida el tiempo máximo; se crea antes que el pool para no dejar hilos huérfanos.
        this.fetcher = new TimedGridFetcher(accessor, config.getFetchTimeoutSeconds());
        AtomicInteger counter = new AtomicInteger();
        this.threadPool = Executors.newFixedThreadPool(Math.max(config.getWorkerCount(), 1),
                r -> new Thread(r, WORKER_THREAD_PREFIX + counter.incrementAndGet()));
        log.info("LikelihoodBatchProcessor inicializado. (Modo: {}, Estrategia: {}, Hilos: {})",
                config.getMode(), strategy.getName(), Math.max(config.getWorkerCount(), 1));
    }

    /**
     * Ejecución completa sin máscara externa.
     */
    public LikelihoodResult process(List<TagObservation> observations, List<LocalDate> masterDates) {
        return process(observations, masterDates, null);
    }

    /**
     * @param externalMask Máscara opcional (forma de salida). Las celdas a 0 o NaN quedan excluidas.
     */
    public LikelihoodResult process(List<TagObservation> observations, List<LocalDate> masterDates,
                                    GridLayer externalMask) {
        long startTime = System.currentTimeMillis();

        // 1. Alineación temporal
        SortedSet<LocalDate> available = accessor.availableDates();
        AlignmentPlan plan = alignmentManager.align(observations, masterDates, available);

        // 2. Pre-escaneo y reserva de la pila completa
        RunGeometry geometry = new GridShapeResolver(config, fetcher).resolve(plan, available, externalMask);
        LikelihoodStack stack = LikelihoodStackFactory.allocate(geometry.shape(), plan.slotCount());

        // 3. Trabajadores diarios
        List<DailyLikelihoodTask> tasks = new ArrayList<>(plan.processingDays().size());
        for (LocalDate day : plan.processingDays()) {
            tasks.add(new DailyLikelihoodTask(day, plan.slotOf(day).orElseThrow(), plan.observationsOn(day),
                    fetcher, strategy, geometry));
        }

        List<Future<DayResult>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LikelihoodComputationException("Cálculo de verosimilitud interrumpido.", e);
        }

        List<DayResult> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            DailyLikelihoodTask task = tasks.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("El trabajador del día {} terminó con error.", task.getDay(), e.getCause());
                results.add(new DayResult(
                        DayReport.failed(task.getDay(), task.getSlot(), DayStatus.FAILED, String.valueOf(e.getCause())),
                        GridLayer.zeros(geometry.shape())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LikelihoodComputationException("Cálculo de verosimilitud interrumpido.", e);
            }
        }

        // 4. Ensamblado secuencial
        LikelihoodStackFactory.assemble(stack, results);

        List<DayReport> reports = new ArrayList<>(results.size() + plan.unassignedDays().size());
        results.forEach(r -> reports.add(r.report()));
        for (LocalDate day : plan.unassignedDays()) {
            reports.add(DayReport.failed(day, -1, DayStatus.UNASSIGNED, "Fecha ausente del vector maestro."));
        }
        reports.sort(Comparator.comparing(DayReport::date));
        reports.forEach(r -> log.info("{}", r));

        long elapsed = System.currentTimeMillis() - startTime;
        LikelihoodResult result = LikelihoodResult.builder()
                .mode(config.getMode())
                .stack(stack)
                .dates(plan.masterDates())
                .longitudes(geometry.longitudes())
                .latitudes(geometry.latitudes())
                .reports(List.copyOf(reports))
                .elapsedMillis(elapsed)
                .build();
        log.info("Cálculo completado en {} ms: {} huecos, {} días procesados, {} fallidos.",
                elapsed, result.slotCount(), results.size(), result.failedDayCount());
        return result;
    }

    /**
     * Atajo que abre y cierra el procesador para una única ejecución.
     */
    public static LikelihoodResult run(LikelihoodConfig config, IReferenceDataAccessor accessor,
                                       List<TagObservation> observations, List<LocalDate> masterDates) {
        try (LikelihoodBatchProcessor processor = new LikelihoodBatchProcessor(config, accessor)) {
            return processor.process(observations, masterDates);
        }
    }

    @Override
    public void close() {
        log.info("Cerrando el pool de hilos de LikelihoodBatchProcessor.");
        threadPool.shutdown();
        try {
            if (!threadPool.awaitTermination(5, TimeUnit.SECONDS)) {
                threadPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            threadPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        fetcher.close();
    }
}
