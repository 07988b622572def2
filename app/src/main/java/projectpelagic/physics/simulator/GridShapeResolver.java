package projectpelagic.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.GridShape;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.timeline.AlignmentPlan;
import projectpelagic.exception.DataUnavailableException;
import projectpelagic.physics.solver.GridAggregator;
import projectpelagic.physics.solver.SpatialVariabilityEstimator;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Pre-escaneo que fija la geometría de toda la ejecución antes de lanzar ninguna tarea diaria:
 * forma de salida, ejes, factor de agregación y ventana de vecindad.
 * <p>
 * La forma nunca se infiere del primer día que termine; se decide aquí una sola vez.
 */
@Slf4j
public class GridShapeResolver {

    private final LikelihoodConfig config;
    private final TimedGridFetcher fetcher;

    public GridShapeResolver(LikelihoodConfig config, TimedGridFetcher fetcher) {
        this.config = config;
        this.fetcher = fetcher;
    }

    /**
     * @param plan           Plan de alineación (define el orden de los candidatos a pre-escanear).
     * @param availableDates Fechas de referencia disponibles, usadas si ningún día de proceso es legible.
     * @param externalMask   Máscara opcional con la forma de salida; puede ser nula.
     * @throws DataUnavailableException si no se puede leer ninguna rejilla y no hay forma explícita.
     */
    public RunGeometry resolve(AlignmentPlan plan, Set<LocalDate> availableDates, GridLayer externalMask) {
        Set<LocalDate> candidates = new LinkedHashSet<>(plan.processingDays());
        LocalDate last = plan.masterDates().get(plan.masterDates().size() - 1);
        availableDates.stream().filter(d -> !d.isAfter(last)).forEach(candidates::add);

        for (LocalDate candidate : candidates) {
            try {
                GridField field = fetcher.fetch(candidate);
                return fromField(field, candidate, externalMask);
            } catch (DataUnavailableException e) {
                log.warn("Pre-escaneo: no se pudo leer la rejilla de {}: {}", candidate, e.getMessage());
            }
        }

        GridShape explicit = config.getOutputShape();
        if (explicit == null) {
            throw new DataUnavailableException("No se puede determinar la forma de salida: ninguna rejilla legible y sin forma explícita.");
        }
        log.warn("Pre-escaneo sin rejillas legibles; se usa la forma explícita {} con ejes por índice.", explicit);
        int window = config.getFocalWindowSize() != null ? config.getFocalWindowSize() : SpatialVariabilityEstimator.MIN_WINDOW_SIZE;
        return RunGeometry.builder()
                .shape(explicit)
                .longitudes(indexAxis(explicit.nx()))
                .latitudes(indexAxis(explicit.ny()))
                .aggregationFactor(1)
                .focalWindowSize(validateWindow(window))
                .externalMask(externalMask)
                .build();
    }

    private RunGeometry fromField(GridField field, LocalDate source, GridLayer externalMask) {
        int factor = 1;
        if (config.isAutoAggregate() && (field.getNx() > 1 || field.getNy() > 1)) {
            factor = GridAggregator.aggregationFactor(field.resolution(), config.getTargetResolution());
        }
        GridField effective = GridAggregator.aggregate(field, factor);

        GridShape shape = effective.shape();
        if (config.getOutputShape() != null && !config.getOutputShape().equals(shape)) {
            log.warn("La forma explícita {} difiere de la rejilla pre-escaneada {}; prevalece la explícita.",
                    config.getOutputShape(), shape);
            shape = config.getOutputShape();
        }

        int window;
        if (config.getFocalWindowSize() != null) {
            window = validateWindow(config.getFocalWindowSize());
        } else if (effective.getNx() > 1 || effective.getNy() > 1) {
            window = SpatialVariabilityEstimator.windowSizeFor(effective.resolution(), config.getFocalExtentDegrees());
        } else {
            window = SpatialVariabilityEstimator.MIN_WINDOW_SIZE;
        }

        boolean axesMatch = shape.equals(effective.shape());
        log.info("Pre-escaneo ({}): forma {}, agregación x{}, ventana {}.", source, shape, factor, window);
        return RunGeometry.builder()
                .shape(shape)
                .longitudes(axesMatch ? effective.getLongitudes() : indexAxis(shape.nx()))
                .latitudes(axesMatch ? effective.getLatitudes() : indexAxis(shape.ny()))
                .aggregationFactor(factor)
                .focalWindowSize(window)
                .externalMask(externalMask)
                .build();
    }

    private static int validateWindow(int window) {
        if (window < SpatialVariabilityEstimator.MIN_WINDOW_SIZE || window % 2 == 0) {
            throw new IllegalArgumentException("La ventana de vecindad debe ser impar y >= 3: " + window);
        }
        return window;
    }

    private static double[] indexAxis(int n) {
        double[] axis = new double[n];
        for (int i = 0; i < n; i++) {
            axis[i] = i;
        }
        return axis;
    }
}
