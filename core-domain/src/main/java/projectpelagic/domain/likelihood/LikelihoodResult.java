package projectpelagic.domain.likelihood;

import lombok.Builder;
import lombok.Value;
import projectpelagic.config.LikelihoodConfig;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Resultado completo de una ejecución, tal como lo recibe el consumidor externo
 * (georreferenciación / exportación).
 */
@Value
public class LikelihoodResult {

    LikelihoodConfig.Mode mode;

    /**
     * Pila de verosimilitudes normalizadas, un hueco por fecha de {@link #dates}.
     */
    LikelihoodStack stack;

    /**
     * Vector maestro de fechas truncado.
     */
    List<LocalDate> dates;

    /**
     * Ejes de la rejilla de salida (tras la posible agregación).
     */
    double[] longitudes;
    double[] latitudes;

    /**
     * Registro de estado por día procesado, ordenado por fecha.
     */
    List<DayReport> reports;

    long elapsedMillis;

    @Builder
    public LikelihoodResult(LikelihoodConfig.Mode mode, LikelihoodStack stack, List<LocalDate> dates,
                            double[] longitudes, double[] latitudes, List<DayReport> reports, long elapsedMillis) {
        Objects.requireNonNull(stack, "La pila de salida no puede ser nula.");
        Objects.requireNonNull(longitudes, "El eje de longitudes no puede ser nulo.");
        Objects.requireNonNull(latitudes, "El eje de latitudes no puede ser nulo.");
        this.mode = mode;
        this.stack = stack;
        this.dates = dates == null ? List.of() : List.copyOf(dates);
        this.longitudes = longitudes.clone();
        this.latitudes = latitudes.clone();
        this.reports = reports == null ? List.of() : List.copyOf(reports);
        this.elapsedMillis = elapsedMillis;
    }

    public double[] getLongitudes() {
        return longitudes.clone();
    }

    public double[] getLatitudes() {
        return latitudes.clone();
    }

    public int slotCount() {
        return stack.getSlotCount();
    }

    public long failedDayCount() {
        return reports.stream().filter(r -> !r.status().isSuccess()).count();
    }

    /**
     * Resumen serializable (sin la pila) para el registro de la ejecución.
     */
    public LikelihoodRunReport toRunReport() {
        return new LikelihoodRunReport(mode, dates.size(), stack.getShape().nx(), stack.getShape().ny(),
                dates.isEmpty() ? null : dates.get(0),
                dates.isEmpty() ? null : dates.get(dates.size() - 1),
                reports, elapsedMillis);
    }
}
