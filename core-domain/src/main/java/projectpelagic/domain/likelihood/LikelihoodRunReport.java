package projectpelagic.domain.likelihood;

import projectpelagic.config.LikelihoodConfig;

import java.time.LocalDate;
import java.util.List;

/**
 * Resumen de una ejecución apto para JSON: forma de la salida, rango de fechas y
 * estado de cada día.
 */
public record LikelihoodRunReport(
        LikelihoodConfig.Mode mode,
        int slotCount,
        int nx,
        int ny,
        LocalDate firstDate,
        LocalDate lastDate,
        List<DayReport> days,
        long elapsedMillis
) {
}
