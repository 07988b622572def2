package projectpelagic.domain.likelihood;

import java.util.Objects;
import projectpelagic.domain.grid.GridLayer;

/**
 * Producto de un trabajador diario: la rejilla combinada (aún sin normalizar) y su informe.
 * Se consume una única vez durante el ensamblado.
 */
public record DayResult(DayReport report, GridLayer likelihood) {

    public DayResult {
        Objects.requireNonNull(report, "El informe diario no puede ser nulo.");
        Objects.requireNonNull(likelihood, "La rejilla diaria no puede ser nula.");
    }

    public int slot() {
        return report.slot();
    }

    public boolean isSuccess() {
        return report.status().isSuccess();
    }
}
