package projectpelagic.domain.profile;

import java.util.List;
import java.util.Objects;

/**
 * Perfil diario reconstruido: una entrada por nivel de profundidad distinto al que
 * se han ajustado las muestras de ese día.
 */
public record DepthProfileFit(List<DepthBound> bounds) {

    public DepthProfileFit {
        Objects.requireNonNull(bounds, "La lista de cotas no puede ser nula.");
        bounds = List.copyOf(bounds);
    }

    public int size() {
        return bounds.size();
    }

    public boolean isEmpty() {
        return bounds.isEmpty();
    }

    public int[] levelIndices() {
        return bounds.stream().mapToInt(DepthBound::levelIndex).toArray();
    }

    /**
     * Mínimo de las cotas inferiores finitas, o {@code NaN} si no hay ninguna.
     */
    public double minLow() {
        return bounds.stream()
                .mapToDouble(DepthBound::low)
                .filter(Double::isFinite)
                .min()
                .orElse(Double.NaN);
    }

    public int deepestLevelIndex() {
        return bounds.stream().mapToInt(DepthBound::levelIndex).max()
                .orElseThrow(() -> new IllegalStateException("El perfil está vacío."));
    }
}
