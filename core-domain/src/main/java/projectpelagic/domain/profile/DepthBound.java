package projectpelagic.domain.profile;

/**
 * Cotas estimadas del perfil de la marca en un nivel de profundidad de la rejilla.
 *
 * @param levelIndex Índice del nivel en el eje de profundidad de la rejilla de referencia.
 * @param depth      Profundidad del nivel [m].
 * @param low        Cota inferior (ajuste de mínimos menos el error estándar escalado).
 * @param high       Cota superior (ajuste de máximos más el error estándar escalado).
 */
public record DepthBound(int levelIndex, double depth, double low, double high) {
}
