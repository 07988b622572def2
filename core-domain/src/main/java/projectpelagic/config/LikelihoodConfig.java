package projectpelagic.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import projectpelagic.domain.grid.GridShape;

/**
 * Contenedor principal para todos los parámetros de un cálculo de verosimilitud.
 * <p>
 * Los campos opcionales se representan con tipos envoltorio ({@code Integer}, {@code Double})
 * y valen {@code null} cuando deben derivarse automáticamente durante el pre-escaneo de la rejilla.
 */
@Value
@Builder
@With
@Jacksonized
public class LikelihoodConfig {

    public static final double DEFAULT_HEAT_CAPACITY = 3.993;
    public static final double DEFAULT_SEAWATER_DENSITY = 1025.0;
    public static final double DEFAULT_HEAT_CONTENT_SCALE = 10000.0;
    public static final double DEFAULT_HEAT_CONTENT_BIAS = 0.2;

    /**
     * Tipo de comparación entre la marca y el campo de referencia.
     */
    @Builder.Default
    Mode mode = Mode.PROFILE;

    /**
     * Lado de la ventana cuadrada de vecindad (impar, >= 3). Si es nulo se deriva de la
     * resolución de la rejilla para cubrir aproximadamente {@link #focalExtentDegrees}.
     */
    Integer focalWindowSize;

    /**
     * Extensión espacial (grados) que debe cubrir la ventana de vecindad derivada.
     */
    @Builder.Default
    double focalExtentDegrees = 0.25;

    /**
     * Error del sensor de la marca, en porcentaje. Ensancha el intervalo SST.
     */
    @Builder.Default
    double sensorErrorPercent = 1.0;

    /**
     * Isoterma base para el contenido calorífico. Nula = mínimo del perfil bajo del día.
     */
    Double isotherm;

    /**
     * Enmascara las celdas sin dato en la capa más profunda relevante (modo OHC).
     */
    @Builder.Default
    boolean bathymetryMask = true;

    /**
     * Constante de calibración restada a la verosimilitud OHC normalizada.
     */
    @Builder.Default
    double heatContentBias = DEFAULT_HEAT_CONTENT_BIAS;

    /**
     * Capacidad calorífica del agua de mar [kJ/kg·°C].
     */
    @Builder.Default
    double heatCapacity = DEFAULT_HEAT_CAPACITY;

    /**
     * Densidad asumida del agua de mar [kg/m³].
     */
    @Builder.Default
    double seawaterDensity = DEFAULT_SEAWATER_DENSITY;

    /**
     * Divisor de escala aplicado al contenido calorífico integrado.
     */
    @Builder.Default
    double heatContentScale = DEFAULT_HEAT_CONTENT_SCALE;

    /**
     * Agrega (promedio por bloques) las rejillas más finas que {@link #targetResolution}.
     */
    @Builder.Default
    boolean autoAggregate = false;

    @Builder.Default
    double targetResolution = 0.1;

    /**
     * Número de hilos del pool de trabajadores diarios.
     */
    @Builder.Default
    int workerCount = Runtime.getRuntime().availableProcessors();

    /**
     * Tiempo máximo de espera para obtener la rejilla de referencia de un día.
     */
    @Builder.Default
    long fetchTimeoutSeconds = 120;

    /**
     * Forma espacial explícita de la salida. Si es nula la fija el pre-escaneo.
     */
    GridShape outputShape;

    /**
     * Fracción de vecinos más cercanos usada por la regresión local del perfil.
     */
    @Builder.Default
    double regressionSpan = 0.7;

    /**
     * Grado del polinomio local de la regresión del perfil.
     */
    @Builder.Default
    int regressionDegree = 2;

    public static LikelihoodConfig defaults(Mode mode) {
        return LikelihoodConfig.builder().mode(mode).build();
    }

    public enum Mode {
        /** Perfil de temperatura en profundidad, producto entre capas. */
        PROFILE,
        /** Contenido calorífico oceánico integrado sobre la columna. */
        OHC,
        /** Temperatura superficial del mar. */
        SST
    }
}
