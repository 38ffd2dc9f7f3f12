package motorlab.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Configuración del motor de incertidumbre Monte Carlo.
 */
@Value
@Builder
@With
public class MonteCarloSettings {

    /**
     * Número de muestras por defecto de una campaña.
     */
    @Builder.Default
    int sampleCount = 10_000;

    /**
     * Semilla principal. Cada muestra deriva su propio flujo aleatorio de (seed, índice),
     * de modo que el resultado no depende del número de hilos.
     */
    @Builder.Default
    long seed = 42L;

    /**
     * Número de hilos del pool de evaluación.
     */
    @Builder.Default
    int workerCount = Runtime.getRuntime().availableProcessors();

    /**
     * Factor mínimo aplicado a un parámetro perturbado (evita valores no físicos).
     */
    @Builder.Default
    double minimumFactor = 0.5;

    public static MonteCarloSettings defaults() {
        return MonteCarloSettings.builder().build();
    }
}
