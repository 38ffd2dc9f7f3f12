package motorlab.uncertainty;

import lombok.extern.slf4j.Slf4j;
import motorlab.config.MonteCarloSettings;
import motorlab.config.MotorConfiguration;
import motorlab.config.MotorConfigurationValidator;
import motorlab.domain.uncertainty.StatisticalSummary;
import motorlab.domain.uncertainty.UncertaintySpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Motor de propagación de incertidumbre por Monte Carlo.
 * <p>
 * Las muestras se reparten en particiones contiguas, una por hilo del pool. Cada muestra
 * deriva su flujo aleatorio de (semilla, índice), así que con la misma semilla el resumen
 * es el mismo sea cual sea el número de hilos.
 */
@Slf4j
public class MonteCarloEngine implements AutoCloseable {

    private final MonteCarloSettings settings;
    private final MotorConfigurationValidator validator;
    private final ExecutorService threadPool;
    private final int workerCount;

    public MonteCarloEngine(MonteCarloSettings settings) {
        this(settings, new MotorConfigurationValidator());
    }

    public MonteCarloEngine(MonteCarloSettings settings, MotorConfigurationValidator validator) {
        this.settings = Objects.requireNonNull(settings, "settings no puede ser null");
        this.validator = Objects.requireNonNull(validator, "validator no puede ser null");
        this.workerCount = Math.max(settings.getWorkerCount(), 1);
        this.threadPool = Executors.newFixedThreadPool(workerCount);
        log.info("MonteCarloEngine inicializado. (Hilos: {}, Semilla: {})", workerCount, settings.getSeed());
    }

    public StatisticalSummary run(MotorConfiguration nominal, UncertaintySpec spec, PerformanceModel model) {
        return run(nominal, spec, settings.getSampleCount(), model);
    }

    /**
     * Ejecuta la campaña completa y bloquea hasta tener el resumen.
     */
    public StatisticalSummary run(MotorConfiguration nominal, UncertaintySpec spec, int sampleCount, PerformanceModel model) {
        return start(nominal, spec, sampleCount, model).awaitSummary();
    }

    /**
     * Lanza la campaña en segundo plano.
     *
     * @param nominal Configuración nominal; debe traer geometría si se perturban área de garganta o de inyector.
     * @throws IllegalArgumentException si {@code sampleCount} no es positivo.
     */
    public MonteCarloRun start(MotorConfiguration nominal, UncertaintySpec spec, int sampleCount, PerformanceModel model) {
        Objects.requireNonNull(nominal, "nominal no puede ser null");
        Objects.requireNonNull(spec, "spec no puede ser null");
        Objects.requireNonNull(model, "model no puede ser null");
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("El número de muestras debe ser positivo, recibido: " + sampleCount);
        }
        if (threadPool.isShutdown()) {
            throw new IllegalStateException("MonteCarloEngine ya está cerrado.");
        }
        // Falla pronto si un parámetro requiere una geometría que no existe
        spec.perturbations().keySet().forEach(parameter -> parameter.nominalValue(nominal));

        int partitionCount = Math.min(workerCount, sampleCount);
        int chunk = (sampleCount + partitionCount - 1) / partitionCount;
        AtomicBoolean stopRequested = new AtomicBoolean(false);

        List<Future<PartialStatistics>> futures = new ArrayList<>(partitionCount);
        for (int from = 0; from < sampleCount; from += chunk) {
            int to = Math.min(from + chunk, sampleCount);
            futures.add(threadPool.submit(new MonteCarloPartitionTask(
                    nominal, spec, model, validator, from, to,
                    settings.getSeed(), settings.getMinimumFactor(), stopRequested)));
        }
        log.info("Campaña Monte Carlo lanzada: {} muestras en {} particiones, {} parámetros inciertos.",
                sampleCount, futures.size(), spec.perturbations().size());
        return new MonteCarloRun(sampleCount, futures, stopRequested);
    }

    @Override
    public void close() {
        if (!threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("MonteCarloEngine cerrado.");
    }
}
