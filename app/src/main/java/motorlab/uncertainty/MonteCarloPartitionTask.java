package motorlab.uncertainty;

import lombok.extern.slf4j.Slf4j;
import motorlab.config.MotorConfiguration;
import motorlab.config.MotorConfigurationValidator;
import motorlab.domain.exception.MotorAnalysisException;
import motorlab.domain.exception.ValidationException;
import motorlab.domain.uncertainty.UncertainParameter;
import motorlab.domain.uncertainty.UncertaintySpec;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Evalúa las muestras [fromIndex, toIndex) de una campaña y devuelve sus estadísticos parciales.
 * <p>
 * Antes de cada muestra consulta la bandera de parada; las muestras ya empezadas terminan.
 */
@Slf4j
public class MonteCarloPartitionTask implements Callable<PartialStatistics> {

    private static final String VALIDATION_FAILURE = ValidationException.class.getSimpleName();

    private final MotorConfiguration nominal;
    private final Map<UncertainParameter, Double> perturbations;
    private final PerformanceModel model;
    private final MotorConfigurationValidator validator;
    private final int fromIndex;
    private final int toIndex;
    private final long seed;
    private final double minimumFactor;
    private final AtomicBoolean stopRequested;

    public MonteCarloPartitionTask(MotorConfiguration nominal, UncertaintySpec spec, PerformanceModel model,
                                   MotorConfigurationValidator validator, int fromIndex, int toIndex,
                                   long seed, double minimumFactor, AtomicBoolean stopRequested) {
        this.nominal = nominal;
        // Orden del enum: la secuencia de normales consumida por muestra es estable
        this.perturbations = new EnumMap<>(UncertainParameter.class);
        this.perturbations.putAll(spec.perturbations());
        this.model = model;
        this.validator = validator;
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
        this.seed = seed;
        this.minimumFactor = minimumFactor;
        this.stopRequested = stopRequested;
    }

    @Override
    public PartialStatistics call() {
        PartialStatistics partial = new PartialStatistics();
        for (int index = fromIndex; index < toIndex; index++) {
            if (stopRequested.get()) {
                log.debug("Partición [{}, {}) detenida en la muestra {}", fromIndex, toIndex, index);
                break;
            }
            partial.accept(evaluate(index));
        }
        return partial;
    }

    MonteCarloSample evaluate(int index) {
        MotorConfiguration perturbed = perturb(index);

        List<String> violations = validator.verify(perturbed);
        if (!violations.isEmpty()) {
            log.debug("Muestra {} descartada por validación: {}", index, violations.get(0));
            return MonteCarloSample.failure(index, perturbed, VALIDATION_FAILURE);
        }

        try {
            return MonteCarloSample.success(index, perturbed, model.evaluate(perturbed));
        } catch (MotorAnalysisException e) {
            log.debug("Muestra {} fallida: {}", index, e.getMessage());
            return MonteCarloSample.failure(index, perturbed, e.getClass().getSimpleName());
        }
    }

    /**
     * Multiplica cada parámetro por max(1 + σ·z, factor mínimo) con z ~ N(0, 1).
     */
    MotorConfiguration perturb(int index) {
        BoxMullerGaussian gaussian = BoxMullerGaussian.forSample(seed, index);
        MotorConfiguration configuration = nominal;
        for (Map.Entry<UncertainParameter, Double> entry : perturbations.entrySet()) {
            double factor = Math.max(1.0 + entry.getValue() * gaussian.next(), minimumFactor);
            configuration = entry.getKey().scale(configuration, factor);
        }
        return configuration;
    }
}
