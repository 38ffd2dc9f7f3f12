package motorlab.uncertainty;

import motorlab.config.MotorConfiguration;
import motorlab.domain.uncertainty.OutputQuantity;

import java.util.Map;

/**
 * Resultado de evaluar una configuración perturbada. Si {@code failureCause} no es null,
 * la muestra es un fallo y {@code outputs} está vacío.
 */
public record MonteCarloSample(
        int index,
        MotorConfiguration configuration,
        Map<OutputQuantity, Double> outputs,
        String failureCause
) {
    public static MonteCarloSample success(int index, MotorConfiguration configuration, Map<OutputQuantity, Double> outputs) {
        return new MonteCarloSample(index, configuration, outputs, null);
    }

    public static MonteCarloSample failure(int index, MotorConfiguration configuration, String cause) {
        return new MonteCarloSample(index, configuration, Map.of(), cause);
    }

    public boolean isSuccess() {
        return failureCause == null;
    }
}
