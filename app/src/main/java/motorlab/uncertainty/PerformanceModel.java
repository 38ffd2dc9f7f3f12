package motorlab.uncertainty;

import motorlab.config.MotorConfiguration;
import motorlab.domain.uncertainty.OutputQuantity;

import java.util.Map;

/**
 * Modelo evaluado sobre cada configuración perturbada. Devuelve las magnitudes de salida
 * que acumula la campaña; los fallos del modelo se señalan con excepciones de la taxonomía.
 */
@FunctionalInterface
public interface PerformanceModel {
    Map<OutputQuantity, Double> evaluate(MotorConfiguration configuration);
}
