package motorlab.domain.uncertainty;

import lombok.Builder;

import java.util.Map;
import java.util.Optional;

/**
 * Resumen de una campaña Monte Carlo.
 *
 * @param requestedSamples  Muestras solicitadas.
 * @param completedSamples  Muestras evaluadas (menos que las solicitadas si se detuvo antes).
 * @param successfulSamples Muestras que produjeron un resultado válido.
 * @param statistics        Estadísticos por magnitud de salida.
 * @param failureCounts     Fallos agrupados por causa.
 * @param stoppedEarly      Indica si la campaña se detuvo de forma cooperativa.
 */
@Builder
public record StatisticalSummary(
        int requestedSamples,
        int completedSamples,
        int successfulSamples,
        Map<OutputQuantity, QuantityStatistics> statistics,
        Map<String, Integer> failureCounts,
        boolean stoppedEarly
) {
    public StatisticalSummary {
        statistics = Map.copyOf(statistics);
        failureCounts = Map.copyOf(failureCounts);
    }

    /**
     * Fracción de muestras válidas sobre las evaluadas. Los fallos cuentan en el denominador.
     */
    public double successRate() {
        return completedSamples == 0 ? 0.0 : (double) successfulSamples / completedSamples;
    }

    public Optional<QuantityStatistics> get(OutputQuantity quantity) {
        return Optional.ofNullable(statistics.get(quantity));
    }
}
