package motorlab.domain.uncertainty;

import lombok.Builder;

/**
 * Estadísticos de una magnitud sobre las muestras válidas.
 * La desviación típica es poblacional; los percentiles se toman por índice sobre la serie ordenada.
 */
@Builder
public record QuantityStatistics(
        OutputQuantity quantity,
        int sampleCount,
        double mean,
        double standardDeviation,
        double coefficientOfVariation,
        double percentile5,
        double percentile95,
        double min,
        double max
) {
}
