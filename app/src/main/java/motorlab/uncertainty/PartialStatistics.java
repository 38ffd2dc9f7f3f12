package motorlab.uncertainty;

import motorlab.domain.uncertainty.OutputQuantity;
import motorlab.domain.uncertainty.QuantityStatistics;
import motorlab.domain.uncertainty.StatisticalSummary;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Acumulador local de una partición Monte Carlo.
 * <p>
 * Cada partición tiene el suyo (sin estado compartido entre hilos) y el llamador los fusiona
 * al final. Los momentos se acumulan con Welford y se combinan con la fórmula de Chan; los
 * valores se conservan para calcular percentiles.
 */
public class PartialStatistics {

    private int attempted;
    private int succeeded;
    private final Map<String, Integer> failures = new TreeMap<>();
    private final Map<OutputQuantity, Accumulator> accumulators = new EnumMap<>(OutputQuantity.class);

    public void accept(MonteCarloSample sample) {
        attempted++;
        if (!sample.isSuccess()) {
            failures.merge(sample.failureCause(), 1, Integer::sum);
            return;
        }
        succeeded++;
        sample.outputs().forEach((quantity, value) ->
                accumulators.computeIfAbsent(quantity, q -> new Accumulator()).add(value));
    }

    public void merge(PartialStatistics other) {
        attempted += other.attempted;
        succeeded += other.succeeded;
        other.failures.forEach((cause, count) -> failures.merge(cause, count, Integer::sum));
        other.accumulators.forEach((quantity, accumulator) ->
                accumulators.computeIfAbsent(quantity, q -> new Accumulator()).merge(accumulator));
    }

    public int getAttempted() {
        return attempted;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public StatisticalSummary toSummary(int requestedSamples) {
        Map<OutputQuantity, QuantityStatistics> statistics = new EnumMap<>(OutputQuantity.class);
        accumulators.forEach((quantity, accumulator) -> statistics.put(quantity, accumulator.finish(quantity)));
        return StatisticalSummary.builder()
                .requestedSamples(requestedSamples)
                .completedSamples(attempted)
                .successfulSamples(succeeded)
                .statistics(statistics)
                .failureCounts(failures)
                .stoppedEarly(attempted < requestedSamples)
                .build();
    }

    static final class Accumulator {
        private long count;
        private double mean;
        private double m2;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private double[] values = new double[64];
        private int size;

        void add(double value) {
            count++;
            double delta = value - mean;
            mean += delta / count;
            m2 += delta * (value - mean);
            min = Math.min(min, value);
            max = Math.max(max, value);
            ensureCapacity(size + 1);
            values[size++] = value;
        }

        void merge(Accumulator other) {
            if (other.count == 0) {
                return;
            }
            long total = count + other.count;
            double delta = other.mean - mean;
            mean += delta * other.count / total;
            m2 += other.m2 + delta * delta * count * other.count / total;
            count = total;
            min = Math.min(min, other.min);
            max = Math.max(max, other.max);
            ensureCapacity(size + other.size);
            System.arraycopy(other.values, 0, values, size, other.size);
            size += other.size;
        }

        QuantityStatistics finish(OutputQuantity quantity) {
            double[] sorted = Arrays.copyOf(values, size);
            Arrays.sort(sorted);
            double std = count > 0 ? Math.sqrt(m2 / count) : 0.0;
            return QuantityStatistics.builder()
                    .quantity(quantity)
                    .sampleCount(size)
                    .mean(mean)
                    .standardDeviation(std)
                    .coefficientOfVariation(mean != 0.0 ? std / Math.abs(mean) : 0.0)
                    .percentile5(percentile(sorted, 0.05))
                    .percentile95(percentile(sorted, 0.95))
                    .min(min)
                    .max(max)
                    .build();
        }

        private static double percentile(double[] sorted, double fraction) {
            if (sorted.length == 0) {
                return Double.NaN;
            }
            int index = Math.min(sorted.length - 1, (int) Math.floor(sorted.length * fraction));
            return sorted[index];
        }

        private void ensureCapacity(int required) {
            if (required > values.length) {
                values = Arrays.copyOf(values, Math.max(required, values.length * 2));
            }
        }
    }
}
