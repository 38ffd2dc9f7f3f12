package motorlab.domain.regression;

import java.util.List;

/**
 * Serie temporal de la regresión del grano.
 * <p>
 * Los tiempos son estrictamente crecientes y el diámetro del canal no decrece. Si se detectó
 * riesgo de perforación, las muestras a partir de {@code firstRiskIndex} repiten el último estado válido.
 * Si el alma de un sólido se agota, la cola queda en {@link SampleStatus#BURNOUT} con empuje nulo.
 *
 * @param samples        Muestras en orden temporal.
 * @param firstRiskIndex Índice de la primera muestra congelada, o -1 si no hubo riesgo.
 */
public record RegressionTimeline(List<RegressionSample> samples, int firstRiskIndex) {

    public RegressionTimeline {
        samples = List.copyOf(samples);
    }

    public int getSampleCount() {
        return samples.size();
    }

    public boolean hasBurnthroughRisk() {
        return firstRiskIndex >= 0;
    }

    public boolean hasBurnout() {
        return samples.stream().anyMatch(sample -> sample.status() == SampleStatus.BURNOUT);
    }

    /**
     * Prefijo de muestras nominales, antes de congelar la geometría o de agotar el alma.
     */
    public List<RegressionSample> validSamples() {
        for (int i = 0; i < samples.size(); i++) {
            if (!samples.get(i).isNominal()) {
                return samples.subList(0, i);
            }
        }
        return samples;
    }

    public RegressionSample lastValidSample() {
        List<RegressionSample> valid = validSamples();
        return valid.get(valid.size() - 1);
    }

    /**
     * Impulso total integrado por trapecios sobre las muestras válidas (N·s).
     */
    public double totalImpulse() {
        List<RegressionSample> valid = validSamples();
        double impulse = 0.0;
        for (int i = 1; i < valid.size(); i++) {
            RegressionSample a = valid.get(i - 1);
            RegressionSample b = valid.get(i);
            impulse += 0.5 * (a.thrust() + b.thrust()) * (b.time() - a.time());
        }
        return impulse;
    }

    public double averageThrust() {
        return validSamples().stream().mapToDouble(RegressionSample::thrust).average().orElse(0.0);
    }

    public double peakChamberPressure() {
        return validSamples().stream().mapToDouble(RegressionSample::chamberPressure).max().orElse(0.0);
    }

    /**
     * Deriva de la relación O/F entre la primera y la última muestra válida.
     */
    public double ofShift() {
        List<RegressionSample> valid = validSamples();
        return valid.get(valid.size() - 1).ofRatio() - valid.get(0).ofRatio();
    }
}
