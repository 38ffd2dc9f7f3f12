package motorlab.domain.uncertainty;

import lombok.Builder;
import lombok.Singular;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Desviaciones típicas relativas (fracción del nominal, 1σ) por parámetro.
 *
 * @param perturbations Mapa parámetro → σ relativa (ej: 0.05 = ±5 %).
 */
@Builder
public record UncertaintySpec(@Singular Map<UncertainParameter, Double> perturbations) {

    public UncertaintySpec {
        for (Map.Entry<UncertainParameter, Double> entry : perturbations.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0 || !Double.isFinite(entry.getValue())) {
                throw new IllegalArgumentException("σ relativa inválida para " + entry.getKey() + ": " + entry.getValue());
            }
        }
        perturbations = Map.copyOf(perturbations);
    }

    /**
     * Misma σ relativa para todos los parámetros indicados.
     */
    public static UncertaintySpec uniform(double relativeSigma, UncertainParameter... parameters) {
        UncertaintySpecBuilder builder = UncertaintySpec.builder();
        for (UncertainParameter parameter : parameters) {
            builder.perturbation(parameter, relativeSigma);
        }
        return builder.build();
    }

    /**
     * Construye la especificación a partir de nombres de parámetro (insensible a mayúsculas).
     *
     * @throws IllegalArgumentException si algún nombre no corresponde a un parámetro conocido.
     */
    public static UncertaintySpec fromNames(Map<String, Double> byName) {
        Map<UncertainParameter, Double> parsed = new EnumMap<>(UncertainParameter.class);
        byName.forEach((name, sigma) ->
                parsed.put(UncertainParameter.valueOf(name.trim().toUpperCase(Locale.ROOT)), sigma));
        return new UncertaintySpec(parsed);
    }
}
