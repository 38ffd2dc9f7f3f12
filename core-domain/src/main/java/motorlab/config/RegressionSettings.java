package motorlab.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Configuración del simulador de regresión temporal.
 */
@Value
@Builder
@With
public class RegressionSettings {

    /**
     * Número de muestras por defecto de la línea temporal.
     */
    @Builder.Default
    int stepCount = 100;

    /**
     * Fracción del diámetro de cámara que el canal no debe superar (margen estructural).
     */
    @Builder.Default
    double burnthroughPortRatio = 0.85;

    public static RegressionSettings defaults() {
        return RegressionSettings.builder().build();
    }
}
