package motorlab.config;

import java.util.List;

/**
 * Configuración aceptada junto con las advertencias no bloqueantes detectadas.
 */
public record ValidationReport(MotorConfiguration configuration, List<String> warnings) {

    public ValidationReport {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
