package motorlab.domain.exception;

import java.util.List;

/**
 * Se lanza cuando una configuración de entrada viola una o varias restricciones.
 * Enumera TODAS las violaciones detectadas, no solo la primera.
 */
public class ValidationException extends MotorAnalysisException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        StringBuilder sb = new StringBuilder("Configuración inválida (")
                .append(violations.size())
                .append(" violaciones):");
        for (String violation : violations) {
            sb.append(System.lineSeparator()).append(" - ").append(violation);
        }
        return sb.toString();
    }
}
