package motorlab.domain.exception;

/**
 * Raíz de la taxonomía de errores del núcleo de análisis.
 * <p>
 * Todas las excepciones son no comprobadas: los fallos numéricos y de validación
 * se propagan sin envolver hasta el llamador inmediato.
 */
public abstract class MotorAnalysisException extends RuntimeException {

    protected MotorAnalysisException(String message) {
        super(message);
    }

    protected MotorAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
