package motorlab.domain.exception;

/**
 * Un paso intermedio produjo una cantidad física negativa, nula o no finita.
 */
public class InfeasibleDesignException extends MotorAnalysisException {

    public InfeasibleDesignException(String message) {
        super(message);
    }
}
