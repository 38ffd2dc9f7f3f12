package motorlab.domain.exception;

/**
 * Ninguna geometría de inyector satisface simultáneamente las restricciones declaradas.
 */
public class InfeasibleGeometryException extends MotorAnalysisException {

    public InfeasibleGeometryException(String message) {
        super(message);
    }
}
