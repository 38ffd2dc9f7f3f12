package motorlab.domain.exception;

import java.util.Locale;

/**
 * El proceso iterativo agotó el límite de iteraciones sin alcanzar la tolerancia.
 * Conserva la última estimación para diagnóstico.
 */
public class ConvergenceException extends MotorAnalysisException {

    private final double lastEstimate;
    private final int iterations;
    private final double residual;

    public ConvergenceException(String context, double lastEstimate, int iterations, double residual) {
        super(String.format(Locale.ROOT,
                "%s: sin convergencia tras %d iteraciones (última estimación = %.6e, residuo = %.3e)",
                context, iterations, lastEstimate, residual));
        this.lastEstimate = lastEstimate;
        this.iterations = iterations;
        this.residual = residual;
    }

    public double getLastEstimate() {
        return lastEstimate;
    }

    public int getIterations() {
        return iterations;
    }

    public double getResidual() {
        return residual;
    }
}
