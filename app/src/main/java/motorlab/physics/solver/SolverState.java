package motorlab.physics.solver;

import lombok.Getter;
import motorlab.domain.motor.MassFlow;

/**
 * Estado mutable de UNA ejecución del punto fijo de presión de cámara.
 * Pertenece exclusivamente a la invocación del solver que lo crea.
 */
@Getter
public class SolverState {

    private double chamberPressure;
    private double relaxationFactor;
    private MassFlow massFlow;
    private int iterations;
    private double residual = Double.POSITIVE_INFINITY;
    private boolean converged;

    SolverState(double initialPressure, double relaxationFactor) {
        this.chamberPressure = initialPressure;
        this.relaxationFactor = relaxationFactor;
    }

    /**
     * Registra la evaluación de una iteración. Si el residuo crece respecto al anterior
     * se reduce a la mitad el factor de relajación (sin bajar de {@code minimumRelaxation}).
     */
    void record(int iteration, MassFlow flow, double newResidual, double minimumRelaxation) {
        if (iteration > 1 && newResidual > residual) {
            relaxationFactor = Math.max(relaxationFactor * 0.5, minimumRelaxation);
        }
        this.iterations = iteration;
        this.massFlow = flow;
        this.residual = newResidual;
    }

    void advanceTo(double pressure) {
        this.chamberPressure = pressure;
    }

    void markConverged() {
        this.converged = true;
    }
}
