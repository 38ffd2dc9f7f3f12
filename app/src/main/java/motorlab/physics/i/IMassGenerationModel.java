package motorlab.physics.i;

import motorlab.config.MotorConfiguration;
import motorlab.domain.motor.MassFlow;
import motorlab.domain.motor.MotorGeometry;

/**
 * Modelo de generación de masa en la cámara: dada una presión, cuánto oxidante y
 * combustible entran al flujo. Cada arquitectura de motor aporta el suyo.
 */
public interface IMassGenerationModel extends ISolverComponent {

    MassFlow generate(double chamberPressure, MotorConfiguration configuration, MotorGeometry geometry);

    /**
     * Presión que la iteración no debe alcanzar (por ejemplo, la del tanque en un híbrido).
     */
    default double pressureCeiling(MotorConfiguration configuration) {
        return Double.POSITIVE_INFINITY;
    }
}
