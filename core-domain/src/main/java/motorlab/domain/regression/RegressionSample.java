package motorlab.domain.regression;

import lombok.Builder;
import lombok.With;
import motorlab.domain.motor.MotorPerformance;

import java.util.Objects;

/**
 * Instantánea del motor en un instante de la combustión.
 *
 * @param time            Tiempo desde el encendido (s).
 * @param portDiameter    Diámetro del canal (m).
 * @param ofRatio         Relación O/F instantánea.
 * @param chamberPressure Presión de cámara (Pa).
 * @param thrust          Empuje (N).
 * @param status          Estado de la muestra.
 * @param performance     Punto de operación completo en este instante.
 */
@Builder
@With
public record RegressionSample(
        double time,
        double portDiameter,
        double ofRatio,
        double chamberPressure,
        double thrust,
        SampleStatus status,
        MotorPerformance performance
) {
    public RegressionSample {
        Objects.requireNonNull(status, "status no puede ser null");
        Objects.requireNonNull(performance, "performance no puede ser null");
    }

    public static RegressionSample of(double time, SampleStatus status, MotorPerformance performance) {
        return new RegressionSample(
                time,
                performance.portDiameter(),
                performance.ofRatio(),
                performance.chamberPressure(),
                performance.thrust(),
                status,
                performance
        );
    }

    public boolean isNominal() {
        return status == SampleStatus.NOMINAL;
    }
}
