package motorlab.physics.impl;

import motorlab.config.MotorConfiguration;
import motorlab.domain.exception.InfeasibleDesignException;
import motorlab.domain.motor.MassFlow;
import motorlab.domain.motor.MotorGeometry;
import motorlab.physics.i.IMassGenerationModel;

/**
 * Generación de masa de un motor híbrido.
 * <p>
 * El oxidante entra por un orificio de área efectiva Cd·A con el salto tanque-cámara;
 * el combustible regresa según {@code r = a·G_ox^n} corregida por la temperatura inicial del grano.
 */
public class HybridMassGenerationModel implements IMassGenerationModel {

    @Override
    public MassFlow generate(double chamberPressure, MotorConfiguration configuration, MotorGeometry geometry) {
        double pressureDrop = configuration.tankPressure() - chamberPressure;
        if (pressureDrop <= 0) {
            throw new InfeasibleDesignException(String.format(
                    "La presión de cámara (%.3e Pa) alcanza la del tanque (%.3e Pa): no hay flujo de oxidante.",
                    chamberPressure, configuration.tankPressure()));
        }
        double oxidizerFlow = geometry.injectorFlowArea()
                * Math.sqrt(2.0 * configuration.oxidizer().density() * pressureDrop);

        double oxidizerFlux = oxidizerFlow / geometry.portArea();
        double regressionRate = configuration.regressionCoefficient()
                * Math.pow(oxidizerFlux, configuration.regressionExponent())
                * configuration.temperatureFactor();
        double fuelFlow = configuration.propellantDensity() * geometry.burningArea() * regressionRate;

        return new MassFlow(oxidizerFlow, fuelFlow, regressionRate);
    }

    @Override
    public double pressureCeiling(MotorConfiguration configuration) {
        return configuration.tankPressure();
    }

    @Override
    public String getName() {
        return "Regresión híbrida G_ox^n";
    }

    @Override
    public String getDescription() {
        return "Orificio incompresible para el oxidante y regresión por flujo de oxidante en el canal.";
    }
}
