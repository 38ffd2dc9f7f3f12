package motorlab.physics.impl;

import motorlab.config.MotorConfiguration;
import motorlab.domain.exception.InfeasibleDesignException;
import motorlab.domain.motor.MassFlow;
import motorlab.domain.motor.MotorGeometry;
import motorlab.physics.i.IMassGenerationModel;

/**
 * Generación de masa de un motor sólido con la ley de Saint-Robert {@code r = a·Pc^n}.
 * El gasto se reparte entre oxidante y aglutinante según la relación de la formulación.
 */
public class SolidMassGenerationModel implements IMassGenerationModel {

    @Override
    public MassFlow generate(double chamberPressure, MotorConfiguration configuration, MotorGeometry geometry) {
        double burningArea = geometry.burningArea();
        if (burningArea <= 0) {
            throw new InfeasibleDesignException("El grano está consumido: superficie de combustión nula.");
        }
        double burnRate = configuration.regressionCoefficient()
                * Math.pow(chamberPressure, configuration.regressionExponent())
                * configuration.temperatureFactor();
        double massFlow = configuration.propellantDensity() * burningArea * burnRate;

        double of = configuration.ofRatio();
        return new MassFlow(massFlow * of / (1.0 + of), massFlow / (1.0 + of), burnRate);
    }

    @Override
    public String getName() {
        return "Saint-Robert";
    }

    @Override
    public String getDescription() {
        return "Velocidad de combustión a·Pc^n sobre la superficie BATES del grano.";
    }
}
