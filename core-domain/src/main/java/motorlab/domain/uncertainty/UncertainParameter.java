package motorlab.domain.uncertainty;

import motorlab.config.MotorConfiguration;
import motorlab.domain.motor.MotorGeometry;

import java.util.function.BiFunction;
import java.util.function.ToDoubleFunction;

/**
 * Parámetros de la configuración que admiten perturbación estocástica.
 * <p>
 * Los parámetros de hardware (garganta, inyector) actúan sobre la geometría fija del motor,
 * por lo que requieren una configuración con geometría ya dimensionada.
 */
public enum UncertainParameter {

    REGRESSION_COEFFICIENT(MotorConfiguration::regressionCoefficient, MotorConfiguration::withRegressionCoefficient),
    REGRESSION_EXPONENT(MotorConfiguration::regressionExponent, MotorConfiguration::withRegressionExponent),
    PROPELLANT_DENSITY(MotorConfiguration::propellantDensity, MotorConfiguration::withPropellantDensity),
    CHAMBER_TEMPERATURE(MotorConfiguration::chamberTemperature, MotorConfiguration::withChamberTemperature),
    GAS_CONSTANT(MotorConfiguration::gasConstant, MotorConfiguration::withGasConstant),
    GAMMA(MotorConfiguration::gamma, MotorConfiguration::withGamma),
    TANK_PRESSURE(MotorConfiguration::tankPressure, MotorConfiguration::withTankPressure),
    PROPELLANT_TEMPERATURE(MotorConfiguration::propellantTemperature, MotorConfiguration::withPropellantTemperature),
    ATMOSPHERIC_PRESSURE(MotorConfiguration::atmosphericPressure, MotorConfiguration::withAtmosphericPressure),
    OXIDIZER_DENSITY(
            c -> c.oxidizer().density(),
            (c, v) -> c.withOxidizer(c.oxidizer().withDensity(v))),
    THROAT_AREA(
            c -> requireGeometry(c).throatArea(),
            (c, v) -> c.withGeometry(requireGeometry(c).withThroatArea(v))),
    INJECTOR_FLOW_AREA(
            c -> requireGeometry(c).injectorFlowArea(),
            (c, v) -> c.withGeometry(requireGeometry(c).withInjectorFlowArea(v)));

    private final ToDoubleFunction<MotorConfiguration> getter;
    private final BiFunction<MotorConfiguration, Double, MotorConfiguration> setter;

    UncertainParameter(ToDoubleFunction<MotorConfiguration> getter,
                       BiFunction<MotorConfiguration, Double, MotorConfiguration> setter) {
        this.getter = getter;
        this.setter = setter;
    }

    public double nominalValue(MotorConfiguration configuration) {
        return getter.applyAsDouble(configuration);
    }

    /**
     * Devuelve una copia de la configuración con el parámetro escalado por {@code factor}.
     */
    public MotorConfiguration scale(MotorConfiguration configuration, double factor) {
        return setter.apply(configuration, nominalValue(configuration) * factor);
    }

    private static MotorGeometry requireGeometry(MotorConfiguration configuration) {
        MotorGeometry geometry = configuration.geometry();
        if (geometry == null) {
            throw new IllegalStateException("Perturbar el hardware requiere una configuración con geometría fija.");
        }
        return geometry;
    }
}
