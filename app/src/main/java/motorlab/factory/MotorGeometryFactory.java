package motorlab.factory;

import lombok.extern.slf4j.Slf4j;
import motorlab.config.MotorConfiguration;
import motorlab.config.SolverSettings;
import motorlab.domain.exception.InfeasibleDesignException;
import motorlab.domain.motor.CombustionMode;
import motorlab.domain.motor.MotorGeometry;
import motorlab.physics.solver.IsentropicNozzle;
import motorlab.physics.solver.NozzleExpansion;

/**
 * Fábrica que dimensiona el hardware de un motor en su punto de diseño.
 * <p>
 * El dimensionado se hace a la temperatura de referencia del grano: una configuración a otra
 * temperatura resuelta sobre esta geometría se aparta del punto de diseño, que es justo lo
 * que se quiere observar en un motor ya construido.
 */
@Slf4j
public class MotorGeometryFactory {

    /** Diámetro de cámara automático de un híbrido, relativo al canal final. */
    static final double HYBRID_CHAMBER_TO_PORT = 1.5;
    /** Fracción del diámetro de cámara ocupada por un grano sólido (resto: liner y aislante). */
    static final double SOLID_GRAIN_FILL = 0.8;
    /** Relación mínima área de canal / área de garganta del grano sólido. */
    static final double PORT_TO_THROAT_AREA_RATIO = 2.0;
    static final int MAX_BATES_SEGMENTS = 20;

    private final SolverSettings settings;

    public MotorGeometryFactory(SolverSettings settings) {
        this.settings = settings;
    }

    /**
     * Dimensiona garganta, tobera, grano, cámara e inyector para la configuración.
     *
     * @throws InfeasibleDesignException si el diseño resultante no es físicamente realizable.
     */
    public MotorGeometry size(MotorConfiguration configuration) {
        double chamberPressure = configuration.chamberPressure();
        double ambient = configuration.atmosphericPressure();
        double cStar = IsentropicNozzle.characteristicVelocity(
                configuration.gamma(), configuration.gasConstant(), configuration.chamberTemperature());

        NozzleExpansion nozzle = IsentropicNozzle.expand(
                configuration.gamma(), configuration.gasConstant(), configuration.chamberTemperature(),
                chamberPressure, ambient, configuration.expansionRatio(), settings);
        double exitPressure = nozzle.pressureRatio() * chamberPressure;

        // Empuje por unidad de área de garganta: término de cantidad de movimiento + término de presión.
        double thrustPerThroatArea = configuration.nozzleType().getEfficiency() * chamberPressure * nozzle.exitVelocity() / cStar
                + (exitPressure - ambient) * nozzle.expansionRatio();
        if (!(thrustPerThroatArea > 0)) {
            throw new InfeasibleDesignException(String.format(
                    "La tobera no produce empuje positivo (ε = %.2f, Pe = %.3e Pa, Pa = %.3e Pa).",
                    nozzle.expansionRatio(), exitPressure, ambient));
        }

        double throatArea = configuration.thrust() / thrustPerThroatArea;
        double massFlow = chamberPressure * throatArea / cStar;
        double of = configuration.ofRatio();
        double oxidizerFlow = massFlow * of / (1.0 + of);
        double fuelFlow = massFlow / (1.0 + of);

        MotorGeometry.MotorGeometryBuilder builder = MotorGeometry.builder()
                .motorType(configuration.motorType())
                .throatArea(throatArea)
                .expansionRatio(nozzle.expansionRatio());

        MotorGeometry geometry = configuration.isHybrid()
                ? sizeHybrid(builder, configuration, throatArea, massFlow, oxidizerFlow, fuelFlow)
                : sizeSolid(builder, configuration, throatArea, massFlow);

        log.debug("Motor {} dimensionado: At = {} m², ε = {}, Dc = {} m, canal = {} m",
                configuration.motorType(), throatArea, nozzle.expansionRatio(),
                geometry.chamberDiameter(), geometry.portDiameter());
        return geometry;
    }

    private MotorGeometry sizeHybrid(MotorGeometry.MotorGeometryBuilder builder, MotorConfiguration configuration,
                                     double throatArea, double massFlow, double oxidizerFlow, double fuelFlow) {
        double a = configuration.regressionCoefficient();
        double n = configuration.regressionExponent();
        double initialFlux = configuration.initialOxidizerFlux();

        double portDiameter = Math.sqrt(4.0 * (oxidizerFlow / initialFlux) / Math.PI);
        double initialRate = a * Math.pow(initialFlux, n);
        double grainLength = fuelFlow / (configuration.propellantDensity() * Math.PI * portDiameter * initialRate);
        double finalPort = projectHybridPort(portDiameter, oxidizerFlow, a, n, configuration.burnTime());

        double chamberDiameter = resolveChamberDiameter(configuration, throatArea, massFlow, HYBRID_CHAMBER_TO_PORT * finalPort);
        if (finalPort >= chamberDiameter) {
            throw new InfeasibleDesignException(String.format(
                    "El canal final (%.4f m) no cabe en la cámara (%.4f m).", finalPort, chamberDiameter));
        }

        double pressureDrop = configuration.tankPressure() - configuration.chamberPressure();
        if (!(pressureDrop > 0)) {
            throw new InfeasibleDesignException("El salto tanque-cámara debe ser positivo para dimensionar el inyector.");
        }
        double injectorFlowArea = oxidizerFlow / Math.sqrt(2.0 * configuration.oxidizer().density() * pressureDrop);

        return builder
                .chamberDiameter(chamberDiameter)
                .grainOuterDiameter(chamberDiameter)
                .initialPortDiameter(portDiameter)
                .portDiameter(portDiameter)
                .grainLength(grainLength)
                .segmentCount(1)
                .injectorFlowArea(injectorFlowArea)
                .oxidizerLoad(oxidizerFlow * configuration.burnTime())
                .build();
    }

    /**
     * Grano BATES: segmentos de longitud (3·Dₒ + D₀)/2, que dan una curva de empuje casi neutra.
     * Con alma w = r·t_b la superficie inicial por segmento vale 2π·D₀² + 5π·w·D₀ + 2π·w², y se
     * elige el mayor número de segmentos que mantiene el canal por encima del mínimo.
     */
    private MotorGeometry sizeSolid(MotorGeometry.MotorGeometryBuilder builder, MotorConfiguration configuration,
                                    double throatArea, double massFlow) {
        double burnRate = configuration.regressionCoefficient()
                * Math.pow(configuration.chamberPressure(), configuration.regressionExponent());
        double burningArea = massFlow / (configuration.propellantDensity() * burnRate);
        double web = burnRate * configuration.burnTime();
        double minimumPort = Math.sqrt(4.0 * PORT_TO_THROAT_AREA_RATIO * throatArea / Math.PI);

        int segments = 1;
        double portDiameter = batesPortDiameter(burningArea, web, 1);
        for (int candidate = 2; candidate <= MAX_BATES_SEGMENTS; candidate++) {
            double candidatePort = batesPortDiameter(burningArea, web, candidate);
            if (candidatePort < minimumPort) {
                break;
            }
            segments = candidate;
            portDiameter = candidatePort;
        }
        if (!(portDiameter > 0)) {
            throw new InfeasibleDesignException("El área de combustión requerida es menor que las caras de un segmento BATES.");
        }
        if (portDiameter < minimumPort) {
            log.warn("Canal del grano ({} m) por debajo del mínimo recomendado ({} m): riesgo de combustión erosiva.",
                    portDiameter, minimumPort);
        }

        double outerDiameter = portDiameter + 2.0 * web;
        double chamberDiameter = resolveChamberDiameter(configuration, throatArea, massFlow, outerDiameter / SOLID_GRAIN_FILL);
        if (outerDiameter > chamberDiameter) {
            throw new InfeasibleDesignException(String.format(
                    "El grano (%.4f m) no cabe en la cámara (%.4f m).", outerDiameter, chamberDiameter));
        }

        return builder
                .chamberDiameter(chamberDiameter)
                .grainOuterDiameter(outerDiameter)
                .initialPortDiameter(portDiameter)
                .portDiameter(portDiameter)
                .grainLength(2.0 * portDiameter + 3.0 * web)
                .segmentCount(segments)
                .injectorFlowArea(0.0)
                .oxidizerLoad(0.0)
                .build();
    }

    private static double batesPortDiameter(double burningArea, double web, int segments) {
        double discriminant = 9.0 * web * web + 8.0 * burningArea / (segments * Math.PI);
        return (-5.0 * web + Math.sqrt(discriminant)) / 4.0;
    }

    private static double resolveChamberDiameter(MotorConfiguration configuration, double throatArea,
                                                 double massFlow, double automatic) {
        if (configuration.chamberDiameter() > 0) {
            return configuration.chamberDiameter();
        }
        if (configuration.combustionMode() == CombustionMode.FINITE_AREA) {
            double chamberArea = configuration.contractionRatio() != null
                    ? configuration.contractionRatio() * throatArea
                    : massFlow / configuration.massFlux();
            return Math.sqrt(4.0 * chamberArea / Math.PI);
        }
        return automatic;
    }

    /**
     * Diámetro del canal híbrido tras {@code time} segundos con gasto de oxidante constante.
     * Integración cerrada de dR/dt = a·(ṁ_ox/(π·R²))^n:
     * <pre>
     *   R^(2n+1) = R0^(2n+1) + (2n+1)·a·(ṁ_ox/π)^n·t
     * </pre>
     */
    public static double projectHybridPort(double portDiameter, double oxidizerFlow, double a, double n, double time) {
        double exponent = 2.0 * n + 1.0;
        double radius = portDiameter / 2.0;
        double grown = Math.pow(radius, exponent) + exponent * a * Math.pow(oxidizerFlow / Math.PI, n) * time;
        return 2.0 * Math.pow(grown, 1.0 / exponent);
    }
}
