package motorlab.config;

import lombok.extern.slf4j.Slf4j;
import motorlab.domain.exception.ValidationException;
import motorlab.domain.injector.InjectorSpec;
import motorlab.domain.injector.PintleSpec;
import motorlab.domain.injector.ShowerheadSpec;
import motorlab.domain.injector.SwirlSpec;
import motorlab.domain.motor.CombustionMode;
import motorlab.domain.motor.MotorType;
import motorlab.domain.motor.NozzleType;
import motorlab.domain.motor.OxidizerPhase;
import motorlab.domain.motor.OxidizerProperties;
import motorlab.domain.motor.Propellant;
import motorlab.physics.model.StandardAtmosphere;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Convierte una {@link RawMotorInput} en una {@link MotorConfiguration} válida.
 * <p>
 * Aplica los valores por defecto documentados, comprueba TODAS las restricciones y, si alguna
 * falla, lanza una única {@link ValidationException} con la lista completa de violaciones.
 * Nunca corrige en silencio una entrada inconsistente.
 * <p>
 * Esta clase no tiene estado y es thread safe.
 */
@Slf4j
public class MotorConfigurationValidator {

    // --- Valores por defecto ---
    public static final double DEFAULT_THRUST = 1000.0; // N
    public static final double DEFAULT_BURN_TIME = 10.0; // s
    public static final double DEFAULT_HYBRID_OF_RATIO = 6.5;
    public static final double DEFAULT_CHAMBER_PRESSURE = 20.0e5; // Pa
    public static final double DEFAULT_CHARACTERISTIC_LENGTH = 1.0; // m
    public static final double DEFAULT_TEMPERATURE_SENSITIVITY = 0.002; // 1/K
    public static final double DEFAULT_INITIAL_OXIDIZER_FLUX = 350.0; // kg/m²s
    public static final double DEFAULT_TANK_PRESSURE = 50.0e5; // Pa

    // --- Límites ---
    public static final double MAX_OF_RATIO = 20.0;
    public static final double MAX_CHAMBER_PRESSURE = 200.0e5; // Pa
    public static final double MAX_BURN_TIME = 300.0; // s
    public static final double MIN_CHAMBER_DIAMETER = 0.01; // m
    public static final double MAX_CHAMBER_DIAMETER = 5.0; // m
    public static final double RECOMMENDED_TANK_MARGIN = 0.20;
    public static final double IMPULSE_CONSISTENCY_TOLERANCE = 0.01;

    /**
     * Valida la entrada y devuelve la configuración. Las advertencias se registran en el log.
     *
     * @throws ValidationException si hay una o más violaciones.
     */
    public MotorConfiguration validate(RawMotorInput raw) {
        ValidationReport report = check(raw);
        report.warnings().forEach(w -> log.warn("Advertencia de configuración: {}", w));
        return report.configuration();
    }

    /**
     * Valida la entrada y devuelve la configuración junto con las advertencias ordenadas.
     *
     * @throws ValidationException si hay una o más violaciones.
     */
    public ValidationReport check(RawMotorInput raw) {
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        MotorType type = raw.motorType() != null ? raw.motorType() : MotorType.HYBRID;
        Propellant propellant = raw.propellant() != null ? raw.propellant() : Propellant.defaultFor(type);
        if (propellant.getMotorType() != type) {
            violations.add(String.format("El propelente %s no es compatible con un motor %s.", propellant, type));
        }

        // 1. Empuje / tiempo de combustión / impulso total (dos de tres)
        double[] thrustAndTime = resolveImpulseTriplet(raw, violations);

        // 2. Presión ambiente: explícita, por altitud de diseño o nivel del mar
        double atmosphericPressure = resolveAtmosphericPressure(raw, violations, warnings);

        // 3. Modo de combustión
        CombustionMode mode = raw.combustionMode() != null ? raw.combustionMode() : CombustionMode.INFINITE_AREA;
        Double contractionRatio = raw.contractionRatio();
        Double massFlux = raw.massFlux();
        if (mode == CombustionMode.INFINITE_AREA && (contractionRatio != null || massFlux != null)) {
            warnings.add("Se ignoran la relación de contracción y el flujo másico: el modo de combustión es de área infinita.");
            contractionRatio = null;
            massFlux = null;
        }

        // 4. Oxidante e inyector
        OxidizerPhase phase = raw.oxidizerPhase() != null ? raw.oxidizerPhase() : OxidizerPhase.LIQUID;
        OxidizerProperties oxidizer = new OxidizerProperties(
                phase,
                valueOr(raw.oxidizerDensity(), phase.getDefaultDensity()),
                valueOr(raw.oxidizerViscosity(), phase.getDefaultViscosity()),
                valueOr(raw.oxidizerVaporPressure(), OxidizerProperties.N2O_VAPOR_PRESSURE)
        );
        InjectorSpec injector = raw.injector();
        if (type == MotorType.HYBRID && injector == null) {
            injector = ShowerheadSpec.defaults();
        } else if (type == MotorType.SOLID && injector != null) {
            warnings.add("Se ignora la especificación de inyector: un motor sólido no tiene alimentación de oxidante.");
            injector = null;
        }

        MotorConfiguration configuration = MotorConfiguration.builder()
                .motorType(type)
                .propellant(propellant)
                .thrust(thrustAndTime[0])
                .burnTime(thrustAndTime[1])
                .ofRatio(valueOr(raw.ofRatio(), type == MotorType.SOLID ? propellant.getFormulationOfRatio() : DEFAULT_HYBRID_OF_RATIO))
                .chamberPressure(valueOr(raw.chamberPressure(), DEFAULT_CHAMBER_PRESSURE))
                .atmosphericPressure(atmosphericPressure)
                .chamberTemperature(valueOr(raw.chamberTemperature(), propellant.getCombustionTemperature()))
                .gamma(valueOr(raw.gamma(), propellant.getGamma()))
                .gasConstant(valueOr(raw.gasConstant(), propellant.getGasConstant()))
                .characteristicLength(valueOr(raw.characteristicLength(), DEFAULT_CHARACTERISTIC_LENGTH))
                .expansionRatio(valueOr(raw.expansionRatio(), 0.0))
                .nozzleType(raw.nozzleType() != null ? raw.nozzleType() : NozzleType.CONICAL)
                .regressionCoefficient(valueOr(raw.regressionCoefficient(), propellant.getRegressionCoefficient()))
                .regressionExponent(valueOr(raw.regressionExponent(), propellant.getRegressionExponent()))
                .propellantDensity(valueOr(raw.propellantDensity(), propellant.getDensity()))
                .propellantTemperature(valueOr(raw.propellantTemperature(), MotorConfiguration.REFERENCE_TEMPERATURE))
                .temperatureSensitivity(valueOr(raw.temperatureSensitivity(), DEFAULT_TEMPERATURE_SENSITIVITY))
                .combustionMode(mode)
                .contractionRatio(contractionRatio)
                .massFlux(massFlux)
                .chamberDiameter(valueOr(raw.chamberDiameter(), 0.0))
                .initialOxidizerFlux(valueOr(raw.initialOxidizerFlux(), DEFAULT_INITIAL_OXIDIZER_FLUX))
                .oxidizer(oxidizer)
                .tankPressure(valueOr(raw.tankPressure(), DEFAULT_TANK_PRESSURE))
                .injector(injector)
                .build();

        violations.addAll(verify(configuration));

        if (type == MotorType.HYBRID) {
            double margin = (configuration.tankPressure() - configuration.chamberPressure()) / configuration.chamberPressure();
            if (margin > 0 && margin < RECOMMENDED_TANK_MARGIN) {
                warnings.add(String.format(Locale.ROOT,
                        "Margen tanque-cámara del %.1f %% (recomendado >= %.0f %%): riesgo de inestabilidad de alimentación.",
                        margin * 100.0, RECOMMENDED_TANK_MARGIN * 100.0));
            }
        }

        if (!violations.isEmpty()) {
            log.debug("Validación fallida con {} violaciones.", violations.size());
            throw new ValidationException(violations);
        }
        return new ValidationReport(configuration, warnings);
    }

    /**
     * Comprueba los invariantes de una configuración ya construida (por ejemplo, una muestra
     * perturbada). No lanza: devuelve la lista de violaciones, vacía si es válida.
     */
    public List<String> verify(MotorConfiguration c) {
        List<String> violations = new ArrayList<>();

        requirePositive(violations, "empuje", c.thrust());
        requirePositive(violations, "tiempo de combustión", c.burnTime());
        if (c.burnTime() > MAX_BURN_TIME) {
            violations.add(format("El tiempo de combustión (%.1f s) supera el máximo de %.0f s.", c.burnTime(), MAX_BURN_TIME));
        }
        if (!(c.ofRatio() > 0) || c.ofRatio() > MAX_OF_RATIO) {
            violations.add(format("La relación O/F (%.3f) debe estar en (0, %.0f].", c.ofRatio(), MAX_OF_RATIO));
        }
        requirePositive(violations, "presión de cámara", c.chamberPressure());
        if (c.chamberPressure() > MAX_CHAMBER_PRESSURE) {
            violations.add(format("La presión de cámara (%.3e Pa) supera el máximo de %.3e Pa.", c.chamberPressure(), MAX_CHAMBER_PRESSURE));
        }
        if (!(c.atmosphericPressure() >= 0)) {
            violations.add(format("La presión atmosférica (%.3e Pa) no puede ser negativa.", c.atmosphericPressure()));
        }
        if (!(c.chamberPressure() > c.atmosphericPressure())) {
            violations.add(format("La presión de cámara (%.3e Pa) debe ser mayor que la presión atmosférica (%.3e Pa).",
                    c.chamberPressure(), c.atmosphericPressure()));
        }
        requirePositive(violations, "temperatura de cámara", c.chamberTemperature());
        if (!(c.gamma() > 1.0)) {
            violations.add(format("La relación de calores específicos (%.4f) debe ser mayor que 1.", c.gamma()));
        }
        requirePositive(violations, "constante de los gases", c.gasConstant());
        requirePositive(violations, "longitud característica L*", c.characteristicLength());
        if (c.expansionRatio() != 0.0 && !(c.expansionRatio() > 1.0)) {
            violations.add(format("La relación de expansión (%.3f) debe ser mayor que 1, o 0 para adaptación automática.", c.expansionRatio()));
        }

        requirePositive(violations, "coeficiente de regresión", c.regressionCoefficient());
        if (!(c.regressionExponent() > 0) || !(c.regressionExponent() < 1.0)) {
            violations.add(format("El exponente de regresión (%.3f) debe estar en (0, 1).", c.regressionExponent()));
        }
        requirePositive(violations, "densidad del propelente", c.propellantDensity());
        requirePositive(violations, "temperatura del propelente", c.propellantTemperature());
        if (!(c.temperatureFactor() > 0)) {
            violations.add(format("La corrección por temperatura del grano (%.3f) debe ser positiva.", c.temperatureFactor()));
        }

        if (c.combustionMode() == CombustionMode.FINITE_AREA) {
            boolean hasContraction = c.contractionRatio() != null;
            boolean hasMassFlux = c.massFlux() != null;
            if (hasContraction == hasMassFlux) {
                violations.add("La combustión de área finita requiere exactamente uno de: relación de contracción o flujo másico.");
            } else if (hasContraction && !(c.contractionRatio() > 1.0)) {
                violations.add(format("La relación de contracción (%.3f) debe ser mayor que 1.", c.contractionRatio()));
            } else if (hasMassFlux && !(c.massFlux() > 0)) {
                violations.add(format("El flujo másico de cámara (%.3f kg/m²s) debe ser positivo.", c.massFlux()));
            }
        }
        if (c.chamberDiameter() != 0.0
                && (!(c.chamberDiameter() >= MIN_CHAMBER_DIAMETER) || c.chamberDiameter() > MAX_CHAMBER_DIAMETER)) {
            violations.add(format("El diámetro de cámara (%.4f m) debe estar en [%.2f, %.1f] m.",
                    c.chamberDiameter(), MIN_CHAMBER_DIAMETER, MAX_CHAMBER_DIAMETER));
        }

        if (c.isHybrid()) {
            requirePositive(violations, "flujo inicial de oxidante", c.initialOxidizerFlux());
            requirePositive(violations, "densidad del oxidante", c.oxidizer().density());
            requirePositive(violations, "viscosidad del oxidante", c.oxidizer().viscosity());
            requirePositive(violations, "presión de vapor del oxidante", c.oxidizer().vaporPressure());
            if (!(c.tankPressure() > c.chamberPressure())) {
                violations.add(format("La presión del tanque (%.3e Pa) debe ser mayor que la presión de cámara (%.3e Pa).",
                        c.tankPressure(), c.chamberPressure()));
            }
            if (c.injector() != null) {
                verifyInjector(c.injector(), c.tankPressure(), violations);
            }
        }
        return violations;
    }

    private void verifyInjector(InjectorSpec spec, double tankPressure, List<String> violations) {
        double cd = spec.resolvedDischargeCoefficient();
        if (!(cd > 0) || cd > 1.0) {
            violations.add(format("El coeficiente de descarga del inyector (%.3f) debe estar en (0, 1].", cd));
        }
        if (!(spec.pressureDrop() >= 0)) {
            violations.add(format("La caída de presión del inyector (%.3e Pa) no puede ser negativa.", spec.pressureDrop()));
        } else if (spec.pressureDrop() >= tankPressure) {
            violations.add(format("La caída de presión del inyector (%.3e Pa) debe ser menor que la presión del tanque.", spec.pressureDrop()));
        }

        if (spec instanceof ShowerheadSpec showerhead) {
            requirePositive(violations, "velocidad objetivo de inyección", showerhead.targetVelocity());
            requirePositive(violations, "diámetro mínimo de orificio", showerhead.minHoleDiameter());
            requirePositive(violations, "espesor de placa", showerhead.plateThickness());
            if (showerhead.holeCount() < 0) {
                violations.add("El número de orificios no puede ser negativo.");
            }
            if (showerhead.minHoleDiameter() > showerhead.maxHoleDiameter()) {
                violations.add(format("El diámetro mínimo de orificio (%.2e m) supera al máximo (%.2e m).",
                        showerhead.minHoleDiameter(), showerhead.maxHoleDiameter()));
            }
        } else if (spec instanceof PintleSpec pintle) {
            requirePositive(violations, "diámetro del pintle", pintle.pintleDiameter());
            if (!(pintle.pintleDiameter() < pintle.outerDiameter())) {
                violations.add(format("El diámetro del pintle (%.2e m) debe ser menor que el diámetro exterior (%.2e m).",
                        pintle.pintleDiameter(), pintle.outerDiameter()));
            }
        } else if (spec instanceof SwirlSpec swirl) {
            if (swirl.slotCount() < 1) {
                violations.add("El inyector de torbellino necesita al menos una ranura.");
            }
            if (!(swirl.sprayHalfAngleDegrees() > 0) || !(swirl.sprayHalfAngleDegrees() < 90.0)) {
                violations.add(format("El semiángulo de cono (%.1f°) debe estar en (0, 90).", swirl.sprayHalfAngleDegrees()));
            }
            if (swirl.slotWidth() < 0 || swirl.slotHeight() < 0) {
                violations.add("Las dimensiones de ranura no pueden ser negativas.");
            }
        }
    }

    private double[] resolveImpulseTriplet(RawMotorInput raw, List<String> violations) {
        Double thrust = raw.thrust();
        Double burnTime = raw.burnTime();
        Double impulse = raw.totalImpulse();

        if (impulse != null) {
            if (!(impulse > 0)) {
                violations.add(format("El impulso total (%.3f N·s) debe ser positivo.", impulse));
            } else if (thrust != null && burnTime != null) {
                double deviation = Math.abs(thrust * burnTime - impulse) / impulse;
                if (deviation > IMPULSE_CONSISTENCY_TOLERANCE) {
                    violations.add(format("Empuje × tiempo (%.1f N·s) no es consistente con el impulso total (%.1f N·s): desviación %.2f %%.",
                            thrust * burnTime, impulse, deviation * 100.0));
                }
            } else if (thrust != null && thrust > 0) {
                burnTime = impulse / thrust;
            } else if (burnTime != null && burnTime > 0) {
                thrust = impulse / burnTime;
            } else if (thrust == null && burnTime == null) {
                violations.add("El impulso total requiere además el empuje o el tiempo de combustión.");
            }
        }
        return new double[]{
                valueOr(thrust, DEFAULT_THRUST),
                valueOr(burnTime, DEFAULT_BURN_TIME)
        };
    }

    private double resolveAtmosphericPressure(RawMotorInput raw, List<String> violations, List<String> warnings) {
        if (raw.atmosphericPressure() != null) {
            if (raw.designAltitude() != null) {
                warnings.add("Se proporcionaron presión atmosférica y altitud de diseño: se usa la presión explícita.");
            }
            return raw.atmosphericPressure();
        }
        if (raw.designAltitude() != null) {
            if (!(raw.designAltitude() >= 0)) {
                violations.add(format("La altitud de diseño (%.1f m) no puede ser negativa.", raw.designAltitude()));
                return StandardAtmosphere.SEA_LEVEL_PRESSURE;
            }
            return StandardAtmosphere.pressure(raw.designAltitude());
        }
        return StandardAtmosphere.SEA_LEVEL_PRESSURE;
    }

    private static void requirePositive(List<String> violations, String name, double value) {
        if (!(value > 0)) {
            violations.add(format("El valor de %s (%.4g) debe ser positivo.", name, value));
        }
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
