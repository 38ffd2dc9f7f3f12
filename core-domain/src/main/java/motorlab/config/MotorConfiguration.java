package motorlab.config;

import lombok.Builder;
import lombok.With;
import motorlab.domain.injector.InjectorSpec;
import motorlab.domain.injector.ShowerheadSpec;
import motorlab.domain.motor.CombustionMode;
import motorlab.domain.motor.MotorGeometry;
import motorlab.domain.motor.MotorType;
import motorlab.domain.motor.NozzleType;
import motorlab.domain.motor.OxidizerPhase;
import motorlab.domain.motor.OxidizerProperties;
import motorlab.domain.motor.Propellant;

import java.util.Objects;

/**
 * Configuración validada e inmutable de un motor.
 * <p>
 * Nunca se modifica: la regresión y las perturbaciones Monte Carlo trabajan sobre copias
 * derivadas con los métodos {@code with...}. Unidades SI.
 *
 * @param motorType              Arquitectura del motor.
 * @param propellant             Entrada del catálogo de la que salen los valores por defecto.
 * @param thrust                 Empuje de diseño (N).
 * @param burnTime               Tiempo de combustión de diseño (s).
 * @param ofRatio                Relación O/F de diseño (en sólidos, la de la formulación).
 * @param chamberPressure        Presión de cámara de diseño (Pa).
 * @param atmosphericPressure    Presión ambiente de adaptación de la tobera (Pa).
 * @param chamberTemperature     Temperatura de combustión (K).
 * @param gamma                  Relación de calores específicos de los gases.
 * @param gasConstant            Constante específica de los gases (J/kg·K).
 * @param characteristicLength   Longitud característica L* (m).
 * @param expansionRatio         Relación de expansión, 0 = adaptada a la presión ambiente.
 * @param nozzleType             Perfil de tobera.
 * @param regressionCoefficient  Coeficiente a de la ley de regresión.
 * @param regressionExponent     Exponente n de la ley de regresión.
 * @param propellantDensity      Densidad del grano (kg/m³).
 * @param propellantTemperature  Temperatura inicial del grano (K).
 * @param temperatureSensitivity Sensibilidad lineal de la velocidad de combustión a la temperatura (1/K).
 * @param combustionMode         Modelo de cámara.
 * @param contractionRatio       Relación de contracción Ac/At (solo FINITE_AREA), o null.
 * @param massFlux               Flujo másico por unidad de área de cámara (solo FINITE_AREA), o null.
 * @param chamberDiameter        Diámetro de cámara impuesto (m), 0 = automático.
 * @param initialOxidizerFlux    Flujo de oxidante en el canal al encendido, para dimensionar (kg/m²s).
 * @param oxidizer               Propiedades del oxidante.
 * @param tankPressure           Presión de tanque (Pa).
 * @param injector               Especificación del inyector, o null en sólidos.
 * @param geometry               Hardware fijo. Si es null el motor se dimensiona en el punto de diseño.
 */
@Builder
@With
public record MotorConfiguration(
        MotorType motorType,
        Propellant propellant,
        double thrust,
        double burnTime,
        double ofRatio,
        double chamberPressure,
        double atmosphericPressure,
        double chamberTemperature,
        double gamma,
        double gasConstant,
        double characteristicLength,
        double expansionRatio,
        NozzleType nozzleType,
        double regressionCoefficient,
        double regressionExponent,
        double propellantDensity,
        double propellantTemperature,
        double temperatureSensitivity,
        CombustionMode combustionMode,
        Double contractionRatio,
        Double massFlux,
        double chamberDiameter,
        double initialOxidizerFlux,
        OxidizerProperties oxidizer,
        double tankPressure,
        InjectorSpec injector,
        MotorGeometry geometry
) {

    /** Temperatura de referencia de las leyes de regresión (K). */
    public static final double REFERENCE_TEMPERATURE = 298.15;

    public MotorConfiguration {
        Objects.requireNonNull(motorType, "motorType no puede ser null");
        Objects.requireNonNull(propellant, "propellant no puede ser null");
        Objects.requireNonNull(nozzleType, "nozzleType no puede ser null");
        Objects.requireNonNull(combustionMode, "combustionMode no puede ser null");
        Objects.requireNonNull(oxidizer, "oxidizer no puede ser null");
    }

    public boolean hasFixedGeometry() {
        return geometry != null;
    }

    public boolean isHybrid() {
        return motorType == MotorType.HYBRID;
    }

    /** Impulso total de diseño (N·s). */
    public double totalImpulse() {
        return thrust * burnTime;
    }

    /**
     * Factor multiplicativo de la velocidad de regresión por la temperatura inicial del grano.
     */
    public double temperatureFactor() {
        return 1.0 + temperatureSensitivity * (propellantTemperature - REFERENCE_TEMPERATURE);
    }

    /**
     * Motor híbrido HTPB/N2O de 1 kN y 10 s con inyector de ducha.
     * Sirve como referencia en pruebas y ejemplos.
     */
    public static MotorConfiguration getTestingHybrid() {
        Propellant fuel = Propellant.HTPB;
        return MotorConfiguration.builder()
                .motorType(MotorType.HYBRID)
                .propellant(fuel)
                .thrust(1000.0)
                .burnTime(10.0)
                .ofRatio(6.5)
                .chamberPressure(20.0e5)
                .atmosphericPressure(101_325.0)
                .chamberTemperature(fuel.getCombustionTemperature())
                .gamma(fuel.getGamma())
                .gasConstant(fuel.getGasConstant())
                .characteristicLength(1.0)
                .expansionRatio(0.0)
                .nozzleType(NozzleType.CONICAL)
                .regressionCoefficient(fuel.getRegressionCoefficient())
                .regressionExponent(fuel.getRegressionExponent())
                .propellantDensity(fuel.getDensity())
                .propellantTemperature(REFERENCE_TEMPERATURE)
                .temperatureSensitivity(0.002)
                .combustionMode(CombustionMode.INFINITE_AREA)
                .chamberDiameter(0.0)
                .initialOxidizerFlux(350.0)
                .oxidizer(OxidizerProperties.nitrousOxide(OxidizerPhase.LIQUID))
                .tankPressure(30.0e5)
                .injector(ShowerheadSpec.defaults())
                .build();
    }

    /**
     * Motor sólido APCP de 500 N y 3 s con grano BATES.
     */
    public static MotorConfiguration getTestingSolid() {
        Propellant propellant = Propellant.APCP;
        return MotorConfiguration.builder()
                .motorType(MotorType.SOLID)
                .propellant(propellant)
                .thrust(500.0)
                .burnTime(3.0)
                .ofRatio(propellant.getFormulationOfRatio())
                .chamberPressure(40.0e5)
                .atmosphericPressure(101_325.0)
                .chamberTemperature(propellant.getCombustionTemperature())
                .gamma(propellant.getGamma())
                .gasConstant(propellant.getGasConstant())
                .characteristicLength(1.0)
                .expansionRatio(0.0)
                .nozzleType(NozzleType.CONICAL)
                .regressionCoefficient(propellant.getRegressionCoefficient())
                .regressionExponent(propellant.getRegressionExponent())
                .propellantDensity(propellant.getDensity())
                .propellantTemperature(REFERENCE_TEMPERATURE)
                .temperatureSensitivity(0.002)
                .combustionMode(CombustionMode.INFINITE_AREA)
                .chamberDiameter(0.0)
                .initialOxidizerFlux(350.0)
                .oxidizer(OxidizerProperties.nitrousOxide(OxidizerPhase.LIQUID))
                .tankPressure(0.0)
                .build();
    }
}
