package motorlab.config;

import lombok.Builder;
import lombok.With;
import motorlab.domain.injector.InjectorSpec;
import motorlab.domain.motor.CombustionMode;
import motorlab.domain.motor.MotorType;
import motorlab.domain.motor.NozzleType;
import motorlab.domain.motor.OxidizerPhase;
import motorlab.domain.motor.Propellant;

/**
 * Entrada cruda tal como llega del llamador (formulario, JSON...). Todos los campos son opcionales:
 * un campo null recibe su valor por defecto documentado durante la validación.
 * <p>
 * Unidades SI en todos los campos (Pa, m, kg, s, K).
 */
@Builder
@With
public record RawMotorInput(
        MotorType motorType,
        Propellant propellant,

        // --- Objetivos de diseño ---
        Double thrust,
        Double burnTime,
        Double totalImpulse,
        Double ofRatio,
        Double chamberPressure,
        Double atmosphericPressure,
        Double designAltitude,

        // --- Gases de combustión ---
        Double chamberTemperature,
        Double gamma,
        Double gasConstant,
        Double characteristicLength,

        // --- Tobera ---
        Double expansionRatio,
        NozzleType nozzleType,

        // --- Grano ---
        Double regressionCoefficient,
        Double regressionExponent,
        Double propellantDensity,
        Double propellantTemperature,
        Double temperatureSensitivity,

        // --- Cámara ---
        CombustionMode combustionMode,
        Double contractionRatio,
        Double massFlux,
        Double chamberDiameter,
        Double initialOxidizerFlux,

        // --- Alimentación de oxidante ---
        OxidizerPhase oxidizerPhase,
        Double oxidizerDensity,
        Double oxidizerViscosity,
        Double oxidizerVaporPressure,
        Double tankPressure,
        InjectorSpec injector
) {
}
