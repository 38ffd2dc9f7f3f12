package motorlab.domain.motor;

import lombok.Builder;
import lombok.With;

/**
 * Punto de operación estacionario resuelto para una configuración.
 * <p>
 * Cumple {@code totalMassFlow = oxidizerMassFlow + fuelMassFlow} y
 * {@code throatArea·chamberPressure/characteristicVelocity ≈ totalMassFlow} dentro de la tolerancia del solver.
 *
 * @param motorType              Arquitectura del motor.
 * @param chamberPressure        Presión de cámara convergida (Pa).
 * @param exitPressure           Presión estática en la salida de tobera (Pa).
 * @param atmosphericPressure    Presión ambiente usada en el término de presión (Pa).
 * @param totalMassFlow          Gasto másico total (kg/s).
 * @param oxidizerMassFlow       Gasto másico de oxidante (kg/s).
 * @param fuelMassFlow           Gasto másico de combustible (kg/s).
 * @param ofRatio                Relación oxidante/combustible resultante.
 * @param thrust                 Empuje (N).
 * @param specificImpulse        Impulso específico (s).
 * @param characteristicVelocity Velocidad característica c* (m/s).
 * @param thrustCoefficient      Coeficiente de empuje CF.
 * @param exitVelocity           Velocidad de salida de los gases (m/s).
 * @param throatDiameter         Diámetro de garganta (m).
 * @param exitDiameter           Diámetro de salida (m).
 * @param expansionRatio         Relación de expansión de la tobera.
 * @param chamberDiameter        Diámetro de cámara (m).
 * @param chamberLength          Longitud de cámara: grano más el volumen L*·At (m).
 * @param chamberVolume          Volumen de combustión L*·At (m³).
 * @param portDiameter           Diámetro actual del canal (m).
 * @param finalPortDiameter      Diámetro del canal previsto al final de la combustión (m).
 * @param regressionRate         Velocidad de regresión superficial (m/s).
 * @param burnTime               Tiempo de combustión efectivo estimado (s).
 * @param oxidizerMass           Masa de oxidante consumida (kg).
 * @param fuelMass               Masa de combustible consumida (kg).
 * @param totalImpulse           Impulso total F·t (N·s).
 * @param iterations             Iteraciones del punto fijo.
 * @param residual               Residuo relativo final.
 * @param oxidizer               Propiedades de alimentación del oxidante (null en sólidos).
 * @param tankPressure           Presión de tanque (Pa).
 * @param geometry               Geometría con la que se resolvió.
 */
@Builder
@With
public record MotorPerformance(
        MotorType motorType,
        double chamberPressure,
        double exitPressure,
        double atmosphericPressure,
        double totalMassFlow,
        double oxidizerMassFlow,
        double fuelMassFlow,
        double ofRatio,
        double thrust,
        double specificImpulse,
        double characteristicVelocity,
        double thrustCoefficient,
        double exitVelocity,
        double throatDiameter,
        double exitDiameter,
        double expansionRatio,
        double chamberDiameter,
        double chamberLength,
        double chamberVolume,
        double portDiameter,
        double finalPortDiameter,
        double regressionRate,
        double burnTime,
        double oxidizerMass,
        double fuelMass,
        double totalImpulse,
        int iterations,
        double residual,
        OxidizerProperties oxidizer,
        double tankPressure,
        MotorGeometry geometry
) {

    public double throatArea() {
        return Math.PI * throatDiameter * throatDiameter / 4.0;
    }

    public double propellantMass() {
        return oxidizerMass + fuelMass;
    }
}
