package motorlab.domain.motor;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Propiedades del oxidante en las condiciones de alimentación del inyector.
 *
 * @param phase         Fase a la entrada del inyector.
 * @param density       Densidad (kg/m³).
 * @param viscosity     Viscosidad dinámica (Pa·s).
 * @param vaporPressure Presión de saturación a la temperatura del tanque (Pa).
 */
@Builder
@With
public record OxidizerProperties(
        OxidizerPhase phase,
        double density,
        double viscosity,
        double vaporPressure
) {
    /** Presión de vapor del N2O a unos 20 °C (Pa). */
    public static final double N2O_VAPOR_PRESSURE = 5.1e6;

    public OxidizerProperties {
        Objects.requireNonNull(phase, "phase no puede ser null");
    }

    /**
     * N2O con los valores por defecto de la fase indicada.
     */
    public static OxidizerProperties nitrousOxide(OxidizerPhase phase) {
        return new OxidizerProperties(phase, phase.getDefaultDensity(), phase.getDefaultViscosity(), N2O_VAPOR_PRESSURE);
    }
}
