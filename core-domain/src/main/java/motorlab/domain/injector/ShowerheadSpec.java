package motorlab.domain.injector;

import lombok.Builder;
import lombok.With;

/**
 * Placa de orificios axiales.
 *
 * @param dischargeCoefficient Cd explícito o null.
 * @param pressureDrop         Caída de presión (Pa), 0 = automática.
 * @param targetVelocity       Velocidad de inyección objetivo (m/s), 0 = 30 m/s.
 * @param holeCount            Número de orificios, 0 = búsqueda automática.
 * @param minHoleDiameter      Diámetro mínimo fabricable (m), 0 = 0.3 mm.
 * @param maxHoleDiameter      Diámetro máximo admitido (m), 0 = 2.0 mm.
 * @param plateThickness       Espesor de placa (m), 0 = 3 mm.
 */
@Builder
@With
public record ShowerheadSpec(
        Double dischargeCoefficient,
        double pressureDrop,
        double targetVelocity,
        int holeCount,
        double minHoleDiameter,
        double maxHoleDiameter,
        double plateThickness
) implements InjectorSpec {

    public static final double DEFAULT_TARGET_VELOCITY = 30.0;
    public static final double DEFAULT_MIN_HOLE_DIAMETER = 0.3e-3;
    public static final double DEFAULT_MAX_HOLE_DIAMETER = 2.0e-3;
    public static final double DEFAULT_PLATE_THICKNESS = 3.0e-3;

    public ShowerheadSpec {
        if (targetVelocity == 0) targetVelocity = DEFAULT_TARGET_VELOCITY;
        if (minHoleDiameter == 0) minHoleDiameter = DEFAULT_MIN_HOLE_DIAMETER;
        if (maxHoleDiameter == 0) maxHoleDiameter = DEFAULT_MAX_HOLE_DIAMETER;
        if (plateThickness == 0) plateThickness = DEFAULT_PLATE_THICKNESS;
    }

    public static ShowerheadSpec defaults() {
        return ShowerheadSpec.builder().build();
    }

    @Override
    public InjectorFamily family() {
        return InjectorFamily.SHOWERHEAD;
    }
}
