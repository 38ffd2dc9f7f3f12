package motorlab.domain.injector;

import lombok.Builder;
import lombok.With;

/**
 * Inyector de pintle con salida anular.
 *
 * @param dischargeCoefficient Cd explícito o null.
 * @param pressureDrop         Caída de presión (Pa), 0 = automática.
 * @param outerDiameter        Diámetro exterior del manguito (m), 0 = 50 mm.
 * @param pintleDiameter       Diámetro del pintle (m), 0 = 25 mm.
 */
@Builder
@With
public record PintleSpec(
        Double dischargeCoefficient,
        double pressureDrop,
        double outerDiameter,
        double pintleDiameter
) implements InjectorSpec {

    public static final double DEFAULT_OUTER_DIAMETER = 50.0e-3;
    public static final double DEFAULT_PINTLE_DIAMETER = 25.0e-3;

    public PintleSpec {
        if (outerDiameter == 0) outerDiameter = DEFAULT_OUTER_DIAMETER;
        if (pintleDiameter == 0) pintleDiameter = DEFAULT_PINTLE_DIAMETER;
    }

    public static PintleSpec defaults() {
        return PintleSpec.builder().build();
    }

    @Override
    public InjectorFamily family() {
        return InjectorFamily.PINTLE;
    }
}
