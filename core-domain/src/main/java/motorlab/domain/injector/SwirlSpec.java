package motorlab.domain.injector;

import lombok.Builder;
import lombok.With;

/**
 * Inyector de torbellino con ranuras tangenciales.
 *
 * @param dischargeCoefficient  Cd explícito o null.
 * @param pressureDrop          Caída de presión (Pa), 0 = automática.
 * @param slotCount             Número de ranuras tangenciales, 0 = 6.
 * @param sprayHalfAngleDegrees Semiángulo de cono objetivo (grados), 0 = 45°.
 * @param slotWidth             Ancho de ranura (m), 0 = derivado.
 * @param slotHeight            Alto de ranura (m), 0 = derivado.
 */
@Builder
@With
public record SwirlSpec(
        Double dischargeCoefficient,
        double pressureDrop,
        int slotCount,
        double sprayHalfAngleDegrees,
        double slotWidth,
        double slotHeight
) implements InjectorSpec {

    public static final int DEFAULT_SLOT_COUNT = 6;
    public static final double DEFAULT_SPRAY_HALF_ANGLE = 45.0;

    public SwirlSpec {
        if (slotCount == 0) slotCount = DEFAULT_SLOT_COUNT;
        if (sprayHalfAngleDegrees == 0) sprayHalfAngleDegrees = DEFAULT_SPRAY_HALF_ANGLE;
    }

    public static SwirlSpec defaults() {
        return SwirlSpec.builder().build();
    }

    @Override
    public InjectorFamily family() {
        return InjectorFamily.SWIRL;
    }
}
