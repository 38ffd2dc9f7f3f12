package motorlab.domain.injector;

import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Inyector de torbellino dimensionado.
 *
 * @param slotCount             Número de ranuras tangenciales.
 * @param slotWidth             Ancho de ranura (m).
 * @param slotHeight            Alto de ranura (m).
 * @param sprayHalfAngleDegrees Semiángulo de cono resultante (grados).
 * @param exitOrificeDiameter   Diámetro del orificio de salida (m).
 * @param swirlChamberDiameter  Diámetro de la cámara de torbellino (m).
 */
@Builder
@With
public record SwirlDesign(
        double dischargeCoefficient,
        double pressureDrop,
        double exitVelocity,
        double reynoldsNumber,
        double flowArea,
        double footprintDiameter,
        boolean footprintClamped,
        List<String> warnings,
        int slotCount,
        double slotWidth,
        double slotHeight,
        double sprayHalfAngleDegrees,
        double exitOrificeDiameter,
        double swirlChamberDiameter
) implements InjectorDesign {

    public SwirlDesign {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @Override
    public InjectorFamily family() {
        return InjectorFamily.SWIRL;
    }
}
