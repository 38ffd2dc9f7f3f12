package motorlab.domain.injector;

import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Pintle dimensionado.
 *
 * @param outerDiameter  Diámetro exterior del manguito (m).
 * @param pintleDiameter Diámetro del pintle (m).
 * @param gap            Holgura anular (m).
 */
@Builder
@With
public record PintleDesign(
        double dischargeCoefficient,
        double pressureDrop,
        double exitVelocity,
        double reynoldsNumber,
        double flowArea,
        double footprintDiameter,
        boolean footprintClamped,
        List<String> warnings,
        double outerDiameter,
        double pintleDiameter,
        double gap
) implements InjectorDesign {

    public PintleDesign {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @Override
    public InjectorFamily family() {
        return InjectorFamily.PINTLE;
    }
}
