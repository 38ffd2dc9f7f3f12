package motorlab.domain.injector;

import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Placa de orificios dimensionada.
 *
 * @param holeCount      Número de orificios.
 * @param holeDiameter   Diámetro de cada orificio (m).
 * @param holePitch      Separación entre centros en el patrón hexagonal (m).
 * @param plateThickness Espesor de placa (m).
 */
@Builder
@With
public record ShowerheadDesign(
        double dischargeCoefficient,
        double pressureDrop,
        double exitVelocity,
        double reynoldsNumber,
        double flowArea,
        double footprintDiameter,
        boolean footprintClamped,
        List<String> warnings,
        int holeCount,
        double holeDiameter,
        double holePitch,
        double plateThickness
) implements InjectorDesign {

    public ShowerheadDesign {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @Override
    public InjectorFamily family() {
        return InjectorFamily.SHOWERHEAD;
    }

    /** Relación longitud/diámetro de los orificios. */
    public double lengthToDiameter() {
        return plateThickness / holeDiameter;
    }
}
