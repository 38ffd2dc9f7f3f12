package motorlab.physics.injector;

import lombok.extern.slf4j.Slf4j;
import motorlab.domain.exception.InfeasibleGeometryException;
import motorlab.domain.injector.InjectorFamily;
import motorlab.domain.injector.ShowerheadDesign;
import motorlab.domain.injector.ShowerheadSpec;
import motorlab.domain.motor.MotorPerformance;
import motorlab.physics.i.IInjectorSizer;

import java.util.ArrayList;
import java.util.List;

import static motorlab.physics.injector.InjectorHydraulics.format;

/**
 * Dimensionado de una placa de orificios (showerhead).
 * <p>
 * Con número de orificios libre se recorren N ∈ [4, 200]: el diámetro se ajusta a los límites de
 * fabricación, se descartan los candidatos cuya área entregada se aleja más de un 5 % de la
 * requerida y se elige el de menor penalización (L/D respecto a 4, velocidad objetivo y desajuste de área).
 */
@Slf4j
public class ShowerheadInjectorSizer implements IInjectorSizer<ShowerheadSpec, ShowerheadDesign> {

    static final int MIN_HOLES = 4;
    static final int MAX_HOLES = 200;
    static final double AREA_TOLERANCE = 0.05;
    static final double TARGET_LENGTH_TO_DIAMETER = 4.0;
    static final double OUT_OF_WINDOW_PENALTY = 10.0;
    static final double AREA_MISMATCH_WEIGHT = 10.0;
    static final double HOLE_PITCH_FACTOR = 3.0;
    static final double MIN_HOLE_PITCH_FACTOR = 1.5;
    // Área ocupada por orificio en un patrón hexagonal: (√3/2)·p².
    private static final double HEX_CELL_FACTOR = Math.sqrt(3.0) / 2.0;

    @Override
    public InjectorFamily family() {
        return InjectorFamily.SHOWERHEAD;
    }

    @Override
    public ShowerheadDesign size(MotorPerformance performance, ShowerheadSpec spec) {
        List<String> warnings = new ArrayList<>();
        double massFlow = performance.oxidizerMassFlow();
        double density = performance.oxidizer().density();
        double cd = spec.resolvedDischargeCoefficient();
        double pressureDrop = InjectorHydraulics.resolvePressureDrop(spec.pressureDrop(), performance, warnings);
        double requiredArea = InjectorHydraulics.requiredArea(massFlow, cd, density, pressureDrop);

        int holeCount;
        double holeDiameter;
        if (spec.holeCount() > 0) {
            holeCount = spec.holeCount();
            double ideal = Math.sqrt(4.0 * requiredArea / (holeCount * Math.PI));
            holeDiameter = clamp(ideal, spec.minHoleDiameter(), spec.maxHoleDiameter());
            if (holeDiameter != ideal) {
                warnings.add(format("Diámetro de orificio ajustado de %.3f mm a %.3f mm por los límites de fabricación.",
                        ideal * 1e3, holeDiameter * 1e3));
            }
            checkFixedCount(holeCount, holeDiameter, requiredArea, massFlow, cd, density, performance);
        } else {
            int best = searchHoleCount(requiredArea, massFlow, cd, density, spec);
            holeCount = best;
            holeDiameter = clamp(Math.sqrt(4.0 * requiredArea / (best * Math.PI)), spec.minHoleDiameter(), spec.maxHoleDiameter());
        }

        double flowArea = holeCount * Math.PI * holeDiameter * holeDiameter / 4.0;
        double actualDrop = InjectorHydraulics.pressureDropFor(massFlow, cd, density, flowArea);
        double velocity = InjectorHydraulics.jetVelocity(actualDrop, density);
        double reynolds = InjectorHydraulics.reynolds(density, velocity, holeDiameter, performance.oxidizer().viscosity());
        double lengthToDiameter = spec.plateThickness() / holeDiameter;
        InjectorHydraulics.addAdvisories(warnings, performance, actualDrop, velocity, reynolds, lengthToDiameter);

        double pitch = HOLE_PITCH_FACTOR * holeDiameter;
        return ShowerheadDesign.builder()
                .dischargeCoefficient(cd)
                .pressureDrop(actualDrop)
                .exitVelocity(velocity)
                .reynoldsNumber(reynolds)
                .flowArea(flowArea)
                .footprintDiameter(footprint(holeCount, pitch, holeDiameter))
                .footprintClamped(false)
                .warnings(warnings)
                .holeCount(holeCount)
                .holeDiameter(holeDiameter)
                .holePitch(pitch)
                .plateThickness(spec.plateThickness())
                .build();
    }

    private int searchHoleCount(double requiredArea, double massFlow, double cd, double density, ShowerheadSpec spec) {
        int bestCount = -1;
        double bestPenalty = Double.POSITIVE_INFINITY;

        for (int n = MIN_HOLES; n <= MAX_HOLES; n++) {
            double diameter = clamp(Math.sqrt(4.0 * requiredArea / (n * Math.PI)), spec.minHoleDiameter(), spec.maxHoleDiameter());
            double delivered = n * Math.PI * diameter * diameter / 4.0;
            double mismatch = Math.abs(delivered / requiredArea - 1.0);
            if (mismatch > AREA_TOLERANCE) {
                continue;
            }

            double lengthToDiameter = spec.plateThickness() / diameter;
            double penalty = Math.abs(lengthToDiameter - TARGET_LENGTH_TO_DIAMETER);
            if (lengthToDiameter < InjectorHydraulics.MIN_LENGTH_TO_DIAMETER
                    || lengthToDiameter > InjectorHydraulics.MAX_LENGTH_TO_DIAMETER) {
                penalty += OUT_OF_WINDOW_PENALTY;
            }
            double velocity = InjectorHydraulics.bulkVelocity(massFlow, density, delivered);
            double velocityDeviation = (velocity - spec.targetVelocity()) / spec.targetVelocity();
            penalty += velocityDeviation * velocityDeviation + AREA_MISMATCH_WEIGHT * mismatch;

            if (penalty < bestPenalty) {
                bestPenalty = penalty;
                bestCount = n;
            }
        }

        if (bestCount < 0) {
            throw new InfeasibleGeometryException(format(
                    "Ningún número de orificios en [%d, %d] con diámetro en [%.3f, %.3f] mm entrega el área requerida de %.3f mm² (±%.0f %%).",
                    MIN_HOLES, MAX_HOLES, spec.minHoleDiameter() * 1e3, spec.maxHoleDiameter() * 1e3,
                    requiredArea * 1e6, AREA_TOLERANCE * 100.0));
        }
        log.debug("Búsqueda de orificios: N = {} (penalización {})", bestCount, bestPenalty);
        return bestCount;
    }

    /**
     * Con número impuesto, el diámetro recortado debe seguir entregando el área requerida y la
     * caída resultante debe caber en el margen tanque-cámara.
     */
    private static void checkFixedCount(int holeCount, double holeDiameter, double requiredArea, double massFlow,
                                        double cd, double density, MotorPerformance performance) {
        double delivered = holeCount * Math.PI * holeDiameter * holeDiameter / 4.0;
        double mismatch = Math.abs(delivered / requiredArea - 1.0);
        if (mismatch > AREA_TOLERANCE) {
            throw new InfeasibleGeometryException(format(
                    "%d orificios de %.3f mm entregan %.3f mm² frente a los %.3f mm² requeridos (±%.0f %%).",
                    holeCount, holeDiameter * 1e3, delivered * 1e6, requiredArea * 1e6, AREA_TOLERANCE * 100.0));
        }
        double drop = InjectorHydraulics.pressureDropFor(massFlow, cd, density, delivered);
        double available = performance.tankPressure() - performance.chamberPressure();
        if (drop > available) {
            throw new InfeasibleGeometryException(format(
                    "%d orificios de %.3f mm necesitan una caída de %.2f bar y el margen tanque-cámara es de %.2f bar.",
                    holeCount, holeDiameter * 1e3, drop / 1e5, available / 1e5));
        }
    }

    /**
     * Reduce la separación entre orificios; la hidráulica no cambia.
     */
    @Override
    public ShowerheadDesign shrinkToFootprint(ShowerheadDesign design, double maxFootprint, MotorPerformance performance) {
        double pitch = (maxFootprint - design.holeDiameter()) / patternFactor(design.holeCount());
        if (pitch < MIN_HOLE_PITCH_FACTOR * design.holeDiameter()) {
            throw new InfeasibleGeometryException(format(
                    "%d orificios de %.3f mm no caben en %.1f mm ni con la separación mínima de %.1f·d.",
                    design.holeCount(), design.holeDiameter() * 1e3, maxFootprint * 1e3, MIN_HOLE_PITCH_FACTOR));
        }
        return design.withHolePitch(pitch)
                .withFootprintDiameter(maxFootprint)
                .withFootprintClamped(true)
                .withWarnings(InjectorFootprintLimiter.withAdjustmentNote(design.warnings(), design.footprintDiameter(), maxFootprint));
    }

    private static double footprint(int holeCount, double pitch, double holeDiameter) {
        return pitch * patternFactor(holeCount) + holeDiameter;
    }

    private static double patternFactor(int holeCount) {
        return Math.sqrt(4.0 * holeCount * HEX_CELL_FACTOR / Math.PI);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public String getName() {
        return "Showerhead";
    }

    @Override
    public String getDescription() {
        return "Búsqueda exhaustiva del número de orificios con penalización por L/D y velocidad.";
    }
}
