package motorlab.physics.injector;

import motorlab.domain.exception.InfeasibleGeometryException;
import motorlab.domain.injector.InjectorFamily;
import motorlab.domain.injector.PintleDesign;
import motorlab.domain.injector.PintleSpec;
import motorlab.domain.motor.MotorPerformance;
import motorlab.physics.i.IInjectorSizer;

import java.util.ArrayList;
import java.util.List;

import static motorlab.physics.injector.InjectorHydraulics.format;

/**
 * Dimensionado de un inyector de pintle: la holgura anular sale del área requerida sobre el
 * diámetro medio entre manguito y pintle.
 */
public class PintleInjectorSizer implements IInjectorSizer<PintleSpec, PintleDesign> {

    static final double MIN_GAP = 0.3e-3; // m
    static final double MAX_GAP = 3.0e-3; // m

    @Override
    public InjectorFamily family() {
        return InjectorFamily.PINTLE;
    }

    @Override
    public PintleDesign size(MotorPerformance performance, PintleSpec spec) {
        List<String> warnings = new ArrayList<>();
        double massFlow = performance.oxidizerMassFlow();
        double density = performance.oxidizer().density();
        double cd = spec.resolvedDischargeCoefficient();
        double pressureDrop = InjectorHydraulics.resolvePressureDrop(spec.pressureDrop(), performance, warnings);
        double requiredArea = InjectorHydraulics.requiredArea(massFlow, cd, density, pressureDrop);

        double meanDiameter = (spec.outerDiameter() + spec.pintleDiameter()) / 2.0;
        double idealGap = requiredArea / (Math.PI * meanDiameter);
        double gap = Math.max(MIN_GAP, Math.min(MAX_GAP, idealGap));
        if (gap != idealGap) {
            warnings.add(format("Holgura anular ajustada de %.3f mm a %.3f mm (límites [%.1f, %.1f] mm).",
                    idealGap * 1e3, gap * 1e3, MIN_GAP * 1e3, MAX_GAP * 1e3));
        }
        requireRadialRoom(gap, spec.outerDiameter(), spec.pintleDiameter());

        double flowArea = Math.PI * meanDiameter * gap;
        double actualDrop = InjectorHydraulics.pressureDropFor(massFlow, cd, density, flowArea);
        double velocity = InjectorHydraulics.jetVelocity(actualDrop, density);
        double reynolds = InjectorHydraulics.reynolds(density, velocity, 2.0 * gap, performance.oxidizer().viscosity());
        InjectorHydraulics.addAdvisories(warnings, performance, actualDrop, velocity, reynolds, null);

        return PintleDesign.builder()
                .dischargeCoefficient(cd)
                .pressureDrop(actualDrop)
                .exitVelocity(velocity)
                .reynoldsNumber(reynolds)
                .flowArea(flowArea)
                .footprintDiameter(spec.outerDiameter())
                .footprintClamped(false)
                .warnings(warnings)
                .outerDiameter(spec.outerDiameter())
                .pintleDiameter(spec.pintleDiameter())
                .gap(gap)
                .build();
    }

    /**
     * Escala manguito y pintle manteniendo el área de paso; la holgura se recalcula.
     */
    @Override
    public PintleDesign shrinkToFootprint(PintleDesign design, double maxFootprint, MotorPerformance performance) {
        double scale = maxFootprint / design.outerDiameter();
        double outer = maxFootprint;
        double pintle = design.pintleDiameter() * scale;
        double gap = design.flowArea() / (Math.PI * (outer + pintle) / 2.0);
        requireRadialRoom(gap, outer, pintle);

        double reynolds = InjectorHydraulics.reynolds(performance.oxidizer().density(), design.exitVelocity(),
                2.0 * gap, performance.oxidizer().viscosity());
        List<String> warnings = design.warnings();
        if (reynolds < InjectorHydraulics.TURBULENT_REYNOLDS && design.reynoldsNumber() >= InjectorHydraulics.TURBULENT_REYNOLDS) {
            warnings = new ArrayList<>(warnings);
            warnings.add(format("Número de Reynolds bajo (%.0f): atomización pobre.", reynolds));
        }
        return design.withOuterDiameter(outer)
                .withPintleDiameter(pintle)
                .withGap(gap)
                .withReynoldsNumber(reynolds)
                .withFootprintDiameter(maxFootprint)
                .withFootprintClamped(true)
                .withWarnings(InjectorFootprintLimiter.withAdjustmentNote(warnings, design.outerDiameter(), maxFootprint));
    }

    private static void requireRadialRoom(double gap, double outerDiameter, double pintleDiameter) {
        double room = (outerDiameter - pintleDiameter) / 2.0;
        if (gap >= room) {
            throw new InfeasibleGeometryException(format(
                    "La holgura anular (%.3f mm) no cabe entre pintle y manguito (%.3f mm disponibles).",
                    gap * 1e3, room * 1e3));
        }
    }

    @Override
    public String getName() {
        return "Pintle";
    }
}
