package motorlab.physics.injector;

import motorlab.domain.exception.InfeasibleGeometryException;
import motorlab.domain.injector.InjectorFamily;
import motorlab.domain.injector.SwirlDesign;
import motorlab.domain.injector.SwirlSpec;
import motorlab.domain.motor.MotorPerformance;
import motorlab.physics.i.IInjectorSizer;

import java.util.ArrayList;
import java.util.List;

import static motorlab.physics.injector.InjectorHydraulics.format;

/**
 * Dimensionado de un inyector de torbellino.
 * <p>
 * El orificio de salida mide el caudal. El semiángulo de cono fija la relación entre la
 * componente tangencial (ranuras) y la axial (orificio): {@code tan α = v_t / v_a}, de donde
 * sale el área total de ranuras.
 */
public class SwirlInjectorSizer implements IInjectorSizer<SwirlSpec, SwirlDesign> {

    static final double SLOT_ASPECT_RATIO = 2.0; // ancho / alto
    static final double SWIRL_CHAMBER_RATIO = 3.0;
    static final double MIN_SWIRL_CHAMBER_RATIO = 1.5;
    static final double ANGLE_DEVIATION_WARNING = 5.0; // grados

    @Override
    public InjectorFamily family() {
        return InjectorFamily.SWIRL;
    }

    @Override
    public SwirlDesign size(MotorPerformance performance, SwirlSpec spec) {
        List<String> warnings = new ArrayList<>();
        double massFlow = performance.oxidizerMassFlow();
        double density = performance.oxidizer().density();
        double cd = spec.resolvedDischargeCoefficient();
        double pressureDrop = InjectorHydraulics.resolvePressureDrop(spec.pressureDrop(), performance, warnings);

        double orificeArea = InjectorHydraulics.requiredArea(massFlow, cd, density, pressureDrop);
        double orificeDiameter = Math.sqrt(4.0 * orificeArea / Math.PI);
        double axialVelocity = InjectorHydraulics.bulkVelocity(massFlow, density, orificeArea);

        int slots = spec.slotCount();
        double slotWidth;
        double slotHeight;
        double halfAngle;
        if (spec.slotWidth() > 0 && spec.slotHeight() > 0) {
            slotWidth = spec.slotWidth();
            slotHeight = spec.slotHeight();
            double tangentialVelocity = massFlow / (density * slots * slotWidth * slotHeight);
            halfAngle = Math.toDegrees(Math.atan(tangentialVelocity / axialVelocity));
            if (Math.abs(halfAngle - spec.sprayHalfAngleDegrees()) > ANGLE_DEVIATION_WARNING) {
                warnings.add(format("Las ranuras impuestas dan un semiángulo de %.1f° frente a los %.1f° objetivo.",
                        halfAngle, spec.sprayHalfAngleDegrees()));
            }
        } else {
            halfAngle = spec.sprayHalfAngleDegrees();
            double tangentialVelocity = axialVelocity * Math.tan(Math.toRadians(halfAngle));
            double slotArea = massFlow / (density * tangentialVelocity) / slots;
            if (spec.slotWidth() > 0) {
                slotWidth = spec.slotWidth();
                slotHeight = slotArea / slotWidth;
            } else if (spec.slotHeight() > 0) {
                slotHeight = spec.slotHeight();
                slotWidth = slotArea / slotHeight;
            } else {
                slotHeight = Math.sqrt(slotArea / SLOT_ASPECT_RATIO);
                slotWidth = SLOT_ASPECT_RATIO * slotHeight;
            }
        }

        // Velocidad axial en el orificio de salida: Cd·√(2ΔP/ρ).
        double exitVelocity = axialVelocity;
        double reynolds = InjectorHydraulics.reynolds(density, exitVelocity, orificeDiameter, performance.oxidizer().viscosity());
        InjectorHydraulics.addAdvisories(warnings, performance, pressureDrop, exitVelocity, reynolds, null);

        double swirlChamber = SWIRL_CHAMBER_RATIO * orificeDiameter;
        return SwirlDesign.builder()
                .dischargeCoefficient(cd)
                .pressureDrop(pressureDrop)
                .exitVelocity(exitVelocity)
                .reynoldsNumber(reynolds)
                .flowArea(orificeArea)
                .footprintDiameter(swirlChamber + 2.0 * slotWidth)
                .footprintClamped(false)
                .warnings(warnings)
                .slotCount(slots)
                .slotWidth(slotWidth)
                .slotHeight(slotHeight)
                .sprayHalfAngleDegrees(halfAngle)
                .exitOrificeDiameter(orificeDiameter)
                .swirlChamberDiameter(swirlChamber)
                .build();
    }

    /**
     * Reduce la cámara de torbellino; orificio y ranuras se mantienen.
     */
    @Override
    public SwirlDesign shrinkToFootprint(SwirlDesign design, double maxFootprint, MotorPerformance performance) {
        double swirlChamber = maxFootprint - 2.0 * design.slotWidth();
        if (swirlChamber < MIN_SWIRL_CHAMBER_RATIO * design.exitOrificeDiameter()) {
            throw new InfeasibleGeometryException(format(
                    "La cámara de torbellino no cabe en %.1f mm: necesitaría al menos %.1f mm.",
                    maxFootprint * 1e3,
                    (MIN_SWIRL_CHAMBER_RATIO * design.exitOrificeDiameter() + 2.0 * design.slotWidth()) * 1e3));
        }
        return design.withSwirlChamberDiameter(swirlChamber)
                .withFootprintDiameter(maxFootprint)
                .withFootprintClamped(true)
                .withWarnings(InjectorFootprintLimiter.withAdjustmentNote(design.warnings(), design.footprintDiameter(), maxFootprint));
    }

    @Override
    public String getName() {
        return "Swirl";
    }
}
