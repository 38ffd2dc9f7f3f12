package motorlab.physics.injector;

import lombok.extern.slf4j.Slf4j;
import motorlab.domain.injector.InjectorDesign;
import motorlab.domain.injector.InjectorSpec;
import motorlab.domain.motor.MotorPerformance;
import motorlab.physics.i.IInjectorSizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Paso de post-proceso que limita la huella del inyector al 90 % del diámetro de cámara.
 * <p>
 * Es una ayuda de diseño, no una validación: cuando recorta la geometría lo deja anotado
 * en las advertencias con el prefijo {@link #DESIGN_ADJUSTMENT_PREFIX}. Si la familia no puede
 * encogerse lo bastante, el sizer lanza InfeasibleGeometryException.
 */
@Slf4j
public class InjectorFootprintLimiter {

    public static final double MAX_FOOTPRINT_FRACTION = 0.9;
    public static final String DESIGN_ADJUSTMENT_PREFIX = "[Ajuste de diseño]";

    public <S extends InjectorSpec, D extends InjectorDesign> D enforce(D design, IInjectorSizer<S, D> sizer,
                                                                        MotorPerformance performance) {
        double maxFootprint = MAX_FOOTPRINT_FRACTION * performance.chamberDiameter();
        if (design.footprintDiameter() <= maxFootprint) {
            return design;
        }
        log.warn("Huella del inyector {} ({} m) supera el {} del diámetro de cámara ({} m). Se reduce.",
                design.family(), design.footprintDiameter(), MAX_FOOTPRINT_FRACTION, performance.chamberDiameter());
        return sizer.shrinkToFootprint(design, maxFootprint, performance);
    }

    /**
     * Advertencias del diseño original seguidas de la anotación del recorte.
     */
    static List<String> withAdjustmentNote(List<String> warnings, double originalFootprint, double newFootprint) {
        List<String> result = new ArrayList<>(warnings);
        result.add(InjectorHydraulics.format("%s Huella del inyector reducida de %.1f mm a %.1f mm (%.0f %% del diámetro de cámara).",
                DESIGN_ADJUSTMENT_PREFIX, originalFootprint * 1e3, newFootprint * 1e3, MAX_FOOTPRINT_FRACTION * 100.0));
        return result;
    }
}
