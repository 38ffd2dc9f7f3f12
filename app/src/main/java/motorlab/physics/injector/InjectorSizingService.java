package motorlab.physics.injector;

import lombok.extern.slf4j.Slf4j;
import motorlab.domain.injector.InjectorDesign;
import motorlab.domain.injector.InjectorFamily;
import motorlab.domain.injector.InjectorSpec;
import motorlab.domain.motor.MotorPerformance;
import motorlab.physics.i.IInjectorSizer;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Punto de entrada del subsistema de inyectores.
 * <p>
 * La familia se resuelve una sola vez a la entrada y se delega en su sizer; después se aplica
 * el limitador de huella como paso aislado de post-proceso.
 */
@Slf4j
public class InjectorSizingService {

    private final Map<InjectorFamily, IInjectorSizer<?, ?>> sizers = new EnumMap<>(InjectorFamily.class);
    private final InjectorFootprintLimiter footprintLimiter;

    public InjectorSizingService() {
        this(new InjectorFootprintLimiter());
    }

    public InjectorSizingService(InjectorFootprintLimiter footprintLimiter) {
        this.footprintLimiter = Objects.requireNonNull(footprintLimiter, "footprintLimiter no puede ser null");
        register(new ShowerheadInjectorSizer());
        register(new PintleInjectorSizer());
        register(new SwirlInjectorSizer());
    }

    private void register(IInjectorSizer<?, ?> sizer) {
        sizers.put(sizer.family(), sizer);
    }

    /**
     * Dimensiona el inyector para el punto de operación indicado.
     *
     * @throws motorlab.domain.exception.InfeasibleGeometryException si ninguna geometría cumple las restricciones.
     * @throws IllegalArgumentException si el punto de operación no tiene alimentación de oxidante.
     */
    public InjectorDesign size(MotorPerformance performance, InjectorSpec spec) {
        Objects.requireNonNull(performance, "performance no puede ser null");
        Objects.requireNonNull(spec, "spec no puede ser null");
        if (performance.oxidizer() == null || !(performance.oxidizerMassFlow() > 0)) {
            throw new IllegalArgumentException("El dimensionado de inyector requiere un punto de operación con alimentación de oxidante.");
        }
        InjectorDesign design = sizeWith(sizers.get(spec.family()), performance, spec);
        log.debug("Inyector {} dimensionado: ΔP = {} Pa, v = {} m/s, {} advertencias",
                design.family(), design.pressureDrop(), design.exitVelocity(), design.warnings().size());
        return design;
    }

    @SuppressWarnings("unchecked")
    private <S extends InjectorSpec, D extends InjectorDesign> D sizeWith(IInjectorSizer<S, D> sizer,
                                                                          MotorPerformance performance,
                                                                          InjectorSpec spec) {
        D raw = sizer.size(performance, (S) spec);
        return footprintLimiter.enforce(raw, sizer, performance);
    }
}
