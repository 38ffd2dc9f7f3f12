package motorlab.physics.i;

import motorlab.domain.injector.InjectorDesign;
import motorlab.domain.injector.InjectorFamily;
import motorlab.domain.injector.InjectorSpec;
import motorlab.domain.motor.MotorPerformance;

/**
 * Dimensionador de una familia concreta de inyector.
 *
 * @param <S> Especificación de entrada de la familia.
 * @param <D> Diseño resultante de la familia.
 */
public interface IInjectorSizer<S extends InjectorSpec, D extends InjectorDesign> extends ISolverComponent {

    InjectorFamily family();

    /**
     * Dimensiona la geometría hidráulica sin considerar la huella sobre la cámara.
     */
    D size(MotorPerformance performance, S spec);

    /**
     * Reduce la geometría para que su huella no supere {@code maxFootprint}.
     *
     * @throws motorlab.domain.exception.InfeasibleGeometryException si no es posible.
     */
    D shrinkToFootprint(D design, double maxFootprint, MotorPerformance performance);
}
