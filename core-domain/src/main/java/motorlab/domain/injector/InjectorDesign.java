package motorlab.domain.injector;

import java.util.List;

/**
 * Resultado del dimensionado de un inyector. Unión etiquetada con un registro por familia.
 * <p>
 * Las advertencias son consultivas y ordenadas: nunca invalidan el diseño.
 */
public interface InjectorDesign {

    InjectorFamily family();

    double dischargeCoefficient();

    /** Caída de presión que exige la geometría final (Pa). */
    double pressureDrop();

    /** Velocidad de salida del oxidante (m/s). */
    double exitVelocity();

    double reynoldsNumber();

    /** Área geométrica de paso que mide el caudal (m²). */
    double flowArea();

    /** Diámetro de la huella del inyector sobre la cabeza de cámara (m). */
    double footprintDiameter();

    /** Indica si el limitador de huella tuvo que reducir la geometría. */
    boolean footprintClamped();

    List<String> warnings();
}
