package motorlab.domain.motor;

import motorlab.domain.injector.InjectorDesign;

import java.util.List;

/**
 * Resultado encadenado validación → punto de operación → inyector.
 *
 * @param performance Punto de operación de diseño.
 * @param injector    Inyector dimensionado, o null en motores sólidos.
 * @param warnings    Advertencias de configuración seguidas de las del inyector, en orden.
 */
public record MotorAnalysis(MotorPerformance performance, InjectorDesign injector, List<String> warnings) {

    public MotorAnalysis {
        warnings = List.copyOf(warnings);
    }
}
