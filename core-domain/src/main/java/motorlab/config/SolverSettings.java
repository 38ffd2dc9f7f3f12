package motorlab.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros numéricos compartidos por los procesos iterativos
 * (punto fijo de presión de cámara y búsqueda de la presión de salida).
 */
@Value
@Builder
@With
public class SolverSettings {

    /**
     * Cambio relativo por debajo del cual se declara la convergencia.
     */
    @Builder.Default
    double tolerance = 1e-6;

    /**
     * Límite de iteraciones antes de lanzar ConvergenceException.
     */
    @Builder.Default
    int maxIterations = 1000;

    /**
     * Factor de subrelajación inicial del punto fijo.
     */
    @Builder.Default
    double relaxationFactor = 0.5;

    /**
     * Suelo del factor de subrelajación tras sucesivas reducciones por oscilación.
     */
    @Builder.Default
    double minimumRelaxationFactor = 1.0 / 64.0;

    public static SolverSettings defaults() {
        return SolverSettings.builder().build();
    }
}
