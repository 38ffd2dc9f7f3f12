package motorlab.physics.i;

/**
 * Contrato base para cualquier componente numérico del sistema.
 * Permite tratar a todos los solvers de forma polimórfica para tareas
 * de logging e identificación, sin importar su física.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Punto fijo subrelajado").
     */
    String getName();

    /**
     * Descripción técnica del método.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
