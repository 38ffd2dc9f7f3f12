package motorlab.physics.solver;

/**
 * Condiciones de salida de la tobera para una presión de cámara dada.
 *
 * @param expansionRatio Relación de áreas salida/garganta.
 * @param pressureRatio  Relación Pe/Pc en el ramal supersónico.
 * @param exitVelocity   Velocidad de salida ideal por balance de energía (m/s).
 */
public record NozzleExpansion(double expansionRatio, double pressureRatio, double exitVelocity) {
}
