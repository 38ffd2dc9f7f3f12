package motorlab.domain.motor;

/**
 * Arquitectura del motor.
 */
public enum MotorType {
    /** Oxidante líquido o gaseoso inyectado sobre un grano de combustible sólido. */
    HYBRID,
    /** Propelente premezclado (oxidante + combustible) en un único grano. */
    SOLID
}
