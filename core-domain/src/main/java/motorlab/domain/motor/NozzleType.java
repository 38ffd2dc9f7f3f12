package motorlab.domain.motor;

/**
 * Perfil de la tobera divergente. Cada perfil aporta un rendimiento que escala
 * el término de cantidad de movimiento del empuje (pérdidas por divergencia).
 */
public enum NozzleType {
    CONICAL(0.955),
    BELL(0.985),
    PARABOLIC(0.975);

    private final double efficiency;

    NozzleType(double efficiency) {
        this.efficiency = efficiency;
    }

    public double getEfficiency() {
        return efficiency;
    }
}
