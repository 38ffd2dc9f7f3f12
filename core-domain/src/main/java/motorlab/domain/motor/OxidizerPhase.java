package motorlab.domain.motor;

/**
 * Fase del oxidante a la entrada del inyector.
 */
public enum OxidizerPhase {
    LIQUID(1220.0, 2.0e-4),
    GAS(100.0, 1.5e-5);

    private final double defaultDensity;
    private final double defaultViscosity;

    OxidizerPhase(double defaultDensity, double defaultViscosity) {
        this.defaultDensity = defaultDensity;
        this.defaultViscosity = defaultViscosity;
    }

    /** Densidad por defecto (kg/m³), N2O. */
    public double getDefaultDensity() {
        return defaultDensity;
    }

    /** Viscosidad dinámica por defecto (Pa·s), N2O. */
    public double getDefaultViscosity() {
        return defaultViscosity;
    }
}
