package motorlab.domain.motor;

/**
 * Catálogo de propelentes con sus propiedades nominales.
 * <p>
 * Los combustibles híbridos usan la ley de regresión {@code r = a·G_ox^n} (G en kg/m²s, r en m/s).
 * Los propelentes sólidos usan la ley de Saint-Robert {@code r = a·Pc^n} (Pc en Pa, r en m/s).
 * Los valores son orientativos: cualquier entrada explícita de la configuración tiene prioridad.
 */
public enum Propellant {

    // --- Combustibles híbridos (con N2O) ---
    HTPB(MotorType.HYBRID, 920.0, 3.0e-4, 0.50, 3200.0, 415.0, 1.25, 0.0),
    PE(MotorType.HYBRID, 950.0, 2.5e-4, 0.62, 3100.0, 420.0, 1.25, 0.0),
    PMMA(MotorType.HYBRID, 1180.0, 1.5e-4, 0.55, 2900.0, 380.0, 1.25, 0.0),
    PARAFFIN(MotorType.HYBRID, 900.0, 5.0e-4, 0.62, 3000.0, 450.0, 1.25, 0.0),
    ABS(MotorType.HYBRID, 1040.0, 1.8e-4, 0.58, 2800.0, 390.0, 1.25, 0.0),
    PLA(MotorType.HYBRID, 1250.0, 1.2e-4, 0.52, 2700.0, 370.0, 1.25, 0.0),

    // --- Propelentes sólidos ---
    APCP(MotorType.SOLID, 1810.0, 2.83e-5, 0.35, 3241.7, 290.0, 1.1986, 7.0 / 3.0),
    KNSU(MotorType.SOLID, 1841.0, 1.0e-4, 0.319, 3104.8, 278.7, 1.2134, 65.0 / 35.0),
    KNO3_SUCROSE(MotorType.SOLID, 1689.0, 8.9e-5, 0.33, 2394.2, 264.5, 1.2441, 65.0 / 35.0),
    BLACK_POWDER(MotorType.SOLID, 1650.0, 1.2e-4, 0.30, 2216.4, 250.4, 1.2510, 3.0),
    DOUBLE_BASE(MotorType.SOLID, 1580.0, 1.95e-4, 0.25, 2789.3, 309.2, 1.2612, 1.0);

    private final MotorType motorType;
    private final double density;
    private final double regressionCoefficient;
    private final double regressionExponent;
    private final double combustionTemperature;
    private final double gasConstant;
    private final double gamma;
    private final double formulationOfRatio;

    Propellant(MotorType motorType, double density, double regressionCoefficient, double regressionExponent,
               double combustionTemperature, double gasConstant, double gamma, double formulationOfRatio) {
        this.motorType = motorType;
        this.density = density;
        this.regressionCoefficient = regressionCoefficient;
        this.regressionExponent = regressionExponent;
        this.combustionTemperature = combustionTemperature;
        this.gasConstant = gasConstant;
        this.gamma = gamma;
        this.formulationOfRatio = formulationOfRatio;
    }

    /** Tipo de motor en el que este propelente tiene sentido. */
    public MotorType getMotorType() {
        return motorType;
    }

    /** Densidad del grano (kg/m³). */
    public double getDensity() {
        return density;
    }

    public double getRegressionCoefficient() {
        return regressionCoefficient;
    }

    public double getRegressionExponent() {
        return regressionExponent;
    }

    /** Temperatura de combustión (K). */
    public double getCombustionTemperature() {
        return combustionTemperature;
    }

    /** Constante específica de los gases de combustión (J/kg·K). */
    public double getGasConstant() {
        return gasConstant;
    }

    public double getGamma() {
        return gamma;
    }

    /**
     * Relación másica oxidante/aglutinante de la formulación. Solo aplica a sólidos (0 en híbridos).
     */
    public double getFormulationOfRatio() {
        return formulationOfRatio;
    }

    /**
     * Propelente por defecto para un tipo de motor.
     */
    public static Propellant defaultFor(MotorType type) {
        return type == MotorType.SOLID ? APCP : HTPB;
    }
}
