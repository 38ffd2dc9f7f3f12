package motorlab.domain.injector;

/**
 * Familias de inyector soportadas, con su coeficiente de descarga por defecto.
 */
public enum InjectorFamily {
    SHOWERHEAD(0.70),
    PINTLE(0.75),
    SWIRL(0.65);

    private final double defaultDischargeCoefficient;

    InjectorFamily(double defaultDischargeCoefficient) {
        this.defaultDischargeCoefficient = defaultDischargeCoefficient;
    }

    public double getDefaultDischargeCoefficient() {
        return defaultDischargeCoefficient;
    }
}
