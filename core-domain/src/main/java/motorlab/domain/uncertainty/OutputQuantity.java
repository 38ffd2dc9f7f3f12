package motorlab.domain.uncertainty;

/**
 * Magnitudes de salida sobre las que se acumulan estadísticas.
 */
public enum OutputQuantity {
    THRUST("N"),
    SPECIFIC_IMPULSE("s"),
    BURN_TIME("s"),
    CHAMBER_PRESSURE("Pa"),
    TOTAL_MASS_FLOW("kg/s"),
    OF_RATIO("-"),
    INJECTOR_EXIT_VELOCITY("m/s");

    private final String unit;

    OutputQuantity(String unit) {
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
