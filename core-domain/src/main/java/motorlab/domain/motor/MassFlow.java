package motorlab.domain.motor;

/**
 * Generación de masa a una presión de cámara dada.
 *
 * @param oxidizer       Gasto de oxidante (kg/s).
 * @param fuel           Gasto de combustible (kg/s).
 * @param regressionRate Velocidad de regresión superficial (m/s).
 */
public record MassFlow(double oxidizer, double fuel, double regressionRate) {

    public double total() {
        return oxidizer + fuel;
    }

    public double ofRatio() {
        return fuel > 0 ? oxidizer / fuel : Double.POSITIVE_INFINITY;
    }
}
