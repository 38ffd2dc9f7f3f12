package motorlab.physics.model;

/**
 * Atmósfera estándar internacional (ISA) de dos capas: troposfera con gradiente lineal
 * hasta 11 km y estratosfera isoterma hasta 20 km.
 * Se usa para obtener la presión ambiente a la altitud de diseño de la tobera.
 */
public final class StandardAtmosphere {

    public static final double SEA_LEVEL_PRESSURE = 101_325.0; // Pa
    private static final double SEA_LEVEL_TEMPERATURE = 288.15; // K
    private static final double LAPSE_RATE = 0.0065; // K/m
    private static final double AIR_GAS_CONSTANT = 287.05; // J/(kg·K)
    private static final double GRAVITY = 9.80665; // m/s²
    private static final double TROPOPAUSE = 11_000.0; // m

    /**
     * Prohibido construir esta clase utilidad
     */
    private StandardAtmosphere() {
    }

    /**
     * Temperatura ISA (K). Altitudes negativas se tratan como nivel del mar.
     */
    public static double temperature(double altitude) {
        double h = Math.max(0.0, altitude);
        return SEA_LEVEL_TEMPERATURE - LAPSE_RATE * Math.min(h, TROPOPAUSE);
    }

    /**
     * Presión ISA (Pa) a la altitud indicada (m).
     */
    public static double pressure(double altitude) {
        double h = Math.max(0.0, altitude);
        double exponent = GRAVITY / (AIR_GAS_CONSTANT * LAPSE_RATE);
        if (h <= TROPOPAUSE) {
            return SEA_LEVEL_PRESSURE * Math.pow(temperature(h) / SEA_LEVEL_TEMPERATURE, exponent);
        }
        double tropopauseTemperature = temperature(TROPOPAUSE);
        double tropopausePressure = SEA_LEVEL_PRESSURE * Math.pow(tropopauseTemperature / SEA_LEVEL_TEMPERATURE, exponent);
        return tropopausePressure * Math.exp(-GRAVITY * (h - TROPOPAUSE) / (AIR_GAS_CONSTANT * tropopauseTemperature));
    }
}
