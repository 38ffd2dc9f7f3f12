package motorlab.physics.solver;

import motorlab.config.SolverSettings;
import motorlab.domain.exception.ConvergenceException;
import motorlab.domain.exception.InfeasibleDesignException;

/**
 * Relaciones de flujo isentrópico cuasi-unidimensional para la tobera convergente-divergente.
 * <p>
 * La presión de salida se obtiene invirtiendo la relación algebraica área-presión en el
 * ramal supersónico mediante bisección en escala logarítmica.
 * Esta clase es Thread safe.
 */
public final class IsentropicNozzle {

    public static final double STANDARD_GRAVITY = 9.80665; // m/s²
    public static final double MAX_EXPANSION_RATIO = 250.0;
    private static final double MIN_PRESSURE_RATIO = 1e-12;

    /**
     * Prohibido construir esta clase utilidad
     */
    private IsentropicNozzle() {
    }

    /**
     * Velocidad característica c* (m/s).
     */
    public static double characteristicVelocity(double gamma, double gasConstant, double chamberTemperature) {
        double exponent = (gamma + 1.0) / (gamma - 1.0);
        double chokedTerm = Math.sqrt(Math.pow(2.0 / (gamma + 1.0), exponent));
        return Math.sqrt(gamma * gasConstant * chamberTemperature) / (gamma * chokedTerm);
    }

    /**
     * Gasto que pasa por una garganta bloqueada: {@code ṁ = Pc·At/c*}.
     */
    public static double throatMassFlow(double chamberPressure, double throatArea, double characteristicVelocity) {
        return chamberPressure * throatArea / characteristicVelocity;
    }

    /**
     * Relación de presiones garganta/cámara (flujo bloqueado).
     */
    public static double criticalPressureRatio(double gamma) {
        return Math.pow(2.0 / (gamma + 1.0), gamma / (gamma - 1.0));
    }

    /**
     * Relación de áreas Ae/At que corresponde a una relación de presiones Pe/Pc.
     */
    public static double areaRatio(double gamma, double pressureRatio) {
        double gm1 = gamma - 1.0;
        double gp1 = gamma + 1.0;
        double throatTerm = Math.pow(gp1 / 2.0, 1.0 / gm1);
        double densityTerm = Math.pow(pressureRatio, 1.0 / gamma);
        double velocityTerm = Math.sqrt(gp1 / gm1 * (1.0 - Math.pow(pressureRatio, gm1 / gamma)));
        return 1.0 / (throatTerm * densityTerm * velocityTerm);
    }

    /**
     * Relación de presiones Pe/Pc en el ramal supersónico para una relación de expansión dada.
     *
     * @throws InfeasibleDesignException si la relación de expansión no es mayor que 1.
     * @throws ConvergenceException      si la bisección no alcanza la tolerancia en el límite de iteraciones.
     */
    public static double exitPressureRatio(double gamma, double expansionRatio, double tolerance, int maxIterations) {
        if (!(expansionRatio > 1.0)) {
            throw new InfeasibleDesignException("La relación de expansión debe ser mayor que 1 para flujo supersónico: " + expansionRatio);
        }
        // areaRatio decrece al aumentar la presión entre MIN_PRESSURE_RATIO y la crítica.
        double logLow = Math.log(MIN_PRESSURE_RATIO);
        double logHigh = Math.log(criticalPressureRatio(gamma));
        for (int i = 0; i < maxIterations; i++) {
            double logMid = 0.5 * (logLow + logHigh);
            if (areaRatio(gamma, Math.exp(logMid)) > expansionRatio) {
                logLow = logMid;
            } else {
                logHigh = logMid;
            }
            if (logHigh - logLow < tolerance) {
                return Math.exp(0.5 * (logLow + logHigh));
            }
        }
        throw new ConvergenceException("Presión de salida de tobera",
                Math.exp(0.5 * (logLow + logHigh)), maxIterations, logHigh - logLow);
    }

    /**
     * Relación de expansión que adapta la presión de salida a la ambiente, limitada a {@link #MAX_EXPANSION_RATIO}.
     */
    public static double optimumExpansionRatio(double gamma, double chamberPressure, double ambientPressure) {
        if (ambientPressure <= 0) {
            return MAX_EXPANSION_RATIO;
        }
        double pressureRatio = ambientPressure / chamberPressure;
        if (pressureRatio >= criticalPressureRatio(gamma)) {
            throw new InfeasibleDesignException(String.format(
                    "La presión de cámara (%.3e Pa) no basta para bloquear la garganta frente a %.3e Pa.",
                    chamberPressure, ambientPressure));
        }
        return Math.min(areaRatio(gamma, pressureRatio), MAX_EXPANSION_RATIO);
    }

    /**
     * Velocidad de salida ideal por balance de energía (m/s).
     */
    public static double exitVelocity(double gamma, double gasConstant, double chamberTemperature, double pressureRatio) {
        double expansionTerm = 1.0 - Math.pow(pressureRatio, (gamma - 1.0) / gamma);
        return Math.sqrt(2.0 * gamma / (gamma - 1.0) * gasConstant * chamberTemperature * expansionTerm);
    }

    /**
     * Resuelve las condiciones de salida de la tobera.
     *
     * @param requestedExpansionRatio Relación fija, o 0 para adaptarla a {@code ambientPressure}.
     */
    public static NozzleExpansion expand(double gamma, double gasConstant, double chamberTemperature,
                                         double chamberPressure, double ambientPressure,
                                         double requestedExpansionRatio, SolverSettings settings) {
        double expansionRatio = requestedExpansionRatio > 0
                ? requestedExpansionRatio
                : optimumExpansionRatio(gamma, chamberPressure, ambientPressure);
        double pressureRatio = exitPressureRatio(gamma, expansionRatio, settings.getTolerance(), settings.getMaxIterations());
        double exitVelocity = exitVelocity(gamma, gasConstant, chamberTemperature, pressureRatio);
        if (!Double.isFinite(exitVelocity) || exitVelocity <= 0) {
            throw new InfeasibleDesignException("Velocidad de salida no física: " + exitVelocity);
        }
        return new NozzleExpansion(expansionRatio, pressureRatio, exitVelocity);
    }
}
