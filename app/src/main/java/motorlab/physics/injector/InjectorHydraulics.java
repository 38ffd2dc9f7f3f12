package motorlab.physics.injector;

import motorlab.domain.motor.MotorPerformance;
import motorlab.domain.motor.OxidizerPhase;

import java.util.List;
import java.util.Locale;

/**
 * Relaciones hidráulicas comunes a todas las familias de inyector y avisos consultivos.
 * <p>
 * El caudal se modela con la ecuación del orificio incompresible {@code ṁ = Cd·A·√(2ρΔP)}.
 */
public final class InjectorHydraulics {

    // Selección automática de la caída de presión, como fracción de Pc.
    static final double MIN_DROP_FRACTION = 0.15;
    static final double OPTIMAL_DROP_FRACTION = 0.20;
    static final double MAX_DROP_FRACTION = 0.30;
    static final double AVAILABLE_DROP_USAGE = 0.8;

    // Umbrales de los avisos.
    static final double LOW_DROP_FRACTION = 0.20;
    static final double MIN_RECOMMENDED_VELOCITY = 20.0; // m/s
    static final double MAX_RECOMMENDED_VELOCITY = 50.0; // m/s
    static final double TURBULENT_REYNOLDS = 4000.0;
    static final double MIN_LENGTH_TO_DIAMETER = 3.0;
    static final double MAX_LENGTH_TO_DIAMETER = 5.0;
    static final double CAVITATION_TANK_FRACTION = 0.5;
    static final double FLASH_BOILING_MARGIN_FRACTION = 0.5;

    /**
     * Prohibido construir esta clase utilidad
     */
    private InjectorHydraulics() {
    }

    /**
     * Caída de presión de diseño. Si no se impone, se elige entre el 15 % y el 30 % de Pc
     * según el margen disponible entre tanque y cámara.
     */
    static double resolvePressureDrop(double requested, MotorPerformance performance, List<String> warnings) {
        double chamberPressure = performance.chamberPressure();
        double available = performance.tankPressure() - chamberPressure;
        if (requested > 0) {
            if (requested > available) {
                warnings.add(format("La caída de presión impuesta (%.2f bar) supera el margen tanque-cámara (%.2f bar).",
                        requested / 1e5, available / 1e5));
            }
            return requested;
        }

        double minimum = MIN_DROP_FRACTION * chamberPressure;
        double optimal = OPTIMAL_DROP_FRACTION * chamberPressure;
        double maximum = MAX_DROP_FRACTION * chamberPressure;
        if (available < minimum) {
            warnings.add(format("Presión de tanque insuficiente: margen de %.2f bar frente a %.2f bar mínimos. Se usa el mínimo.",
                    available / 1e5, minimum / 1e5));
            return minimum;
        }
        if (available > maximum) {
            return optimal;
        }
        return Math.min(optimal, AVAILABLE_DROP_USAGE * available);
    }

    static double requiredArea(double massFlow, double dischargeCoefficient, double density, double pressureDrop) {
        return massFlow / (dischargeCoefficient * Math.sqrt(2.0 * density * pressureDrop));
    }

    /**
     * Caída de presión que necesita un área dada para pasar el gasto.
     */
    static double pressureDropFor(double massFlow, double dischargeCoefficient, double density, double area) {
        double term = massFlow / (dischargeCoefficient * area);
        return term * term / (2.0 * density);
    }

    /**
     * Velocidad media en una sección de paso: {@code ṁ/(ρ·A)}. Con Cd &lt; 1 queda por debajo de la de Bernoulli.
     */
    static double bulkVelocity(double massFlow, double density, double area) {
        return massFlow / (density * area);
    }

    static double jetVelocity(double pressureDrop, double density) {
        return Math.sqrt(2.0 * pressureDrop / density);
    }

    static double reynolds(double density, double velocity, double length, double viscosity) {
        return density * velocity * length / viscosity;
    }

    /**
     * Añade los avisos consultivos en orden: caída baja, velocidad, Reynolds, L/D, cavitación, ebullición súbita.
     *
     * @param lengthToDiameter L/D de los orificios, o null si la familia no lo tiene.
     */
    static void addAdvisories(List<String> warnings, MotorPerformance performance, double pressureDrop,
                              double velocity, double reynolds, Double lengthToDiameter) {
        double chamberPressure = performance.chamberPressure();
        if (pressureDrop < LOW_DROP_FRACTION * chamberPressure) {
            warnings.add(format("Caída de presión baja (%.1f %% de Pc): posible acoplamiento con inestabilidades de cámara.",
                    100.0 * pressureDrop / chamberPressure));
        }
        if (velocity < MIN_RECOMMENDED_VELOCITY || velocity > MAX_RECOMMENDED_VELOCITY) {
            warnings.add(format("Velocidad de inyección de %.1f m/s fuera del rango recomendado [%.0f, %.0f] m/s.",
                    velocity, MIN_RECOMMENDED_VELOCITY, MAX_RECOMMENDED_VELOCITY));
        }
        if (reynolds < TURBULENT_REYNOLDS) {
            warnings.add(format("Número de Reynolds bajo (%.0f): atomización pobre.", reynolds));
        }
        if (lengthToDiameter != null
                && (lengthToDiameter < MIN_LENGTH_TO_DIAMETER || lengthToDiameter > MAX_LENGTH_TO_DIAMETER)) {
            warnings.add(format("Relación L/D de %.2f fuera del intervalo recomendado [%.0f, %.0f].",
                    lengthToDiameter, MIN_LENGTH_TO_DIAMETER, MAX_LENGTH_TO_DIAMETER));
        }
        if (performance.oxidizer().phase() == OxidizerPhase.LIQUID) {
            if (pressureDrop > CAVITATION_TANK_FRACTION * performance.tankPressure()) {
                warnings.add(format("Riesgo de cavitación: la caída de presión supera el %.0f %% de la presión de tanque.",
                        CAVITATION_TANK_FRACTION * 100.0));
            }
            double vaporMargin = performance.oxidizer().vaporPressure() - chamberPressure;
            if (vaporMargin > 0 && pressureDrop < FLASH_BOILING_MARGIN_FRACTION * vaporMargin) {
                warnings.add(format("Riesgo de ebullición súbita: Pc (%.2f bar) por debajo de la presión de vapor (%.2f bar) con una caída de solo %.2f bar.",
                        chamberPressure / 1e5, performance.oxidizer().vaporPressure() / 1e5, pressureDrop / 1e5));
            }
        }
    }

    static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
