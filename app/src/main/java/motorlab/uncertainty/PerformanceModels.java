package motorlab.uncertainty;

import motorlab.domain.injector.InjectorDesign;
import motorlab.domain.motor.MotorPerformance;
import motorlab.domain.regression.RegressionSample;
import motorlab.domain.regression.RegressionTimeline;
import motorlab.domain.uncertainty.OutputQuantity;
import motorlab.physics.i.IPerformanceSolver;
import motorlab.physics.injector.InjectorSizingService;
import motorlab.physics.simulator.RegressionSimulator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Modelos de evaluación predefinidos para las campañas Monte Carlo.
 */
public final class PerformanceModels {

    /**
     * Prohibido construir esta clase utilidad
     */
    private PerformanceModels() {
    }

    /**
     * Punto de operación estacionario.
     */
    public static PerformanceModel steadyState(IPerformanceSolver solver) {
        return configuration -> outputs(solver.solve(configuration));
    }

    /**
     * Punto de operación más dimensionado del inyector: una geometría de inyector inviable
     * también cuenta como fallo de la muestra.
     */
    public static PerformanceModel steadyStateWithInjector(IPerformanceSolver solver, InjectorSizingService injectors) {
        return configuration -> {
            MotorPerformance performance = solver.solve(configuration);
            Map<OutputQuantity, Double> values = outputs(performance);
            if (configuration.injector() != null) {
                InjectorDesign design = injectors.size(performance, configuration.injector());
                values.put(OutputQuantity.INJECTOR_EXIT_VELOCITY, design.exitVelocity());
            }
            return values;
        };
    }

    /**
     * Línea temporal de regresión: empuje e Isp medios, presión de pico y duración válida.
     */
    public static PerformanceModel regression(RegressionSimulator simulator, int stepCount) {
        return configuration -> {
            RegressionTimeline timeline = simulator.simulate(configuration, stepCount);
            List<RegressionSample> valid = timeline.validSamples();
            Map<OutputQuantity, Double> values = new EnumMap<>(OutputQuantity.class);
            values.put(OutputQuantity.THRUST, timeline.averageThrust());
            values.put(OutputQuantity.CHAMBER_PRESSURE, timeline.peakChamberPressure());
            values.put(OutputQuantity.BURN_TIME, timeline.lastValidSample().time());
            values.put(OutputQuantity.SPECIFIC_IMPULSE,
                    valid.stream().mapToDouble(s -> s.performance().specificImpulse()).average().orElse(0.0));
            values.put(OutputQuantity.TOTAL_MASS_FLOW,
                    valid.stream().mapToDouble(s -> s.performance().totalMassFlow()).average().orElse(0.0));
            values.put(OutputQuantity.OF_RATIO,
                    valid.stream().mapToDouble(RegressionSample::ofRatio).average().orElse(0.0));
            return values;
        };
    }

    static Map<OutputQuantity, Double> outputs(MotorPerformance performance) {
        Map<OutputQuantity, Double> values = new EnumMap<>(OutputQuantity.class);
        values.put(OutputQuantity.THRUST, performance.thrust());
        values.put(OutputQuantity.SPECIFIC_IMPULSE, performance.specificImpulse());
        values.put(OutputQuantity.BURN_TIME, performance.burnTime());
        values.put(OutputQuantity.CHAMBER_PRESSURE, performance.chamberPressure());
        values.put(OutputQuantity.TOTAL_MASS_FLOW, performance.totalMassFlow());
        values.put(OutputQuantity.OF_RATIO, performance.ofRatio());
        return values;
    }
}
