package motorlab.uncertainty;

import motorlab.config.MonteCarloSettings;
import motorlab.config.MotorConfiguration;
import motorlab.config.SolverSettings;
import motorlab.domain.exception.InfeasibleDesignException;
import motorlab.domain.uncertainty.OutputQuantity;
import motorlab.domain.uncertainty.QuantityStatistics;
import motorlab.domain.uncertainty.StatisticalSummary;
import motorlab.domain.uncertainty.UncertainParameter;
import motorlab.domain.uncertainty.UncertaintySpec;
import motorlab.factory.MotorGeometryFactory;
import motorlab.physics.solver.SteadyStateSolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class MonteCarloEngineTest {

    private MonteCarloEngine engine;
    private MotorConfiguration nominal;

    @BeforeEach
    void setUp() {
        engine = new MonteCarloEngine(MonteCarloSettings.builder().workerCount(4).seed(7L).build());
        MotorConfiguration hybrid = MotorConfiguration.getTestingHybrid();
        nominal = hybrid.withGeometry(new MotorGeometryFactory(SolverSettings.defaults()).size(hybrid));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Perturbaciones del 1 %: más del 95 % de muestras válidas y empuje medio cerca del nominal")
    void run_smallPerturbationsMostlySucceed() {
        // ARRANGE
        UncertaintySpec spec = UncertaintySpec.uniform(0.01,
                UncertainParameter.REGRESSION_COEFFICIENT,
                UncertainParameter.PROPELLANT_DENSITY,
                UncertainParameter.CHAMBER_TEMPERATURE,
                UncertainParameter.TANK_PRESSURE,
                UncertainParameter.THROAT_AREA);

        // ACT
        StatisticalSummary summary = engine.run(nominal, spec, 200, PerformanceModels.steadyState(new SteadyStateSolver()));

        // ASSERT
        assertEquals(200, summary.completedSamples());
        assertFalse(summary.stoppedEarly());
        assertTrue(summary.successRate() > 0.95, "Tasa de éxito: " + summary.successRate());

        QuantityStatistics thrust = summary.get(OutputQuantity.THRUST).orElseThrow();
        assertEquals(1000.0, thrust.mean(), 20.0);
        assertTrue(thrust.standardDeviation() > 0);
        assertTrue(thrust.min() <= thrust.percentile5() && thrust.percentile5() <= thrust.mean());
        assertTrue(thrust.mean() <= thrust.percentile95() && thrust.percentile95() <= thrust.max());
    }

    @Test
    @DisplayName("Misma semilla, distinto número de hilos: mismo resumen")
    void run_isIndependentOfWorkerCount() {
        // ARRANGE
        UncertaintySpec spec = UncertaintySpec.uniform(0.02,
                UncertainParameter.REGRESSION_COEFFICIENT, UncertainParameter.GAMMA);
        PerformanceModel model = PerformanceModels.steadyState(new SteadyStateSolver());

        // ACT
        StatisticalSummary parallel = engine.run(nominal, spec, 60, model);
        StatisticalSummary sequential;
        try (MonteCarloEngine single = new MonteCarloEngine(MonteCarloSettings.builder().workerCount(1).seed(7L).build())) {
            sequential = single.run(nominal, spec, 60, model);
        }

        // ASSERT
        assertEquals(sequential.successfulSamples(), parallel.successfulSamples());
        assertEquals(sequential.failureCounts(), parallel.failureCounts());
        QuantityStatistics a = sequential.get(OutputQuantity.SPECIFIC_IMPULSE).orElseThrow();
        QuantityStatistics b = parallel.get(OutputQuantity.SPECIFIC_IMPULSE).orElseThrow();
        assertEquals(a.mean(), b.mean(), Math.abs(a.mean()) * 1e-12);
        assertEquals(a.standardDeviation(), b.standardDeviation(), a.standardDeviation() * 1e-9);
        assertEquals(a.percentile5(), b.percentile5());
        assertEquals(a.percentile95(), b.percentile95());
        assertEquals(a.min(), b.min());
        assertEquals(a.max(), b.max());
    }

    @Test
    @DisplayName("Las muestras que violan la validación o fallan en el modelo cuentan en el denominador")
    void run_countsFailuresByCause() {
        // ARRANGE
        double nominalCoefficient = nominal.regressionCoefficient();
        UncertaintySpec spec = UncertaintySpec.builder()
                .perturbation(UncertainParameter.TANK_PRESSURE, 0.5)
                .perturbation(UncertainParameter.REGRESSION_COEFFICIENT, 0.1)
                .build();
        PerformanceModel model = config -> {
            if (config.regressionCoefficient() > nominalCoefficient) {
                throw new InfeasibleDesignException("Coeficiente demasiado alto");
            }
            return Map.of(OutputQuantity.THRUST, 1.0);
        };

        // ACT
        StatisticalSummary summary = engine.run(nominal, spec, 400, model);

        // ASSERT
        Map<String, Integer> failures = summary.failureCounts();
        assertTrue(failures.containsKey("ValidationException"), "Fallos: " + failures);
        assertTrue(failures.containsKey("InfeasibleDesignException"), "Fallos: " + failures);
        int failed = failures.values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(summary.completedSamples(), summary.successfulSamples() + failed);
        assertTrue(summary.successRate() < 0.95);
        assertEquals(summary.successfulSamples(), summary.get(OutputQuantity.THRUST).orElseThrow().sampleCount());
    }

    @Test
    @DisplayName("Parada cooperativa: se devuelven las muestras completadas y se marca la parada")
    void start_stopsBetweenSamples() {
        // ARRANGE
        CountDownLatch gate = new CountDownLatch(1);
        PerformanceModel blocking = config -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return Map.of(OutputQuantity.THRUST, 1.0);
        };
        UncertaintySpec spec = UncertaintySpec.uniform(0.01, UncertainParameter.GAMMA);

        // ACT
        MonteCarloRun run = engine.start(nominal, spec, 100_000, blocking);
        run.requestStop();
        gate.countDown();
        StatisticalSummary summary = run.awaitSummary();

        // ASSERT
        assertTrue(run.isStopRequested());
        assertTrue(summary.stoppedEarly());
        assertTrue(summary.completedSamples() <= 4, "Como mucho una muestra en curso por partición.");
        assertEquals(summary.completedSamples(), summary.successfulSamples());
    }

    @Test
    @DisplayName("Perturbar el área de garganta exige una geometría nominal")
    void start_requiresGeometryForHardwareParameters() {
        UncertaintySpec spec = UncertaintySpec.uniform(0.01, UncertainParameter.THROAT_AREA);
        MotorConfiguration unsized = MotorConfiguration.getTestingHybrid();

        assertThrows(IllegalStateException.class,
                () -> engine.start(unsized, spec, 10, PerformanceModels.steadyState(new SteadyStateSolver())));
    }

    @Test
    @DisplayName("Un número de muestras no positivo es un error de programación")
    void start_rejectsNonPositiveSampleCount() {
        UncertaintySpec spec = UncertaintySpec.uniform(0.01, UncertainParameter.GAMMA);
        assertThrows(IllegalArgumentException.class,
                () -> engine.start(nominal, spec, 0, PerformanceModels.steadyState(new SteadyStateSolver())));
    }
}
