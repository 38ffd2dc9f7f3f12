package motorlab.physics.simulator;

import motorlab.config.MotorConfiguration;
import motorlab.config.RegressionSettings;
import motorlab.config.SolverSettings;
import motorlab.domain.motor.MotorGeometry;
import motorlab.domain.motor.MotorPerformance;
import motorlab.domain.motor.MotorType;
import motorlab.domain.regression.RegressionSample;
import motorlab.domain.regression.RegressionTimeline;
import motorlab.domain.regression.SampleStatus;
import motorlab.factory.MotorGeometryFactory;
import motorlab.physics.i.IPerformanceSolver;
import motorlab.physics.solver.SteadyStateSolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RegressionSimulatorTest {

    private MotorGeometryFactory geometryFactory;
    private RegressionSimulator simulator;

    @BeforeEach
    void setUp() {
        geometryFactory = new MotorGeometryFactory(SolverSettings.defaults());
        simulator = new RegressionSimulator(new SteadyStateSolver(), geometryFactory, RegressionSettings.defaults());
    }

    // --------------------------------------------------------------------------
    // Integración con el solver real
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Híbrido de referencia: tiempos equiespaciados, canal creciente y sin riesgo de perforación")
    void simulate_hybridReferenceMotor() {
        // ARRANGE
        MotorConfiguration config = MotorConfiguration.getTestingHybrid();

        // ACT
        RegressionTimeline timeline = simulator.simulate(config, 50);

        // ASSERT
        List<RegressionSample> samples = timeline.samples();
        assertEquals(50, timeline.getSampleCount());
        assertFalse(timeline.hasBurnthroughRisk());
        assertEquals(0.0, samples.get(0).time());
        assertEquals(config.burnTime(), samples.get(samples.size() - 1).time(), 1e-9);
        for (int i = 1; i < samples.size(); i++) {
            assertTrue(samples.get(i).time() > samples.get(i - 1).time());
            assertTrue(samples.get(i).portDiameter() > samples.get(i - 1).portDiameter());
            assertEquals(SampleStatus.NOMINAL, samples.get(i).status());
        }
        assertEquals(config.totalImpulse(), timeline.totalImpulse(), 0.15 * config.totalImpulse());
    }

    @Test
    @DisplayName("Margen estructural pequeño: la cola repite el último estado válido marcada como riesgo")
    void simulate_freezesTailOnBurnthroughRisk() {
        // ARRANGE
        RegressionSimulator strict = new RegressionSimulator(new SteadyStateSolver(), geometryFactory,
                RegressionSettings.builder().burnthroughPortRatio(0.5).build());

        // ACT
        RegressionTimeline timeline = strict.simulate(MotorConfiguration.getTestingHybrid(), 40);

        // ASSERT
        assertTrue(timeline.hasBurnthroughRisk());
        int firstRisk = timeline.firstRiskIndex();
        assertTrue(firstRisk > 0 && firstRisk < 40);
        RegressionSample lastValid = timeline.lastValidSample();
        assertEquals(firstRisk - 1, timeline.samples().indexOf(lastValid));
        for (int i = firstRisk; i < timeline.getSampleCount(); i++) {
            RegressionSample sample = timeline.samples().get(i);
            assertEquals(SampleStatus.BURNTHROUGH_RISK, sample.status());
            assertSame(lastValid.performance(), sample.performance());
            assertEquals(lastValid.portDiameter(), sample.portDiameter());
        }
        assertEquals(firstRisk, timeline.validSamples().size());
    }

    @Test
    @DisplayName("Sólido de referencia: el canal no supera el diámetro exterior del grano")
    void simulate_solidPortStaysInsideGrain() {
        // ACT
        RegressionTimeline timeline = simulator.simulate(MotorConfiguration.getTestingSolid(), 30);

        // ASSERT
        MotorGeometry geometry = timeline.samples().get(0).performance().geometry();
        for (RegressionSample sample : timeline.validSamples()) {
            assertTrue(sample.portDiameter() <= geometry.grainOuterDiameter());
        }
        assertTrue(timeline.averageThrust() > 0);
    }

    @Test
    @DisplayName("Sólido de referencia: agotar el alma es fin de combustión, no riesgo de perforación")
    void simulate_solidWebExhaustionIsBurnout() {
        // ACT
        RegressionTimeline timeline = simulator.simulate(MotorConfiguration.getTestingSolid(), 50);

        // ASSERT
        assertFalse(timeline.hasBurnthroughRisk());
        assertTrue(timeline.hasBurnout());
        MotorGeometry geometry = timeline.samples().get(0).performance().geometry();
        int burning = timeline.validSamples().size();
        assertTrue(burning > 0 && burning < timeline.getSampleCount());
        for (int i = burning; i < timeline.getSampleCount(); i++) {
            RegressionSample sample = timeline.samples().get(i);
            assertEquals(SampleStatus.BURNOUT, sample.status());
            assertEquals(0.0, sample.thrust());
            assertEquals(sample.performance().atmosphericPressure(), sample.chamberPressure());
            assertEquals(geometry.grainOuterDiameter(), sample.portDiameter());
        }
        for (int i = 1; i < timeline.getSampleCount(); i++) {
            assertTrue(timeline.samples().get(i).portDiameter() >= timeline.samples().get(i - 1).portDiameter());
        }
    }

    // --------------------------------------------------------------------------
    // Mecánica del paso temporal (solver simulado)
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Cada paso avanza el canal 2·r·Δt sobre la geometría fija")
    void simulate_advancesPortByRegressionRate() {
        // ARRANGE
        IPerformanceSolver solver = mock(IPerformanceSolver.class);
        MotorPerformance performance = MotorPerformance.builder()
                .motorType(MotorType.HYBRID)
                .regressionRate(1e-3)
                .thrust(100.0)
                .chamberPressure(20e5)
                .ofRatio(6.0)
                .build();
        when(solver.solve(any())).thenReturn(performance);
        MotorGeometry geometry = MotorGeometry.builder()
                .motorType(MotorType.HYBRID)
                .throatArea(1e-4)
                .expansionRatio(5.0)
                .chamberDiameter(0.1)
                .grainOuterDiameter(0.1)
                .initialPortDiameter(0.03)
                .portDiameter(0.03)
                .grainLength(0.3)
                .segmentCount(1)
                .injectorFlowArea(1e-5)
                .oxidizerLoad(3.0)
                .build();
        MotorConfiguration config = MotorConfiguration.getTestingHybrid().withBurnTime(4.0).withGeometry(geometry);
        RegressionSimulator mocked = new RegressionSimulator(solver, geometryFactory, RegressionSettings.defaults());

        // ACT
        RegressionTimeline timeline = mocked.simulate(config, 5);

        // ASSERT
        ArgumentCaptor<MotorConfiguration> captor = ArgumentCaptor.forClass(MotorConfiguration.class);
        verify(solver, times(5)).solve(captor.capture());
        List<MotorConfiguration> solved = captor.getAllValues();
        for (int i = 0; i < solved.size(); i++) {
            assertEquals(0.03 + i * 2.0 * 1e-3 * 1.0, solved.get(i).geometry().portDiameter(), 1e-12);
        }
        assertFalse(timeline.hasBurnthroughRisk());
    }

    @Test
    @DisplayName("Menos de 2 pasos no definen una línea temporal")
    void simulate_rejectsTooFewSteps() {
        assertThrows(IllegalArgumentException.class,
                () -> simulator.simulate(MotorConfiguration.getTestingHybrid(), 1));
    }
}
