package motorlab;

import motorlab.config.MotorConfiguration;
import motorlab.config.MotorConfigurationValidator;
import motorlab.config.RawMotorInput;
import motorlab.config.ValidationReport;
import motorlab.domain.exception.ValidationException;
import motorlab.domain.injector.InjectorDesign;
import motorlab.domain.injector.ShowerheadSpec;
import motorlab.domain.motor.MotorAnalysis;
import motorlab.domain.motor.MotorGeometry;
import motorlab.domain.motor.MotorPerformance;
import motorlab.domain.motor.MotorType;
import motorlab.domain.uncertainty.UncertainParameter;
import motorlab.domain.uncertainty.UncertaintySpec;
import motorlab.factory.MotorGeometryFactory;
import motorlab.physics.i.IPerformanceSolver;
import motorlab.physics.injector.InjectorSizingService;
import motorlab.physics.simulator.RegressionSimulator;
import motorlab.uncertainty.MonteCarloEngine;
import motorlab.uncertainty.MonteCarloRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Orquestación de la fachada con colaboradores simulados.
 */
@ExtendWith(MockitoExtension.class)
class MotorAnalysisServiceTest {

    @Mock
    private MotorConfigurationValidator validator;
    @Mock
    private IPerformanceSolver solver;
    @Mock
    private MotorGeometryFactory geometryFactory;
    @Mock
    private InjectorSizingService injectorService;
    @Mock
    private RegressionSimulator regressionSimulator;
    @Mock
    private MonteCarloEngine monteCarloEngine;

    private MotorAnalysisService service;
    private MotorPerformance performance;

    @BeforeEach
    void setUp() {
        service = new MotorAnalysisService(validator, solver, geometryFactory, injectorService,
                regressionSimulator, monteCarloEngine);
        performance = MotorPerformance.builder().motorType(MotorType.HYBRID).thrust(1000.0).build();
    }

    @Test
    @DisplayName("analyze: valida, resuelve y dimensiona el inyector; advertencias de configuración primero")
    void analyze_chainsValidationSolveAndInjector() {
        // ARRANGE
        RawMotorInput raw = RawMotorInput.builder().motorType(MotorType.HYBRID).build();
        MotorConfiguration config = MotorConfiguration.getTestingHybrid();
        InjectorDesign design = mock(InjectorDesign.class);
        when(validator.check(raw)).thenReturn(new ValidationReport(config, List.of("margen")));
        when(solver.solve(config)).thenReturn(performance);
        when(injectorService.size(performance, config.injector())).thenReturn(design);
        when(design.warnings()).thenReturn(List.of("velocidad"));

        // ACT
        MotorAnalysis analysis = service.analyze(raw);

        // ASSERT
        assertSame(performance, analysis.performance());
        assertSame(design, analysis.injector());
        assertEquals(List.of("margen", "velocidad"), analysis.warnings());
    }

    @Test
    @DisplayName("analyze: un sólido no pasa por el dimensionado de inyector")
    void analyze_solidSkipsInjector() {
        // ARRANGE
        RawMotorInput raw = RawMotorInput.builder().motorType(MotorType.SOLID).build();
        MotorConfiguration config = MotorConfiguration.getTestingSolid();
        when(validator.check(raw)).thenReturn(new ValidationReport(config, List.of()));
        when(solver.solve(config)).thenReturn(performance);

        // ACT
        MotorAnalysis analysis = service.analyze(raw);

        // ASSERT
        assertNull(analysis.injector());
        verifyNoInteractions(injectorService);
    }

    @Test
    @DisplayName("Una entrada inválida nunca llega al solver")
    void analyze_validationFailureStopsChain() {
        // ARRANGE
        RawMotorInput raw = RawMotorInput.builder().build();
        when(validator.check(raw)).thenThrow(new ValidationException(List.of("tanque")));

        // ACT & ASSERT
        assertThrows(ValidationException.class, () -> service.analyze(raw));
        verifyNoInteractions(solver, injectorService);
    }

    @Test
    @DisplayName("runMonteCarlo dimensiona el motor una vez y perturba el hardware construido")
    void runMonteCarlo_sizesGeometryOnce() {
        // ARRANGE
        MotorConfiguration config = MotorConfiguration.getTestingHybrid();
        MotorGeometry geometry = mock(MotorGeometry.class);
        MonteCarloRun run = mock(MonteCarloRun.class);
        UncertaintySpec spec = UncertaintySpec.uniform(0.01, UncertainParameter.GAMMA);
        when(geometryFactory.size(config)).thenReturn(geometry);
        when(monteCarloEngine.start(any(), eq(spec), anyInt(), any())).thenReturn(run);

        // ACT
        service.runMonteCarlo(config, spec, 50);

        // ASSERT
        ArgumentCaptor<MotorConfiguration> nominal = ArgumentCaptor.forClass(MotorConfiguration.class);
        verify(monteCarloEngine).start(nominal.capture(), eq(spec), eq(50), any());
        assertSame(geometry, nominal.getValue().geometry());
        verify(geometryFactory, times(1)).size(config);
        verify(run).awaitSummary();
    }

    @Test
    @DisplayName("Con geometría ya fija no se vuelve a dimensionar")
    void startMonteCarlo_keepsFixedGeometry() {
        // ARRANGE
        MotorConfiguration built = MotorConfiguration.getTestingHybrid().withGeometry(mock(MotorGeometry.class));
        UncertaintySpec spec = UncertaintySpec.uniform(0.01, UncertainParameter.GAMMA);

        // ACT
        service.startMonteCarlo(built, spec, 10);

        // ASSERT
        verify(monteCarloEngine).start(eq(built), eq(spec), eq(10), any());
        verifyNoInteractions(geometryFactory);
    }

    @Test
    @DisplayName("Las operaciones directas delegan en su colaborador")
    void directOperationsDelegate() {
        // ARRANGE
        MotorConfiguration config = MotorConfiguration.getTestingHybrid();
        ShowerheadSpec spec = ShowerheadSpec.defaults();

        // ACT
        service.solve(config);
        service.sizeInjector(performance, spec);
        service.simulateRegression(config, 20);
        service.close();

        // ASSERT
        verify(solver).solve(config);
        verify(injectorService).size(performance, spec);
        verify(regressionSimulator).simulate(config, 20);
        verify(monteCarloEngine).close();
    }
}
