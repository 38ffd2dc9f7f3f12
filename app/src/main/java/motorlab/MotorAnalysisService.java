package motorlab;

import lombok.extern.slf4j.Slf4j;
import motorlab.config.MonteCarloSettings;
import motorlab.config.MotorConfiguration;
import motorlab.config.MotorConfigurationValidator;
import motorlab.config.RawMotorInput;
import motorlab.config.RegressionSettings;
import motorlab.config.SolverSettings;
import motorlab.config.ValidationReport;
import motorlab.domain.injector.InjectorDesign;
import motorlab.domain.injector.InjectorSpec;
import motorlab.domain.motor.MotorAnalysis;
import motorlab.domain.motor.MotorPerformance;
import motorlab.domain.regression.RegressionTimeline;
import motorlab.domain.uncertainty.StatisticalSummary;
import motorlab.domain.uncertainty.UncertaintySpec;
import motorlab.factory.MotorGeometryFactory;
import motorlab.physics.i.IPerformanceSolver;
import motorlab.physics.injector.InjectorSizingService;
import motorlab.physics.simulator.RegressionSimulator;
import motorlab.physics.solver.SteadyStateSolver;
import motorlab.uncertainty.MonteCarloEngine;
import motorlab.uncertainty.MonteCarloRun;
import motorlab.uncertainty.PerformanceModel;
import motorlab.uncertainty.PerformanceModels;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Punto de entrada del núcleo de análisis: validación, punto de operación, inyector,
 * regresión temporal e incertidumbre.
 * <p>
 * Posee el pool de hilos del motor Monte Carlo, por eso es {@link AutoCloseable}.
 */
@Slf4j
public class MotorAnalysisService implements AutoCloseable {

    private final MotorConfigurationValidator validator;
    private final IPerformanceSolver solver;
    private final MotorGeometryFactory geometryFactory;
    private final InjectorSizingService injectorService;
    private final RegressionSimulator regressionSimulator;
    private final MonteCarloEngine monteCarloEngine;

    public MotorAnalysisService() {
        this(SolverSettings.defaults(), RegressionSettings.defaults(), MonteCarloSettings.defaults());
    }

    public MotorAnalysisService(SolverSettings solverSettings, RegressionSettings regressionSettings,
                                MonteCarloSettings monteCarloSettings) {
        this(new MotorConfigurationValidator(), solverSettings, new MotorGeometryFactory(solverSettings),
                regressionSettings, monteCarloSettings);
    }

    private MotorAnalysisService(MotorConfigurationValidator validator, SolverSettings solverSettings,
                                 MotorGeometryFactory geometryFactory, RegressionSettings regressionSettings,
                                 MonteCarloSettings monteCarloSettings) {
        this(validator, new SteadyStateSolver(solverSettings, geometryFactory), geometryFactory,
                new InjectorSizingService(), regressionSettings, new MonteCarloEngine(monteCarloSettings, validator));
    }

    private MotorAnalysisService(MotorConfigurationValidator validator, IPerformanceSolver solver,
                                 MotorGeometryFactory geometryFactory, InjectorSizingService injectorService,
                                 RegressionSettings regressionSettings, MonteCarloEngine monteCarloEngine) {
        this(validator, solver, geometryFactory, injectorService,
                new RegressionSimulator(solver, geometryFactory, regressionSettings), monteCarloEngine);
    }

    /**
     * Constructor con colaboradores explícitos (pruebas, solvers alternativos).
     */
    public MotorAnalysisService(MotorConfigurationValidator validator, IPerformanceSolver solver,
                                MotorGeometryFactory geometryFactory, InjectorSizingService injectorService,
                                RegressionSimulator regressionSimulator, MonteCarloEngine monteCarloEngine) {
        this.validator = Objects.requireNonNull(validator, "validator no puede ser null");
        this.solver = Objects.requireNonNull(solver, "solver no puede ser null");
        this.geometryFactory = Objects.requireNonNull(geometryFactory, "geometryFactory no puede ser null");
        this.injectorService = Objects.requireNonNull(injectorService, "injectorService no puede ser null");
        this.regressionSimulator = Objects.requireNonNull(regressionSimulator, "regressionSimulator no puede ser null");
        this.monteCarloEngine = Objects.requireNonNull(monteCarloEngine, "monteCarloEngine no puede ser null");
    }

    /**
     * Completa los valores por defecto y valida la entrada.
     *
     * @throws motorlab.domain.exception.ValidationException con todas las violaciones encontradas.
     */
    public ValidationReport validate(RawMotorInput raw) {
        return validator.check(raw);
    }

    public MotorPerformance solve(MotorConfiguration configuration) {
        return solver.solve(configuration);
    }

    public InjectorDesign sizeInjector(MotorPerformance performance, InjectorSpec spec) {
        return injectorService.size(performance, spec);
    }

    public RegressionTimeline simulateRegression(MotorConfiguration configuration, int stepCount) {
        return regressionSimulator.simulate(configuration, stepCount);
    }

    /**
     * Campaña Monte Carlo sobre el motor construido: la geometría nominal se dimensiona una vez
     * y las perturbaciones actúan sobre ese hardware.
     */
    public StatisticalSummary runMonteCarlo(MotorConfiguration configuration, UncertaintySpec spec, int sampleCount) {
        return startMonteCarlo(configuration, spec, sampleCount).awaitSummary();
    }

    public MonteCarloRun startMonteCarlo(MotorConfiguration configuration, UncertaintySpec spec, int sampleCount) {
        MotorConfiguration nominal = asBuilt(configuration);
        return monteCarloEngine.start(nominal, spec, sampleCount, modelFor(nominal));
    }

    /**
     * Cadena completa: validación, punto de operación y, en híbridos, inyector.
     * Las advertencias de configuración preceden a las del inyector.
     */
    public MotorAnalysis analyze(RawMotorInput raw) {
        ValidationReport report = validate(raw);
        MotorConfiguration configuration = report.configuration();
        MotorPerformance performance = solve(configuration);

        List<String> warnings = new ArrayList<>(report.warnings());
        InjectorDesign injector = null;
        if (configuration.isHybrid() && configuration.injector() != null) {
            injector = sizeInjector(performance, configuration.injector());
            warnings.addAll(injector.warnings());
        }
        log.info("Análisis completado: F = {} N, Isp = {} s, Pc = {} Pa, {} advertencias",
                performance.thrust(), performance.specificImpulse(), performance.chamberPressure(), warnings.size());
        return new MotorAnalysis(performance, injector, warnings);
    }

    private MotorConfiguration asBuilt(MotorConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration no puede ser null");
        return configuration.hasFixedGeometry()
                ? configuration
                : configuration.withGeometry(geometryFactory.size(configuration));
    }

    private PerformanceModel modelFor(MotorConfiguration configuration) {
        return configuration.isHybrid() && configuration.injector() != null
                ? PerformanceModels.steadyStateWithInjector(solver, injectorService)
                : PerformanceModels.steadyState(solver);
    }

    @Override
    public void close() {
        monteCarloEngine.close();
    }
}
