package motorlab.physics.solver;

import lombok.extern.slf4j.Slf4j;
import motorlab.config.MotorConfiguration;
import motorlab.config.SolverSettings;
import motorlab.domain.exception.ConvergenceException;
import motorlab.domain.exception.InfeasibleDesignException;
import motorlab.domain.motor.MassFlow;
import motorlab.domain.motor.MotorGeometry;
import motorlab.domain.motor.MotorPerformance;
import motorlab.domain.motor.MotorType;
import motorlab.factory.MotorGeometryFactory;
import motorlab.physics.i.IMassGenerationModel;
import motorlab.physics.i.IPerformanceSolver;
import motorlab.physics.i.ISolverComponent;
import motorlab.physics.impl.HybridMassGenerationModel;
import motorlab.physics.impl.SolidMassGenerationModel;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Solver del punto de operación estacionario.
 * <p>
 * Resuelve la presión de cámara como punto fijo del balance de masa en la garganta:
 * <pre>
 *   Pc = ṁ(Pc)·c* / At
 * </pre>
 * donde ṁ(Pc) lo aporta el {@link IMassGenerationModel} del tipo de motor. La actualización está
 * subrelajada y el factor se reduce a la mitad cada vez que el residuo crece.
 * <p>
 * Si la configuración no trae geometría fija, el motor se dimensiona primero en el punto de diseño.
 * No tiene estado mutable compartido: es thread safe.
 */
@Slf4j
public class SteadyStateSolver implements IPerformanceSolver, ISolverComponent {

    private final SolverSettings settings;
    private final MotorGeometryFactory geometryFactory;
    private final Map<MotorType, IMassGenerationModel> massModels = new EnumMap<>(MotorType.class);

    public SteadyStateSolver() {
        this(SolverSettings.defaults());
    }

    public SteadyStateSolver(SolverSettings settings) {
        this(settings, new MotorGeometryFactory(settings));
    }

    public SteadyStateSolver(SolverSettings settings, MotorGeometryFactory geometryFactory) {
        this.settings = Objects.requireNonNull(settings, "settings no puede ser null");
        this.geometryFactory = Objects.requireNonNull(geometryFactory, "geometryFactory no puede ser null");
        massModels.put(MotorType.HYBRID, new HybridMassGenerationModel());
        massModels.put(MotorType.SOLID, new SolidMassGenerationModel());
    }

    /**
     * Resuelve el punto de operación.
     *
     * @throws ConvergenceException       si el punto fijo no converge en el límite de iteraciones.
     * @throws InfeasibleDesignException  si algún paso produce una magnitud no física.
     */
    @Override
    public MotorPerformance solve(MotorConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration no puede ser null");
        MotorGeometry geometry = configuration.hasFixedGeometry()
                ? configuration.geometry()
                : geometryFactory.size(configuration);

        double cStar = IsentropicNozzle.characteristicVelocity(
                configuration.gamma(), configuration.gasConstant(), configuration.chamberTemperature());
        if (!Double.isFinite(cStar) || cStar <= 0) {
            throw new InfeasibleDesignException("Velocidad característica no física: " + cStar);
        }

        SolverState state = converge(configuration, geometry, massModels.get(configuration.motorType()), cStar);
        log.debug("Presión de cámara convergida en {} iteraciones: {} Pa (residuo {})",
                state.getIterations(), state.getChamberPressure(), state.getResidual());
        return buildPerformance(configuration, geometry, state, cStar);
    }

    private SolverState converge(MotorConfiguration configuration, MotorGeometry geometry,
                                 IMassGenerationModel model, double cStar) {
        SolverState state = new SolverState(configuration.chamberPressure(), settings.getRelaxationFactor());
        double ceiling = model.pressureCeiling(configuration);
        double throatArea = geometry.throatArea();

        for (int iteration = 1; iteration <= settings.getMaxIterations(); iteration++) {
            double pressure = state.getChamberPressure();
            MassFlow flow = model.generate(pressure, configuration, geometry);
            double totalFlow = flow.total();
            if (!Double.isFinite(totalFlow) || totalFlow <= 0) {
                throw new InfeasibleDesignException(String.format(
                        "Gasto másico no físico (%.4e kg/s) a %.4e Pa.", totalFlow, pressure));
            }

            double throatFlow = IsentropicNozzle.throatMassFlow(pressure, throatArea, cStar);
            double impliedPressure = pressure * totalFlow / throatFlow;
            double residual = Math.abs(totalFlow - throatFlow) / throatFlow;
            state.record(iteration, flow, residual, settings.getMinimumRelaxationFactor());

            if (residual < settings.getTolerance()) {
                state.markConverged();
                return state;
            }

            double next = pressure + state.getRelaxationFactor() * (impliedPressure - pressure);
            // Acercarse al techo por bisección en lugar de cruzarlo.
            if (next >= ceiling) {
                next = 0.5 * (pressure + ceiling);
            }
            state.advanceTo(next);
        }
        throw new ConvergenceException("Presión de cámara",
                state.getChamberPressure(), state.getIterations(), state.getResidual());
    }

    private MotorPerformance buildPerformance(MotorConfiguration configuration, MotorGeometry geometry,
                                              SolverState state, double cStar) {
        double chamberPressure = state.getChamberPressure();
        MassFlow flow = state.getMassFlow();
        double massFlow = flow.total();
        double ambient = configuration.atmosphericPressure();

        NozzleExpansion nozzle = IsentropicNozzle.expand(
                configuration.gamma(), configuration.gasConstant(), configuration.chamberTemperature(),
                chamberPressure, ambient, geometry.expansionRatio(), settings);
        double exitPressure = nozzle.pressureRatio() * chamberPressure;
        if (exitPressure >= chamberPressure) {
            throw new InfeasibleDesignException("La presión de salida no puede superar la de cámara.");
        }

        double thrust = configuration.nozzleType().getEfficiency() * massFlow * nozzle.exitVelocity()
                + (exitPressure - ambient) * geometry.exitArea();
        if (!Double.isFinite(thrust) || thrust <= 0) {
            throw new InfeasibleDesignException(String.format(
                    "Empuje no físico (%.3f N): la tobera está demasiado sobreexpandida.", thrust));
        }

        double chamberVolume = configuration.characteristicLength() * geometry.throatArea();
        double chamberCrossSection = Math.PI * geometry.chamberDiameter() * geometry.chamberDiameter() / 4.0;
        double grainLength = geometry.currentGrainLength() * geometry.segmentCount();

        MotorPerformance.MotorPerformanceBuilder builder = MotorPerformance.builder()
                .motorType(configuration.motorType())
                .chamberPressure(chamberPressure)
                .exitPressure(exitPressure)
                .atmosphericPressure(ambient)
                .totalMassFlow(massFlow)
                .oxidizerMassFlow(flow.oxidizer())
                .fuelMassFlow(flow.fuel())
                .thrust(thrust)
                .specificImpulse(thrust / (massFlow * IsentropicNozzle.STANDARD_GRAVITY))
                .characteristicVelocity(cStar)
                .thrustCoefficient(thrust / (chamberPressure * geometry.throatArea()))
                .exitVelocity(nozzle.exitVelocity())
                .throatDiameter(geometry.throatDiameter())
                .exitDiameter(Math.sqrt(4.0 * geometry.exitArea() / Math.PI))
                .expansionRatio(nozzle.expansionRatio())
                .chamberDiameter(geometry.chamberDiameter())
                .chamberLength(grainLength + chamberVolume / chamberCrossSection)
                .chamberVolume(chamberVolume)
                .portDiameter(geometry.portDiameter())
                .regressionRate(flow.regressionRate())
                .iterations(state.getIterations())
                .residual(state.getResidual())
                .geometry(geometry);

        if (configuration.isHybrid()) {
            completeHybrid(builder, configuration, geometry, flow, thrust);
        } else {
            completeSolid(builder, configuration, geometry, flow, thrust);
        }
        return builder.build();
    }

    private void completeHybrid(MotorPerformance.MotorPerformanceBuilder builder, MotorConfiguration configuration,
                                MotorGeometry geometry, MassFlow flow, double thrust) {
        double burnTime = geometry.oxidizerLoad() / flow.oxidizer();
        double finalPort = MotorGeometryFactory.projectHybridPort(
                geometry.portDiameter(), flow.oxidizer(),
                configuration.regressionCoefficient() * configuration.temperatureFactor(),
                configuration.regressionExponent(), burnTime);
        double fuelMass = configuration.propellantDensity() * Math.PI / 4.0
                * (finalPort * finalPort - geometry.portDiameter() * geometry.portDiameter()) * geometry.grainLength();

        builder.ofRatio(flow.ofRatio())
                .finalPortDiameter(finalPort)
                .burnTime(burnTime)
                .oxidizerMass(geometry.oxidizerLoad())
                .fuelMass(fuelMass)
                .totalImpulse(thrust * burnTime)
                .oxidizer(configuration.oxidizer())
                .tankPressure(configuration.tankPressure());
    }

    private void completeSolid(MotorPerformance.MotorPerformanceBuilder builder, MotorConfiguration configuration,
                               MotorGeometry geometry, MassFlow flow, double thrust) {
        double burnRate = flow.regressionRate();
        // Las caras extremas regresan por ambos lados: el segmento se agota a L/(2r).
        double burnTime = Math.min(geometry.remainingWeb() / burnRate, geometry.currentGrainLength() / (2.0 * burnRate));
        double outer = geometry.grainOuterDiameter();
        double port = geometry.portDiameter();
        double propellantMass = configuration.propellantDensity() * geometry.segmentCount()
                * Math.PI / 4.0 * (outer * outer - port * port) * geometry.currentGrainLength();
        double of = configuration.ofRatio();

        builder.ofRatio(of)
                .finalPortDiameter(Math.min(outer, port + 2.0 * burnRate * burnTime))
                .burnTime(burnTime)
                .oxidizerMass(propellantMass * of / (1.0 + of))
                .fuelMass(propellantMass / (1.0 + of))
                .totalImpulse(thrust * burnTime);
    }

    @Override
    public String getName() {
        return "Punto fijo subrelajado";
    }

    @Override
    public String getDescription() {
        return "Balance de masa en garganta Pc = ṁ·c*/At con relajación adaptativa y tobera isentrópica.";
    }
}
