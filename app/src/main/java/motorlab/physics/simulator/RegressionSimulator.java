package motorlab.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import motorlab.config.MotorConfiguration;
import motorlab.config.RegressionSettings;
import motorlab.domain.motor.MotorGeometry;
import motorlab.domain.motor.MotorPerformance;
import motorlab.domain.motor.MotorType;
import motorlab.domain.regression.RegressionSample;
import motorlab.domain.regression.RegressionTimeline;
import motorlab.domain.regression.SampleStatus;
import motorlab.factory.MotorGeometryFactory;
import motorlab.physics.i.IPerformanceSolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Simula la evolución temporal del motor a medida que el grano regresa.
 * <p>
 * En cada paso se resuelve el punto de operación con el canal actual y después se avanza el
 * canal {@code 2·r·Δt}. Si el siguiente diámetro superaría el margen estructural, el resto de la
 * línea temporal repite el último estado válido marcado como {@link SampleStatus#BURNTHROUGH_RISK}.
 * En un sólido, llegar al diámetro exterior del grano es el final normal de la combustión: la cola
 * se marca como {@link SampleStatus#BURNOUT} con empuje nulo.
 * <p>
 * Un único paso hacia delante; los fallos del solver se propagan sin envolver.
 */
@Slf4j
public class RegressionSimulator {

    private final IPerformanceSolver solver;
    private final MotorGeometryFactory geometryFactory;
    private final RegressionSettings settings;

    public RegressionSimulator(IPerformanceSolver solver, MotorGeometryFactory geometryFactory, RegressionSettings settings) {
        this.solver = Objects.requireNonNull(solver, "solver no puede ser null");
        this.geometryFactory = Objects.requireNonNull(geometryFactory, "geometryFactory no puede ser null");
        this.settings = Objects.requireNonNull(settings, "settings no puede ser null");
    }

    public RegressionTimeline simulate(MotorConfiguration configuration) {
        return simulate(configuration, settings.getStepCount());
    }

    /**
     * @param stepCount Número de muestras (al menos 2), equiespaciadas entre 0 y el tiempo de combustión.
     */
    public RegressionTimeline simulate(MotorConfiguration configuration, int stepCount) {
        Objects.requireNonNull(configuration, "configuration no puede ser null");
        if (stepCount < 2) {
            throw new IllegalArgumentException("La simulación de regresión necesita al menos 2 pasos, recibido: " + stepCount);
        }

        MotorGeometry geometry = configuration.hasFixedGeometry()
                ? configuration.geometry()
                : geometryFactory.size(configuration);
        double deltaTime = configuration.burnTime() / (stepCount - 1);
        double riskLimit = settings.getBurnthroughPortRatio() * geometry.chamberDiameter();
        double burnoutLimit = geometry.motorType() == MotorType.SOLID
                ? geometry.grainOuterDiameter()
                : Double.POSITIVE_INFINITY;

        List<RegressionSample> samples = new ArrayList<>(stepCount);
        int firstRiskIndex = -1;
        MotorPerformance frozen = null;
        SampleStatus tailStatus = null;

        for (int i = 0; i < stepCount; i++) {
            double time = i * deltaTime;
            if (tailStatus == SampleStatus.BURNTHROUGH_RISK) {
                samples.add(RegressionSample.of(time, SampleStatus.BURNTHROUGH_RISK, frozen));
                continue;
            }
            if (tailStatus == SampleStatus.BURNOUT) {
                samples.add(burnedOut(time, frozen, burnoutLimit));
                continue;
            }

            MotorPerformance performance = solver.solve(configuration.withGeometry(geometry));
            samples.add(RegressionSample.of(time, SampleStatus.NOMINAL, performance));

            double nextPort = geometry.portDiameter() + 2.0 * performance.regressionRate() * deltaTime;
            if (i == stepCount - 1 || nextPort <= Math.min(riskLimit, burnoutLimit)) {
                geometry = geometry.withPortDiameter(nextPort);
                continue;
            }

            frozen = performance;
            if (burnoutLimit <= riskLimit) {
                tailStatus = SampleStatus.BURNOUT;
                log.info("Alma agotada en t = {} s: el canal alcanza el diámetro exterior del grano ({} m).",
                        time + deltaTime, burnoutLimit);
            } else {
                tailStatus = SampleStatus.BURNTHROUGH_RISK;
                firstRiskIndex = i + 1;
                log.warn("Riesgo de perforación en t = {} s: el canal pasaría de {} m a {} m (límite {} m). Se congela la geometría.",
                        time + deltaTime, geometry.portDiameter(), nextPort, riskLimit);
            }
        }

        log.debug("Regresión completada: {} muestras, riesgo de perforación = {}", samples.size(), firstRiskIndex >= 0);
        return new RegressionTimeline(samples, firstRiskIndex);
    }

    /**
     * Muestra tras agotar el alma: sin empuje y con la cámara a presión ambiente.
     */
    private static RegressionSample burnedOut(double time, MotorPerformance last, double grainOuterDiameter) {
        return RegressionSample.of(time, SampleStatus.BURNOUT, last)
                .withPortDiameter(grainOuterDiameter)
                .withThrust(0.0)
                .withChamberPressure(last.atmosphericPressure());
    }
}
