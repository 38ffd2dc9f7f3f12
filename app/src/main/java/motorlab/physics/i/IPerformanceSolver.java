package motorlab.physics.i;

import motorlab.config.MotorConfiguration;
import motorlab.domain.motor.MotorPerformance;

@FunctionalInterface
public interface IPerformanceSolver {
    MotorPerformance solve(MotorConfiguration configuration);
}
