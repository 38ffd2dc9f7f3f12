package motorlab.uncertainty;

import java.util.SplittableRandom;

/**
 * Generador de normales estándar por la transformada de Box–Muller.
 * Cada llamada a la transformada produce dos valores; el segundo se guarda para la siguiente.
 * <p>
 * No es thread safe: cada muestra Monte Carlo usa su propia instancia.
 */
public class BoxMullerGaussian {

    private final SplittableRandom random;
    private double spare;
    private boolean hasSpare;

    public BoxMullerGaussian(SplittableRandom random) {
        this.random = random;
    }

    /**
     * Flujo determinista para la muestra {@code index} de una campaña con semilla {@code seed}.
     * No depende de cómo se repartan las muestras entre hilos.
     */
    public static BoxMullerGaussian forSample(long seed, int index) {
        return new BoxMullerGaussian(new SplittableRandom(seed ^ (0x9E3779B97F4A7C15L * (index + 1L))));
    }

    public double next() {
        if (hasSpare) {
            hasSpare = false;
            return spare;
        }
        double u1 = 1.0 - random.nextDouble(); // (0, 1]: evita log(0)
        double u2 = random.nextDouble();
        double radius = Math.sqrt(-2.0 * Math.log(u1));
        double angle = 2.0 * Math.PI * u2;
        spare = radius * Math.sin(angle);
        hasSpare = true;
        return radius * Math.cos(angle);
    }
}
