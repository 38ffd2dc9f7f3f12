package motorlab.uncertainty;

import lombok.extern.slf4j.Slf4j;
import motorlab.domain.uncertainty.StatisticalSummary;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Campaña Monte Carlo en curso. Permite pedir una parada cooperativa y esperar el resumen,
 * que incluye las muestras completadas hasta ese momento.
 */
@Slf4j
public class MonteCarloRun {

    private final int requestedSamples;
    private final List<Future<PartialStatistics>> partitions;
    private final AtomicBoolean stopRequested;

    MonteCarloRun(int requestedSamples, List<Future<PartialStatistics>> partitions, AtomicBoolean stopRequested) {
        this.requestedSamples = requestedSamples;
        this.partitions = partitions;
        this.stopRequested = stopRequested;
    }

    public void requestStop() {
        if (!stopRequested.getAndSet(true)) {
            log.info("Parada solicitada para la campaña Monte Carlo de {} muestras.", requestedSamples);
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public boolean isDone() {
        return partitions.stream().allMatch(Future::isDone);
    }

    /**
     * Espera a todas las particiones y fusiona sus estadísticos.
     *
     * @throws IllegalStateException si el hilo llamador se interrumpe (el estado de interrupción se conserva).
     */
    public StatisticalSummary awaitSummary() {
        PartialStatistics total = new PartialStatistics();
        for (Future<PartialStatistics> partition : partitions) {
            try {
                total.merge(partition.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopRequested.set(true);
                throw new IllegalStateException("Campaña Monte Carlo interrumpida.", e);
            } catch (ExecutionException e) {
                stopRequested.set(true);
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Error en una partición Monte Carlo.", e.getCause());
            }
        }

        StatisticalSummary summary = total.toSummary(requestedSamples);
        log.info("Campaña Monte Carlo terminada: {}/{} muestras evaluadas, tasa de éxito {}",
                summary.completedSamples(), requestedSamples, summary.successRate());
        return summary;
    }
}
