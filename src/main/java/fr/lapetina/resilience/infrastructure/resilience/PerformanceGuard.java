package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.LongSupplier;

/**
 * Measures how long an operation takes.
 *
 * Slow successful calls are logged at WARN, failures at ERROR with their duration.
 * Neither the result nor the exception is altered.
 */
public final class PerformanceGuard {

    private static final Logger log = LoggerFactory.getLogger(PerformanceGuard.class);

    public static final Duration DEFAULT_SLOW_CALL_THRESHOLD = Duration.ofSeconds(3);

    private final Duration slowCallThreshold;
    private final MetricsRegistry metricsRegistry;
    private final LongSupplier nanoTime;

    public PerformanceGuard(Duration slowCallThreshold, MetricsRegistry metricsRegistry, LongSupplier nanoTime) {
        this.slowCallThreshold = slowCallThreshold;
        this.metricsRegistry = metricsRegistry;
        this.nanoTime = nanoTime;
    }

    public PerformanceGuard(Duration slowCallThreshold, MetricsRegistry metricsRegistry) {
        this(slowCallThreshold, metricsRegistry, System::nanoTime);
    }

    public PerformanceGuard() {
        this(DEFAULT_SLOW_CALL_THRESHOLD, null);
    }

    /**
     * Runs and times the operation.
     *
     * @param operationName name used in logs and metrics
     * @param operation     the work to run
     * @return the operation's result, unchanged
     * @throws Exception the operation's failure, unchanged
     */
    public <T> T monitor(String operationName, Callable<T> operation) throws Exception {
        long start = nanoTime.getAsLong();
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            Duration elapsed = Duration.ofNanos(nanoTime.getAsLong() - start);
            record(operationName, "failure", elapsed);
            log.error("Operation {} failed after {} ms: {}", operationName, elapsed.toMillis(), e.toString());
            throw e;
        }

        Duration elapsed = Duration.ofNanos(nanoTime.getAsLong() - start);
        record(operationName, "success", elapsed);
        if (elapsed.compareTo(slowCallThreshold) >= 0) {
            log.warn("Slow operation detected: operation={}, durationMs={}, thresholdMs={}",
                    operationName, elapsed.toMillis(), slowCallThreshold.toMillis());
        } else {
            log.debug("Operation completed: operation={}, durationMs={}", operationName, elapsed.toMillis());
        }
        return result;
    }

    /**
     * Returns a callable that times the operation.
     */
    public <T> Callable<T> decorate(String operationName, Callable<T> operation) {
        return () -> monitor(operationName, operation);
    }

    public Duration getSlowCallThreshold() {
        return slowCallThreshold;
    }

    private void record(String operationName, String outcome, Duration elapsed) {
        if (metricsRegistry != null) {
            metricsRegistry.recordOperationDuration(operationName, outcome, elapsed);
        }
    }
}
