package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs an operation, retrying failures with exponential backoff and jitter.
 *
 * <p>At most {@code maxRetries + 1} invocations are made. When they all fail, or when a
 * failure is not retryable under the policy, the last exception is rethrown unchanged:
 * classifying it is up to the caller.
 *
 * <p>The backoff blocks the calling thread. Interrupting it ends the retries: the interrupt
 * flag is restored and the last failure is rethrown. An operation that throws
 * {@link InterruptedException} is never retried, whatever the policy says.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final MetricsRegistry metricsRegistry;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;
    private final RetryPolicy defaultPolicy;

    public RetryExecutor(RetryPolicy defaultPolicy, MetricsRegistry metricsRegistry,
                         Sleeper sleeper, DoubleSupplier jitterSource) {
        this.defaultPolicy = defaultPolicy;
        this.metricsRegistry = metricsRegistry;
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    public RetryExecutor(RetryPolicy defaultPolicy, MetricsRegistry metricsRegistry) {
        this(defaultPolicy, metricsRegistry, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor() {
        this(RetryPolicy.defaults(), null);
    }

    /**
     * Runs the operation with the default policy.
     */
    public <T> T run(Callable<T> operation, String target) throws Exception {
        return run(operation, target, defaultPolicy);
    }

    /**
     * Runs the operation with the given attempt bound and backoff factor, keeping the
     * default policy's jitter and retry predicate.
     */
    public <T> T run(Callable<T> operation, String target, int maxRetries, double backoffFactor) throws Exception {
        RetryPolicy policy = RetryPolicy.builder()
                .maxRetries(maxRetries)
                .backoffFactor(backoffFactor)
                .maxJitter(defaultPolicy.getMaxJitter())
                .retryOn(defaultPolicy::isRetryable)
                .build();
        return run(operation, target, policy);
    }

    /**
     * Runs the operation under the given policy.
     *
     * @param operation the work to run
     * @param target    name of the operation, used in logs and metrics
     * @param policy    retry policy
     * @return the first successful result
     * @throws Exception the last failure, unchanged
     */
    public <T> T run(Callable<T> operation, String target, RetryPolicy policy) throws Exception {
        RetryContext context = new RetryContext(target, policy.getMaxAttempts());

        while (true) {
            T result;
            try {
                result = operation.call();
            } catch (Exception e) {
                Duration delay = onFailure(context, policy, e);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry interrupted during backoff: target={}, attempts={}",
                            target, context.getAttemptCount());
                    throw e;
                }
                continue;
            }

            if (context.getAttemptCount() > 0) {
                log.info("Operation succeeded after retry: target={}, attempt={}",
                        target, context.getAttemptCount() + 1);
            }
            incrementCount(target, "success");
            return result;
        }
    }

    /**
     * Returns a callable that runs the operation under the given policy.
     */
    public <T> Callable<T> decorate(Callable<T> operation, String target, RetryPolicy policy) {
        return () -> run(operation, target, policy);
    }

    /**
     * Records a failed attempt and returns the delay before the next one,
     * or rethrows the failure when no retry follows.
     */
    private Duration onFailure(RetryContext context, RetryPolicy policy, Exception error) throws Exception {
        int retryIndex = context.getAttemptCount();

        if (error instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            context.recordFailure(error, null);
            incrementCount(context.getTarget(), "interrupted");
            log.warn("Operation interrupted, giving up: target={}, attempt={}",
                    context.getTarget(), context.getAttemptCount());
            throw error;
        }

        if (!policy.isRetryable(error)) {
            context.recordFailure(error, null);
            incrementCount(context.getTarget(), "not_retryable");
            log.info("Failure is not retryable, giving up: target={}, attempt={}, error={}",
                    context.getTarget(), context.getAttemptCount(), error.toString());
            throw error;
        }

        if (retryIndex >= policy.getMaxRetries()) {
            context.recordFailure(error, null);
            incrementCount(context.getTarget(), "exhausted");
            log.error("All {} attempts failed for {}: {}",
                    context.getAttemptCount(), context.getTarget(), error.toString());
            throw error;
        }

        Duration delay = policy.delay(retryIndex, jitterSource.getAsDouble());
        context.recordFailure(error, delay);
        incrementCount(context.getTarget(), "retry");
        log.warn("Attempt {} failed for {}: {}. Retrying in {} ms",
                context.getAttemptCount(), context.getTarget(), error.toString(), delay.toMillis());
        return delay;
    }

    private void incrementCount(String target, String outcome) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementRetryCount(target, outcome);
        }
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
