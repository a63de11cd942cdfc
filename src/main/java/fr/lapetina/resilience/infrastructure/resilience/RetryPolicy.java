package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.domain.error.ApplicationError;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry configuration: attempt bound, exponential backoff and which failures are retried.
 *
 * <p>The delay before retry {@code n} (0-based) is
 * {@code backoffFactor * 2^n} seconds plus a random jitter in {@code [0, maxJitter)}.
 *
 * <p>By default untyped exceptions are retried, while an {@link ApplicationError} is retried
 * only when its kind is retryable (database, external API) and it is not an open-circuit
 * rejection. Use {@link Builder#retryAnyException()} to retry everything.
 */
public final class RetryPolicy {

    public static final Predicate<Throwable> RETRYABLE_KINDS = RetryPolicy::isRetryableByKind;
    public static final Predicate<Throwable> ANY_EXCEPTION = error -> true;

    private final int maxRetries;
    private final double backoffFactor;
    private final Duration maxJitter;
    private final Predicate<Throwable> retryOn;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.backoffFactor = builder.backoffFactor;
        this.maxJitter = builder.maxJitter;
        this.retryOn = builder.retryOn;
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static RetryPolicy of(int maxRetries, double backoffFactor) {
        return builder().maxRetries(maxRetries).backoffFactor(backoffFactor).build();
    }

    public static RetryPolicy noRetry() {
        return builder().maxRetries(0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Total number of invocations, first attempt included.
     */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public Duration getMaxJitter() {
        return maxJitter;
    }

    public boolean isRetryable(Throwable error) {
        return retryOn.test(error);
    }

    /**
     * Delay before retry {@code retryIndex} without jitter. Non-decreasing in the index.
     */
    public Duration baseDelay(int retryIndex) {
        double seconds = backoffFactor * Math.pow(2, retryIndex);
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }

    /**
     * Delay before retry {@code retryIndex}, with jitter.
     *
     * @param jitterFraction random value in [0, 1)
     */
    public Duration delay(int retryIndex, double jitterFraction) {
        long jitterNanos = (long) (maxJitter.toNanos() * jitterFraction);
        return baseDelay(retryIndex).plusNanos(jitterNanos);
    }

    private static boolean isRetryableByKind(Throwable error) {
        if (error instanceof ApplicationError applicationError) {
            return applicationError.getKind().isRetryable()
                    && !applicationError.hasCode(ApplicationError.SERVICE_UNAVAILABLE);
        }
        return !(error instanceof InterruptedException);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetries=" + maxRetries +
                ", backoffFactor=" + backoffFactor +
                ", maxJitter=" + maxJitter +
                '}';
    }

    public static final class Builder {
        private int maxRetries = 3;
        private double backoffFactor = 1.0;
        private Duration maxJitter = Duration.ofSeconds(1);
        private Predicate<Throwable> retryOn = RETRYABLE_KINDS;

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            if (backoffFactor < 0) {
                throw new IllegalArgumentException("backoffFactor must be >= 0");
            }
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder maxJitter(Duration maxJitter) {
            Objects.requireNonNull(maxJitter, "maxJitter");
            if (maxJitter.isNegative()) {
                throw new IllegalArgumentException("maxJitter must not be negative");
            }
            this.maxJitter = maxJitter;
            return this;
        }

        public Builder noJitter() {
            return maxJitter(Duration.ZERO);
        }

        public Builder retryOn(Predicate<Throwable> retryOn) {
            this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
            return this;
        }

        public Builder retryAnyException() {
            return retryOn(ANY_EXCEPTION);
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
