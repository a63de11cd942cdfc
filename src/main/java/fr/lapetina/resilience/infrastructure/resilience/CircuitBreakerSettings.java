package fr.lapetina.resilience.infrastructure.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds of one circuit breaker.
 *
 * @param failureThreshold consecutive failures that open the circuit
 * @param timeout          time after the last failure before a trial call is let through
 * @param successThreshold consecutive trial successes needed to close the circuit again
 */
public record CircuitBreakerSettings(int failureThreshold, Duration timeout, int successThreshold) {

    public static final CircuitBreakerSettings DEFAULTS =
            new CircuitBreakerSettings(5, Duration.ofSeconds(60), 1);

    public CircuitBreakerSettings {
        Objects.requireNonNull(timeout, "Timeout is required");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static CircuitBreakerSettings of(int failureThreshold, Duration timeout) {
        return new CircuitBreakerSettings(failureThreshold, timeout, 1);
    }
}
