package fr.lapetina.resilience.infrastructure.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Consistent copy of a circuit breaker's state, taken under its lock.
 */
public record CircuitBreakerSnapshot(
        @JsonProperty("service_name") String serviceName,
        CircuitBreaker.State state,
        @JsonProperty("failure_count") int failureCount,
        @JsonProperty("success_count") int successCount,
        @JsonProperty("last_failure_time") Instant lastFailureTime,
        @JsonProperty("failure_threshold") int failureThreshold,
        Duration timeout
) {
}
