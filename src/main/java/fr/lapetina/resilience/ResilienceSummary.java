package fr.lapetina.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.resilience.infrastructure.metrics.ErrorSummary;
import fr.lapetina.resilience.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.resilience.infrastructure.resilience.CircuitBreakerSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Combined view of error counts and circuit breaker states at one point in time.
 */
public record ResilienceSummary(
        ErrorSummary errors,
        @JsonProperty("circuit_breakers") List<CircuitBreakerSnapshot> circuitBreakers,
        Instant timestamp
) {
    public ResilienceSummary {
        circuitBreakers = List.copyOf(circuitBreakers);
    }

    /**
     * Returns true when at least one breaker is not closed.
     */
    public boolean hasOpenCircuits() {
        return circuitBreakers.stream()
                .anyMatch(snapshot -> snapshot.state() != CircuitBreaker.State.CLOSED);
    }
}
