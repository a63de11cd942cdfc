package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.domain.error.ApplicationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Circuit breaker guarding calls to one named service.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failures reached threshold, calls rejected until the timeout has elapsed
 *   since the last failure
 * - HALF_OPEN: Trial calls pass through; enough successes close the circuit,
 *   any failure reopens it
 *
 * Every transition runs under this breaker's monitor. The monitor is never held
 * while the guarded call runs, and counters change only once the call has returned
 * or thrown.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String serviceName;
    private final CircuitBreakerSettings settings;
    private final Clock clock;

    // Guarded by this
    private State state = State.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String serviceName, CircuitBreakerSettings settings, Clock clock) {
        this.serviceName = serviceName;
        this.settings = settings;
        this.clock = clock;
    }

    public CircuitBreaker(String serviceName) {
        this(serviceName, CircuitBreakerSettings.DEFAULTS, Clock.systemUTC());
    }

    /**
     * Runs the operation through the breaker.
     *
     * @throws ApplicationError with code {@code SERVICE_UNAVAILABLE} if the circuit is open;
     *                          the operation is not invoked in that case
     * @throws Exception        whatever the operation throws, unchanged. An {@link Error} thrown by
     *                          the operation counts as a failure before it propagates
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        acquirePermission();

        T result;
        try {
            result = operation.call();
        } catch (ApplicationError e) {
            if (!e.getKind().isCallerFault()) {
                recordFailure();
            }
            throw e;
        } catch (Exception | Error e) {
            recordFailure();
            throw e;
        }

        recordSuccess();
        return result;
    }

    /**
     * Checks whether a call may proceed, moving OPEN to HALF_OPEN once the timeout has elapsed.
     *
     * @throws ApplicationError if the circuit is open
     */
    synchronized void acquirePermission() {
        if (state != State.OPEN) {
            return;
        }

        Duration sinceLastFailure = Duration.between(lastFailureTime, clock.instant());
        if (sinceLastFailure.compareTo(settings.timeout()) >= 0) {
            state = State.HALF_OPEN;
            successCount = 0;
            log.info("Circuit breaker transitioning to HALF_OPEN: service={}", serviceName);
            return;
        }

        Duration retryAfter = settings.timeout().minus(sinceLastFailure);
        log.debug("Call rejected by open circuit: service={}, retryAfterMs={}", serviceName, retryAfter.toMillis());
        throw ApplicationError.serviceUnavailable(serviceName, retryAfter);
    }

    /**
     * Records a successful call.
     */
    synchronized void recordSuccess() {
        switch (state) {
            case CLOSED -> failureCount = 0;
            case HALF_OPEN -> {
                successCount++;
                if (successCount >= settings.successThreshold()) {
                    state = State.CLOSED;
                    failureCount = 0;
                    successCount = 0;
                    log.info("Circuit breaker CLOSED after recovery: service={}", serviceName);
                }
            }
            case OPEN -> {
                // A call admitted before the circuit opened; the open state stands
            }
        }
    }

    /**
     * Records a failed call.
     */
    synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();

        switch (state) {
            case CLOSED -> {
                if (failureCount >= settings.failureThreshold()) {
                    state = State.OPEN;
                    log.warn("Circuit breaker OPENED: service={}, failures={}", serviceName, failureCount);
                }
            }
            case HALF_OPEN -> {
                state = State.OPEN;
                successCount = 0;
                log.warn("Circuit breaker OPENED (half-open failure): service={}", serviceName);
            }
            case OPEN -> {
                // Stays open, the timeout restarts from this failure
            }
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public synchronized void forceState(State newState) {
        State old = state;
        state = newState;
        successCount = 0;
        if (newState == State.CLOSED) {
            failureCount = 0;
        }
        if (newState == State.OPEN) {
            lastFailureTime = clock.instant();
        }
        log.info("Circuit breaker forced from {} to {}: service={}", old, newState, serviceName);
    }

    /**
     * Current state. Reading does not move OPEN to HALF_OPEN; only a call does.
     */
    public synchronized State getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized int getSuccessCount() {
        return successCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getServiceName() {
        return serviceName;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(serviceName, state, failureCount, successCount, lastFailureTime,
                settings.failureThreshold(), settings.timeout());
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "service='" + serviceName + '\'' +
                ", state=" + getState() +
                ", failures=" + getFailureCount() +
                '}';
    }
}
