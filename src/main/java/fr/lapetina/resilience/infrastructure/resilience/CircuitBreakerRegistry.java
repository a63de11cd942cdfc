package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of circuit breakers keyed by service name.
 *
 * Breakers are created lazily, CLOSED, on first use of a name, with the registry
 * defaults unless the name was registered beforehand with its own settings.
 * Lives as long as the process; state is in memory only.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerSettings defaults;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;

    public CircuitBreakerRegistry(CircuitBreakerSettings defaults, Clock clock, MetricsRegistry metricsRegistry) {
        this.defaults = defaults;
        this.clock = clock;
        this.metricsRegistry = metricsRegistry;
    }

    public CircuitBreakerRegistry(CircuitBreakerSettings defaults, Clock clock) {
        this(defaults, clock, null);
    }

    public CircuitBreakerRegistry() {
        this(CircuitBreakerSettings.DEFAULTS, Clock.systemUTC(), null);
    }

    /**
     * Registers a service with its own thresholds. A service that already has a
     * breaker keeps it, and its current state.
     */
    public CircuitBreaker register(String serviceName, CircuitBreakerSettings settings) {
        CircuitBreaker breaker = breakers.computeIfAbsent(serviceName, name -> create(name, settings));
        if (!breaker.getSettings().equals(settings)) {
            log.warn("Circuit breaker already registered with other settings, keeping existing: service={}, existing={}",
                    serviceName, breaker.getSettings());
        }
        return breaker;
    }

    /**
     * Returns the breaker for a service, creating it with the defaults on first use.
     */
    public CircuitBreaker getOrCreate(String serviceName) {
        return breakers.computeIfAbsent(serviceName, name -> create(name, defaults));
    }

    public Optional<CircuitBreaker> find(String serviceName) {
        return Optional.ofNullable(breakers.get(serviceName));
    }

    /**
     * Runs an operation through the named service's breaker.
     *
     * @see CircuitBreaker#execute(Callable)
     */
    public <T> T execute(String serviceName, Callable<T> operation) throws Exception {
        return getOrCreate(serviceName).execute(operation);
    }

    /**
     * Returns a callable that runs the operation through the named service's breaker.
     */
    public <T> Callable<T> decorate(String serviceName, Callable<T> operation) {
        return () -> execute(serviceName, operation);
    }

    /**
     * Closes the named breaker and clears its counters.
     */
    public void reset(String serviceName) {
        find(serviceName).ifPresent(breaker -> breaker.forceState(CircuitBreaker.State.CLOSED));
    }

    public void forceState(String serviceName, CircuitBreaker.State state) {
        getOrCreate(serviceName).forceState(state);
    }

    /**
     * Returns snapshots of all breakers, ordered by service name.
     */
    public List<CircuitBreakerSnapshot> snapshot() {
        List<CircuitBreakerSnapshot> snapshots = new ArrayList<>();
        for (CircuitBreaker breaker : breakers.values()) {
            snapshots.add(breaker.snapshot());
        }
        snapshots.sort(Comparator.comparing(CircuitBreakerSnapshot::serviceName));
        return snapshots;
    }

    public int size() {
        return breakers.size();
    }

    public CircuitBreakerSettings getDefaults() {
        return defaults;
    }

    private CircuitBreaker create(String serviceName, CircuitBreakerSettings settings) {
        CircuitBreaker breaker = new CircuitBreaker(serviceName, settings, clock);
        if (metricsRegistry != null) {
            metricsRegistry.registerCircuitBreakerState(serviceName, () -> gaugeValue(breaker.getState()));
        }
        log.info("Circuit breaker created: service={}, failureThreshold={}, timeoutMs={}, successThreshold={}",
                serviceName, settings.failureThreshold(), settings.timeout().toMillis(), settings.successThreshold());
        return breaker;
    }

    private static int gaugeValue(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
