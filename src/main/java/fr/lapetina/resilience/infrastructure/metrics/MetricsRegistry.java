package fr.lapetina.resilience.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Error counters by type and code
 * - Retry attempt counters per target
 * - Operation duration timers (performance guard)
 * - Circuit breaker state gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> operationTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Gauge> breakerGauges = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.registry = prometheusRegistry;

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Wraps an existing registry, e.g. a {@code SimpleMeterRegistry} in tests.
     * No JVM binders are attached and {@link #scrape()} returns an empty string.
     */
    public MetricsRegistry(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;
        this.prometheusRegistry = null;
    }

    public MetricsRegistry() {
        this("resilience");
    }

    /**
     * Increments the error counter for a type/code pair.
     */
    public void incrementErrorCount(String errorType, String errorCode) {
        String code = errorCode != null ? errorCode : "none";
        String key = errorType + ":" + code;
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of handled errors")
                        .tag("type", errorType)
                        .tag("code", code)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the retry counter for a target and attempt outcome.
     */
    public void incrementRetryCount(String target, String outcome) {
        String key = target + ":" + outcome;
        retryCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_retry_attempts_total")
                        .description("Retry executor attempts")
                        .tag("target", target)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the duration of a monitored operation.
     */
    public void recordOperationDuration(String operation, String outcome, Duration duration) {
        String key = operation + ":" + outcome;
        operationTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_operation_duration")
                        .description("Duration of monitored operations")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Registers a gauge for a circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN).
     * Registering the same service twice keeps the first gauge.
     */
    public void registerCircuitBreakerState(String serviceName, Supplier<Number> stateValue) {
        breakerGauges.computeIfAbsent(serviceName, name ->
                Gauge.builder(prefix + "_circuit_breaker_state", stateValue, s -> s.get().doubleValue())
                        .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                        .tag("service", name)
                        .strongReference(true)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return prometheusRegistry != null ? prometheusRegistry.scrape() : "";
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
