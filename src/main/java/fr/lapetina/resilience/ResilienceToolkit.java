package fr.lapetina.resilience;

import fr.lapetina.resilience.infrastructure.boundary.ProcessFailureBoundary;
import fr.lapetina.resilience.infrastructure.config.ConfigLoader;
import fr.lapetina.resilience.infrastructure.config.ResilienceConfig;
import fr.lapetina.resilience.infrastructure.handler.ErrorHandler;
import fr.lapetina.resilience.infrastructure.metrics.ErrorMetrics;
import fr.lapetina.resilience.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resilience.infrastructure.resilience.CacheFallback;
import fr.lapetina.resilience.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.resilience.infrastructure.resilience.CircuitBreakerSettings;
import fr.lapetina.resilience.infrastructure.resilience.DatabaseErrorTranslator;
import fr.lapetina.resilience.infrastructure.resilience.PerformanceGuard;
import fr.lapetina.resilience.infrastructure.resilience.RetryExecutor;
import fr.lapetina.resilience.infrastructure.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Factory for creating fully-wired resilience components from configuration.
 * This is the primary entry point of the library.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ResilienceToolkit toolkit = ResilienceToolkit.create("resilience.yaml")) {
 *     ResilientCall call = toolkit.newCall("payments-api").build();
 *     Receipt receipt = call.call(() -> payments.charge(order));
 * }
 * }</pre>
 */
public class ResilienceToolkit implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilienceToolkit.class);

    private final ResilienceConfig config;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final ErrorMetrics errorMetrics;
    private final ErrorHandler errorHandler;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryExecutor retryExecutor;
    private final PerformanceGuard performanceGuard;
    private final DatabaseErrorTranslator databaseErrorTranslator;
    private final CacheFallback cacheFallback;
    private ProcessFailureBoundary boundary;

    protected ResilienceToolkit(ResilienceConfig config, Clock clock) {
        ConfigLoader.validate(config);
        this.config = config;
        this.clock = clock;

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;
        this.errorMetrics = new ErrorMetrics(metricsRegistry);
        this.errorHandler = new ErrorHandler(errorMetrics);

        // Circuit breakers, with the configured services registered up front
        CircuitBreakerSettings defaults = config.getCircuitBreaker().toDefaults();
        this.circuitBreakers = new CircuitBreakerRegistry(defaults, clock, metricsRegistry);
        for (Map.Entry<String, ResilienceConfig.ServiceConfig> entry
                : config.getCircuitBreaker().getServices().entrySet()) {
            circuitBreakers.register(entry.getKey(), entry.getValue().toSettings(defaults));
        }

        RetryPolicy retryPolicy = config.getRetry().toPolicy();
        this.retryExecutor = new RetryExecutor(retryPolicy, metricsRegistry);
        this.performanceGuard = new PerformanceGuard(
                Duration.ofMillis(config.getPerformance().getSlowCallThresholdMs()), metricsRegistry);
        this.databaseErrorTranslator = new DatabaseErrorTranslator();
        this.cacheFallback = new CacheFallback(errorHandler);

        if (config.getBoundary().isInstallOnStart()) {
            installFailureBoundary();
        }

        log.info("ResilienceToolkit initialized: services={}, retry={}, metrics={}",
                circuitBreakers.size(), retryPolicy, metricsRegistry != null);
    }

    /**
     * Creates a toolkit from the specified configuration file.
     */
    public static ResilienceToolkit create(String configPath) {
        log.info("Initializing ResilienceToolkit from config: {}", configPath);
        return fromConfig(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a toolkit from the default configuration (resilience.yaml).
     */
    public static ResilienceToolkit create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    public static ResilienceToolkit fromConfig(ResilienceConfig config) {
        return new ResilienceToolkit(config, Clock.systemUTC());
    }

    public static ResilienceToolkit fromConfig(ResilienceConfig config, Clock clock) {
        return new ResilienceToolkit(config, clock);
    }

    /**
     * Creates a toolkit with built-in defaults, without reading any file.
     */
    public static ResilienceToolkit createDefault() {
        return fromConfig(ConfigLoader.createDefault());
    }

    /**
     * Starts a call wired with the toolkit's performance guard, retry executor,
     * circuit breaker for the named service and error handler.
     */
    public ResilientCall.Builder newCall(String name) {
        return ResilientCall.builder(name)
                .performance(performanceGuard)
                .retry(retryExecutor)
                .circuitBreaker(circuitBreakers, name)
                .errorHandler(errorHandler);
    }

    /**
     * Installs the process failure boundary with this toolkit's error handler.
     */
    public synchronized ProcessFailureBoundary installFailureBoundary() {
        if (boundary == null) {
            boundary = ProcessFailureBoundary.install(errorHandler);
        }
        return boundary;
    }

    public ResilienceSummary summary() {
        return new ResilienceSummary(errorMetrics.summary(), circuitBreakers.snapshot(), clock.instant());
    }

    public ResilienceConfig getConfig() {
        return config;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ErrorMetrics getErrorMetrics() {
        return errorMetrics;
    }

    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public RetryExecutor getRetryExecutor() {
        return retryExecutor;
    }

    public PerformanceGuard getPerformanceGuard() {
        return performanceGuard;
    }

    public DatabaseErrorTranslator getDatabaseErrorTranslator() {
        return databaseErrorTranslator;
    }

    public CacheFallback getCacheFallback() {
        return cacheFallback;
    }

    @Override
    public void close() {
        log.info("Shutting down ResilienceToolkit...");
        synchronized (this) {
            if (boundary != null) {
                ProcessFailureBoundary.uninstall();
                boundary = null;
            }
        }
        if (metricsRegistry != null) {
            metricsRegistry.close();
        }
        log.info("ResilienceToolkit shutdown complete");
    }
}
