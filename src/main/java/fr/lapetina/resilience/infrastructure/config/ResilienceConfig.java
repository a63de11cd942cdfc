package fr.lapetina.resilience.infrastructure.config;

import fr.lapetina.resilience.infrastructure.resilience.CircuitBreakerSettings;
import fr.lapetina.resilience.infrastructure.resilience.RetryPolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration object for the resilience core.
 * Designed to be populated from YAML.
 */
public class ResilienceConfig {

    private RetryConfig retry = new RetryConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private PerformanceConfig performance = new PerformanceConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private BoundaryConfig boundary = new BoundaryConfig();

    // Getters and Setters
    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public PerformanceConfig getPerformance() { return performance; }
    public void setPerformance(PerformanceConfig performance) { this.performance = performance; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public BoundaryConfig getBoundary() { return boundary; }
    public void setBoundary(BoundaryConfig boundary) { this.boundary = boundary; }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private double backoffFactor = 1.0;
        private long maxJitterMs = 1000;
        private boolean retryAnyException = false;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }

        public long getMaxJitterMs() { return maxJitterMs; }
        public void setMaxJitterMs(long maxJitterMs) { this.maxJitterMs = maxJitterMs; }

        public boolean isRetryAnyException() { return retryAnyException; }
        public void setRetryAnyException(boolean retryAnyException) { this.retryAnyException = retryAnyException; }

        public RetryPolicy toPolicy() {
            RetryPolicy.Builder builder = RetryPolicy.builder()
                    .maxRetries(maxRetries)
                    .backoffFactor(backoffFactor)
                    .maxJitter(Duration.ofMillis(maxJitterMs));
            if (retryAnyException) {
                builder.retryAnyException();
            }
            return builder.build();
        }
    }

    /**
     * Circuit breaker defaults and per-service overrides.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long timeoutMs = 60000;
        private int successThreshold = 1;
        private Map<String, ServiceConfig> services = new LinkedHashMap<>();

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public Map<String, ServiceConfig> getServices() { return services; }
        public void setServices(Map<String, ServiceConfig> services) { this.services = services; }

        public CircuitBreakerSettings toDefaults() {
            return new CircuitBreakerSettings(failureThreshold, Duration.ofMillis(timeoutMs), successThreshold);
        }
    }

    /**
     * Thresholds of one named service. Unset values inherit the circuit breaker defaults.
     */
    public static class ServiceConfig {
        private Integer failureThreshold;
        private Long timeoutMs;
        private Integer successThreshold;

        public Integer getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(Integer failureThreshold) { this.failureThreshold = failureThreshold; }

        public Long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }

        public Integer getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(Integer successThreshold) { this.successThreshold = successThreshold; }

        public CircuitBreakerSettings toSettings(CircuitBreakerSettings defaults) {
            return new CircuitBreakerSettings(
                    failureThreshold != null ? failureThreshold : defaults.failureThreshold(),
                    timeoutMs != null ? Duration.ofMillis(timeoutMs) : defaults.timeout(),
                    successThreshold != null ? successThreshold : defaults.successThreshold());
        }
    }

    /**
     * Performance monitoring configuration.
     */
    public static class PerformanceConfig {
        private long slowCallThresholdMs = 3000;

        public long getSlowCallThresholdMs() { return slowCallThresholdMs; }
        public void setSlowCallThresholdMs(long slowCallThresholdMs) { this.slowCallThresholdMs = slowCallThresholdMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "resilience";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Process failure boundary configuration.
     */
    public static class BoundaryConfig {
        private boolean installOnStart = false;

        public boolean isInstallOnStart() { return installOnStart; }
        public void setInstallOnStart(boolean installOnStart) { this.installOnStart = installOnStart; }
    }
}
