package fr.lapetina.resilience.infrastructure.config;

import fr.lapetina.resilience.domain.error.ApplicationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Validation of the loaded values
 *
 * Every failure is raised as a CONFIGURATION error: configuration problems are
 * fatal at startup and never retried.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG = "resilience.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ResilienceConfig.class, loaderOptions));
    }

    public ConfigLoader() {
        this(DEFAULT_CONFIG);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded, validated configuration
     * @throws ApplicationError CONFIGURATION error if loading or validation fails
     */
    public ResilienceConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw configurationError("config_path", "Failed to load from classpath: " + classpathResource, e);
        }

        throw configurationError("config_path", "Configuration file not found: " + configPath, null);
    }

    private ResilienceConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw configurationError("config_path", "Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ResilienceConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private ResilienceConfig parse(InputStream inputStream, String source) {
        ResilienceConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw configurationError("config_path", "Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Empty configuration in {}, using defaults", source);
            config = createDefault();
        }
        validate(config);
        return config;
    }

    /**
     * Checks that every section is present and value ranges.
     *
     * @throws ApplicationError CONFIGURATION error naming the offending key
     */
    public static void validate(ResilienceConfig config) {
        requireSection("retry", config.getRetry());
        requireSection("circuitBreaker", config.getCircuitBreaker());
        requireSection("circuitBreaker.services", config.getCircuitBreaker().getServices());
        requireSection("performance", config.getPerformance());
        requireSection("metrics", config.getMetrics());
        requireSection("boundary", config.getBoundary());

        ResilienceConfig.RetryConfig retry = config.getRetry();
        requireAtLeast("retry.maxRetries", retry.getMaxRetries(), 0);
        if (retry.getBackoffFactor() < 0) {
            throw invalid("retry.backoffFactor", "must be >= 0", "non-negative number");
        }
        requireAtLeast("retry.maxJitterMs", retry.getMaxJitterMs(), 0);

        ResilienceConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        requireAtLeast("circuitBreaker.failureThreshold", breaker.getFailureThreshold(), 1);
        requireAtLeast("circuitBreaker.timeoutMs", breaker.getTimeoutMs(), 0);
        requireAtLeast("circuitBreaker.successThreshold", breaker.getSuccessThreshold(), 1);

        for (Map.Entry<String, ResilienceConfig.ServiceConfig> entry : breaker.getServices().entrySet()) {
            String prefix = "circuitBreaker.services." + entry.getKey();
            ResilienceConfig.ServiceConfig service = entry.getValue();
            if (service == null) {
                throw invalid(prefix, "service entry is empty", "mapping");
            }
            if (service.getFailureThreshold() != null) {
                requireAtLeast(prefix + ".failureThreshold", service.getFailureThreshold(), 1);
            }
            if (service.getTimeoutMs() != null) {
                requireAtLeast(prefix + ".timeoutMs", service.getTimeoutMs(), 0);
            }
            if (service.getSuccessThreshold() != null) {
                requireAtLeast(prefix + ".successThreshold", service.getSuccessThreshold(), 1);
            }
        }

        requireAtLeast("performance.slowCallThresholdMs", config.getPerformance().getSlowCallThresholdMs(), 0);

        String prefix = config.getMetrics().getPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw invalid("metrics.prefix", "must not be blank", "string");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ResilienceConfig createDefault() {
        return new ResilienceConfig();
    }

    // A key written with no value in YAML sets the section to null
    private static void requireSection(String key, Object section) {
        if (section == null) {
            throw invalid(key, "section is empty", "mapping");
        }
    }

    private static void requireAtLeast(String key, long value, long minimum) {
        if (value < minimum) {
            throw invalid(key, "must be >= " + minimum + " but was " + value, "integer");
        }
    }

    private static ApplicationError invalid(String key, String message, String expectedType) {
        return ApplicationError.configuration(key, message, expectedType);
    }

    private static ApplicationError configurationError(String key, String message, Throwable cause) {
        return ApplicationError.configuration(key, message, null, cause);
    }
}
