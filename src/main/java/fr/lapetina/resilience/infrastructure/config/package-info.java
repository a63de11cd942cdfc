/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing and validation. Invalid configuration is
 * reported as a {@code CONFIGURATION} error and is fatal at startup.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilience.infrastructure.config.ResilienceConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.resilience.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code retry} - Attempt bound, backoff factor and jitter</li>
 *   <li>{@code circuitBreaker} - Default thresholds and per-service overrides</li>
 *   <li>{@code performance} - Slow call threshold</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code boundary} - Process failure boundary installation</li>
 * </ul>
 *
 * @see fr.lapetina.resilience.infrastructure.config.ResilienceConfig
 * @see fr.lapetina.resilience.infrastructure.config.ConfigLoader
 */
package fr.lapetina.resilience.infrastructure.config;
