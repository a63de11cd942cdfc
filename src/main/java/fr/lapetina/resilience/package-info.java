/**
 * Resilience core - error taxonomy, handling and fault-tolerance guards for back-end services.
 *
 * <p>This library classifies failures into a fixed taxonomy, reports them as structured records,
 * counts them, and protects calls to unreliable dependencies with retries, circuit breakers,
 * performance monitoring and input validation.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilience.ResilienceToolkit} - Main entry point wiring every component
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.resilience.ResilientCall} - A call wrapped in validation, timing, retry
 *       and circuit breaker guards</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ResilienceToolkit toolkit = ResilienceToolkit.create("resilience.yaml")) {
 *     ResilientCall call = toolkit.newCall("payments-api").build();
 *     Receipt receipt = call.call(() -> payments.charge(order));
 *
 *     ResilienceSummary summary = toolkit.summary();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Typed application errors with stable codes and structured reports</li>
 *   <li>Exponential backoff retry with jitter</li>
 *   <li>Per-service circuit breakers</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Process-wide handling of uncaught failures</li>
 * </ul>
 *
 * @see fr.lapetina.resilience.ResilienceToolkit
 * @see fr.lapetina.resilience.ResilientCall
 */
package fr.lapetina.resilience;
