/**
 * Fault-tolerance guards around calls to unreliable dependencies.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilience.infrastructure.resilience.RetryExecutor} - Exponential backoff retry</li>
 *   <li>{@link fr.lapetina.resilience.infrastructure.resilience.CircuitBreakerRegistry} - Named circuit breakers</li>
 *   <li>{@link fr.lapetina.resilience.infrastructure.resilience.PerformanceGuard} - Slow call detection</li>
 *   <li>{@link fr.lapetina.resilience.infrastructure.resilience.DatabaseErrorTranslator} - Data-access failure mapping</li>
 *   <li>{@link fr.lapetina.resilience.infrastructure.resilience.CacheFallback} - Cache failures degraded to misses</li>
 * </ul>
 */
package fr.lapetina.resilience.infrastructure.resilience;
