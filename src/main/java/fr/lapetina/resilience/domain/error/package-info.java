/**
 * Error taxonomy shared by the whole application.
 *
 * <p>Every failure the application reports is an {@link fr.lapetina.resilience.domain.error.ApplicationError}
 * tagged with one {@link fr.lapetina.resilience.domain.error.ErrorKind}. The kind decides how the error is
 * logged, whether it may be retried or trip a circuit breaker, and what an end user gets to see.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilience.domain.error.ApplicationError} - Immutable tagged error with per-kind factories</li>
 *   <li>{@link fr.lapetina.resilience.domain.error.ErrorReport} - Stable serializable report contract</li>
 *   <li>{@link fr.lapetina.resilience.domain.error.RequestContextHolder} - Ambient request captured by new errors</li>
 *   <li>{@link fr.lapetina.resilience.domain.error.PublicErrorView} - End-user projection of a report</li>
 * </ul>
 */
package fr.lapetina.resilience.domain.error;
