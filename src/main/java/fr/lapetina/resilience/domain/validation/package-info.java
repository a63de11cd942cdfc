/**
 * Declarative validation and sanitization of named inputs.
 *
 * <p>A {@link fr.lapetina.resilience.domain.validation.ValidationGuard} runs before the call it guards,
 * so that invalid input is rejected before any retry or circuit breaker gets involved.
 */
package fr.lapetina.resilience.domain.validation;
