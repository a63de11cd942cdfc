package fr.lapetina.resilience;

import fr.lapetina.resilience.domain.validation.ValidationGuard;
import fr.lapetina.resilience.infrastructure.handler.ErrorHandler;
import fr.lapetina.resilience.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.resilience.infrastructure.resilience.PerformanceGuard;
import fr.lapetina.resilience.infrastructure.resilience.RetryExecutor;
import fr.lapetina.resilience.infrastructure.resilience.RetryPolicy;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * A named call wrapped in the configured guards.
 *
 * <p>Guards apply outermost first:
 * <ol>
 *   <li>validation of the named inputs</li>
 *   <li>performance monitoring</li>
 *   <li>retry</li>
 *   <li>circuit breaker</li>
 * </ol>
 * Every guard is optional. A retried call goes through the breaker on each attempt, and
 * is timed once as a whole. When an error handler is set, the failure that finally escapes
 * is reported once, then rethrown unchanged.
 *
 * <pre>{@code
 * ResilientCall call = ResilientCall.builder("fetch-listing")
 *         .retry(retryExecutor, RetryPolicy.of(2, 0.5))
 *         .circuitBreaker(breakers, "listings-api")
 *         .errorHandler(errorHandler)
 *         .build();
 *
 * Listing listing = call.call(() -> client.fetch(id));
 * }</pre>
 */
public final class ResilientCall {

    private final String name;
    private final ValidationGuard validationGuard;
    private final PerformanceGuard performanceGuard;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerRegistry circuitBreakers;
    private final String serviceName;
    private final ErrorHandler errorHandler;

    private ResilientCall(Builder builder) {
        this.name = builder.name;
        this.validationGuard = builder.validationGuard;
        this.performanceGuard = builder.performanceGuard;
        this.retryExecutor = builder.retryExecutor;
        this.retryPolicy = builder.retryPolicy;
        this.circuitBreakers = builder.circuitBreakers;
        this.serviceName = builder.serviceName != null ? builder.serviceName : builder.name;
        this.errorHandler = builder.errorHandler;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Runs the operation through the guards. Input validation does not apply.
     *
     * @throws Exception the failure that escaped the guards, unchanged
     */
    public <T> T call(Callable<T> operation) throws Exception {
        return reported(() -> guarded(operation));
    }

    /**
     * Validates the inputs, then runs the operation with the validated copy. Invalid input
     * fails before any other guard is involved and the operation is not invoked.
     *
     * @throws Exception the failure that escaped the guards, unchanged
     */
    public <T> T call(Map<String, Object> inputs, Function<Map<String, Object>, T> operation) throws Exception {
        return reported(() -> {
            Map<String, Object> validated = validationGuard != null
                    ? validationGuard.validate(inputs)
                    : inputs;
            return guarded(() -> operation.apply(validated));
        });
    }

    private <T> T guarded(Callable<T> operation) throws Exception {
        Callable<T> chain = operation;
        if (circuitBreakers != null) {
            chain = circuitBreakers.decorate(serviceName, chain);
        }
        if (retryExecutor != null) {
            RetryPolicy policy = retryPolicy != null ? retryPolicy : retryExecutor.getDefaultPolicy();
            chain = retryExecutor.decorate(chain, name, policy);
        }
        if (performanceGuard != null) {
            chain = performanceGuard.decorate(name, chain);
        }
        return chain.call();
    }

    private <T> T reported(Callable<T> body) throws Exception {
        try {
            return body.call();
        } catch (Exception e) {
            if (errorHandler != null) {
                errorHandler.handle(e, Map.of("operation", name));
            }
            throw e;
        }
    }

    public String getName() {
        return name;
    }

    public String getServiceName() {
        return serviceName;
    }

    public static final class Builder {
        private final String name;
        private ValidationGuard validationGuard;
        private PerformanceGuard performanceGuard;
        private RetryExecutor retryExecutor;
        private RetryPolicy retryPolicy;
        private CircuitBreakerRegistry circuitBreakers;
        private String serviceName;
        private ErrorHandler errorHandler;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder validation(ValidationGuard validationGuard) {
            this.validationGuard = validationGuard;
            return this;
        }

        public Builder performance(PerformanceGuard performanceGuard) {
            this.performanceGuard = performanceGuard;
            return this;
        }

        /**
         * Retries with the executor's default policy.
         */
        public Builder retry(RetryExecutor retryExecutor) {
            return retry(retryExecutor, null);
        }

        public Builder retry(RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
            this.retryExecutor = retryExecutor;
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Guards the call with the breaker named after the call.
         */
        public Builder circuitBreaker(CircuitBreakerRegistry circuitBreakers) {
            return circuitBreaker(circuitBreakers, null);
        }

        public Builder circuitBreaker(CircuitBreakerRegistry circuitBreakers, String serviceName) {
            this.circuitBreakers = circuitBreakers;
            this.serviceName = serviceName;
            return this;
        }

        public Builder errorHandler(ErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public ResilientCall build() {
            return new ResilientCall(this);
        }
    }
}
