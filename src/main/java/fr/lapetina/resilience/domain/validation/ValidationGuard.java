package fr.lapetina.resilience.domain.validation;

import fr.lapetina.resilience.domain.error.ApplicationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Validates and sanitizes named inputs before a guarded call runs.
 *
 * <p>Every declared input is checked, keeping the first violation of each. A single
 * violation is thrown as is; several are thrown together as one {@code VALIDATION_FAILED}
 * error carrying each violation as a suppressed exception. In both cases the guarded
 * call is not invoked.
 *
 * <pre>{@code
 * ValidationGuard guard = ValidationGuard.builder()
 *         .field("city", ValidationRule.builder().required().type(String.class).maxLength(100).sanitize().build())
 *         .field("price", ValidationRule.builder().type(Number.class).min(0).build())
 *         .build();
 *
 * List<Property> results = guard.call(inputs, validated -> search(validated));
 * }</pre>
 */
public final class ValidationGuard {

    private static final Logger log = LoggerFactory.getLogger(ValidationGuard.class);

    private final Map<String, ValidationRule> rules;

    private ValidationGuard(Map<String, ValidationRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static ValidationGuard of(Map<String, ValidationRule> rules) {
        return new ValidationGuard(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates the inputs.
     *
     * @param inputs named inputs; undeclared names are passed through unchecked
     * @return a copy of the inputs with sanitized values
     * @throws ApplicationError VALIDATION error on any violation
     */
    public Map<String, Object> validate(Map<String, Object> inputs) {
        Map<String, Object> source = inputs != null ? inputs : Map.of();
        List<ApplicationError> violations = new ArrayList<>();
        Map<String, Object> validated = new LinkedHashMap<>(source);

        for (Map.Entry<String, ValidationRule> entry : rules.entrySet()) {
            String param = entry.getKey();
            ValidationRule rule = entry.getValue();
            Object value = source.get(param);

            Optional<ApplicationError> violation = rule.check(param, value);
            if (violation.isPresent()) {
                violations.add(violation.get());
            } else if (value != null) {
                validated.put(param, rule.apply(value));
            }
        }

        if (violations.size() == 1) {
            log.debug("Input rejected: field={}", violations.get(0).getField());
            throw violations.get(0);
        }
        if (!violations.isEmpty()) {
            log.debug("Input rejected: fields={}", violations.size());
            throw ApplicationError.validationFailed(violations);
        }
        return validated;
    }

    /**
     * Validates the inputs, then runs the operation with the validated copy.
     */
    public <T> T call(Map<String, Object> inputs, Function<Map<String, Object>, T> operation) {
        Map<String, Object> validated = validate(inputs);
        return operation.apply(validated);
    }

    public Map<String, ValidationRule> getRules() {
        return rules;
    }

    public static final class Builder {
        private final Map<String, ValidationRule> rules = new LinkedHashMap<>();

        public Builder field(String name, ValidationRule rule) {
            rules.put(name, rule);
            return this;
        }

        public ValidationGuard build() {
            return new ValidationGuard(rules);
        }
    }
}
