package fr.lapetina.resilience.domain.validation;

import fr.lapetina.resilience.domain.error.ApplicationError;

import java.util.Optional;

/**
 * Declarative rule set for one named input.
 *
 * Checks run in order: required, type, numeric bounds, string length.
 * Only the first violated check is reported.
 */
public final class ValidationRule {

    private final boolean required;
    private final Class<?> type;
    private final Number min;
    private final Number max;
    private final Integer minLength;
    private final Integer maxLength;
    private final boolean sanitize;

    private ValidationRule(Builder builder) {
        this.required = builder.required;
        this.type = builder.type;
        this.min = builder.min;
        this.max = builder.max;
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.sanitize = builder.sanitize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks a value, absent inputs being passed as null.
     *
     * @return the first violation, or empty if the value is valid
     */
    public Optional<ApplicationError> check(String param, Object value) {
        if (value == null) {
            return required
                    ? Optional.of(ApplicationError.validation(param, param + " is required", null))
                    : Optional.empty();
        }

        if (type != null && !type.isInstance(value)) {
            return violation(param, param + " must be of type " + type.getSimpleName(), value);
        }

        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            if ((min != null || max != null) && Double.isNaN(numeric)) {
                return violation(param, param + " must be a number", value);
            }
            if (min != null && numeric < min.doubleValue()) {
                return violation(param, param + " must be >= " + min, value);
            }
            if (max != null && numeric > max.doubleValue()) {
                return violation(param, param + " must be <= " + max, value);
            }
        }

        if (value instanceof CharSequence text) {
            if (minLength != null && text.length() < minLength) {
                return violation(param, param + " must have at least " + minLength + " characters", value);
            }
            if (maxLength != null && text.length() > maxLength) {
                return violation(param, param + " must have at most " + maxLength + " characters", value);
            }
        }

        return Optional.empty();
    }

    /**
     * Returns the value to hand to the guarded call: sanitized when the rule asks for it.
     */
    public Object apply(Object value) {
        if (sanitize && value instanceof String text) {
            return InputSanitizer.stripScripts(text);
        }
        return value;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isSanitize() {
        return sanitize;
    }

    private static Optional<ApplicationError> violation(String param, String message, Object value) {
        return Optional.of(ApplicationError.validation(param, message, value));
    }

    public static final class Builder {
        private boolean required;
        private Class<?> type;
        private Number min;
        private Number max;
        private Integer minLength;
        private Integer maxLength;
        private boolean sanitize;

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Builder min(Number min) {
            this.min = min;
            return this;
        }

        public Builder max(Number max) {
            this.max = max;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder sanitize() {
            this.sanitize = true;
            return this;
        }

        public ValidationRule build() {
            if (min != null && max != null && min.doubleValue() > max.doubleValue()) {
                throw new IllegalArgumentException("min must be <= max");
            }
            if (minLength != null && maxLength != null && minLength > maxLength) {
                throw new IllegalArgumentException("minLength must be <= maxLength");
            }
            return new ValidationRule(this);
        }
    }
}
