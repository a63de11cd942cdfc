package fr.lapetina.resilience.domain.error;

/**
 * Error taxonomy for the application.
 * Each kind carries the policy applied when an error of that kind is handled:
 * log severity, retry eligibility, circuit breaking and end-user visibility.
 */
public enum ErrorKind {
    /** Malformed input, recovered locally with field-level detail */
    VALIDATION("ValidationError", Severity.WARN, false, false, true),

    /** Query or connection failure */
    DATABASE("DatabaseError", Severity.ERROR, true, true, false),

    /** Third-party API call failure */
    EXTERNAL_API("ExternalAPIError", Severity.ERROR, true, true, false),

    /** Bad credentials or token, never retried */
    AUTHENTICATION("AuthenticationError", Severity.WARN, false, false, true),

    /** Insufficient permission, never retried */
    AUTHORIZATION("AuthorizationError", Severity.WARN, false, false, true),

    /** Cache backend failure, usually treated as a miss */
    CACHE("CacheError", Severity.ERROR, false, false, false),

    /** Inference or training failure, not retried (non-idempotent) */
    ML_MODEL("MLModelError", Severity.ERROR, false, false, false),

    /** Pipeline stage failure, upstream decides retry */
    DATA_PROCESSING("DataProcessingError", Severity.ERROR, false, false, false),

    /** Missing or invalid configuration key, fatal at startup */
    CONFIGURATION("ConfigurationError", Severity.ERROR, false, false, false),

    /** Unclassified or unexpected failure */
    SYSTEM("SystemError", Severity.ERROR, false, false, false);

    public enum Severity {
        WARN,
        ERROR
    }

    private final String typeName;
    private final Severity severity;
    private final boolean retryable;
    private final boolean circuitBreakable;
    private final boolean userFacing;

    ErrorKind(String typeName, Severity severity, boolean retryable,
              boolean circuitBreakable, boolean userFacing) {
        this.typeName = typeName;
        this.severity = severity;
        this.retryable = retryable;
        this.circuitBreakable = circuitBreakable;
        this.userFacing = userFacing;
    }

    /**
     * Name used as {@code error_type} in reports and as the default error code.
     */
    public String getTypeName() {
        return typeName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isCircuitBreakable() {
        return circuitBreakable;
    }

    /**
     * Whether the message of an error of this kind may be shown to an end user as is.
     */
    public boolean isUserFacing() {
        return userFacing;
    }

    /**
     * Caller-fault kinds say nothing about the health of a downstream dependency.
     */
    public boolean isCallerFault() {
        return this == VALIDATION || this == AUTHENTICATION || this == AUTHORIZATION;
    }
}
