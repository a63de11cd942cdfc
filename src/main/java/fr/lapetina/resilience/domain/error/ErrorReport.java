package fr.lapetina.resilience.domain.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable representation of a handled error.
 *
 * <p>The six core fields ({@code error_type, message, code, details, timestamp,
 * request_context}) form the stable contract consumed by outer layers. The remaining
 * fields are added by the error handler and omitted from JSON when absent.
 * Immutable and thread-safe.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorReport(
        @JsonProperty("error_id") String errorId,
        @JsonProperty("error_type") String errorType,
        String message,
        String code,
        Map<String, Object> details,
        Instant timestamp,
        @JsonInclude(JsonInclude.Include.ALWAYS)
        @JsonProperty("request_context") RequestContext requestContext,
        Map<String, Object> context,
        List<String> traceback,
        @JsonProperty("validation_errors") List<FieldError> validationErrors
) {
    public ErrorReport {
        Objects.requireNonNull(errorType, "Error type is required");
        Objects.requireNonNull(code, "Code is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        details = details != null ? unmodifiableCopy(details) : Map.of();
        context = context != null ? unmodifiableCopy(context) : null;
        traceback = traceback != null ? List.copyOf(traceback) : null;
        validationErrors = validationErrors != null ? List.copyOf(validationErrors) : null;
    }

    /**
     * Creates a report holding only the core fields.
     */
    public static ErrorReport of(String errorType, String message, String code,
                                 Map<String, Object> details, Instant timestamp,
                                 RequestContext requestContext) {
        return new ErrorReport(null, errorType, message, code, details, timestamp,
                requestContext, null, null, null);
    }

    public ErrorReport withErrorId(String errorId) {
        return new ErrorReport(errorId, errorType, message, code, details, timestamp,
                requestContext, context, traceback, validationErrors);
    }

    public ErrorReport withContext(Map<String, Object> context) {
        return new ErrorReport(errorId, errorType, message, code, details, timestamp,
                requestContext, context, traceback, validationErrors);
    }

    public ErrorReport withTraceback(List<String> traceback) {
        return new ErrorReport(errorId, errorType, message, code, details, timestamp,
                requestContext, context, traceback, validationErrors);
    }

    public ErrorReport withValidationErrors(List<FieldError> validationErrors) {
        return new ErrorReport(errorId, errorType, message, code, details, timestamp,
                requestContext, context, traceback, validationErrors);
    }

    /**
     * Plain map view with the same fields as the JSON form: the timestamp as ISO-8601,
     * absent optional fields left out.
     */
    public Map<String, Object> toMap() {
        return ReportMapper.toMap(this);
    }

    // Map.copyOf rejects null values, reports legitimately carry them
    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * One failed field inside an aggregated validation report.
     */
    public record FieldError(String field, String message, String code) {

        public Map<String, Object> toMap() {
            return ReportMapper.toMap(this);
        }
    }
}
