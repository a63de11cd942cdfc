package fr.lapetina.resilience.domain.error;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single exception type of the error taxonomy.
 *
 * <p>The {@link ErrorKind} tags the variant; kind-specific data lives in {@link #getDetails()}.
 * Errors are created through the per-kind factories, which never throw: null arguments are
 * tolerated and previews of payloads are truncated.
 *
 * <p>The ambient {@link RequestContext}, if any, is captured at construction time.
 * Immutable after construction.
 */
public class ApplicationError extends RuntimeException {

    public static final String SYSTEM_ERROR = "SYSTEM_ERROR";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";

    private static final int QUERY_PREVIEW_LENGTH = 500;
    private static final int PAYLOAD_PREVIEW_LENGTH = 200;
    private static final int CACHE_KEY_LENGTH = 100;

    private final ErrorKind kind;
    private final String code;
    private final Map<String, Object> details;
    private final Instant timestamp;
    private final RequestContext requestContext;

    public ApplicationError(ErrorKind kind, String message, String code,
                            Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind != null ? kind : ErrorKind.SYSTEM;
        this.code = code != null ? code : this.kind.getTypeName();
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
        this.timestamp = Instant.now();
        this.requestContext = RequestContextHolder.current().orElse(null);
    }

    public ApplicationError(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    // Factories, one per kind

    public static ApplicationError validation(String field, String message, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("validation_message", message);
        details.put("value_type", value != null ? value.getClass().getSimpleName() : null);
        return new ApplicationError(ErrorKind.VALIDATION,
                "Validation error in field '" + field + "': " + message, null, details, null);
    }

    /**
     * Aggregates several field violations into one error. The individual violations
     * are attached as suppressed exceptions.
     */
    public static ApplicationError validationFailed(List<ApplicationError> violations) {
        List<Map<String, Object>> fields = new ArrayList<>();
        for (ApplicationError violation : violations) {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("field", violation.getField());
            field.put("message", violation.getDetails().get("validation_message"));
            fields.add(field);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fields", fields);
        ApplicationError error = new ApplicationError(ErrorKind.VALIDATION,
                "Multiple validation errors: " + violations.size() + " fields failed",
                VALIDATION_FAILED, details, null);
        violations.forEach(error::addSuppressed);
        return error;
    }

    public static ApplicationError database(String operation, String message, String table,
                                            String query, Throwable cause) {
        return database(operation, message, table, query, cause, null);
    }

    public static ApplicationError database(String operation, String message, String table,
                                            String query, Throwable cause, String code) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("table", table);
        details.put("query_preview", truncate(query, QUERY_PREVIEW_LENGTH));
        details.put("original_error", cause != null ? String.valueOf(cause.getMessage()) : null);
        return new ApplicationError(ErrorKind.DATABASE,
                "Database " + operation + " error: " + message, code, details, cause);
    }

    public static ApplicationError externalApi(String apiName, String endpoint, Integer statusCode,
                                               String message, Object responseData) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("api_name", apiName);
        details.put("endpoint", endpoint);
        details.put("status_code", statusCode);
        details.put("response_preview", preview(responseData, PAYLOAD_PREVIEW_LENGTH));
        String text = message != null ? message : "External API error: " + apiName + " " + endpoint;
        return new ApplicationError(ErrorKind.EXTERNAL_API, text, null, details, null);
    }

    /**
     * Raised by an open circuit breaker instead of invoking the guarded call.
     */
    public static ApplicationError serviceUnavailable(String serviceName, Duration retryAfter) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("service_name", serviceName);
        details.put("retry_after_ms", retryAfter != null ? retryAfter.toMillis() : null);
        return new ApplicationError(ErrorKind.EXTERNAL_API,
                "Service " + serviceName + " is currently unavailable (circuit open)",
                SERVICE_UNAVAILABLE, details, null);
    }

    public static ApplicationError authentication(String message, String authType, String userId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("auth_type", authType);
        details.put("user_id", userId);
        return new ApplicationError(ErrorKind.AUTHENTICATION,
                "Authentication error: " + message, null, details, null);
    }

    public static ApplicationError authorization(String message, String requiredPermission,
                                                 String userId, String resource) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required_permission", requiredPermission);
        details.put("user_id", userId);
        details.put("resource", resource);
        return new ApplicationError(ErrorKind.AUTHORIZATION,
                "Authorization error: " + message, null, details, null);
    }

    public static ApplicationError cache(String operation, String cacheKey, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("cache_key", truncate(cacheKey, CACHE_KEY_LENGTH));
        return new ApplicationError(ErrorKind.CACHE,
                "Cache " + operation + " error: " + message, null, details, null);
    }

    public static ApplicationError mlModel(String modelName, String operation, String message,
                                           Object inputData) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("model_name", modelName);
        details.put("operation", operation);
        details.put("input_preview", preview(inputData, PAYLOAD_PREVIEW_LENGTH));
        return new ApplicationError(ErrorKind.ML_MODEL,
                "ML model error (" + modelName + "): " + message, null, details, null);
    }

    public static ApplicationError dataProcessing(String processor, String stage, String message,
                                                  Object dataSample) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("processor", processor);
        details.put("stage", stage);
        details.put("data_sample", preview(dataSample, PAYLOAD_PREVIEW_LENGTH));
        return new ApplicationError(ErrorKind.DATA_PROCESSING,
                "Data processing error (" + processor + "): " + message, null, details, null);
    }

    public static ApplicationError configuration(String configKey, String message, String expectedType) {
        return configuration(configKey, message, expectedType, null);
    }

    public static ApplicationError configuration(String configKey, String message, String expectedType,
                                                 Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("config_key", configKey);
        details.put("expected_type", expectedType);
        return new ApplicationError(ErrorKind.CONFIGURATION,
                "Configuration error (" + configKey + "): " + message, null, details, cause);
    }

    public static ApplicationError system(String message, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception_type", cause != null ? cause.getClass().getName() : null);
        return new ApplicationError(ErrorKind.SYSTEM, message, SYSTEM_ERROR, details, cause);
    }

    /**
     * Returns the error itself when already typed, otherwise wraps it as a SYSTEM error.
     */
    public static ApplicationError classify(Throwable error) {
        if (error instanceof ApplicationError applicationError) {
            return applicationError;
        }
        String message = error != null ? String.valueOf(error.getMessage()) : "Unknown error";
        return system(message, error);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Request under which the error was raised, or null outside of any request.
     */
    public RequestContext getRequestContext() {
        return requestContext;
    }

    /**
     * Field name of a validation error, null for other kinds.
     */
    public String getField() {
        Object field = details.get("field");
        return field != null ? field.toString() : null;
    }

    public boolean hasCode(String expected) {
        return code.equals(expected);
    }

    public ErrorReport toReport() {
        return ErrorReport.of(kind.getTypeName(), getMessage(), code, details, timestamp, requestContext);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private static String preview(Object value, int maxLength) {
        return value != null ? truncate(String.valueOf(value), maxLength) : null;
    }

    @Override
    public String toString() {
        return "ApplicationError{" +
                "kind=" + kind +
                ", code='" + code + '\'' +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
