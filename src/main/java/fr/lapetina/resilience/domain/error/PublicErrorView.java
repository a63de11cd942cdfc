package fr.lapetina.resilience.domain.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What an end user may see of a handled error.
 *
 * Validation and security errors keep their specific message and field detail.
 * Every other kind is reduced to a generic message plus the error id for support
 * correlation. Stack traces and internal details never appear here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublicErrorView(
        String message,
        String code,
        @JsonProperty("error_id") String errorId,
        @JsonProperty("field_errors") List<ErrorReport.FieldError> fieldErrors
) {
    public static final String GENERIC_MESSAGE = "Something went wrong. Please try again later.";

    public static PublicErrorView from(ErrorReport report) {
        ErrorKind kind = kindOf(report.errorType());
        if (report.validationErrors() != null) {
            return new PublicErrorView(report.message(), report.code(), report.errorId(),
                    report.validationErrors());
        }
        if (kind != null && kind.isUserFacing()) {
            return new PublicErrorView(report.message(), report.code(), report.errorId(), null);
        }
        return new PublicErrorView(GENERIC_MESSAGE, "INTERNAL_ERROR", report.errorId(), null);
    }

    private static ErrorKind kindOf(String errorType) {
        for (ErrorKind kind : ErrorKind.values()) {
            if (kind.getTypeName().equals(errorType)) {
                return kind;
            }
        }
        return null;
    }
}
