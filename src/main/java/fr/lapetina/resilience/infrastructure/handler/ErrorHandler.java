package fr.lapetina.resilience.infrastructure.handler;

import fr.lapetina.resilience.domain.error.ApplicationError;
import fr.lapetina.resilience.domain.error.ErrorKind;
import fr.lapetina.resilience.domain.error.ErrorReport;
import fr.lapetina.resilience.infrastructure.metrics.ErrorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Centralized error handling: classification, logging and reporting.
 *
 * <p>Every call logs the failure exactly once and records it once in the attached
 * {@link ErrorMetrics}. Callers must not log the same failure again.
 *
 * <p>Handling never throws, short of a virtual machine error. If building the report fails,
 * a minimal SYSTEM report is returned and recorded instead.
 */
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    static final String VALIDATION_BATCH_TYPE = "ValidationErrors";

    private final ErrorMetrics errorMetrics;

    public ErrorHandler(ErrorMetrics errorMetrics) {
        this.errorMetrics = errorMetrics;
    }

    public ErrorHandler() {
        this(null);
    }

    /**
     * Handles a failure with no additional context.
     */
    public ErrorReport handle(Throwable error) {
        return handle(error, Map.of());
    }

    /**
     * Classifies, logs and reports a failure.
     *
     * @param error   the failure, typed or not
     * @param context caller-supplied context merged into the report
     * @return the report, never null
     */
    public ErrorReport handle(Throwable error, Map<String, Object> context) {
        try {
            if (error instanceof ApplicationError applicationError) {
                if (isValidationBatch(applicationError)) {
                    return handleValidationBatch(suppressedViolations(applicationError), context);
                }
                return handleApplicationError(applicationError, context);
            }
            return handleSystemError(error, context);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return fallbackReport(error, e);
        }
    }

    /**
     * Aggregates several validation failures into one report, logged once at WARN.
     */
    public ErrorReport handleValidationBatch(List<ApplicationError> errors) {
        return handleValidationBatch(errors, null);
    }

    private ErrorReport handleValidationBatch(List<ApplicationError> errors, Map<String, Object> context) {
        try {
            List<ErrorReport.FieldError> fieldErrors = new ArrayList<>();
            for (ApplicationError error : errors) {
                Object fieldMessage = error.getDetails().get("validation_message");
                fieldErrors.add(new ErrorReport.FieldError(
                        error.getField(),
                        fieldMessage != null ? fieldMessage.toString() : error.getMessage(),
                        error.getCode()));
            }

            ErrorReport report = ErrorReport.of(
                            VALIDATION_BATCH_TYPE,
                            "Multiple validation errors: " + errors.size() + " fields failed",
                            ApplicationError.VALIDATION_FAILED,
                            Map.of("failed_fields", fieldErrors.size()),
                            Instant.now(),
                            errors.isEmpty() ? null : errors.get(0).getRequestContext())
                    .withErrorId(generateErrorId())
                    .withContext(context)
                    .withValidationErrors(fieldErrors);

            withReportFields(log.atWarn(), report)
                    .log("Multiple validation errors: errorId={}, fields={}",
                            report.errorId(), fieldErrors.size());

            record(report);
            return report;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return fallbackReport(null, e);
        }
    }

    private ErrorReport handleApplicationError(ApplicationError error, Map<String, Object> context) {
        ErrorReport report = error.toReport()
                .withErrorId(generateErrorId())
                .withContext(context);

        ErrorKind kind = error.getKind();
        LoggingEventBuilder event = withReportFields(log.atLevel(levelOf(kind)), report);
        if (kind == ErrorKind.SYSTEM) {
            event = event.setCause(error);
        }
        event.log("{}: errorId={}, type={}, code={}, message={}",
                describe(kind), report.errorId(), report.errorType(), report.code(), report.message());

        record(report);
        return report;
    }

    private ErrorReport handleSystemError(Throwable error, Map<String, Object> context) {
        ApplicationError wrapped = ApplicationError.classify(error);
        String errorType = error != null ? error.getClass().getSimpleName() : ErrorKind.SYSTEM.getTypeName();

        ErrorReport report = ErrorReport.of(
                        errorType,
                        wrapped.getMessage(),
                        ApplicationError.SYSTEM_ERROR,
                        wrapped.getDetails(),
                        wrapped.getTimestamp(),
                        wrapped.getRequestContext())
                .withErrorId(generateErrorId())
                .withContext(context)
                .withTraceback(traceback(error));

        withReportFields(log.atError(), report)
                .setCause(error)
                .log("System error: errorId={}, type={}, message={}",
                        report.errorId(), errorType, report.message());

        record(report);
        return report;
    }

    // Must not touch the original failure beyond its class: its own methods may be what failed
    private ErrorReport fallbackReport(Throwable original, Throwable handlingFailure) {
        String originalType = original != null ? original.getClass().getName() : null;
        ErrorReport report = ErrorReport.of(
                        ErrorKind.SYSTEM.getTypeName(),
                        originalType != null ? "Error handling failed for " + originalType : "Error handling failed",
                        ApplicationError.SYSTEM_ERROR,
                        null,
                        Instant.now(),
                        null)
                .withErrorId(generateErrorId());
        try {
            record(report);
        } catch (RuntimeException recordingFailure) {
            handlingFailure.addSuppressed(recordingFailure);
        }
        try {
            log.error("Error handler failed while handling {}: errorId={}",
                    originalType, report.errorId(), handlingFailure);
        } catch (RuntimeException loggingFailure) {
            handlingFailure.addSuppressed(loggingFailure);
        }
        return report;
    }

    private void record(ErrorReport report) {
        if (errorMetrics != null) {
            errorMetrics.record(report.errorType(), report.code(), report.context());
        }
    }

    private static boolean isValidationBatch(ApplicationError error) {
        return error.getKind() == ErrorKind.VALIDATION
                && error.hasCode(ApplicationError.VALIDATION_FAILED)
                && error.getSuppressed().length > 0;
    }

    private static List<ApplicationError> suppressedViolations(ApplicationError error) {
        List<ApplicationError> violations = new ArrayList<>();
        for (Throwable suppressed : error.getSuppressed()) {
            if (suppressed instanceof ApplicationError violation) {
                violations.add(violation);
            }
        }
        return violations;
    }

    private static LoggingEventBuilder withReportFields(LoggingEventBuilder event, ErrorReport report) {
        for (Map.Entry<String, Object> field : report.toMap().entrySet()) {
            if (!"message".equals(field.getKey()) && !"traceback".equals(field.getKey())) {
                event = event.addKeyValue(field.getKey(), field.getValue());
            }
        }
        return event;
    }

    private static Level levelOf(ErrorKind kind) {
        return kind.getSeverity() == ErrorKind.Severity.WARN ? Level.WARN : Level.ERROR;
    }

    private static String describe(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> "Application validation error";
            case AUTHENTICATION, AUTHORIZATION -> "Application security error";
            case DATABASE, EXTERNAL_API, CACHE -> "Application infrastructure error";
            default -> "Application error";
        };
    }

    /**
     * Generates an opaque id of the form {@code err_<epochSeconds>_<8 hex chars>}.
     */
    static String generateErrorId() {
        return "err_" + Instant.now().getEpochSecond() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static List<String> traceback(Throwable error) {
        if (error == null) {
            return List.of();
        }
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return List.of(writer.toString().split(System.lineSeparator()));
    }
}
