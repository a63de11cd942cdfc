package fr.lapetina.resilience.domain.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationErrorTest {

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("should build validation error with field detail")
        void shouldBuildValidationError() {
            ApplicationError error = ApplicationError.validation("email", "is malformed", "not-an-email");

            assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(error.getCode()).isEqualTo("ValidationError");
            assertThat(error.getMessage()).isEqualTo("Validation error in field 'email': is malformed");
            assertThat(error.getField()).isEqualTo("email");
            assertThat(error.getDetails())
                    .containsEntry("validation_message", "is malformed")
                    .containsEntry("value_type", "String");
        }

        @Test
        @DisplayName("should truncate query preview to 500 characters")
        void shouldTruncateQueryPreview() {
            String query = "SELECT * FROM listings WHERE " + "x".repeat(1000);

            ApplicationError error = ApplicationError.database("select", "timeout", "listings", query, null);

            assertThat(error.getKind()).isEqualTo(ErrorKind.DATABASE);
            assertThat((String) error.getDetails().get("query_preview")).hasSize(500);
            assertThat(error.getDetails()).containsEntry("table", "listings");
            assertThat(error.getDetails().get("original_error")).isNull();
        }

        @Test
        @DisplayName("should keep database cause and original error message")
        void shouldKeepDatabaseCause() {
            IllegalStateException cause = new IllegalStateException("connection reset");

            ApplicationError error = ApplicationError.database("insert", "failed", null, null, cause);

            assertThat(error.getCause()).isSameAs(cause);
            assertThat(error.getDetails()).containsEntry("original_error", "connection reset");
            assertThat(error.getDetails().get("query_preview")).isNull();
        }

        @Test
        @DisplayName("should truncate external API response preview to 200 characters")
        void shouldTruncateResponsePreview() {
            ApplicationError error = ApplicationError.externalApi(
                    "geocoder", "/v1/lookup", 502, "Bad gateway", "y".repeat(300));

            assertThat(error.getKind()).isEqualTo(ErrorKind.EXTERNAL_API);
            assertThat(error.getDetails()).containsEntry("status_code", 502);
            assertThat((String) error.getDetails().get("response_preview")).hasSize(200);
        }

        @Test
        @DisplayName("should build service unavailable as external API error")
        void shouldBuildServiceUnavailable() {
            ApplicationError error = ApplicationError.serviceUnavailable("payments-api", Duration.ofSeconds(2));

            assertThat(error.getKind()).isEqualTo(ErrorKind.EXTERNAL_API);
            assertThat(error.hasCode(ApplicationError.SERVICE_UNAVAILABLE)).isTrue();
            assertThat(error.getDetails())
                    .containsEntry("service_name", "payments-api")
                    .containsEntry("retry_after_ms", 2000L);
        }

        @Test
        @DisplayName("should truncate cache key to 100 characters")
        void shouldTruncateCacheKey() {
            ApplicationError error = ApplicationError.cache("get", "k".repeat(150), "down");

            assertThat(error.getKind()).isEqualTo(ErrorKind.CACHE);
            assertThat((String) error.getDetails().get("cache_key")).hasSize(100);
        }

        @Test
        @DisplayName("should tolerate null arguments")
        void shouldTolerateNullArguments() {
            assertThat(ApplicationError.mlModel(null, null, null, null).getKind()).isEqualTo(ErrorKind.ML_MODEL);
            assertThat(ApplicationError.dataProcessing(null, null, null, null).getKind())
                    .isEqualTo(ErrorKind.DATA_PROCESSING);
            assertThat(ApplicationError.authentication(null, null, null).getKind())
                    .isEqualTo(ErrorKind.AUTHENTICATION);
            assertThat(ApplicationError.authorization(null, null, null, null).getKind())
                    .isEqualTo(ErrorKind.AUTHORIZATION);
            assertThat(ApplicationError.configuration(null, null, null).getKind())
                    .isEqualTo(ErrorKind.CONFIGURATION);
            assertThat(new ApplicationError(null, "boom").getKind()).isEqualTo(ErrorKind.SYSTEM);
        }

        @Test
        @DisplayName("should aggregate violations as suppressed exceptions")
        void shouldAggregateViolations() {
            ApplicationError first = ApplicationError.validation("city", "city is required", null);
            ApplicationError second = ApplicationError.validation("price", "price must be >= 0", -1);

            ApplicationError error = ApplicationError.validationFailed(List.of(first, second));

            assertThat(error.getCode()).isEqualTo(ApplicationError.VALIDATION_FAILED);
            assertThat(error.getMessage()).isEqualTo("Multiple validation errors: 2 fields failed");
            assertThat(error.getSuppressed()).containsExactly(first, second);
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("should return typed error unchanged")
        void shouldReturnTypedErrorUnchanged() {
            ApplicationError typed = ApplicationError.cache("get", "k", "down");

            assertThat(ApplicationError.classify(typed)).isSameAs(typed);
        }

        @Test
        @DisplayName("should wrap untyped exception as system error")
        void shouldWrapUntypedException() {
            IllegalArgumentException raw = new IllegalArgumentException("bad state");

            ApplicationError error = ApplicationError.classify(raw);

            assertThat(error.getKind()).isEqualTo(ErrorKind.SYSTEM);
            assertThat(error.getCode()).isEqualTo(ApplicationError.SYSTEM_ERROR);
            assertThat(error.getCause()).isSameAs(raw);
            assertThat(error.getDetails()).containsEntry("exception_type", IllegalArgumentException.class.getName());
        }
    }

    @Nested
    @DisplayName("Reports")
    class Reports {

        @Test
        @DisplayName("should build report with core fields")
        void shouldBuildReport() {
            ApplicationError error = ApplicationError.externalApi("geocoder", "/v1", 503, "Unavailable", null);

            ErrorReport report = error.toReport();

            assertThat(report.errorType()).isEqualTo("ExternalAPIError");
            assertThat(report.code()).isEqualTo("ExternalAPIError");
            assertThat(report.message()).isEqualTo("Unavailable");
            assertThat(report.timestamp()).isEqualTo(error.getTimestamp());
            assertThat(report.requestContext()).isNull();
        }

        @Test
        @DisplayName("should capture ambient request context")
        void shouldCaptureRequestContext() {
            RequestContext context = new RequestContext("/api/listings", "GET", "10.0.0.1", "curl", "u-42");

            ApplicationError error;
            try (RequestContextHolder.Scope scope = RequestContextHolder.bind(context)) {
                error = ApplicationError.authorization("denied", "listings:write", "u-42", "listing/7");
            }

            assertThat(error.getRequestContext()).isEqualTo(context);
            assertThat(error.toReport().requestContext()).isEqualTo(context);
            assertThat(error.toReport().toMap().get("request_context"))
                    .isEqualTo(Map.of("url", "/api/listings", "method", "GET", "remote_addr", "10.0.0.1",
                            "user_agent", "curl", "user_id", "u-42"));
        }
    }

    @Test
    @DisplayName("should expose kind policies")
    void shouldExposeKindPolicies() {
        assertThat(ErrorKind.DATABASE.isRetryable()).isTrue();
        assertThat(ErrorKind.EXTERNAL_API.isCircuitBreakable()).isTrue();
        assertThat(ErrorKind.VALIDATION.getSeverity()).isEqualTo(ErrorKind.Severity.WARN);
        assertThat(ErrorKind.SYSTEM.getSeverity()).isEqualTo(ErrorKind.Severity.ERROR);
        assertThat(ErrorKind.AUTHORIZATION.isCallerFault()).isTrue();
        assertThat(ErrorKind.CACHE.isCallerFault()).isFalse();
    }
}
