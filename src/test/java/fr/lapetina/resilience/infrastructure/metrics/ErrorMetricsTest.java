package fr.lapetina.resilience.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private ErrorMetrics errorMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        errorMetrics = new ErrorMetrics(new MetricsRegistry("test", meterRegistry));
    }

    @Test
    @DisplayName("should start with an empty summary")
    void shouldStartEmpty() {
        ErrorSummary summary = errorMetrics.summary();

        assertThat(summary.totalErrors()).isZero();
        assertThat(summary.errorCounts()).isEmpty();
        assertThat(summary.topErrors()).isEmpty();
    }

    @Test
    @DisplayName("should count per type and per type:code pattern")
    void shouldCountTypesAndPatterns() {
        errorMetrics.record("DatabaseError", "DATABASE_TIMEOUT");
        errorMetrics.record("DatabaseError", "DATABASE_TIMEOUT");
        errorMetrics.record("DatabaseError", "DATA_INTEGRITY_VIOLATION");
        errorMetrics.record("CacheError", null);

        assertThat(errorMetrics.getCount("DatabaseError")).isEqualTo(3);
        assertThat(errorMetrics.getPatternCount("DatabaseError:DATABASE_TIMEOUT")).isEqualTo(2);
        assertThat(errorMetrics.getPatternCount("CacheError")).isEqualTo(1);
        assertThat(errorMetrics.getCount("ValidationError")).isZero();
    }

    @Test
    @DisplayName("should order summary by descending count")
    void shouldOrderSummary() {
        errorMetrics.record("CacheError", "CacheError");
        errorMetrics.record("DatabaseError", "DATABASE_TIMEOUT");
        errorMetrics.record("DatabaseError", "DATABASE_TIMEOUT");

        ErrorSummary summary = errorMetrics.summary();

        assertThat(summary.totalErrors()).isEqualTo(3);
        assertThat(summary.errorCounts().keySet()).containsExactly("DatabaseError", "CacheError");
        assertThat(summary.topErrors()).containsExactly(
                new ErrorSummary.PatternCount("DatabaseError:DATABASE_TIMEOUT", 2),
                new ErrorSummary.PatternCount("CacheError:CacheError", 1));
    }

    @Test
    @DisplayName("should limit top errors to ten patterns")
    void shouldLimitTopErrors() {
        for (int i = 0; i < 15; i++) {
            errorMetrics.record("SystemError", "CODE_" + i);
        }

        ErrorSummary summary = errorMetrics.summary();

        assertThat(summary.errorPatterns()).hasSize(15);
        assertThat(summary.topErrors()).hasSize(ErrorMetrics.TOP_ERRORS_LIMIT);
    }

    @Test
    @DisplayName("should mirror counts into Micrometer")
    void shouldMirrorIntoMicrometer() {
        errorMetrics.record("ExternalAPIError", "SERVICE_UNAVAILABLE");
        errorMetrics.record("ExternalAPIError", "SERVICE_UNAVAILABLE");

        double count = meterRegistry.get("test_errors_total")
                .tag("type", "ExternalAPIError")
                .tag("code", "SERVICE_UNAVAILABLE")
                .counter()
                .count();

        assertThat(count).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should count exactly under concurrent recording")
    void shouldCountExactlyUnderConcurrency() throws Exception {
        int threads = 8;
        int perThread = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        errorMetrics.record("DatabaseError", "DATABASE_ERROR");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(errorMetrics.getCount("DatabaseError")).isEqualTo((long) threads * perThread);
        assertThat(errorMetrics.summary().totalErrors()).isEqualTo((long) threads * perThread);
    }
}
