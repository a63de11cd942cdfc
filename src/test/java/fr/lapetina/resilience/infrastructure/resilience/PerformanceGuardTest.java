package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerformanceGuardTest {

    private AtomicLong nanoTime;
    private SimpleMeterRegistry meterRegistry;
    private PerformanceGuard guard;

    @BeforeEach
    void setUp() {
        nanoTime = new AtomicLong();
        meterRegistry = new SimpleMeterRegistry();
        guard = new PerformanceGuard(Duration.ofSeconds(3), new MetricsRegistry("test", meterRegistry), nanoTime::get);
    }

    private Timer timer(String operation, String outcome) {
        return meterRegistry.get("test_operation_duration")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .timer();
    }

    @Test
    @DisplayName("should return result unchanged and record duration")
    void shouldReturnResultAndRecord() throws Exception {
        String result = guard.monitor("search", () -> {
            nanoTime.addAndGet(Duration.ofMillis(120).toNanos());
            return "results";
        });

        assertThat(result).isEqualTo("results");
        assertThat(timer("search", "success").count()).isEqualTo(1);
        assertThat(timer("search", "success").totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    @DisplayName("should still return result of a slow call")
    void shouldReturnResultOfSlowCall() throws Exception {
        Integer result = guard.monitor("report", () -> {
            nanoTime.addAndGet(Duration.ofSeconds(4).toNanos());
            return 42;
        });

        assertThat(result).isEqualTo(42);
        assertThat(timer("report", "success").totalTime(TimeUnit.SECONDS)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("should rethrow failure unchanged and record it")
    void shouldRethrowFailure() {
        IllegalStateException failure = new IllegalStateException("boom");

        assertThatThrownBy(() -> guard.monitor("search", () -> {
            nanoTime.addAndGet(Duration.ofMillis(10).toNanos());
            throw failure;
        })).isSameAs(failure);

        assertThat(timer("search", "failure").count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should decorate callables")
    void shouldDecorate() throws Exception {
        assertThat(guard.decorate("ping", () -> "pong").call()).isEqualTo("pong");
        assertThat(guard.getSlowCallThreshold()).isEqualTo(Duration.ofSeconds(3));
    }
}
