package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.domain.error.ApplicationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        // 3 failures, 5s recovery
        circuitBreaker = new CircuitBreaker("payments-api", CircuitBreakerSettings.of(3, Duration.ofSeconds(5)), clock);
        invocations = new AtomicInteger();
    }

    private String succeed() {
        invocations.incrementAndGet();
        return "ok";
    }

    private String fail() throws IOException {
        invocations.incrementAndGet();
        throw new IOException("connection refused");
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThatThrownBy(() -> circuitBreaker.execute(this::fail)).isInstanceOf(IOException.class);
        }
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() throws Exception {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.execute(this::succeed)).isEqualTo("ok");
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        failTimes(2);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        failTimes(1);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("should reject calls without invoking them while open")
    void shouldRejectWhileOpen() {
        failTimes(3);
        int before = invocations.get();

        assertThatThrownBy(() -> circuitBreaker.execute(this::succeed))
                .isInstanceOfSatisfying(ApplicationError.class, e -> {
                    assertThat(e.hasCode(ApplicationError.SERVICE_UNAVAILABLE)).isTrue();
                    assertThat(e.getDetails()).containsEntry("service_name", "payments-api");
                });

        assertThat(invocations.get()).isEqualTo(before);
    }

    @Test
    @DisplayName("should let a trial call through after timeout and close on success")
    void shouldRecoverAfterTimeout() throws Exception {
        failTimes(3);
        clock.advance(Duration.ofSeconds(5));

        // Reading the state does not move it
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThat(circuitBreaker.execute(this::succeed)).isEqualTo("ok");

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should still reject just before timeout")
    void shouldRejectBeforeTimeout() {
        failTimes(3);
        clock.advance(Duration.ofMillis(4999));

        assertThatThrownBy(() -> circuitBreaker.execute(this::succeed)).isInstanceOf(ApplicationError.class);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("should reopen on half-open failure")
    void shouldReopenOnHalfOpenFailure() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(6));

        failTimes(1);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getLastFailureTime()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should require configured successes before closing")
    void shouldRequireSuccessThreshold() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("search",
                new CircuitBreakerSettings(1, Duration.ofSeconds(1), 2), clock);
        assertThatThrownBy(() -> breaker.execute(this::fail)).isInstanceOf(IOException.class);
        clock.advance(Duration.ofSeconds(1));

        breaker.execute(this::succeed);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(breaker.getSuccessCount()).isEqualTo(1);

        breaker.execute(this::succeed);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() throws Exception {
        failTimes(2);
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);

        circuitBreaker.execute(this::succeed);

        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should not count caller faults as failures")
    void shouldIgnoreCallerFaults() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> circuitBreaker.execute(() -> {
                throw ApplicationError.validation("id", "id is required", null);
            })).isInstanceOf(ApplicationError.class);
        }

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should force state")
    void shouldForceState() {
        circuitBreaker.forceState(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        circuitBreaker.forceState(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should take consistent snapshot")
    void shouldTakeSnapshot() {
        failTimes(1);

        CircuitBreakerSnapshot snapshot = circuitBreaker.snapshot();

        assertThat(snapshot.serviceName()).isEqualTo("payments-api");
        assertThat(snapshot.state()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(snapshot.failureCount()).isEqualTo(1);
        assertThat(snapshot.failureThreshold()).isEqualTo(3);
        assertThat(snapshot.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(snapshot.lastFailureTime()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should count an Error thrown by the operation as a failure")
    void shouldCountErrorAsFailure() {
        CircuitBreaker breaker = new CircuitBreaker("search", CircuitBreakerSettings.of(1, Duration.ofSeconds(5)), clock);

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new NoClassDefFoundError("com/example/Driver");
        })).isInstanceOf(NoClassDefFoundError.class);

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reopen when a half-open trial throws an Error")
    void shouldReopenOnHalfOpenError() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(6));

        assertThatThrownBy(() -> circuitBreaker.execute(() -> {
            throw new StackOverflowError();
        })).isInstanceOf(StackOverflowError.class);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> circuitBreaker.execute(this::succeed))
                .isInstanceOfSatisfying(ApplicationError.class,
                        e -> assertThat(e.hasCode(ApplicationError.SERVICE_UNAVAILABLE)).isTrue());
    }

    @Test
    @DisplayName("should count every failure from concurrent callers")
    void shouldCountConcurrentFailures() throws Exception {
        int threads = 8;
        int callsPerThread = 250;
        CircuitBreaker breaker = new CircuitBreaker("search",
                CircuitBreakerSettings.of(threads * callsPerThread + 1, Duration.ofSeconds(5)), clock);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        try {
                            breaker.execute(this::fail);
                        } catch (IOException expected) {
                            // counted by the breaker
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(breaker.getFailureCount()).isEqualTo(threads * callsPerThread);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(invocations.get()).isEqualTo(threads * callsPerThread);
    }

    @Test
    @DisplayName("should not block other callers while a guarded call is running")
    void shouldNotHoldLockDuringCall() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> slow = executor.submit(() -> circuitBreaker.execute(() -> {
                entered.countDown();
                release.await();
                return "slow";
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            Future<String> other = executor.submit(() -> {
                assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
                return circuitBreaker.execute(this::succeed);
            });

            assertThat(other.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
            assertThat(slow.isDone()).isFalse();

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
