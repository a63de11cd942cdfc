package fr.lapetina.resilience.infrastructure.resilience;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Attempt log of a single retry invocation. Not shared between threads
 * and discarded once the invocation returns or gives up.
 */
public final class RetryContext {

    private final String target;
    private final int maxAttempts;
    private final List<Attempt> attempts = new ArrayList<>();

    RetryContext(String target, int maxAttempts) {
        this.target = target;
        this.maxAttempts = maxAttempts;
    }

    void recordFailure(Exception error, Duration nextDelay) {
        attempts.add(new Attempt(attempts.size() + 1, nextDelay, error));
    }

    public String getTarget() {
        return target;
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public boolean hasAttemptsRemaining() {
        return attempts.size() < maxAttempts;
    }

    public Exception getLastException() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).error();
    }

    public List<Attempt> getAttempts() {
        return List.copyOf(attempts);
    }

    /**
     * One failed attempt.
     *
     * @param number    1-based attempt number
     * @param nextDelay delay applied before the next attempt, null if none followed
     * @param error     the failure
     */
    public record Attempt(int number, Duration nextDelay, Exception error) {
    }
}
