package fr.lapetina.resilience.domain.error;

import org.slf4j.MDC;

import java.util.Objects;
import java.util.Optional;

/**
 * Thread-bound holder for the request currently being served.
 *
 * <p>The web layer binds the request for the duration of its handling:
 * <pre>{@code
 * try (RequestContextHolder.Scope scope = RequestContextHolder.bind(context)) {
 *     // errors raised here capture the context
 * }
 * }</pre>
 *
 * While bound, the request is also exposed to log lines through the MDC.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    /**
     * Binds a request to the calling thread. Scopes nest: closing restores the outer request.
     */
    public static Scope bind(RequestContext context) {
        Objects.requireNonNull(context, "context");
        RequestContext previous = CURRENT.get();
        CURRENT.set(context);
        putMdc(context);
        return new Scope(previous);
    }

    public static Optional<RequestContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    private static void putMdc(RequestContext context) {
        putOrRemove("requestUrl", context.url());
        putOrRemove("requestMethod", context.method());
        putOrRemove("userId", context.userId());
    }

    private static void clearMdc() {
        MDC.remove("requestUrl");
        MDC.remove("requestMethod");
        MDC.remove("userId");
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    /**
     * Handle returned by {@link #bind(RequestContext)}.
     */
    public static final class Scope implements AutoCloseable {

        private final RequestContext previous;
        private boolean closed;

        private Scope(RequestContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (previous == null) {
                CURRENT.remove();
                clearMdc();
            } else {
                CURRENT.set(previous);
                putMdc(previous);
            }
        }
    }
}
