package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.domain.error.ApplicationError;
import fr.lapetina.resilience.domain.error.ErrorKind;
import fr.lapetina.resilience.infrastructure.handler.ErrorHandler;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Treats cache backend failures as cache misses.
 *
 * A failing read is reported once through the {@link ErrorHandler} as a CACHE error and
 * the caller gets an empty result, so it falls through to the source of truth.
 */
public final class CacheFallback {

    private final ErrorHandler errorHandler;

    public CacheFallback(ErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    /**
     * Reads from the cache.
     *
     * @param cacheKey key being read, used in the error details
     * @param read     the cache read; a null result is a miss
     * @return the cached value, or empty on a miss or a backend failure
     */
    public <T> Optional<T> get(String cacheKey, Callable<T> read) {
        try {
            return Optional.ofNullable(read.call());
        } catch (Exception e) {
            ApplicationError error = e instanceof ApplicationError typed && typed.getKind() == ErrorKind.CACHE
                    ? typed
                    : ApplicationError.cache("get", cacheKey, String.valueOf(e.getMessage()));
            errorHandler.handle(error, Map.of("fallback", "cache_miss"));
            return Optional.empty();
        }
    }

    /**
     * Writes to the cache. A failing write is reported and otherwise ignored.
     *
     * @return true if the write succeeded
     */
    public boolean put(String cacheKey, Runnable write) {
        try {
            write.run();
            return true;
        } catch (RuntimeException e) {
            ApplicationError error = e instanceof ApplicationError typed && typed.getKind() == ErrorKind.CACHE
                    ? typed
                    : ApplicationError.cache("set", cacheKey, String.valueOf(e.getMessage()));
            errorHandler.handle(error, Map.of("fallback", "skip_write"));
            return false;
        }
    }
}
