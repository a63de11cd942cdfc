package fr.lapetina.resilience.infrastructure.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide error counters keyed by error type and by {@code type:code} pattern.
 *
 * Counters only grow. Each key is incremented atomically, so concurrent
 * recordings are neither lost nor double counted.
 */
public final class ErrorMetrics {

    private static final Logger log = LoggerFactory.getLogger(ErrorMetrics.class);

    static final int TOP_ERRORS_LIMIT = 10;

    private final ConcurrentHashMap<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> errorPatterns = new ConcurrentHashMap<>();
    private final MetricsRegistry metricsRegistry;

    public ErrorMetrics(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    public ErrorMetrics() {
        this(null);
    }

    /**
     * Records one occurrence of an error.
     *
     * @param errorType report type name, e.g. {@code DatabaseError}
     * @param errorCode error code, may be null
     * @param context   free-form context, only logged
     */
    public void record(String errorType, String errorCode, Map<String, Object> context) {
        String type = errorType != null ? errorType : "Unknown";
        String pattern = errorCode != null ? type + ":" + errorCode : type;

        long typeCount = errorCounts.computeIfAbsent(type, k -> new AtomicLong()).incrementAndGet();
        long patternCount = errorPatterns.computeIfAbsent(pattern, k -> new AtomicLong()).incrementAndGet();

        if (metricsRegistry != null) {
            metricsRegistry.incrementErrorCount(type, errorCode);
        }

        log.atDebug()
                .setMessage("Error metrics updated: type={}, pattern={}, typeCount={}, patternCount={}")
                .addArgument(type)
                .addArgument(pattern)
                .addArgument(typeCount)
                .addArgument(patternCount)
                .addKeyValue("event_type", "error_recorded")
                .addKeyValue("context", context != null ? context : Map.of())
                .log();
    }

    public void record(String errorType, String errorCode) {
        record(errorType, errorCode, null);
    }

    public long getCount(String errorType) {
        AtomicLong count = errorCounts.get(errorType);
        return count != null ? count.get() : 0;
    }

    public long getPatternCount(String pattern) {
        AtomicLong count = errorPatterns.get(pattern);
        return count != null ? count.get() : 0;
    }

    /**
     * Returns totals, per-type and per-pattern counts, and the ten most frequent patterns.
     */
    public ErrorSummary summary() {
        Map<String, Long> counts = sortedSnapshot(errorCounts);
        Map<String, Long> patterns = sortedSnapshot(errorPatterns);

        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        List<ErrorSummary.PatternCount> top = patterns.entrySet().stream()
                .limit(TOP_ERRORS_LIMIT)
                .map(e -> new ErrorSummary.PatternCount(e.getKey(), e.getValue()))
                .toList();

        return new ErrorSummary(total, counts, patterns, top);
    }

    private static Map<String, Long> sortedSnapshot(Map<String, AtomicLong> source) {
        Map<String, Long> sorted = new LinkedHashMap<>();
        source.entrySet().stream()
                .map(e -> Map.entry(e.getKey(), e.getValue().get()))
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }
}
