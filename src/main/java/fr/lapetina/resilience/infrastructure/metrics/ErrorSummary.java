package fr.lapetina.resilience.infrastructure.metrics;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the error metrics.
 * Maps iterate in descending count order; {@code topErrors} holds at most ten patterns.
 */
public record ErrorSummary(
        @JsonProperty("total_errors") long totalErrors,
        @JsonProperty("error_counts") Map<String, Long> errorCounts,
        @JsonProperty("error_patterns") Map<String, Long> errorPatterns,
        @JsonProperty("top_errors") List<PatternCount> topErrors
) {
    public ErrorSummary {
        errorCounts = Collections.unmodifiableMap(new LinkedHashMap<>(errorCounts));
        errorPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(errorPatterns));
        topErrors = List.copyOf(topErrors);
    }

    /**
     * A pattern and its count, serialized as a two-element array.
     */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"pattern", "count"})
    public record PatternCount(String pattern, long count) {
    }
}
