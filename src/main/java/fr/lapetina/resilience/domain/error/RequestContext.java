package fr.lapetina.resilience.domain.error;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Snapshot of the ambient request an error was raised under.
 * Immutable and thread-safe.
 */
public record RequestContext(
        String url,
        String method,
        @JsonProperty("remote_addr") String remoteAddr,
        @JsonProperty("user_agent") String userAgent,
        @JsonProperty("user_id") String userId
) {
    public RequestContext {
        if (userAgent == null) {
            userAgent = "";
        }
    }

    public static RequestContext of(String url, String method) {
        return new RequestContext(url, method, null, null, null);
    }

    public RequestContext withUserId(String userId) {
        return new RequestContext(url, method, remoteAddr, userAgent, userId);
    }

    public Map<String, Object> toMap() {
        return ReportMapper.toMap(this);
    }
}
