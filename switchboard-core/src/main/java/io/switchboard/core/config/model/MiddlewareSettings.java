package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MiddlewareSettings(
    @JsonAlias({"thought_signatures"}) ThoughtSignatureSettings thoughtSignatures
) {

    public MiddlewareSettings {
        thoughtSignatures = thoughtSignatures == null ? ThoughtSignatureSettings.defaults() : thoughtSignatures;
    }

    public static MiddlewareSettings defaults() {
        return new MiddlewareSettings(ThoughtSignatureSettings.defaults());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThoughtSignatureSettings(
        Boolean enabled,
        @JsonAlias({"ttl_seconds"}) long ttlSeconds,
        @JsonAlias({"max_conversations"}) int maxConversations,
        @JsonAlias({"cleanup_interval_seconds"}) long cleanupIntervalSeconds
    ) {

        public ThoughtSignatureSettings {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            ttlSeconds = ttlSeconds <= 0 ? 3600 : ttlSeconds;
            maxConversations = maxConversations <= 0 ? 10_000 : maxConversations;
            cleanupIntervalSeconds = cleanupIntervalSeconds <= 0 ? 300 : cleanupIntervalSeconds;
        }

        public static ThoughtSignatureSettings defaults() {
            return new ThoughtSignatureSettings(true, 3600, 10_000, 300);
        }
    }
}
