package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheSettings(
    @JsonAlias({"ttl_seconds"}) long ttlSeconds,
    @JsonAlias({"max_size"}) int maxSize,
    @JsonAlias({"max_chain_length"}) int maxChainLength
) {

    public CacheSettings {
        ttlSeconds = ttlSeconds <= 0 ? 3600 : ttlSeconds;
        maxSize = maxSize <= 0 ? 1000 : maxSize;
        maxChainLength = maxChainLength <= 0 ? 8 : maxChainLength;
    }

    public static CacheSettings defaults() {
        return new CacheSettings(3600, 1000, 8);
    }
}
