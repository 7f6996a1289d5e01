package io.switchboard.core.upstream;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.provider.ProviderConfig;
import java.util.Objects;

/**
 * One call to a provider, already in the provider's dialect.
 */
public record UpstreamRequest(ProviderConfig provider, String apiKey, ObjectNode body, String requestId) {

    public UpstreamRequest {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    public UpstreamRequest withApiKey(String key) {
        return new UpstreamRequest(provider, key, body, requestId);
    }
}
