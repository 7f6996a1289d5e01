package io.switchboard.core.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one in-flight request as middleware sees it.
 *
 * <p>{@code messages} is copied on the way in and on the way out, so neither the caller nor
 * a middleware can change a context after it was built. Use the {@code with*} methods.
 *
 * @param messages client messages in the client's wire format
 * @param provider resolved provider
 * @param model resolved model
 * @param conversationId groups requests of one conversation, may be {@code null}
 * @param clientApiKey key sent by the client, may be {@code null}
 */
public record RequestContext(
    JsonNode messages,
    String provider,
    String model,
    String requestId,
    String conversationId,
    Map<String, Object> metadata,
    String clientApiKey
) {

    public RequestContext {
        messages = messages == null ? JsonNodeFactory.instance.arrayNode() : messages.deepCopy();
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public JsonNode messages() {
        return messages.deepCopy();
    }

    public RequestContext withMessages(JsonNode newMessages) {
        return new RequestContext(newMessages, provider, model, requestId, conversationId, metadata, clientApiKey);
    }

    public RequestContext withProvider(String newProvider) {
        return new RequestContext(messages, newProvider, model, requestId, conversationId, metadata, clientApiKey);
    }

    public RequestContext withModel(String newModel) {
        return new RequestContext(messages, provider, newModel, requestId, conversationId, metadata, clientApiKey);
    }

    public RequestContext withConversationId(String newConversationId) {
        return new RequestContext(messages, provider, model, requestId, newConversationId, metadata, clientApiKey);
    }

    public RequestContext withMetadata(Map<String, Object> newMetadata) {
        return new RequestContext(messages, provider, model, requestId, conversationId, newMetadata, clientApiKey);
    }

    public RequestContext withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return withMetadata(merged);
    }
}
