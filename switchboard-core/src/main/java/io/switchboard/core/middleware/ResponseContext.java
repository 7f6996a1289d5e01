package io.switchboard.core.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one upstream response, already in the client's wire format.
 */
public record ResponseContext(
    JsonNode body,
    RequestContext request,
    boolean streaming,
    Map<String, Object> metadata
) {

    public ResponseContext {
        body = body == null ? JsonNodeFactory.instance.objectNode() : body.deepCopy();
        Objects.requireNonNull(request, "request must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ResponseContext of(JsonNode body, RequestContext request) {
        return new ResponseContext(body, request, false, Map.of());
    }

    @Override
    public JsonNode body() {
        return body.deepCopy();
    }

    public ResponseContext withBody(JsonNode newBody) {
        return new ResponseContext(newBody, request, streaming, metadata);
    }

    public ResponseContext withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new ResponseContext(body, request, streaming, merged);
    }
}
