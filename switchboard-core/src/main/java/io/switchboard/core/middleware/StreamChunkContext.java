package io.switchboard.core.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One streamed delta in the client's wire format.
 *
 * @param accumulatedMetadata metadata gathered by earlier chunks of the same stream
 * @param complete {@code true} on the last chunk
 */
public record StreamChunkContext(
    JsonNode delta,
    RequestContext request,
    Map<String, Object> accumulatedMetadata,
    boolean complete
) {

    public StreamChunkContext {
        delta = delta == null ? JsonNodeFactory.instance.objectNode() : delta.deepCopy();
        Objects.requireNonNull(request, "request must not be null");
        accumulatedMetadata = accumulatedMetadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(accumulatedMetadata));
    }

    @Override
    public JsonNode delta() {
        return delta.deepCopy();
    }

    public StreamChunkContext withDelta(JsonNode newDelta) {
        return new StreamChunkContext(newDelta, request, accumulatedMetadata, complete);
    }

    public StreamChunkContext withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(accumulatedMetadata);
        merged.put(key, value);
        return new StreamChunkContext(delta, request, merged, complete);
    }
}
