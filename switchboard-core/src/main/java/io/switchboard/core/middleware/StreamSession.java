package io.switchboard.core.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Middleware view of one stream. Metadata returned by chunk hooks accumulates across the
 * stream, and completion fires exactly once: after the final chunk, or on {@link #close()}
 * when the stream ended early.
 *
 * <p>One session per stream; not shared between threads.
 */
public final class StreamSession implements AutoCloseable {
    private final MiddlewareChain chain;
    private final RequestContext request;
    private final Map<String, Object> accumulated = new LinkedHashMap<>();
    private boolean completed;
    private int chunks;

    StreamSession(MiddlewareChain chain, RequestContext request) {
        this.chain = chain;
        this.request = request;
    }

    /**
     * Runs {@code delta} through the chunk hooks and returns the delta to forward.
     */
    public JsonNode process(JsonNode delta, boolean last) {
        if (completed) {
            throw new IllegalStateException("Stream " + request.requestId() + " already completed");
        }
        StreamChunkContext result = chain.processStreamChunk(
            new StreamChunkContext(delta, request, accumulated, last)
        );
        accumulated.putAll(result.accumulatedMetadata());
        chunks++;
        if (last) {
            complete();
        }
        return result.delta();
    }

    public Map<String, Object> accumulatedMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(accumulated));
    }

    public int chunkCount() {
        return chunks;
    }

    public boolean isCompleted() {
        return completed;
    }

    private void complete() {
        if (completed) {
            return;
        }
        completed = true;
        chain.completeStream(request, Collections.unmodifiableMap(new LinkedHashMap<>(accumulated)));
    }

    @Override
    public void close() {
        complete();
    }
}
