package io.switchboard.core.middleware;

import java.util.Map;

/**
 * One stage of the {@link MiddlewareChain}.
 *
 * <p>Hooks return a new context instead of changing the one they receive. Defaults pass the
 * context through, so an implementation only overrides the phases it cares about.
 */
public interface Middleware {

    String name();

    default boolean shouldHandle(String provider, String model) {
        return true;
    }

    default RequestContext beforeRequest(RequestContext context) {
        return context;
    }

    default ResponseContext afterResponse(ResponseContext context) {
        return context;
    }

    default StreamChunkContext onStreamChunk(StreamChunkContext context) {
        return context;
    }

    /**
     * Called once per stream after the final chunk, or when the stream ends early.
     */
    default void onStreamComplete(RequestContext request, Map<String, Object> accumulatedMetadata) {
    }

    default void initialize() throws Exception {
    }

    default void cleanup() throws Exception {
    }
}
