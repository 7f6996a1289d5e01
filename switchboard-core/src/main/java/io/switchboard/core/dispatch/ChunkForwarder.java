package io.switchboard.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.conversion.SseEvent;
import io.switchboard.core.middleware.StreamSession;
import java.util.function.Consumer;

/**
 * Runs client-format events through the stream session before forwarding them.
 *
 * <p>One event is held back so the last one can be flagged as final. {@code [DONE]} markers
 * carry no payload and bypass middleware.
 */
final class ChunkForwarder {
    private final StreamSession session;
    private final Consumer<SseEvent> downstream;
    private final ObjectMapper mapper;
    private SseEvent pendingEvent;
    private JsonNode pendingPayload;

    ChunkForwarder(StreamSession session, Consumer<SseEvent> downstream, ObjectMapper mapper) {
        this.session = session;
        this.downstream = downstream;
        this.mapper = mapper;
    }

    void accept(SseEvent event) {
        if (event.isDone()) {
            flush(true);
            downstream.accept(event);
            return;
        }
        JsonNode payload;
        try {
            payload = mapper.readTree(event.data());
        } catch (JsonProcessingException e) {
            downstream.accept(event);
            return;
        }
        flush(false);
        pendingEvent = event;
        pendingPayload = payload;
    }

    void finish() {
        flush(true);
    }

    private void flush(boolean last) {
        if (pendingEvent == null) {
            return;
        }
        SseEvent event = pendingEvent;
        JsonNode payload = pendingPayload;
        pendingEvent = null;
        pendingPayload = null;
        JsonNode processed = session.process(payload, last);
        try {
            downstream.accept(new SseEvent(event.event(), mapper.writeValueAsString(processed)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream chunk", e);
        }
    }
}
