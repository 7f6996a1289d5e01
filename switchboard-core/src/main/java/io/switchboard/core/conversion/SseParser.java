package io.switchboard.core.conversion;

import java.util.Optional;

/**
 * Incremental parser for {@code text/event-stream} bodies, fed one line at a time.
 *
 * <pre>{@code
 * event: content_block_delta
 * data: {"type":"content_block_delta","delta":{"type":"text_delta","text":"Hello"}}
 *
 * }</pre>
 *
 * <p>Not thread-safe; use one parser per stream.
 */
public final class SseParser {
    private String event;
    private StringBuilder data;

    /**
     * Consumes one line without its terminator. Returns the event completed by a blank line.
     */
    public Optional<SseEvent> accept(String line) {
        if (line == null || line.isEmpty()) {
            return flush();
        }
        if (line.startsWith(":")) {
            return Optional.empty();
        }
        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }
        if ("event".equals(field)) {
            event = value.trim();
        } else if ("data".equals(field)) {
            if (data == null) {
                data = new StringBuilder(value);
            } else {
                data.append('\n').append(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Emits whatever is buffered, for streams that end without a trailing blank line.
     */
    public Optional<SseEvent> flush() {
        if (data == null) {
            event = null;
            return Optional.empty();
        }
        SseEvent completed = new SseEvent(event, data.toString());
        event = null;
        data = null;
        return Optional.of(completed);
    }
}
