package io.switchboard.core.conversion;

/**
 * One server-sent event.
 *
 * @param event event name, {@code null} for plain {@code data:} events
 * @param data payload of the {@code data:} lines, joined with newlines
 */
public record SseEvent(String event, String data) {
    public static final String DONE = "[DONE]";

    public SseEvent {
        data = data == null ? "" : data;
    }

    public static SseEvent data(String data) {
        return new SseEvent(null, data);
    }

    public static SseEvent named(String event, String data) {
        return new SseEvent(event, data);
    }

    public static SseEvent done() {
        return new SseEvent(null, DONE);
    }

    public boolean isDone() {
        return DONE.equals(data.trim());
    }

    public String toWire() {
        StringBuilder out = new StringBuilder();
        if (event != null) {
            out.append("event: ").append(event).append('\n');
        }
        for (String line : data.split("\n", -1)) {
            out.append("data: ").append(line).append('\n');
        }
        return out.append('\n').toString();
    }
}
