package io.switchboard.core.conversion;

import java.util.List;

/**
 * Turns upstream stream events into events of the client's dialect.
 *
 * <p>Stateful; one instance per stream.
 */
public interface StreamTranslator {

    List<SseEvent> translate(SseEvent upstream);

    /**
     * Events still owed to the client once upstream has ended. Safe to call more than once.
     */
    List<SseEvent> finish();

    static StreamTranslator passThrough() {
        return new StreamTranslator() {
            @Override
            public List<SseEvent> translate(SseEvent upstream) {
                return List.of(upstream);
            }

            @Override
            public List<SseEvent> finish() {
                return List.of();
            }
        };
    }
}
