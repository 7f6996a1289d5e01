package io.switchboard.core.model;

import java.util.Locale;

/**
 * The two chat dialects the gateway speaks, on either side of a request.
 */
public enum WireFormat {
    /** Role and content-block messages, {@code POST /v1/messages}. */
    ANTHROPIC,
    /** Chat-message completions, {@code POST /v1/chat/completions}. */
    OPENAI;

    public static WireFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "anthropic", "claude", "messages" -> ANTHROPIC;
            case "openai", "chat", "chat_completions" -> OPENAI;
            default -> throw new IllegalArgumentException("Unknown api format: " + value);
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
