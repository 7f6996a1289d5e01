package io.switchboard.core.middleware;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded TTL store of thought signatures, keyed by conversation id and then tool call id.
 */
public final class ThoughtSignatureStore {
    private final Duration ttl;
    private final int maxConversations;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public ThoughtSignatureStore(Duration ttl, int maxConversations, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (maxConversations <= 0) {
            throw new IllegalArgumentException("maxConversations must be > 0");
        }
        this.ttl = ttl;
        this.maxConversations = maxConversations;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void put(String conversationId, Map<String, String> signatures) {
        if (conversationId == null || signatures == null || signatures.isEmpty()) {
            return;
        }
        long now = clock.millis();
        entries.compute(conversationId, (id, existing) -> {
            Map<String, String> merged = new LinkedHashMap<>();
            if (existing != null && existing.expiresAtMs() > now) {
                merged.putAll(existing.signatures());
            }
            merged.putAll(signatures);
            return new Entry(Map.copyOf(merged), now + ttl.toMillis(), now);
        });
        evictOverflow();
    }

    public Map<String, String> get(String conversationId) {
        if (conversationId == null) {
            return Map.of();
        }
        Entry entry = entries.get(conversationId);
        if (entry == null) {
            return Map.of();
        }
        if (entry.expiresAtMs() <= clock.millis()) {
            entries.remove(conversationId, entry);
            return Map.of();
        }
        return entry.signatures();
    }

    /**
     * Removes expired conversations and returns how many were dropped.
     */
    public int cleanupExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.expiresAtMs() <= now);
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private void evictOverflow() {
        while (entries.size() > maxConversations) {
            entries.entrySet().stream()
                .min(Comparator.comparingLong(e -> e.getValue().updatedAtMs()))
                .ifPresent(oldest -> entries.remove(oldest.getKey(), oldest.getValue()));
        }
    }

    private record Entry(Map<String, String> signatures, long expiresAtMs, long updatedAtMs) {
    }
}
