package io.switchboard.core.provider;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rotation function bound to one provider's key list and its shared cursor.
 */
public final class KeyRotation {
    private final String provider;
    private final List<String> keys;
    private final RotationCursor cursor;

    KeyRotation(String provider, List<String> keys, RotationCursor cursor) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.keys = List.copyOf(keys);
        this.cursor = Objects.requireNonNull(cursor, "cursor must not be null");
    }

    public String provider() {
        return provider;
    }

    public int keyCount() {
        return keys.size();
    }

    /**
     * Advances the provider's round-robin cursor until a key outside {@code exclude} comes up.
     * At most one full turn is made.
     */
    public KeySelection next(Set<String> exclude) {
        Set<String> excluded = exclude == null ? Set.of() : exclude;
        if (keys.isEmpty() || excluded.size() >= keys.size()) {
            return KeySelection.exhausted(provider);
        }
        for (int attempt = 0; attempt < keys.size(); attempt++) {
            String candidate = cursor.advance(keys);
            if (!excluded.contains(candidate)) {
                return KeySelection.of(provider, candidate);
            }
        }
        return KeySelection.exhausted(provider);
    }
}
