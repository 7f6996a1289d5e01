package io.switchboard.core.provider;

import io.switchboard.core.error.AllKeysExhaustedException;

/**
 * Result of asking a {@link KeyRotation} for the next key: either a key or exhaustion.
 */
public record KeySelection(String provider, String key) {

    public static KeySelection of(String provider, String key) {
        return new KeySelection(provider, key);
    }

    public static KeySelection exhausted(String provider) {
        return new KeySelection(provider, null);
    }

    public boolean isExhausted() {
        return key == null;
    }

    public String orElseThrow() {
        if (key == null) {
            throw new AllKeysExhaustedException(provider);
        }
        return key;
    }
}
