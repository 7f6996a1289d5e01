package io.switchboard.core.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Short SHA-256 fingerprints for logging keys without revealing them.
 */
public final class KeyHashes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private KeyHashes() {
    }

    public static String shortHash(String key) {
        if (key == null || key.isEmpty()) {
            return "none";
        }
        if (ProviderConfig.PASSTHROUGH_SENTINEL.equals(key)) {
            return "PASSTHRU";
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(8);
            for (int i = 0; i < 4; i++) {
                out.append(HEX[(digest[i] >> 4) & 0x0f]).append(HEX[digest[i] & 0x0f]);
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
