package io.switchboard.core.provider;

import java.util.List;
import java.util.Locale;

/**
 * Decides which upstream failures move on to the next key.
 */
public final class RotationPolicy {
    private static final List<String> QUOTA_MARKERS = List.of(
        "insufficient_quota",
        "insufficient quota",
        "quota exceeded",
        "billing"
    );

    private RotationPolicy() {
    }

    public static boolean shouldRotate(int status, String body) {
        if (status == 401 || status == 403 || status == 429) {
            return true;
        }
        if (status < 400 || status >= 500 || body == null) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        for (String marker : QUOTA_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
