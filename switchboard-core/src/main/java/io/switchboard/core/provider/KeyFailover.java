package io.switchboard.core.provider;

import io.switchboard.core.error.AllKeysExhaustedException;
import io.switchboard.core.error.UpstreamHttpException;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an upstream call, moving to the next key on auth or quota failures.
 *
 * <p>Every failed key joins the exclusion set in the order it failed, so the loop ends after
 * at most one attempt per configured key.
 */
public final class KeyFailover {
    private static final Logger LOG = LoggerFactory.getLogger(KeyFailover.class);

    public <T> T execute(AuthParams auth, UpstreamCall<T> call) {
        Objects.requireNonNull(auth, "auth must not be null");
        Objects.requireNonNull(call, "call must not be null");
        if (!auth.canRotate()) {
            return call.call(auth.apiKey());
        }

        Set<String> excluded = new LinkedHashSet<>();
        String key = auth.apiKey();
        while (true) {
            try {
                return call.call(key);
            } catch (UpstreamHttpException e) {
                if (!RotationPolicy.shouldRotate(e.status(), e.body())) {
                    throw e;
                }
                excluded.add(key);
                LOG.warn(
                    "Key {} for provider {} rejected with HTTP {}, rotating",
                    KeyHashes.shortHash(key),
                    auth.provider(),
                    e.status()
                );
                KeySelection next = auth.rotation().next(excluded);
                if (next.isExhausted()) {
                    LOG.warn("All keys for provider {} exhausted after {} attempts", auth.provider(), excluded.size());
                    throw new AllKeysExhaustedException(auth.provider(), e);
                }
                key = next.key();
            }
        }
    }
}
