package io.switchboard.core.provider;

/**
 * Credentials to use for one upstream call.
 *
 * @param apiKey key for the first attempt
 * @param rotation rotation function over the provider's keys, {@code null} in passthrough mode
 */
public record AuthParams(String provider, String apiKey, boolean passthrough, KeyRotation rotation) {

    static AuthParams passthrough(String provider, String clientKey) {
        return new AuthParams(provider, clientKey, true, null);
    }

    static AuthParams rotating(String provider, String firstKey, KeyRotation rotation) {
        return new AuthParams(provider, firstKey, false, rotation);
    }

    public boolean canRotate() {
        return rotation != null;
    }
}
