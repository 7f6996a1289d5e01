package io.switchboard.core.error;

/**
 * Upstream answered with a success status but a body that is not valid JSON. Not retried.
 */
public final class UpstreamResponseException extends GatewayException {

    public UpstreamResponseException(String provider, Throwable cause) {
        super(ErrorCategory.UPSTREAM, "Provider '" + provider + "' returned an unreadable response: " + cause.getMessage(), cause);
    }
}
