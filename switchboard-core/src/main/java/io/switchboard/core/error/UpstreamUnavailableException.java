package io.switchboard.core.error;

/**
 * Upstream could not be reached or the connection broke before a status arrived.
 */
public final class UpstreamUnavailableException extends GatewayException {

    public UpstreamUnavailableException(String provider, Throwable cause) {
        super(ErrorCategory.UPSTREAM, "Provider '" + provider + "' unavailable: " + cause.getMessage(), cause);
    }
}
