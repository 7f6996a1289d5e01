package io.switchboard.core.error;

public final class MissingClientKeyException extends GatewayException {

    public MissingClientKeyException(String provider) {
        super(
            ErrorCategory.UNAUTHORIZED,
            "Provider '" + provider + "' requires API key passthrough, but no client API key was provided"
        );
    }
}
