package io.switchboard.core.error;

public final class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(ErrorCategory.INVALID_REQUEST, message);
    }
}
