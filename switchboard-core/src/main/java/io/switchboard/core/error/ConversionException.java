package io.switchboard.core.error;

public final class ConversionException extends GatewayException {

    public ConversionException(String message) {
        super(ErrorCategory.INVALID_REQUEST, message);
    }

    public ConversionException(String message, Throwable cause) {
        super(ErrorCategory.INVALID_REQUEST, message, cause);
    }
}
