package io.switchboard.core.error;

public final class ConfigurationValidationException extends GatewayException {

    public ConfigurationValidationException(String message) {
        super(ErrorCategory.CONFIGURATION, message);
    }

    public ConfigurationValidationException(String message, Throwable cause) {
        super(ErrorCategory.CONFIGURATION, message, cause);
    }
}
