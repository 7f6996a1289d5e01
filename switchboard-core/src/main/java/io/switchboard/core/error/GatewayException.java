package io.switchboard.core.error;

import java.util.Objects;

/**
 * Base of every failure the gateway surfaces to a client.
 *
 * <p>The {@link ErrorCategory} is stable so callers can tell "try another key or provider"
 * apart from "fix the request".
 */
public abstract class GatewayException extends RuntimeException {
    private final ErrorCategory category;

    protected GatewayException(ErrorCategory category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    protected GatewayException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    public ErrorCategory category() {
        return category;
    }
}
