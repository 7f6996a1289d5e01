package io.switchboard.core.error;

import java.util.List;

public final class CircularAliasException extends GatewayException {
    private final List<String> chain;

    public CircularAliasException(String message, List<String> chain) {
        super(ErrorCategory.INVALID_REQUEST, message);
        this.chain = chain == null ? List.of() : List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
