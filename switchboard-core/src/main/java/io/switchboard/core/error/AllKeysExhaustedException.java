package io.switchboard.core.error;

public final class AllKeysExhaustedException extends GatewayException {
    private final String provider;

    public AllKeysExhaustedException(String provider) {
        super(ErrorCategory.RATE_LIMITED, "All API keys for provider '" + provider + "' exhausted");
        this.provider = provider;
    }

    public AllKeysExhaustedException(String provider, Throwable lastFailure) {
        super(ErrorCategory.RATE_LIMITED, "All API keys for provider '" + provider + "' exhausted", lastFailure);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
