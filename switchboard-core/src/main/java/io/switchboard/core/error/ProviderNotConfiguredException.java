package io.switchboard.core.error;

import java.util.Collection;

public final class ProviderNotConfiguredException extends GatewayException {
    private final String provider;

    public ProviderNotConfiguredException(String provider, Collection<String> available) {
        super(
            ErrorCategory.NOT_FOUND,
            "Provider '" + provider + "' not found. Available providers: " + String.join(", ", available)
        );
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
