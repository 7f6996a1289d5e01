package io.switchboard.core.config;

import io.switchboard.core.alias.AliasTable;
import io.switchboard.core.config.model.CacheSettings;
import io.switchboard.core.config.model.MiddlewareSettings;
import io.switchboard.core.provider.ProviderConfig;
import java.util.List;

/**
 * Validated configuration snapshot, ready to hand to the registry and the alias service.
 */
public record GatewayConfiguration(
    List<ProviderConfig> providers,
    String defaultProvider,
    AliasTable aliases,
    CacheSettings cache,
    MiddlewareSettings middleware
) {

    public GatewayConfiguration {
        providers = List.copyOf(providers);
    }
}
