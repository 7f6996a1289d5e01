package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SwitchboardConfig(
    @JsonAlias({"default_provider"}) String defaultProvider,
    Map<String, ProviderSettings> providers,
    @JsonAlias({"fallback_aliases"}) Map<String, Map<String, String>> fallbackAliases,
    CacheSettings cache,
    MiddlewareSettings middleware
) {

    public SwitchboardConfig {
        providers = providers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(providers);
        fallbackAliases = fallbackAliases == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fallbackAliases);
        cache = cache == null ? CacheSettings.defaults() : cache;
        middleware = middleware == null ? MiddlewareSettings.defaults() : middleware;
    }

    public static SwitchboardConfig defaults() {
        return new SwitchboardConfig(
            null,
            Map.of(),
            Map.of(),
            CacheSettings.defaults(),
            MiddlewareSettings.defaults()
        );
    }

    public SwitchboardConfig withProviders(Map<String, ProviderSettings> newProviders) {
        return new SwitchboardConfig(defaultProvider, newProviders, fallbackAliases, cache, middleware);
    }

    public SwitchboardConfig withDefaultProvider(String newDefault) {
        return new SwitchboardConfig(newDefault, providers, fallbackAliases, cache, middleware);
    }
}
