package io.switchboard.core.alias;

import java.util.Objects;

/**
 * Input to one resolution attempt. Strategies that recurse build a fresh context instead
 * of changing this one.
 *
 * @param model raw model string as sent by the client
 * @param provider explicit provider scope, may be {@code null}
 * @param defaultProvider provider used for bare names, may be {@code null}
 * @param aliases alias snapshot the attempt runs against
 */
public record ResolutionContext(String model, String provider, String defaultProvider, AliasTable aliases) {

    public ResolutionContext {
        model = model == null ? "" : model.trim();
        provider = provider == null || provider.isBlank() ? null : AliasNames.normalize(provider);
        defaultProvider = defaultProvider == null || defaultProvider.isBlank()
            ? null
            : AliasNames.normalize(defaultProvider);
        Objects.requireNonNull(aliases, "aliases must not be null");
    }

    public static ResolutionContext of(String model, String provider, AliasTable aliases) {
        return new ResolutionContext(model, provider, aliases.defaultProvider().orElse(null), aliases);
    }

    public ResolutionContext withModel(String newModel) {
        return new ResolutionContext(newModel, provider, defaultProvider, aliases);
    }

    public ResolutionContext withProvider(String newProvider) {
        return new ResolutionContext(model, newProvider, defaultProvider, aliases);
    }
}
