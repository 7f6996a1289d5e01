package io.switchboard.core.alias;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every alias known to the gateway.
 *
 * <p>Providers keep their declaration order; that order breaks ties between equally good
 * substring matches. Fallback aliases sit underneath the explicit ones: an explicit alias
 * with the same name replaces the fallback. A reload publishes a whole new table.
 */
public final class AliasTable {
    private static final AliasTable EMPTY = new AliasTable(List.of(), null, Map.of(), Map.of());

    private final List<String> providers;
    private final String defaultProvider;
    private final Map<String, Map<String, String>> explicitAliases;
    private final Map<String, Map<String, String>> fallbackAliases;
    private final Map<String, Map<String, String>> effective;

    private AliasTable(
        List<String> providers,
        String defaultProvider,
        Map<String, Map<String, String>> explicitAliases,
        Map<String, Map<String, String>> fallbackAliases
    ) {
        List<String> order = new ArrayList<>();
        for (String provider : providers) {
            String normalized = AliasNames.normalize(provider);
            if (!normalized.isEmpty() && !order.contains(normalized)) {
                order.add(normalized);
            }
        }
        this.explicitAliases = copyNormalized(explicitAliases, order);
        this.fallbackAliases = copyNormalized(fallbackAliases, order);
        this.providers = List.copyOf(order);
        this.defaultProvider = defaultProvider == null || defaultProvider.isBlank()
            ? null
            : AliasNames.normalize(defaultProvider);

        Map<String, Map<String, String>> merged = new LinkedHashMap<>();
        for (String provider : this.providers) {
            Map<String, String> aliases = new LinkedHashMap<>(this.fallbackAliases.getOrDefault(provider, Map.of()));
            aliases.putAll(this.explicitAliases.getOrDefault(provider, Map.of()));
            if (!aliases.isEmpty()) {
                merged.put(provider, Collections.unmodifiableMap(aliases));
            }
        }
        this.effective = Collections.unmodifiableMap(merged);
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    public static AliasTable of(
        List<String> providers,
        String defaultProvider,
        Map<String, Map<String, String>> explicitAliases,
        Map<String, Map<String, String>> fallbackAliases
    ) {
        return new AliasTable(
            providers == null ? List.of() : providers,
            defaultProvider,
            explicitAliases == null ? Map.of() : explicitAliases,
            fallbackAliases == null ? Map.of() : fallbackAliases
        );
    }

    public List<String> providers() {
        return providers;
    }

    public Optional<String> defaultProvider() {
        return Optional.ofNullable(defaultProvider);
    }

    public boolean knowsProvider(String provider) {
        return providers.contains(AliasNames.normalize(provider));
    }

    /**
     * Position of the provider in configuration order, or {@link Integer#MAX_VALUE} when unknown.
     */
    public int providerRank(String provider) {
        int index = providers.indexOf(AliasNames.normalize(provider));
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    public Map<String, String> aliasesFor(String provider) {
        return effective.getOrDefault(AliasNames.normalize(provider), Map.of());
    }

    public Map<String, Map<String, String>> allAliases() {
        return effective;
    }

    public Map<String, Map<String, String>> fallbackAliases() {
        return fallbackAliases;
    }

    public boolean isFallback(String provider, String alias) {
        String p = AliasNames.normalize(provider);
        String a = AliasNames.normalize(alias);
        return fallbackAliases.getOrDefault(p, Map.of()).containsKey(a)
            && !explicitAliases.getOrDefault(p, Map.of()).containsKey(a);
    }

    public int size() {
        return effective.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Exact lookup, allowing hyphen and underscore to stand in for each other.
     */
    public Optional<String> lookup(String provider, String alias) {
        Map<String, String> aliases = aliasesFor(provider);
        if (aliases.isEmpty()) {
            return Optional.empty();
        }
        for (String variation : AliasNames.variations(alias)) {
            String target = aliases.get(variation);
            if (target != null) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    private static Map<String, Map<String, String>> copyNormalized(
        Map<String, Map<String, String>> source,
        List<String> order
    ) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> entry : source.entrySet()) {
            String provider = AliasNames.normalize(entry.getKey());
            if (provider.isEmpty() || entry.getValue() == null) {
                continue;
            }
            if (!order.contains(provider)) {
                order.add(provider);
            }
            Map<String, String> aliases = new LinkedHashMap<>(copy.getOrDefault(provider, Map.of()));
            for (Map.Entry<String, String> alias : entry.getValue().entrySet()) {
                String name = AliasNames.normalize(alias.getKey());
                String target = alias.getValue() == null ? "" : alias.getValue().trim();
                if (!name.isEmpty() && !target.isEmpty()) {
                    aliases.put(name, target);
                }
            }
            copy.put(provider, Collections.unmodifiableMap(aliases));
        }
        return Collections.unmodifiableMap(copy);
    }
}
