package io.switchboard.core.alias;

import io.switchboard.core.error.CircularAliasException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point for model resolution.
 *
 * <p>Readers dereference one {@link Snapshot} per call and never see a partially replaced
 * table. {@link #reload(AliasTable)} invalidates the cache and then publishes the new
 * snapshot with the new generation.
 */
public final class AliasService {
    private static final Logger LOG = LoggerFactory.getLogger(AliasService.class);

    private final AliasResolverChain chain;
    private final ResolutionCache cache;
    private final AtomicReference<Snapshot> snapshot;

    public AliasService(AliasTable table) {
        this(table, new AliasResolverChain(), new ResolutionCache());
    }

    public AliasService(AliasTable table, AliasResolverChain chain, ResolutionCache cache) {
        this.chain = Objects.requireNonNull(chain, "chain must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.snapshot = new AtomicReference<>(new Snapshot(
            Objects.requireNonNull(table, "table must not be null"),
            cache.generation()
        ));
    }

    /**
     * Resolves a raw client model string.
     *
     * @param rawModel model as sent by the client, e.g. {@code fast}, {@code poe:fast}, {@code !openai:gpt-4o}
     * @param explicitProvider provider scope chosen outside the model string, may be {@code null}
     * @throws CircularAliasException when alias targets loop or chain too deep
     */
    public ResolutionResult resolve(String rawModel, String explicitProvider) {
        Snapshot current = snapshot.get();
        String key = cacheKey(rawModel, explicitProvider);
        var cached = cache.get(key, current.generation());
        if (cached.isPresent()) {
            LOG.debug("Alias cache hit for '{}'", key);
            return cached.get();
        }
        ResolutionResult result = chain.resolve(ResolutionContext.of(rawModel, explicitProvider, current.table()));
        cache.put(key, result, current.generation());
        return result;
    }

    public ResolutionResult resolve(String rawModel) {
        return resolve(rawModel, null);
    }

    public void reload(AliasTable table) {
        Objects.requireNonNull(table, "table must not be null");
        long generation = cache.invalidateAll();
        snapshot.set(new Snapshot(table, generation));
        LOG.info("Published alias table with {} aliases across {} providers", table.size(), table.allAliases().size());
    }

    public AliasTable table() {
        return snapshot.get().table();
    }

    public ResolutionCache.CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * Aliases of the given providers only, typically those with usable credentials.
     */
    public Map<String, Map<String, String>> activeAliases(Set<String> activeProviders) {
        Map<String, Map<String, String>> active = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> entry : table().allAliases().entrySet()) {
            if (activeProviders.contains(entry.getKey())) {
                active.put(entry.getKey(), entry.getValue());
            }
        }
        return active;
    }

    private static String cacheKey(String rawModel, String explicitProvider) {
        String provider = explicitProvider == null ? "" : AliasNames.normalize(explicitProvider);
        return provider + "|" + (rawModel == null ? "" : rawModel.trim());
    }

    private record Snapshot(AliasTable table, long generation) {
    }
}
