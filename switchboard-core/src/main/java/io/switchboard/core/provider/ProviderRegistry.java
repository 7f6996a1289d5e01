package io.switchboard.core.provider;

import io.switchboard.core.error.MissingClientKeyException;
import io.switchboard.core.error.ProviderNotConfiguredException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the configured providers and owns their rotation cursors.
 *
 * <p>The provider map is replaced as a whole on reload; cursors are kept per provider name
 * so round-robin continues across reloads.
 */
public final class ProviderRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final AtomicReference<Map<String, ProviderConfig>> providers = new AtomicReference<>(Map.of());
    private final Map<String, RotationCursor> cursors = new ConcurrentHashMap<>();
    private volatile String defaultProvider;

    public ProviderRegistry(Collection<ProviderConfig> configs, String defaultProvider) {
        replace(configs, defaultProvider);
    }

    public void replace(Collection<ProviderConfig> configs, String defaultProvider) {
        Map<String, ProviderConfig> next = new LinkedHashMap<>();
        for (ProviderConfig config : configs) {
            next.put(config.name(), config);
        }
        providers.set(Collections.unmodifiableMap(next));
        this.defaultProvider = defaultProvider == null || defaultProvider.isBlank()
            ? null
            : defaultProvider.trim().toLowerCase(Locale.ROOT);
        cursors.keySet().retainAll(next.keySet());
        LOG.info("Registered {} providers: {}", next.size(), next.keySet());
    }

    public Optional<ProviderConfig> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get().get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public ProviderConfig require(String name) {
        return find(name).orElseThrow(() -> new ProviderNotConfiguredException(name, names()));
    }

    public List<String> names() {
        return List.copyOf(providers.get().keySet());
    }

    public Set<String> activeProviders() {
        return new LinkedHashSet<>(providers.get().keySet());
    }

    public Optional<String> defaultProvider() {
        return Optional.ofNullable(defaultProvider);
    }

    /**
     * Credentials for one request to {@code provider}.
     *
     * @param clientKey key sent by the client, only used for passthrough providers
     */
    public AuthParams getClientAuth(String provider, String clientKey) {
        ProviderConfig config = require(provider);
        if (config.passthrough()) {
            if (clientKey == null || clientKey.isBlank()) {
                throw new MissingClientKeyException(config.name());
            }
            return AuthParams.passthrough(config.name(), clientKey);
        }
        KeyRotation rotation = rotationFor(config);
        String first = rotation.next(Set.of()).orElseThrow();
        LOG.debug("Using key {} for provider {}", KeyHashes.shortHash(first), config.name());
        return AuthParams.rotating(config.name(), first, rotation);
    }

    public KeyRotation rotationFor(ProviderConfig config) {
        RotationCursor cursor = cursors.computeIfAbsent(config.name(), ignored -> new RotationCursor());
        return new KeyRotation(config.name(), config.apiKeys(), cursor);
    }

    public List<ProviderSummary> summaries() {
        List<ProviderSummary> summaries = new ArrayList<>();
        for (ProviderConfig config : providers.get().values()) {
            List<String> hashes = config.passthrough()
                ? List.of(KeyHashes.shortHash(ProviderConfig.PASSTHROUGH_SENTINEL))
                : config.apiKeys().stream().map(KeyHashes::shortHash).toList();
            summaries.add(new ProviderSummary(
                config.name(),
                config.passthrough() ? "passthrough" : "static",
                config.keyCount(),
                hashes,
                config.baseUrl(),
                config.apiFormat().wireName(),
                config.name().equals(defaultProvider)
            ));
        }
        return summaries;
    }
}
