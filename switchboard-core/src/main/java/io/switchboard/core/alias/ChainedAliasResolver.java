package io.switchboard.core.alias;

import io.switchboard.core.error.CircularAliasException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows aliases whose target is itself an alias, e.g. {@code fast -> sonnet -> gpt-4o-mini}.
 *
 * <p>Revisiting an alias already on the chain, or following more than {@code maxChainLength}
 * aliases, fails with {@link CircularAliasException}.
 */
public final class ChainedAliasResolver implements AliasResolver {
    public static final int DEFAULT_MAX_CHAIN_LENGTH = 8;

    private static final Logger LOG = LoggerFactory.getLogger(ChainedAliasResolver.class);

    private final int maxChainLength;

    public ChainedAliasResolver() {
        this(DEFAULT_MAX_CHAIN_LENGTH);
    }

    public ChainedAliasResolver(int maxChainLength) {
        if (maxChainLength <= 0) {
            throw new IllegalArgumentException("maxChainLength must be > 0");
        }
        this.maxChainLength = maxChainLength;
    }

    @Override
    public String name() {
        return "chained";
    }

    /**
     * Applies to {@code provider:alias} inputs whose alias part is an exact alias of that provider.
     */
    @Override
    public boolean canResolve(ResolutionContext context) {
        String model = context.model();
        if (!AliasNames.hasProviderPrefix(model)) {
            return false;
        }
        return context.aliases().lookup(AliasNames.providerPart(model), AliasNames.modelPart(model)).isPresent();
    }

    @Override
    public Optional<ResolutionResult> resolve(ResolutionContext context) {
        if (!canResolve(context)) {
            return Optional.empty();
        }
        String provider = AliasNames.providerPart(context.model());
        String alias = AliasNames.modelPart(context.model());
        return Optional.of(follow(context.aliases(), provider, alias, List.of(), new LinkedHashSet<>()));
    }

    /**
     * Resolves the target a ranked match points to, continuing through any further aliases.
     */
    public ResolutionResult followMatch(AliasTable aliases, Match match) {
        Set<String> seen = new LinkedHashSet<>();
        seen.add(key(match.provider(), match.alias()));
        return followTarget(aliases, match.provider(), match.target(), List.of(match.alias()), seen);
    }

    private ResolutionResult follow(
        AliasTable aliases,
        String provider,
        String alias,
        List<String> pathSoFar,
        Set<String> seen
    ) {
        String target = aliases.lookup(provider, alias).orElse(null);
        if (target == null) {
            return pathSoFar.isEmpty()
                ? ResolutionResult.unresolved(provider, alias)
                : ResolutionResult.resolved(provider, alias, pathSoFar);
        }

        String visited = key(provider, alias);
        List<String> path = new ArrayList<>(pathSoFar);
        path.add(alias);
        if (!seen.add(visited)) {
            LOG.warn("Alias cycle detected: {} -> {}", String.join(" -> ", seen), visited);
            throw new CircularAliasException(
                "Circular alias reference: " + String.join(" -> ", path),
                path
            );
        }
        if (path.size() > maxChainLength) {
            LOG.warn("Alias chain exceeded {} steps: {}", maxChainLength, String.join(" -> ", path));
            throw new CircularAliasException(
                "Alias chain longer than " + maxChainLength + ": " + String.join(" -> ", path),
                path
            );
        }
        LOG.debug("Alias step {}: '{}:{}' -> '{}'", path.size(), provider, alias, target);
        return followTarget(aliases, provider, target, path, seen);
    }

    private ResolutionResult followTarget(
        AliasTable aliases,
        String provider,
        String target,
        List<String> path,
        Set<String> seen
    ) {
        String nextProvider = provider;
        String nextModel = target;
        if (AliasNames.hasProviderPrefix(target) && aliases.knowsProvider(AliasNames.providerPart(target))) {
            nextProvider = AliasNames.providerPart(target);
            nextModel = AliasNames.modelPart(target);
        }
        if (aliases.lookup(nextProvider, nextModel).isEmpty()) {
            return ResolutionResult.resolved(nextProvider, nextModel, path);
        }
        return follow(aliases, nextProvider, nextModel, path, seen);
    }

    private static String key(String provider, String alias) {
        return provider + ":" + AliasNames.normalize(alias);
    }
}
