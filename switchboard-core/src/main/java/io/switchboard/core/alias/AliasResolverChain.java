package io.switchboard.core.alias;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the resolution strategies in order: literal bypass, direct chained alias,
 * substring matching with ranking. Without any applicable alias the input passes
 * through unchanged.
 */
public final class AliasResolverChain {
    private static final Logger LOG = LoggerFactory.getLogger(AliasResolverChain.class);

    private final LiteralPrefixResolver literal;
    private final ChainedAliasResolver chained;
    private final SubstringMatcher matcher;
    private final MatchRanker ranker;

    public AliasResolverChain() {
        this(ChainedAliasResolver.DEFAULT_MAX_CHAIN_LENGTH);
    }

    public AliasResolverChain(int maxChainLength) {
        this(new LiteralPrefixResolver(), new ChainedAliasResolver(maxChainLength), new SubstringMatcher(), new MatchRanker());
    }

    public AliasResolverChain(
        LiteralPrefixResolver literal,
        ChainedAliasResolver chained,
        SubstringMatcher matcher,
        MatchRanker ranker
    ) {
        this.literal = Objects.requireNonNull(literal, "literal must not be null");
        this.chained = Objects.requireNonNull(chained, "chained must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.ranker = Objects.requireNonNull(ranker, "ranker must not be null");
    }

    public ResolutionResult resolve(ResolutionContext context) {
        if (literal.canResolve(context)) {
            return literal.resolve(context).orElseThrow();
        }

        Optional<ResolutionResult> direct = chained.resolve(context);
        if (direct.isPresent() && direct.get().wasResolved()) {
            logHit(context, direct.get(), "exact");
            return direct.get();
        }

        Optional<ResolutionResult> candidates = matcher.resolve(context);
        if (candidates.isPresent()) {
            Optional<Match> best = ranker.select(candidates.get().matches(), context.aliases());
            if (best.isPresent()) {
                ResolutionResult result = chained.followMatch(context.aliases(), best.get());
                logHit(context, result, best.get().exact() ? "exact" : "substring");
                return result;
            }
        }

        String model = context.model();
        String provider = SubstringMatcher.scopeOf(context);
        if (AliasNames.hasProviderPrefix(model)) {
            model = AliasNames.modelPart(model);
        }
        LOG.debug("No alias matched '{}', passing through as '{}:{}'", context.model(), provider, model);
        return ResolutionResult.unresolved(provider, model);
    }

    private void logHit(ResolutionContext context, ResolutionResult result, String kind) {
        LOG.info(
            "Alias resolved ({} match for '{}'): {} -> '{}'",
            kind,
            context.model(),
            String.join(" -> ", result.resolutionPath()),
            result.qualifiedModel()
        );
    }
}
