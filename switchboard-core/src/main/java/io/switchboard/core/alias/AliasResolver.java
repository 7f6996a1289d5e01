package io.switchboard.core.alias;

import java.util.Optional;

/**
 * One resolution strategy. Strategies are composed into an {@link AliasResolverChain};
 * an empty result hands the request to the next strategy.
 */
public interface AliasResolver {
    String name();

    boolean canResolve(ResolutionContext context);

    Optional<ResolutionResult> resolve(ResolutionContext context);
}
