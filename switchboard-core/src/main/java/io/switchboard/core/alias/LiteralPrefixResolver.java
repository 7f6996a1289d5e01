package io.switchboard.core.alias;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code !model} and {@code !provider:model}: the name after the marker is used
 * verbatim and the alias table is never consulted.
 */
public final class LiteralPrefixResolver implements AliasResolver {
    private static final Logger LOG = LoggerFactory.getLogger(LiteralPrefixResolver.class);

    @Override
    public String name() {
        return "literal";
    }

    @Override
    public boolean canResolve(ResolutionContext context) {
        return !context.model().isEmpty() && context.model().charAt(0) == AliasNames.LITERAL_MARKER;
    }

    @Override
    public Optional<ResolutionResult> resolve(ResolutionContext context) {
        String literal = context.model().substring(1).trim();
        if (literal.isEmpty()) {
            throw new IllegalArgumentException("Literal model name is empty after '!'");
        }

        ResolutionResult result;
        if (AliasNames.hasProviderPrefix(literal)) {
            result = ResolutionResult.unresolved(AliasNames.providerPart(literal), AliasNames.modelPart(literal));
        } else {
            String provider = context.provider() != null ? context.provider() : context.defaultProvider();
            result = ResolutionResult.unresolved(provider, literal);
        }
        LOG.debug("Literal model '{}' -> '{}'", context.model(), result.qualifiedModel());
        return Optional.of(result);
    }
}
