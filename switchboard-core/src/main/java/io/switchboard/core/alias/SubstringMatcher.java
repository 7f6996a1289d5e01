package io.switchboard.core.alias;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds every alias whose name occurs inside the requested model name.
 *
 * <p>Matching is case-insensitive and treats {@code -} and {@code _} as the same character.
 * The search is scoped to a single provider table: the prefix of a {@code provider:model}
 * input, else the explicit provider, else the default provider. Only a table without any
 * default provider is searched across all providers.
 */
public final class SubstringMatcher implements AliasResolver {

    @Override
    public String name() {
        return "substring";
    }

    @Override
    public boolean canResolve(ResolutionContext context) {
        return !context.model().isEmpty() && !context.aliases().allAliases().isEmpty();
    }

    @Override
    public Optional<ResolutionResult> resolve(ResolutionContext context) {
        if (!canResolve(context)) {
            return Optional.empty();
        }
        List<Match> matches = findMatches(context);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ResolutionResult.candidates(context, matches));
    }

    List<Match> findMatches(ResolutionContext context) {
        String model = context.model();
        String scope = scopeOf(context);
        String modelForMatch = AliasNames.hasProviderPrefix(model) ? AliasNames.modelPart(model) : model;
        Set<String> variations = AliasNames.variations(modelForMatch);

        List<Match> matches = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> table : context.aliases().allAliases().entrySet()) {
            if (scope != null && !scope.equals(table.getKey())) {
                continue;
            }
            for (Map.Entry<String, String> alias : table.getValue().entrySet()) {
                String name = alias.getKey();
                for (String variation : variations) {
                    if (variation.contains(name)) {
                        matches.add(new Match(
                            table.getKey(),
                            name,
                            alias.getValue(),
                            name.length(),
                            variations.contains(name)
                        ));
                        break;
                    }
                }
            }
        }
        return matches;
    }

    static String scopeOf(ResolutionContext context) {
        if (AliasNames.hasProviderPrefix(context.model())) {
            return AliasNames.providerPart(context.model());
        }
        if (context.provider() != null) {
            return context.provider();
        }
        return context.defaultProvider();
    }
}
