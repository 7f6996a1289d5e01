package io.switchboard.core.alias;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks one winner among candidate matches: exact before substring, then the longer
 * alias, then the provider declared first in configuration, then the alphabetically
 * first alias name.
 */
public final class MatchRanker {

    public Optional<Match> select(List<Match> matches, AliasTable aliases) {
        if (matches == null || matches.isEmpty()) {
            return Optional.empty();
        }
        Comparator<Match> order = Comparator
            .comparing((Match m) -> m.exact() ? 0 : 1)
            .thenComparing(Match::length, Comparator.reverseOrder())
            .thenComparingInt(m -> aliases.providerRank(m.provider()))
            .thenComparing(Match::provider)
            .thenComparing(Match::alias);
        return matches.stream().min(order);
    }
}
