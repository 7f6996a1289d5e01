package io.switchboard.core.alias;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

final class AliasNames {
    static final char PROVIDER_SEPARATOR = ':';
    static final char LITERAL_MARKER = '!';

    private AliasNames() {
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-cased spellings of a model name where hyphens and underscores are interchangeable.
     */
    static Set<String> variations(String model) {
        String lower = normalize(model);
        Set<String> variations = new LinkedHashSet<>();
        variations.add(lower);
        variations.add(lower.replace('_', '-'));
        variations.add(lower.replace('-', '_'));
        return variations;
    }

    static boolean hasProviderPrefix(String model) {
        return model != null && model.indexOf(PROVIDER_SEPARATOR) > 0;
    }

    static String providerPart(String model) {
        return normalize(model.substring(0, model.indexOf(PROVIDER_SEPARATOR)));
    }

    static String modelPart(String model) {
        return model.substring(model.indexOf(PROVIDER_SEPARATOR) + 1);
    }
}
