package io.switchboard.core.config;

import io.switchboard.core.config.model.ProviderSettings;
import io.switchboard.core.config.model.SwitchboardConfig;
import io.switchboard.core.error.ConfigurationValidationException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies environment variables on top of the file configuration. Environment wins.
 *
 * <pre>
 * OPENAI_API_KEY="k1 k2"        keys, or !PASSTHRU
 * OPENAI_BASE_URL=...           base URL
 * OPENAI_API_FORMAT=anthropic   dialect
 * OPENAI_TIMEOUT=60             seconds
 * POE_ALIAS_FAST=gemini-flash   alias "fast" for provider poe
 * SWITCHBOARD_DEFAULT_PROVIDER=poe
 * </pre>
 *
 * <p>A provider that only appears in the environment and has no base URL is skipped, so an
 * unrelated {@code GITHUB_API_KEY} does not stop the gateway.
 */
public final class EnvironmentOverlay {
    public static final String DEFAULT_PROVIDER_ENV = "SWITCHBOARD_DEFAULT_PROVIDER";

    private static final String API_KEY_SUFFIX = "_API_KEY";
    private static final String ALIAS_MARKER = "_ALIAS_";

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentOverlay.class);

    private EnvironmentOverlay() {
    }

    public static SwitchboardConfig apply(SwitchboardConfig config, Map<String, String> env) {
        Map<String, ProviderSettings> providers = new LinkedHashMap<>();
        config.providers().forEach((name, settings) -> providers.put(name.toLowerCase(Locale.ROOT), settings));
        Set<String> declared = Set.copyOf(providers.keySet());

        // stable order for providers that only appear in the environment
        Map<String, String> sorted = new TreeMap<>(env);
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            String key = entry.getKey();
            if (key.endsWith(API_KEY_SUFFIX) && !key.startsWith("CUSTOM_") && key.length() > API_KEY_SUFFIX.length()) {
                String provider = key.substring(0, key.length() - API_KEY_SUFFIX.length()).toLowerCase(Locale.ROOT);
                providers.put(provider, providers.getOrDefault(provider, ProviderSettings.empty()).withApiKey(entry.getValue()));
            }
        }

        for (Map.Entry<String, ProviderSettings> entry : new LinkedHashMap<>(providers).entrySet()) {
            String upper = entry.getKey().toUpperCase(Locale.ROOT);
            ProviderSettings settings = entry.getValue();
            String baseUrl = env.get(upper + "_BASE_URL");
            if (baseUrl != null && !baseUrl.isBlank()) {
                settings = settings.withBaseUrl(baseUrl.trim());
            }
            if (!declared.contains(entry.getKey()) && !hasBaseUrl(entry.getKey(), settings)) {
                LOG.warn("Skipping provider {}: {}_API_KEY is set but {}_BASE_URL is not", entry.getKey(), upper, upper);
                providers.remove(entry.getKey());
                continue;
            }
            String format = env.get(upper + "_API_FORMAT");
            if (format != null && !format.isBlank()) {
                settings = settings.withApiFormat(format.trim());
            }
            String timeout = env.get(upper + "_TIMEOUT");
            if (timeout != null && !timeout.isBlank()) {
                settings = settings.withTimeoutSeconds(parseTimeout(entry.getKey(), timeout));
            }
            providers.put(entry.getKey(), settings);
        }

        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            String key = entry.getKey();
            int marker = key.indexOf(ALIAS_MARKER);
            if (marker <= 0 || marker + ALIAS_MARKER.length() >= key.length()) {
                continue;
            }
            String provider = key.substring(0, marker).toLowerCase(Locale.ROOT);
            String alias = key.substring(marker + ALIAS_MARKER.length()).toLowerCase(Locale.ROOT);
            providers.put(
                provider,
                providers.getOrDefault(provider, ProviderSettings.empty()).withAlias(alias, entry.getValue())
            );
        }

        SwitchboardConfig overlaid = config.withProviders(providers);
        String defaultProvider = env.get(DEFAULT_PROVIDER_ENV);
        if (defaultProvider != null && !defaultProvider.isBlank()) {
            overlaid = overlaid.withDefaultProvider(defaultProvider.trim().toLowerCase(Locale.ROOT));
        }
        return overlaid;
    }

    private static boolean hasBaseUrl(String provider, ProviderSettings settings) {
        return (settings.baseUrl() != null && !settings.baseUrl().isBlank())
            || ConfigurationLoader.DEFAULT_BASE_URLS.containsKey(provider);
    }

    private static Integer parseTimeout(String provider, String raw) {
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationValidationException(
                "Provider '" + provider + "' timeout is not a number: " + raw,
                e
            );
        }
    }
}
