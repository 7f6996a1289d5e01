package io.switchboard.core.provider;

import io.switchboard.core.error.ConfigurationValidationException;
import io.switchboard.core.model.WireFormat;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static configuration of one upstream provider.
 *
 * <p>A provider either rotates over its own keys or forwards the client's key
 * ({@code passthrough}); never both, never neither.
 */
public record ProviderConfig(
    String name,
    List<String> apiKeys,
    String baseUrl,
    WireFormat apiFormat,
    Duration timeout,
    int maxRetries,
    Map<String, String> customHeaders,
    boolean passthrough
) {
    public static final String PASSTHROUGH_SENTINEL = "!PASSTHRU";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(90);
    public static final int DEFAULT_MAX_RETRIES = 2;

    public ProviderConfig {
        if (name == null || name.isBlank()) {
            throw new ConfigurationValidationException("Provider name must not be blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
        apiKeys = apiKeys == null ? List.of() : List.copyOf(apiKeys);
        for (String key : apiKeys) {
            if (key == null || key.isBlank()) {
                throw new ConfigurationValidationException("Provider '" + name + "' has an empty API key");
            }
            if (PASSTHROUGH_SENTINEL.equals(key)) {
                throw new ConfigurationValidationException(
                    "Provider '" + name + "' mixes " + PASSTHROUGH_SENTINEL + " with static API keys"
                );
            }
        }
        if (passthrough && !apiKeys.isEmpty()) {
            throw new ConfigurationValidationException(
                "Provider '" + name + "' mixes " + PASSTHROUGH_SENTINEL + " with static API keys"
            );
        }
        if (!passthrough && apiKeys.isEmpty()) {
            throw new ConfigurationValidationException("Provider '" + name + "' has no API key configured");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationValidationException("Provider '" + name + "' has no base URL configured");
        }
        baseUrl = baseUrl.trim();
        apiFormat = apiFormat == null ? WireFormat.OPENAI : apiFormat;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationValidationException("Provider '" + name + "' timeout must be > 0");
        }
        if (maxRetries < 0) {
            throw new ConfigurationValidationException("Provider '" + name + "' maxRetries must be >= 0");
        }
        customHeaders = customHeaders == null ? Map.of() : Map.copyOf(customHeaders);
    }

    /**
     * Builds a provider from a raw key string such as {@code "k1 k2 k3"} or {@code "!PASSTHRU"}.
     */
    public static ProviderConfig fromKeyString(
        String name,
        String rawKeys,
        String baseUrl,
        WireFormat apiFormat,
        Duration timeout,
        int maxRetries,
        Map<String, String> customHeaders
    ) {
        if (rawKeys == null || rawKeys.isBlank()) {
            throw new ConfigurationValidationException("Provider '" + name + "' has an empty API key");
        }
        List<String> keys = new ArrayList<>(List.of(rawKeys.trim().split("\\s+")));
        boolean passthrough = keys.contains(PASSTHROUGH_SENTINEL);
        if (passthrough) {
            if (keys.size() > 1) {
                throw new ConfigurationValidationException(
                    "Provider '" + name + "' mixes " + PASSTHROUGH_SENTINEL + " with static API keys"
                );
            }
            keys.clear();
        }
        return new ProviderConfig(name, keys, baseUrl, apiFormat, timeout, maxRetries, customHeaders, passthrough);
    }

    public int keyCount() {
        return apiKeys.size();
    }
}
