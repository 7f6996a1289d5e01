package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider section as written in the configuration file. {@code apiKey} holds one or more
 * whitespace-separated keys, or {@code !PASSTHRU}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderSettings(
    @JsonAlias({"api_key", "api-key"}) String apiKey,
    @JsonAlias({"base_url", "base-url"}) String baseUrl,
    @JsonAlias({"api_format", "api-format"}) String apiFormat,
    @JsonAlias({"timeout_seconds", "timeout"}) Integer timeoutSeconds,
    @JsonAlias({"max_retries"}) Integer maxRetries,
    @JsonAlias({"custom_headers"}) Map<String, String> customHeaders,
    Map<String, String> aliases
) {

    public ProviderSettings {
        customHeaders = customHeaders == null ? Map.of() : Map.copyOf(customHeaders);
        aliases = aliases == null ? new LinkedHashMap<>() : new LinkedHashMap<>(aliases);
    }

    public static ProviderSettings empty() {
        return new ProviderSettings(null, null, null, null, null, Map.of(), Map.of());
    }

    public ProviderSettings withApiKey(String value) {
        return new ProviderSettings(value, baseUrl, apiFormat, timeoutSeconds, maxRetries, customHeaders, aliases);
    }

    public ProviderSettings withBaseUrl(String value) {
        return new ProviderSettings(apiKey, value, apiFormat, timeoutSeconds, maxRetries, customHeaders, aliases);
    }

    public ProviderSettings withApiFormat(String value) {
        return new ProviderSettings(apiKey, baseUrl, value, timeoutSeconds, maxRetries, customHeaders, aliases);
    }

    public ProviderSettings withTimeoutSeconds(Integer value) {
        return new ProviderSettings(apiKey, baseUrl, apiFormat, value, maxRetries, customHeaders, aliases);
    }

    public ProviderSettings withAlias(String alias, String target) {
        Map<String, String> merged = new LinkedHashMap<>(aliases);
        merged.put(alias, target);
        return new ProviderSettings(apiKey, baseUrl, apiFormat, timeoutSeconds, maxRetries, customHeaders, merged);
    }
}
