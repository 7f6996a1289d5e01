package io.switchboard.core.config;

import io.switchboard.core.alias.AliasTable;
import io.switchboard.core.config.model.ProviderSettings;
import io.switchboard.core.config.model.SwitchboardConfig;
import io.switchboard.core.error.ConfigurationValidationException;
import io.switchboard.core.model.WireFormat;
import io.switchboard.core.provider.ProviderConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link GatewayConfiguration} from the configuration file and the environment.
 * Any invalid entry fails the whole load.
 */
public final class ConfigurationLoader {
    static final String OPENAI_BASE_URL = "https://api.openai.com/v1";
    static final Map<String, String> DEFAULT_BASE_URLS = Map.of("openai", OPENAI_BASE_URL);

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final ConfigService configService;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigurationLoader(ConfigService configService, Path configPath, Map<String, String> env) {
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
        this.env = Map.copyOf(env);
    }

    public Path configPath() {
        return configPath;
    }

    public GatewayConfiguration load() {
        SwitchboardConfig fileConfig;
        try {
            fileConfig = configService.load(configPath);
        } catch (IOException e) {
            throw new ConfigurationValidationException("Failed to read configuration " + configPath, e);
        }
        return build(EnvironmentOverlay.apply(fileConfig, env));
    }

    static GatewayConfiguration build(SwitchboardConfig config) {
        List<ProviderConfig> providers = new ArrayList<>();
        Map<String, Map<String, String>> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, ProviderSettings> entry : config.providers().entrySet()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            ProviderSettings settings = entry.getValue();
            validateAliases(name, settings.aliases());
            if (settings.apiKey() == null) {
                if (!settings.aliases().isEmpty()) {
                    LOG.warn("Provider {} has aliases but no API key; its aliases stay inactive", name);
                }
                aliases.put(name, settings.aliases());
                continue;
            }
            providers.add(toProviderConfig(name, settings));
            aliases.put(name, settings.aliases());
        }
        config.fallbackAliases().forEach(ConfigurationLoader::validateAliases);

        String defaultProvider = chooseDefault(config.defaultProvider(), providers);
        List<String> order = new ArrayList<>(aliases.keySet());
        AliasTable table = AliasTable.of(order, defaultProvider, aliases, config.fallbackAliases());
        return new GatewayConfiguration(providers, defaultProvider, table, config.cache(), config.middleware());
    }

    private static ProviderConfig toProviderConfig(String name, ProviderSettings settings) {
        String baseUrl = settings.baseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URLS.get(name);
        }
        WireFormat format;
        try {
            format = WireFormat.parse(settings.apiFormat());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationValidationException("Provider '" + name + "': " + e.getMessage(), e);
        }
        Duration timeout = settings.timeoutSeconds() == null
            ? ProviderConfig.DEFAULT_TIMEOUT
            : Duration.ofSeconds(settings.timeoutSeconds());
        int maxRetries = settings.maxRetries() == null ? ProviderConfig.DEFAULT_MAX_RETRIES : settings.maxRetries();
        return ProviderConfig.fromKeyString(
            name,
            settings.apiKey(),
            baseUrl,
            format,
            timeout,
            maxRetries,
            settings.customHeaders()
        );
    }

    private static void validateAliases(String provider, Map<String, String> aliases) {
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            String name = alias.getKey() == null ? "" : alias.getKey().trim();
            String target = alias.getValue() == null ? "" : alias.getValue().trim();
            if (name.isEmpty() || target.isEmpty()) {
                throw new ConfigurationValidationException("Provider '" + provider + "' has an empty alias definition");
            }
            if (name.equalsIgnoreCase(target)) {
                throw new ConfigurationValidationException(
                    "Alias '" + name + "' of provider '" + provider + "' points at itself"
                );
            }
            if (target.contains("@")) {
                throw new ConfigurationValidationException(
                    "Alias '" + name + "' of provider '" + provider + "' has invalid target '" + target + "'"
                );
            }
        }
    }

    private static String chooseDefault(String configured, List<ProviderConfig> providers) {
        if (configured != null && !configured.isBlank()) {
            String normalized = configured.trim().toLowerCase(Locale.ROOT);
            if (providers.stream().anyMatch(p -> p.name().equals(normalized))) {
                return normalized;
            }
            LOG.warn("Default provider {} is not configured", normalized);
        }
        if (providers.isEmpty()) {
            return null;
        }
        String first = providers.get(0).name();
        LOG.info("Using {} as default provider", first);
        return first;
    }
}
