package io.switchboard.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "SWITCHBOARD_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".switchboard", "config.json");
    }

    public static Path resolveConfigPath(Map<String, String> env) {
        String override = env.get(CONFIG_ENV);
        if (override == null || override.isBlank()) {
            return defaultConfigPath();
        }
        if (override.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(override.substring(2));
        }
        return Path.of(override);
    }
}
