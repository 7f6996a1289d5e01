package io.switchboard.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigPathsTest {

    @Test
    void shouldUseHomeDirectoryByDefault() {
        assertThat(ConfigPaths.resolveConfigPath(Map.of()))
            .isEqualTo(Path.of(System.getProperty("user.home"), ".switchboard", "config.json"));
    }

    @Test
    void shouldHonorOverride() {
        assertThat(ConfigPaths.resolveConfigPath(Map.of(ConfigPaths.CONFIG_ENV, "/etc/switchboard.json")))
            .isEqualTo(Path.of("/etc/switchboard.json"));
        assertThat(ConfigPaths.resolveConfigPath(Map.of(ConfigPaths.CONFIG_ENV, "~/gw.json")))
            .isEqualTo(Path.of(System.getProperty("user.home")).resolve("gw.json"));
    }
}
