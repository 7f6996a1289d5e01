package io.switchboard.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AliasesCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListActiveAliasesAndMarkFallbacks() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "providers": {
                "openai": {"api_key": "sk", "aliases": {"fast": "gpt-4o-mini"}},
                "gemini": {"base_url": "https://gemini", "aliases": {"flash": "gemini-2.5-flash"}}
              },
              "fallback_aliases": {"openai": {"smart": "gpt-4o"}}
            }
            """);
        CliContext context = CliTestSupport.context(configPath, Map.of());
        context.runtime().aliases().resolve("fast");

        CliTestSupport.Result result = CliTestSupport.run(new AliasesCommand(context), "--stats");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.out())
            .contains("openai:")
            .contains("  fast -> gpt-4o-mini")
            .contains("  smart -> gpt-4o (fallback)")
            .doesNotContain("flash")
            .contains("Cache: size=1/1000 hits=0 misses=1");
    }

    @Test
    void shouldReportMissingAliases() {
        CliContext context = CliTestSupport.context(tempDir.resolve("config.json"), Map.of("OPENAI_API_KEY", "sk"));

        CliTestSupport.Result result = CliTestSupport.run(new AliasesCommand(context));

        assertThat(result.out()).contains("No aliases configured");
    }
}
