package io.switchboard.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.config.ConfigService;
import io.switchboard.core.runtime.GatewayRuntime;
import java.nio.file.Path;

public record CliContext(
    GatewayRuntime runtime,
    ConfigService configService,
    Path configPath,
    ObjectMapper mapper
) {
}
