package io.switchboard.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.cli.AliasesCommand;
import io.switchboard.cli.CliContext;
import io.switchboard.cli.InitCommand;
import io.switchboard.cli.ProvidersCommand;
import io.switchboard.cli.ResolveCommand;
import io.switchboard.cli.SendCommand;
import io.switchboard.cli.SwitchboardCliCommand;
import io.switchboard.core.config.ConfigPaths;
import io.switchboard.core.config.ConfigService;
import io.switchboard.core.config.ConfigurationLoader;
import io.switchboard.core.config.ConfigurationReloader;
import io.switchboard.core.error.ConfigurationValidationException;
import io.switchboard.core.runtime.GatewayRuntime;
import io.switchboard.core.upstream.OkHttpUpstreamClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class SwitchboardApplication {
    private static final Logger LOG = LoggerFactory.getLogger(SwitchboardApplication.class);

    private SwitchboardApplication() {
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        ObjectMapper mapper = new ObjectMapper();
        ConfigService configService = new ConfigService(mapper);
        Path configPath = ConfigPaths.resolveConfigPath(env);

        ConfigurationReloader reloader;
        try {
            reloader = new ConfigurationReloader(new ConfigurationLoader(configService, configPath, env));
        } catch (ConfigurationValidationException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }

        GatewayRuntime runtime = GatewayRuntime.create(
            reloader,
            new OkHttpUpstreamClient(mapper),
            mapper,
            Clock.systemUTC()
        );
        runtime.start();
        Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "switchboard-shutdown"));

        CliContext context = new CliContext(runtime, configService, configPath, mapper);
        CommandLine commandLine = new CommandLine(new SwitchboardCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("resolve", new ResolveCommand(context));
        commandLine.addSubcommand("providers", new ProvidersCommand(context));
        commandLine.addSubcommand("aliases", new AliasesCommand(context));
        commandLine.addSubcommand("send", new SendCommand(context));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
