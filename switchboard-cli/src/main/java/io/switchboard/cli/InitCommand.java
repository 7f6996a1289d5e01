package io.switchboard.cli;

import io.switchboard.core.config.model.SwitchboardConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write a configuration file with default settings")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            boolean exists = Files.exists(context.configPath());
            if (exists && !overwrite) {
                System.out.println("Config already exists: " + context.configPath());
                return 0;
            }
            context.configService().save(context.configPath(), SwitchboardConfig.defaults());
            System.out.println((exists ? "Overwrote config with defaults: " : "Created config: ") + context.configPath());
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
