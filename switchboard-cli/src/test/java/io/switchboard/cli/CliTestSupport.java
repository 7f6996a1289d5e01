package io.switchboard.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.config.ConfigService;
import io.switchboard.core.config.ConfigurationLoader;
import io.switchboard.core.config.ConfigurationReloader;
import io.switchboard.core.runtime.GatewayRuntime;
import io.switchboard.core.upstream.OkHttpUpstreamClient;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;

final class CliTestSupport {

    private CliTestSupport() {
    }

    static CliContext context(Path configPath, Map<String, String> env) {
        ObjectMapper mapper = new ObjectMapper();
        ConfigService configService = new ConfigService(mapper);
        ConfigurationReloader reloader = new ConfigurationReloader(new ConfigurationLoader(configService, configPath, env));
        GatewayRuntime runtime = GatewayRuntime.create(reloader, new OkHttpUpstreamClient(mapper), mapper, Clock.systemUTC());
        return new CliContext(runtime, configService, configPath, mapper);
    }

    static Result run(Callable<Integer> command, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    record Result(int exitCode, String out, String err) {
    }
}
