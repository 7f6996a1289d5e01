package io.switchboard.cli;

import io.switchboard.core.alias.ResolutionResult;
import io.switchboard.core.error.GatewayException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "resolve", description = "Show which provider and model a model name routes to")
public final class ResolveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Model name as a client would send it")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Explicit provider scope")
    String provider;

    public ResolveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ResolutionResult result = context.runtime().aliases().resolve(model, provider);
            String target = result.provider() == null
                ? result.resolvedModel()
                : result.provider() + ":" + result.resolvedModel();
            System.out.println(model + " -> " + target);
            if (result.wasResolved()) {
                System.out.println("Alias path: " + String.join(" -> ", result.resolutionPath()));
            } else {
                System.out.println("No alias applied");
            }
            return 0;
        } catch (GatewayException | IllegalArgumentException e) {
            System.err.println("Resolve failed: " + e.getMessage());
            return 1;
        }
    }
}
