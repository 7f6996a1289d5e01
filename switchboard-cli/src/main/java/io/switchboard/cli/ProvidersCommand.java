package io.switchboard.cli;

import io.switchboard.core.provider.ProviderSummary;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "providers", description = "List configured providers")
public final class ProvidersCommand implements Callable<Integer> {
    private final CliContext context;

    public ProvidersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        List<ProviderSummary> summaries = context.runtime().registry().summaries();
        if (summaries.isEmpty()) {
            System.out.println("No providers configured. Set <PROVIDER>_API_KEY or edit " + context.configPath());
            return 0;
        }
        for (ProviderSummary summary : summaries) {
            System.out.println(
                (summary.isDefault() ? "* " : "  ")
                    + summary.name()
                    + " [" + summary.apiFormat() + "] "
                    + summary.baseUrl()
                    + " auth=" + summary.authMode()
                    + " keys=" + String.join(",", summary.keyHashes())
            );
        }
        return 0;
    }
}
