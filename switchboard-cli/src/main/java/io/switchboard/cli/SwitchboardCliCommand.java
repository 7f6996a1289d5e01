package io.switchboard.cli;

import picocli.CommandLine.Command;

@Command(name = "switchboard", mixinStandardHelpOptions = true, description = "LLM gateway dispatch core")
public final class SwitchboardCliCommand implements Runnable {

    @Override
    public void run() {
        // Subcommands do the work; the bare root prints nothing.
    }
}
