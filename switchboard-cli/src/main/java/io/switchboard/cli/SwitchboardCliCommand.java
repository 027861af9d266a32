package io.switchboard.cli;

import picocli.CommandLine.Command;

@Command(name = "switchboard", mixinStandardHelpOptions = true, description = "Route AI requests across registered model backends")
public final class SwitchboardCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
