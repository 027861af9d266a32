package io.switchboard.cli;

import io.switchboard.core.config.model.GatewayConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and registry status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            GatewayConfig config = context.configService().load(context.configPath());
            String masterKeyEnv = config.security().masterKeyEnv();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Registry: " + context.registry().path());
            System.out.println("Registered models: " + context.registry().list().size());
            System.out.println("Active models: " + context.registry().listActiveModels().size());
            System.out.println("Call log: " + config.storage().callLog());
            System.out.println("Request timeout: " + config.routing().requestTimeoutSeconds() + "s");
            System.out.println("Master key (" + masterKeyEnv + ") configured: "
                + (System.getenv(masterKeyEnv) != null && !System.getenv(masterKeyEnv).isBlank()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
