package io.switchboard.app;

import io.switchboard.cli.CliContext;
import io.switchboard.cli.HealthCommand;
import io.switchboard.cli.ModelsCommand;
import io.switchboard.cli.ReportCommand;
import io.switchboard.cli.RunCommand;
import io.switchboard.cli.StatusCommand;
import io.switchboard.cli.SwitchboardCliCommand;
import io.switchboard.core.config.ConfigPaths;
import io.switchboard.core.config.ConfigService;
import io.switchboard.core.config.model.GatewayConfig;
import io.switchboard.core.gateway.AiGateway;
import io.switchboard.core.gateway.GatewayFactory;
import io.switchboard.core.registry.FileModelRegistry;
import io.switchboard.core.registry.SecretResolver;
import io.switchboard.core.usage.CallLogStore;
import io.switchboard.core.usage.UsageReportService;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class SwitchboardApplication {
    private static final Logger LOG = LoggerFactory.getLogger(SwitchboardApplication.class);

    private SwitchboardApplication() {
    }

    public static void main(String[] args) throws Exception {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        GatewayConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        FileModelRegistry registry = new FileModelRegistry(ConfigPaths.resolve(config.registry().path()));
        CallLogStore callLog = GatewayFactory.callLogStore(config.storage());
        SecretResolver secrets = SecretResolver.fromSystem(config.security().masterKeyEnv());

        int exitCode;
        try (AiGateway gateway = GatewayFactory.create(config, registry, callLog, secrets, clock)) {
            CliContext context = new CliContext(
                gateway,
                registry,
                new UsageReportService(callLog, clock),
                configService,
                configPath
            );

            CommandLine commandLine = new CommandLine(new SwitchboardCliCommand());
            commandLine.addSubcommand("run", new RunCommand(context));
            commandLine.addSubcommand("models", new ModelsCommand(context));
            commandLine.addSubcommand("health", new HealthCommand(context));
            commandLine.addSubcommand("report", new ReportCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));
            exitCode = commandLine.execute(args);
        }
        System.exit(exitCode);
    }

    private static GatewayConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}; using defaults: {}", configPath, e.getMessage());
            return GatewayConfig.defaults();
        }
    }
}
