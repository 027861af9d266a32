package io.switchboard.cli;

import io.switchboard.core.config.ConfigService;
import io.switchboard.core.gateway.AiGateway;
import io.switchboard.core.registry.FileModelRegistry;
import io.switchboard.core.usage.UsageReportService;
import java.nio.file.Path;

public record CliContext(
    AiGateway gateway,
    FileModelRegistry registry,
    UsageReportService reports,
    ConfigService configService,
    Path configPath
) {
}
