package io.switchboard.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.switchboard.core.config.model.GatewayConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link GatewayConfig} from JSON, deep-merged over the defaults, then applies environment overrides.
 */
public final class ConfigService {
    public static final String CALL_LOG_ENV = "SWITCHBOARD_CALL_LOG";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public GatewayConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return applyEnvironment(GatewayConfig.defaults());
        }

        JsonNode defaultsNode = mapper.valueToTree(GatewayConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return applyEnvironment(mapper.treeToValue(merged, GatewayConfig.class));
    }

    public void save(Path configPath, GatewayConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public String toPrettyJson(GatewayConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private GatewayConfig applyEnvironment(GatewayConfig config) {
        String callLog = environment.get(CALL_LOG_ENV);
        if (callLog != null && !callLog.isBlank()) {
            return config.withStorage(config.storage().withCallLog(callLog.trim()));
        }
        return config;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
