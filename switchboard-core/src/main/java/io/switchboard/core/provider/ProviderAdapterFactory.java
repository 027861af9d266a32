package io.switchboard.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.registry.SecretResolver;
import java.time.Duration;
import java.util.Objects;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderAdapterFactory {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderAdapterFactory.class);

    private final SecretResolver secrets;
    private final ObjectMapper mapper;
    private final OkHttpClient baseClient;

    public ProviderAdapterFactory(SecretResolver secrets, ObjectMapper mapper) {
        this(secrets, mapper, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .writeTimeout(Duration.ofSeconds(20))
            .build());
    }

    public ProviderAdapterFactory(SecretResolver secrets, ObjectMapper mapper, OkHttpClient baseClient) {
        this.secrets = Objects.requireNonNull(secrets, "secrets must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.baseClient = Objects.requireNonNull(baseClient, "baseClient must not be null");
    }

    public ProviderAdapter create(ModelConfig model) {
        String apiKey = resolve(model, model.credential(), "credential");
        String endpoint = resolve(model, model.endpoint(), "endpoint");
        OkHttpClient client = baseClient.newBuilder()
            .connectionPool(new ConnectionPool())
            .readTimeout(model.limits().timeout())
            .build();
        LOG.debug("Creating {} adapter for model {}", model.provider().wireName(), model.key());
        return switch (model.provider()) {
            case OPENAI_COMPATIBLE -> new OpenAiCompatAdapter(model, apiKey, endpoint, client, mapper);
            case GEMINI -> new GeminiAdapter(model, apiKey, endpoint, client, mapper);
            case DEEPSEEK -> new DeepSeekAdapter(model, apiKey, endpoint, client, mapper);
        };
    }

    private String resolve(ModelConfig model, String reference, String what) {
        try {
            return secrets.resolve(reference).orElse("");
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOG.warn("Could not resolve {} for model {}: {}", what, model.id(), e.getMessage());
            return "";
        }
    }
}
