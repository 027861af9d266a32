package io.switchboard.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.TaskType;
import io.switchboard.core.model.TokenUsage;
import io.switchboard.core.registry.ModelConfig;
import java.util.Map;
import java.util.Optional;
import okhttp3.OkHttpClient;

public final class DeepSeekAdapter extends OpenAiCompatAdapter {
    static final String GENERIC_MODEL = "deepseek-chat";
    static final String CODER_MODEL = "deepseek-coder";
    static final String MATH_MODEL = "deepseek-math";

    public DeepSeekAdapter(ModelConfig model, String apiKey, String endpoint, OkHttpClient client, ObjectMapper mapper) {
        super(model, apiKey, endpoint, client, mapper);
    }

    @Override
    protected Optional<GatewayError> precheck(AIRequest request) {
        Optional<GatewayError> base = super.precheck(request);
        if (base.isPresent()) {
            return base;
        }
        if (request.hasImage()) {
            return Optional.of(GatewayError.of(
                ErrorKind.INVALID_REQUEST_ERROR,
                "model " + model().key() + " does not accept image input"
            ));
        }
        return Optional.empty();
    }

    @Override
    protected String wireModel(AIRequest request) {
        String configured = model().modelName();
        if (!GENERIC_MODEL.equals(configured)) {
            return configured;
        }
        if (request.taskType().isCodeTask()) {
            return CODER_MODEL;
        }
        if (request.taskType() == TaskType.MATH_SOLVING) {
            return MATH_MODEL;
        }
        return configured;
    }

    @Override
    protected void customizePayload(AIRequest request, Map<String, Object> payload) {
        if (request.taskType().isCodeTask()) {
            payload.putIfAbsent("top_p", 0.95);
            payload.put("frequency_penalty", 0.1);
            payload.put("presence_penalty", 0.1);
        }
    }

    @Override
    protected TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return TokenUsage.empty();
        }
        long prompt = usage.has("prompt_tokens")
            ? usage.path("prompt_tokens").asLong(0)
            : usage.path("prompt_cache_hit_tokens").asLong(0) + usage.path("prompt_cache_miss_tokens").asLong(0);
        return new TokenUsage(
            prompt,
            usage.path("completion_tokens").asLong(0),
            usage.path("total_tokens").asLong(0)
        );
    }
}
