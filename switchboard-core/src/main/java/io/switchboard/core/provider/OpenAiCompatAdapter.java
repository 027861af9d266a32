package io.switchboard.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ChatTurn;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.GenerationParams;
import io.switchboard.core.model.ImageInput;
import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.model.TokenUsage;
import io.switchboard.core.registry.ModelConfig;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

public class OpenAiCompatAdapter extends AbstractHttpProviderAdapter {

    public OpenAiCompatAdapter(ModelConfig model, String apiKey, String endpoint, OkHttpClient client, ObjectMapper mapper) {
        super(model, apiKey, endpoint, client, mapper);
    }

    @Override
    protected Request buildRequest(AIRequest request, boolean stream, OkHttpClient callClient) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", wireModel(request));
        payload.put("messages", toWireMessages(request));
        GenerationParams params = request.params();
        if (params.temperature() != null) {
            payload.put("temperature", params.temperature());
        }
        if (params.maxOutputTokens() != null) {
            payload.put("max_tokens", params.maxOutputTokens());
        }
        if (params.topP() != null) {
            payload.put("top_p", params.topP());
        }
        if (request.wantsJson()) {
            payload.put("response_format", Map.of("type", "json_object"));
        }
        if (stream) {
            payload.put("stream", true);
            payload.put("stream_options", Map.of("include_usage", true));
        }
        customizePayload(request, payload);

        return jsonPost(completionsUrl(), payload)
            .header("Authorization", "Bearer " + apiKey())
            .header("Accept", stream ? "text/event-stream" : "application/json")
            .build();
    }

    @Override
    protected ProviderResult parseResponse(JsonNode root) throws ProviderException {
        if (root.has("error") && !root.path("error").isNull()) {
            throw new ProviderException(ErrorKind.API_ERROR, errorMessage(root.path("error")));
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderException(ErrorKind.RESPONSE_PARSING_ERROR, "response has no choices");
        }
        JsonNode content = choices.path(0).path("message").path("content");
        if (content.isMissingNode()) {
            throw new ProviderException(ErrorKind.RESPONSE_PARSING_ERROR, "response has no message content");
        }
        return ProviderResult.ok(content.asText(""), null, parseUsage(root.path("usage")));
    }

    @Override
    protected List<StreamEvent> parseStreamChunk(JsonNode chunk) {
        List<StreamEvent> events = new ArrayList<>();
        if (chunk.has("error") && !chunk.path("error").isNull()) {
            events.add(StreamEvent.error(GatewayError.of(ErrorKind.API_ERROR, errorMessage(chunk.path("error")))));
            return events;
        }
        for (JsonNode choice : chunk.path("choices")) {
            JsonNode content = choice.path("delta").path("content");
            if (content.isTextual() && !content.asText().isEmpty()) {
                events.add(StreamEvent.content(content.asText()));
            }
        }
        JsonNode usage = chunk.path("usage");
        if (usage.isObject()) {
            events.add(StreamEvent.usage(parseUsage(usage)));
        }
        return events;
    }

    protected String wireModel(AIRequest request) {
        return model().modelName();
    }

    protected void customizePayload(AIRequest request, Map<String, Object> payload) {
    }

    protected TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return TokenUsage.empty();
        }
        return new TokenUsage(
            usage.path("prompt_tokens").asLong(0),
            usage.path("completion_tokens").asLong(0),
            usage.path("total_tokens").asLong(0)
        );
    }

    private HttpUrl completionsUrl() {
        return apiBase().newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(AIRequest request) {
        List<Map<String, Object>> wire = new ArrayList<>();
        String system = prompts.systemInstruction(request);
        if (!system.isEmpty()) {
            wire.add(message("system", system));
        }
        for (ChatTurn turn : prompts.conversation(request)) {
            wire.add(message(roleValue(turn), turn.content()));
        }
        if (prompts.hasUserTurn(request)) {
            wire.add(userMessage(request));
        }
        return wire;
    }

    private Map<String, Object> userMessage(AIRequest request) {
        String text = prompts.userText(request);
        if (!request.hasImage()) {
            return message("user", text);
        }
        List<Map<String, Object>> parts = new ArrayList<>();
        if (!text.isBlank()) {
            parts.add(Map.of("type", "text", "text", text));
        }
        parts.add(Map.of("type", "image_url", "image_url", Map.of("url", imageUrl(request.image()))));
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", "user");
        row.put("content", parts);
        return row;
    }

    private static String imageUrl(ImageInput image) {
        return image.hasInlineData() ? image.dataUrl() : image.url();
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", role);
        row.put("content", content);
        return row;
    }

    private static String roleValue(ChatTurn turn) {
        return switch (turn.role()) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    private static String errorMessage(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        String message = error.path("message").asText("");
        return message.isBlank() ? error.toString() : message;
    }
}
