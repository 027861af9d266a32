package io.switchboard.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ChatRole;
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
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class GeminiAdapter extends AbstractHttpProviderAdapter {
    private static final String API_KEY_HEADER = "x-goog-api-key";

    public GeminiAdapter(ModelConfig model, String apiKey, String endpoint, OkHttpClient client, ObjectMapper mapper) {
        super(model, apiKey, endpoint, client, mapper);
    }

    @Override
    protected Request buildRequest(AIRequest request, boolean stream, OkHttpClient callClient)
        throws IOException, ProviderException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", toContents(request, callClient));
        String system = prompts.systemInstruction(request);
        if (!system.isEmpty()) {
            payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system))));
        }
        payload.put("generationConfig", generationConfig(request));

        return jsonPost(methodUrl(stream), payload)
            .header(API_KEY_HEADER, apiKey())
            .build();
    }

    @Override
    protected ProviderResult parseResponse(JsonNode root) throws ProviderException {
        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            String blockReason = root.path("promptFeedback").path("blockReason").asText("");
            if (!blockReason.isBlank()) {
                throw new ProviderException(ErrorKind.INVALID_REQUEST_ERROR, "prompt blocked: " + blockReason);
            }
            throw new ProviderException(ErrorKind.RESPONSE_PARSING_ERROR, "response has no candidates");
        }
        JsonNode parts = candidates.path(0).path("content").path("parts");
        if (!parts.isArray()) {
            throw new ProviderException(ErrorKind.RESPONSE_PARSING_ERROR, "candidate has no content parts");
        }
        return ProviderResult.ok(joinText(parts), null, parseUsage(root.path("usageMetadata")));
    }

    @Override
    protected List<StreamEvent> parseStreamChunk(JsonNode chunk) {
        List<StreamEvent> events = new ArrayList<>();
        if (chunk.has("error")) {
            String message = chunk.path("error").path("message").asText(chunk.path("error").toString());
            events.add(StreamEvent.error(GatewayError.of(ErrorKind.API_ERROR, message)));
            return events;
        }
        String text = joinText(chunk.path("candidates").path(0).path("content").path("parts"));
        if (!text.isEmpty()) {
            events.add(StreamEvent.content(text));
        }
        JsonNode usage = chunk.path("usageMetadata");
        if (usage.isObject()) {
            events.add(StreamEvent.usage(parseUsage(usage)));
        }
        return events;
    }

    @Override
    protected GatewayError classifyHttpError(int status, String body) {
        if (status == 400 && body != null && body.contains("API_KEY_INVALID")) {
            return new GatewayError(ErrorKind.AUTHENTICATION_ERROR, "HTTP 400 API key rejected", status);
        }
        return super.classifyHttpError(status, body);
    }

    private HttpUrl methodUrl(boolean stream) {
        String method = stream ? ":streamGenerateContent" : ":generateContent";
        HttpUrl.Builder url = apiBase().newBuilder()
            .addPathSegment("models")
            .addPathSegment(model().modelName() + method);
        if (stream) {
            url.addQueryParameter("alt", "sse");
        }
        return url.build();
    }

    private List<Map<String, Object>> toContents(AIRequest request, OkHttpClient callClient)
        throws IOException, ProviderException {
        List<Map<String, Object>> contents = new ArrayList<>();
        for (ChatTurn turn : prompts.conversation(request)) {
            contents.add(content(turn.role() == ChatRole.ASSISTANT ? "model" : "user",
                List.of(Map.of("text", turn.content()))));
        }
        if (prompts.hasUserTurn(request)) {
            List<Map<String, Object>> parts = new ArrayList<>();
            String text = prompts.userText(request);
            if (!text.isBlank()) {
                parts.add(Map.of("text", text));
            }
            if (request.hasImage()) {
                parts.add(inlineImage(request.image(), callClient));
            }
            contents.add(content("user", parts));
        }
        return contents;
    }

    private Map<String, Object> inlineImage(ImageInput image, OkHttpClient callClient)
        throws IOException, ProviderException {
        ImageInput inline = image.hasInlineData() ? image : download(image.url(), callClient);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("mimeType", inline.mimeType());
        data.put("data", inline.base64());
        return Map.of("inlineData", data);
    }

    private ImageInput download(String url, OkHttpClient callClient) throws IOException, ProviderException {
        HttpUrl imageUrl = HttpUrl.parse(url);
        if (imageUrl == null) {
            throw new ProviderException(ErrorKind.INVALID_REQUEST_ERROR, "invalid image url");
        }
        Request request = new Request.Builder().url(imageUrl).get().build();
        try (Response response = callClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new ProviderException(new GatewayError(
                    ErrorKind.INVALID_REQUEST_ERROR,
                    "image download failed with HTTP " + response.code(),
                    response.code()
                ));
            }
            MediaType type = body.contentType();
            String mime = type == null ? null : type.type() + "/" + type.subtype();
            return ImageInput.inline(body.bytes(), mime);
        }
    }

    private Map<String, Object> generationConfig(AIRequest request) {
        GenerationParams params = request.params();
        Map<String, Object> config = new LinkedHashMap<>();
        if (params.temperature() != null) {
            config.put("temperature", params.temperature());
        }
        if (params.topP() != null) {
            config.put("topP", params.topP());
        }
        if (params.maxOutputTokens() != null) {
            config.put("maxOutputTokens", params.maxOutputTokens());
        }
        if (request.wantsJson()) {
            config.put("responseMimeType", "application/json");
        }
        return config;
    }

    private static Map<String, Object> content(String role, List<Map<String, Object>> parts) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", role);
        row.put("parts", parts);
        return row;
    }

    private static String joinText(JsonNode parts) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private static TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return TokenUsage.empty();
        }
        return new TokenUsage(
            usage.path("promptTokenCount").asLong(0),
            usage.path("candidatesTokenCount").asLong(0),
            usage.path("totalTokenCount").asLong(0)
        );
    }
}
