package io.switchboard.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.GenerationParams;
import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.model.TaskType;
import io.switchboard.core.registry.ModelConfig;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);
    private static final String HEALTH_PROMPT = "Reply with OK.";
    private static final int HEALTH_MAX_TOKENS = 5;

    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ModelConfig model;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final String configProblem;
    private final StructuredOutput structuredOutput;
    protected final OkHttpClient client;
    protected final ObjectMapper mapper;
    protected final PromptAssembler prompts;

    protected AbstractHttpProviderAdapter(
        ModelConfig model,
        String apiKey,
        String endpoint,
        OkHttpClient client,
        ObjectMapper mapper
    ) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.prompts = new PromptAssembler(mapper);
        this.structuredOutput = new StructuredOutput(mapper);

        String base = endpoint == null || endpoint.isBlank() ? model.provider().defaultEndpoint() : endpoint.trim();
        HttpUrl parsed = HttpUrl.parse(base);
        if (this.apiKey.isEmpty()) {
            this.configProblem = "missing credential for model " + model.id();
        } else if (parsed == null) {
            this.configProblem = "invalid endpoint for model " + model.id();
        } else {
            this.configProblem = "";
        }
        this.apiBase = parsed == null ? HttpUrl.get(model.provider().defaultEndpoint()) : parsed;
    }

    @Override
    public ModelConfig model() {
        return model;
    }

    @Override
    public ProviderResult executeTask(ProviderCall call) {
        Optional<GatewayError> rejected = precheck(call.request());
        if (rejected.isPresent()) {
            return ProviderResult.failed(rejected.get());
        }
        OkHttpClient callClient = client.newBuilder().callTimeout(call.timeout()).build();
        try {
            Request request = buildRequest(call.request(), false, callClient);
            try (Response response = callClient.newCall(request).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    return ProviderResult.failed(classifyHttpError(response.code(), body));
                }
                JsonNode root;
                try {
                    root = mapper.readTree(body);
                } catch (JsonProcessingException e) {
                    return ProviderResult.failed(GatewayError.of(
                        ErrorKind.RESPONSE_PARSING_ERROR,
                        "malformed response from " + model.key() + ": " + e.getOriginalMessage()
                    ));
                }
                return applyOutputShape(call.request(), parseResponse(root));
            }
        } catch (ProviderException e) {
            return ProviderResult.failed(e.error());
        } catch (IOException e) {
            return ProviderResult.failed(ErrorClassifier.fromException(e));
        }
    }

    @Override
    public ProviderStream executeTaskStream(ProviderCall call) {
        Optional<GatewayError> rejected = precheck(call.request());
        if (rejected.isPresent()) {
            return ProviderStream.failed(rejected.get());
        }
        // callTimeout would also bound the body; a stream only bounds the gap between chunks.
        Duration readTimeout = min(call.timeout(), model.limits().timeout());
        OkHttpClient streamClient = client.newBuilder().readTimeout(readTimeout).build();
        Response response = null;
        try {
            Request request = buildRequest(call.request(), true, streamClient);
            Call httpCall = streamClient.newCall(request);
            response = httpCall.execute();
            if (!response.isSuccessful()) {
                String body = response.body() == null ? "" : response.body().string();
                response.close();
                return ProviderStream.failed(classifyHttpError(response.code(), body));
            }
            return new SseProviderStream(model.id(), httpCall, response, mapper, this::parseStreamChunk);
        } catch (ProviderException e) {
            closeQuietly(response);
            return ProviderStream.failed(e.error());
        } catch (IOException e) {
            closeQuietly(response);
            return ProviderStream.failed(ErrorClassifier.fromException(e));
        }
    }

    @Override
    public HealthCheckResult checkHealth() {
        AIRequest probe = AIRequest.builder(TaskType.SUMMARIZATION)
            .prompt(HEALTH_PROMPT)
            .params(new GenerationParams(0.0, HEALTH_MAX_TOKENS, null))
            .build();
        ProviderResult result = executeTask(new ProviderCall(probe, min(HEALTH_TIMEOUT, model.limits().timeout())));
        if (result.success()) {
            return HealthCheckResult.up();
        }
        log.debug("Health check failed for {}: {}", model.key(), result.error());
        return HealthCheckResult.down(result.error().toString());
    }

    @Override
    public void close() {
        client.connectionPool().evictAll();
    }

    protected Optional<GatewayError> precheck(AIRequest request) {
        if (!configProblem.isEmpty()) {
            return Optional.of(GatewayError.of(ErrorKind.CONFIG_ERROR, configProblem));
        }
        return Optional.empty();
    }

    protected abstract Request buildRequest(AIRequest request, boolean stream, OkHttpClient callClient)
        throws IOException, ProviderException;

    protected abstract ProviderResult parseResponse(JsonNode root) throws ProviderException;

    protected abstract List<StreamEvent> parseStreamChunk(JsonNode chunk);

    protected GatewayError classifyHttpError(int status, String body) {
        return ErrorClassifier.fromStatus(status, body);
    }

    protected String apiKey() {
        return apiKey;
    }

    protected HttpUrl apiBase() {
        return apiBase;
    }

    protected Request.Builder jsonPost(HttpUrl url, Map<String, Object> payload) throws JsonProcessingException {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Content-Type", "application/json");
        for (Map.Entry<String, String> header : model.limits().customHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder;
    }

    protected Logger log() {
        return log;
    }

    private ProviderResult applyOutputShape(AIRequest request, ProviderResult result) {
        if (!result.success() || !request.wantsJson() || result.json() != null) {
            return result;
        }
        Optional<JsonNode> json = structuredOutput.parse(result.text());
        if (json.isEmpty()) {
            return ProviderResult.failed(GatewayError.of(
                ErrorKind.RESPONSE_PARSING_ERROR,
                "model " + model.key() + " did not return valid JSON"
            ));
        }
        return ProviderResult.ok(result.text(), json.get(), result.usage());
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static void closeQuietly(Response response) {
        if (response != null) {
            response.close();
        }
    }
}
