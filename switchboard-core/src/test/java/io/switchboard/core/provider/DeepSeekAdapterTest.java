package io.switchboard.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.ImageInput;
import io.switchboard.core.model.ProviderType;
import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.model.TaskType;
import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.support.TestModels;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeepSeekAdapterTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRouteCodeAndMathTasksToSpecialistModels() throws Exception {
        server.enqueue(new MockResponse().setBody(completion("def f(): pass")));
        server.enqueue(new MockResponse().setBody(completion("42")));
        server.enqueue(new MockResponse().setBody(completion("summary")));

        DeepSeekAdapter adapter = adapter("deepseek-chat");
        adapter.executeTask(call(AIRequest.builder(TaskType.CODE_GENERATION).prompt("write f").build()));
        adapter.executeTask(call(AIRequest.builder(TaskType.MATH_SOLVING).prompt("6*7").build()));
        adapter.executeTask(call(AIRequest.builder(TaskType.SUMMARIZATION).prompt("sum up").build()));

        JsonNode code = mapper.readTree(server.takeRequest().getBody().readUtf8());
        JsonNode math = mapper.readTree(server.takeRequest().getBody().readUtf8());
        JsonNode summary = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(code.path("model").asText()).isEqualTo("deepseek-coder");
        assertThat(code.path("frequency_penalty").asDouble()).isEqualTo(0.1);
        assertThat(math.path("model").asText()).isEqualTo("deepseek-math");
        assertThat(summary.path("model").asText()).isEqualTo("deepseek-chat");
    }

    @Test
    void shouldKeepExplicitlyConfiguredModel() throws Exception {
        server.enqueue(new MockResponse().setBody(completion("ok")));

        adapter("deepseek-reasoner").executeTask(call(AIRequest.builder(TaskType.CODE_REVIEW).prompt("review").build()));

        assertThat(mapper.readTree(server.takeRequest().getBody().readUtf8()).path("model").asText())
            .isEqualTo("deepseek-reasoner");
    }

    @Test
    void shouldRejectImagesWithoutCallingBackend() {
        AIRequest request = AIRequest.builder(TaskType.SUMMARIZATION)
            .prompt("describe")
            .image(ImageInput.ofUrl("https://example.com/a.png"))
            .build();

        ProviderResult result = adapter("deepseek-chat").executeTask(call(request));

        assertThat(result.error().kind()).isEqualTo(ErrorKind.INVALID_REQUEST_ERROR);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldSumCacheSplitPromptTokens() {
        server.enqueue(new MockResponse().setBody("""
            {
              "choices": [ { "message": { "content": "ok" } } ],
              "usage": { "prompt_cache_hit_tokens": 30, "prompt_cache_miss_tokens": 20, "completion_tokens": 10 }
            }
            """));

        ProviderResult result = adapter("deepseek-chat")
            .executeTask(call(AIRequest.builder(TaskType.SUMMARIZATION).prompt("hi").build()));

        assertThat(result.usage().promptTokens()).isEqualTo(50);
        assertThat(result.usage().totalTokens()).isEqualTo(60);
    }

    @Test
    void shouldNotRelayReasoningDeltas() {
        String sse = """
            data: {"choices":[{"delta":{"reasoning_content":"thinking..."}}]}

            data: {"choices":[{"delta":{"content":"answer"}}]}

            data: [DONE]

            """;
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(sse));

        List<StreamEvent> events = new ArrayList<>();
        AIRequest request = AIRequest.builder(TaskType.SUMMARIZATION).prompt("q").stream(true).build();
        try (ProviderStream stream = adapter("deepseek-chat").executeTaskStream(call(request))) {
            stream.forEachRemaining(events::add);
        }

        assertThat(events).extracting(StreamEvent::type)
            .containsExactly(StreamEvent.Type.CONTENT, StreamEvent.Type.END);
        assertThat(events.get(0).content()).isEqualTo("answer");
    }

    private DeepSeekAdapter adapter(String modelName) {
        ModelConfig model = TestModels.withEndpoint(
            TestModels.model("d1", ProviderType.DEEPSEEK, modelName, 1),
            server.url("/v1").toString(),
            "ds-key"
        );
        return new DeepSeekAdapter(model, "ds-key", model.endpoint(), new OkHttpClient(), mapper);
    }

    private static String completion(String content) {
        return "{\"choices\":[{\"message\":{\"content\":\"" + content + "\"}}]}";
    }

    private static ProviderCall call(AIRequest request) {
        return new ProviderCall(request, Duration.ofSeconds(5));
    }
}
