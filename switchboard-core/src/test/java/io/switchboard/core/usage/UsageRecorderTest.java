package io.switchboard.core.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.ImageInput;
import io.switchboard.core.model.ProviderType;
import io.switchboard.core.model.TaskType;
import io.switchboard.core.model.TokenUsage;
import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.registry.ModelRegistry;
import io.switchboard.core.registry.StatisticsDelta;
import io.switchboard.core.support.InMemoryCallLogStore;
import io.switchboard.core.support.InMemoryModelRegistry;
import io.switchboard.core.support.MutableClock;
import io.switchboard.core.support.TestModels;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class UsageRecorderTest {
    private static final AIRequest REQUEST = AIRequest.builder(TaskType.SUMMARIZATION).prompt("sum").build();

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-10T12:00:00Z"));
    private final ModelConfig model = TestModels.model("m1", ProviderType.OPENAI_COMPATIBLE, "gpt-4o-mini", 1);
    private final InMemoryModelRegistry registry = new InMemoryModelRegistry(List.of(model));
    private final InMemoryCallLogStore store = new InMemoryCallLogStore();
    private final UsageRecorder recorder = new UsageRecorder(store, registry, mapper, clock, Duration.ZERO);

    @Test
    void shouldWriteEntryAndStatisticsForSuccess() {
        CallLogEntry entry = recorder.record(new CallOutcome(
            "req-1", REQUEST, model, CallLogStatus.SUCCESS, "short", null, new TokenUsage(1000, 500, 1500), 420, null, 1
        ));

        assertThat(store.entries()).containsExactly(entry);
        assertThat(entry.requestId()).isEqualTo("req-1");
        assertThat(entry.provider()).isEqualTo("openai_compatible");
        assertThat(entry.cost()).isCloseTo(0.025, within(1e-9));
        assertThat(entry.timestamp()).isEqualTo(clock.instant());
        assertThat(registry.get("m1").statistics().successfulRequests()).isEqualTo(1);
        assertThat(registry.get("m1").statistics().totalTokensUsed()).isEqualTo(1500);
    }

    @Test
    void shouldAttributeFailureToLastModelTried() {
        GatewayError error = GatewayError.of(ErrorKind.ALL_MODELS_FAILED, "All models failed: x");

        CallLogEntry entry = recorder.record(new CallOutcome(
            "req-2", REQUEST, model, CallLogStatus.FAILED, "", null, null, 90, error, 3
        ));

        assertThat(entry.errorKind()).isEqualTo(ErrorKind.ALL_MODELS_FAILED);
        assertThat(entry.attempts()).isEqualTo(3);
        assertThat(registry.get("m1").statistics().failedRequests()).isEqualTo(1);
        assertThat(registry.get("m1").statistics().lastError()).startsWith("all_models_failed");
    }

    @Test
    void shouldLogWithoutStatisticsWhenNoModelWasSelected() {
        CallLogEntry entry = recorder.record(new CallOutcome(
            "req-3", REQUEST, null, CallLogStatus.FAILED, "", null, null, 1,
            GatewayError.of(ErrorKind.MODEL_SELECTION_ERROR, "No active model"), 0
        ));

        assertThat(entry.modelId()).isEmpty();
        assertThat(entry.cost()).isZero();
        assertThat(registry.deltas()).isEmpty();
    }

    @Test
    void shouldLeaveStatisticsAloneForCancelledStreams() throws Exception {
        AIRequest streaming = AIRequest.builder(TaskType.SUMMARIZATION).prompt("sum").stream(true).build();

        CallLogEntry entry = recorder.record(new CallOutcome(
            "req-4", streaming, model, CallLogStatus.CANCELLED, "partial te", null, null, 50,
            GatewayError.of(ErrorKind.CANCELLED, "stream closed by caller"), 1
        ));

        JsonNode response = mapper.readTree(entry.responseJson());
        assertThat(response.path("text").asText()).isEqualTo("partial te");
        assertThat(response.path("partial").asBoolean()).isTrue();
        assertThat(registry.deltas()).isEmpty();
    }

    @Test
    void shouldElideInlineImageBytesFromRequestJson() throws Exception {
        AIRequest ocr = AIRequest.builder(TaskType.OCR)
            .prompt("read")
            .image(ImageInput.inline(new byte[2048], "image/png"))
            .build();

        CallLogEntry entry = recorder.record(new CallOutcome(
            "req-5", ocr, model, CallLogStatus.SUCCESS, "text", null, null, 10, null, 1
        ));

        JsonNode image = mapper.readTree(entry.requestJson()).path("image");
        assertThat(image.path("bytes").asInt()).isEqualTo(2048);
        assertThat(image.has("data")).isFalse();
        assertThat(entry.requestJson()).hasSizeLessThan(1024);
    }

    @Test
    void shouldRetryFailedStoreWrites() {
        AtomicInteger attempts = new AtomicInteger();
        InMemoryCallLogStore flaky = new InMemoryCallLogStore() {
            @Override
            public synchronized void append(CallLogEntry entry) {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("database is locked");
                }
                super.append(entry);
            }
        };
        UsageRecorder retrying = new UsageRecorder(flaky, registry, mapper, clock, Duration.ZERO);

        retrying.record(new CallOutcome("req-6", REQUEST, model, CallLogStatus.SUCCESS, "ok", null, null, 5, null, 1));

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(flaky.entries()).hasSize(1);
    }

    @Test
    void shouldNotThrowWhenStoreStaysDown() {
        CallLogStore broken = new CallLogStore() {
            @Override
            public void append(CallLogEntry entry) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public List<CallLogEntry> list(Instant since) {
                return List.of();
            }
        };
        UsageRecorder failing = new UsageRecorder(broken, registry, mapper, clock, Duration.ZERO);

        CallLogEntry entry = failing.record(new CallOutcome(
            "req-7", REQUEST, model, CallLogStatus.SUCCESS, "ok", null, null, 5, null, 1
        ));

        assertThat(entry.requestId()).isEqualTo("req-7");
        assertThat(registry.get("m1").statistics().totalRequests()).isZero();
        assertThat(registry.deltas()).isEmpty();
    }

    @Test
    void shouldRetryStatisticsWithoutAppendingEntryTwice() {
        AtomicInteger statisticsCalls = new AtomicInteger();
        InMemoryModelRegistry flakyRegistry = new InMemoryModelRegistry(List.of(model)) {
            @Override
            public synchronized void updateStatistics(String id, StatisticsDelta delta) throws IOException {
                if (statisticsCalls.incrementAndGet() == 1) {
                    throw new IOException("registry file busy");
                }
                super.updateStatistics(id, delta);
            }
        };
        UsageRecorder retrying = new UsageRecorder(store, flakyRegistry, mapper, clock, Duration.ZERO);

        retrying.record(new CallOutcome("req-8", REQUEST, model, CallLogStatus.SUCCESS, "ok", null, null, 5, null, 1));

        assertThat(store.entries()).hasSize(1);
        assertThat(statisticsCalls.get()).isEqualTo(2);
        assertThat(flakyRegistry.get("m1").statistics().totalRequests()).isEqualTo(1);
    }

    @Test
    void shouldNotLoseConcurrentStatisticsUpdatesForOneModel() throws Exception {
        AtomicReference<ModelConfig> stored = new AtomicReference<>(model);
        ModelRegistry unlocked = new ModelRegistry() {
            @Override
            public List<ModelConfig> listActiveModels() {
                return List.of(stored.get());
            }

            @Override
            public Optional<ModelConfig> getModel(String id) {
                return Optional.of(stored.get());
            }

            @Override
            public void updateStatistics(String id, StatisticsDelta delta) {
                ModelConfig current = stored.get();
                Thread.yield();
                stored.set(current.withStatistics(current.statistics().apply(delta)));
            }
        };
        UsageRecorder shared = new UsageRecorder(store, unlocked, mapper, clock, Duration.ZERO);
        int requests = 64;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < requests; i++) {
                String requestId = "req-c" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return shared.record(new CallOutcome(
                        requestId, REQUEST, model, CallLogStatus.SUCCESS, "ok", null, new TokenUsage(1, 1, 2), 5, null, 1
                    ));
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.entries()).hasSize(requests);
        assertThat(stored.get().statistics().totalRequests()).isEqualTo(requests);
        assertThat(stored.get().statistics().totalTokensUsed()).isEqualTo(2L * requests);
    }
}
