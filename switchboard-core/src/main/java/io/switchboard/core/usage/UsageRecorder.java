package io.switchboard.core.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ImageInput;
import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.registry.ModelRegistry;
import io.switchboard.core.registry.StatisticsDelta;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the call log entry and the statistics delta for a finished request.
 * Writes for the same model are serialized; store failures are retried, then logged.
 */
public final class UsageRecorder {
    private static final Logger LOG = LoggerFactory.getLogger(UsageRecorder.class);
    private static final int WRITE_ATTEMPTS = 3;
    private static final String NO_MODEL = "";

    private final CallLogStore callLog;
    private final ModelRegistry registry;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration retryDelay;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public UsageRecorder(CallLogStore callLog, ModelRegistry registry, ObjectMapper mapper, Clock clock) {
        this(callLog, registry, mapper, clock, Duration.ofMillis(100));
    }

    public UsageRecorder(
        CallLogStore callLog,
        ModelRegistry registry,
        ObjectMapper mapper,
        Clock clock,
        Duration retryDelay
    ) {
        this.callLog = Objects.requireNonNull(callLog, "callLog must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
    }

    public CallLogEntry record(CallOutcome outcome) {
        ModelConfig model = outcome.model();
        double cost = model == null ? 0.0 : CostCalculator.cost(model.pricing(), outcome.usage());
        Instant now = clock.instant();
        CallLogEntry entry = toEntry(outcome, cost, now);

        String lockKey = model == null ? NO_MODEL : model.id();
        synchronized (locks.computeIfAbsent(lockKey, ignored -> new Object())) {
            StatisticsDelta delta = model == null ? null : toDelta(outcome, cost, now);
            writePair(entry, model, delta);
        }
        return entry;
    }

    // An entry that already landed is not appended again; the delta never lands without it.
    private void writePair(CallLogEntry entry, ModelConfig model, StatisticsDelta delta) {
        boolean appended = false;
        for (int attempt = 1; attempt <= WRITE_ATTEMPTS; attempt++) {
            try {
                if (!appended) {
                    callLog.append(entry);
                    appended = true;
                }
                if (delta != null) {
                    registry.updateStatistics(model.id(), delta);
                }
                return;
            } catch (IOException | RuntimeException e) {
                String what = appended ? "statistics for model " + model.id() : "call log entry " + entry.id();
                if (attempt == WRITE_ATTEMPTS) {
                    LOG.error("Failed to write {} after {} attempts", what, WRITE_ATTEMPTS, e);
                    return;
                }
                LOG.warn("Write of {} failed (attempt {}/{}): {}", what, attempt, WRITE_ATTEMPTS, e.getMessage());
                sleep(retryDelay.multipliedBy(attempt));
            }
        }
    }

    private CallLogEntry toEntry(CallOutcome outcome, double cost, Instant now) {
        ModelConfig model = outcome.model();
        return new CallLogEntry(
            UUID.randomUUID().toString(),
            outcome.requestId(),
            model == null ? "" : model.id(),
            model == null ? "" : model.provider().wireName(),
            model == null ? "" : model.modelName(),
            outcome.request().taskType(),
            requestJson(outcome.request()),
            responseJson(outcome),
            outcome.usage().promptTokens(),
            outcome.usage().completionTokens(),
            outcome.usage().totalTokens(),
            cost,
            outcome.durationMs(),
            outcome.status(),
            outcome.error() == null ? null : outcome.error().kind(),
            outcome.error() == null ? "" : outcome.error().message(),
            outcome.attempts(),
            now
        );
    }

    private static StatisticsDelta toDelta(CallOutcome outcome, double cost, Instant now) {
        long tokens = outcome.usage().totalTokens();
        return switch (outcome.status()) {
            case SUCCESS -> StatisticsDelta.success(tokens, cost, outcome.durationMs(), now);
            case FAILED, TIMEOUT -> StatisticsDelta.failure(
                tokens,
                cost,
                outcome.durationMs(),
                now,
                outcome.error() == null ? outcome.status().name() : outcome.error().toString()
            );
            case CANCELLED -> null;
        };
    }

    private String requestJson(AIRequest request) {
        ObjectNode node = mapper.createObjectNode();
        node.put("taskType", request.taskType().name());
        node.put("prompt", request.prompt());
        if (!request.systemPrompt().isEmpty()) {
            node.put("systemPrompt", request.systemPrompt());
        }
        if (request.hasImage()) {
            ImageInput image = request.image();
            ObjectNode imageNode = node.putObject("image");
            imageNode.put("mimeType", image.mimeType());
            if (image.hasInlineData()) {
                imageNode.put("bytes", image.data().length);
            } else {
                imageNode.put("url", image.url());
            }
        }
        node.set("context", mapper.valueToTree(request.context()));
        node.set("history", mapper.valueToTree(request.history()));
        node.set("params", mapper.valueToTree(request.params()));
        node.put("stream", request.stream());
        node.put("outputShape", request.outputShape().name());
        return write(node);
    }

    private String responseJson(CallOutcome outcome) {
        ObjectNode node = mapper.createObjectNode();
        node.put("text", outcome.text());
        if (outcome.json() != null) {
            node.set("json", outcome.json());
        }
        if (outcome.request().stream()) {
            node.put("partial", outcome.status() != CallLogStatus.SUCCESS);
        }
        return write(node);
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            LOG.warn("Could not serialize call log payload: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private static void sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
