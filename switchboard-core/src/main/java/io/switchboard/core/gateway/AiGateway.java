package io.switchboard.core.gateway;

import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.AIResponse;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.provider.ProviderResult;
import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.registry.ModelRegistry;
import io.switchboard.core.registry.ModelStatistics;
import io.switchboard.core.routing.Deadline;
import io.switchboard.core.routing.HealthMonitor;
import io.switchboard.core.routing.HealthStatus;
import io.switchboard.core.routing.ModelSelector;
import io.switchboard.core.routing.OpenedStream;
import io.switchboard.core.routing.RoutingEngine;
import io.switchboard.core.routing.RoutingOutcome;
import io.switchboard.core.routing.RoutingTraceLogger;
import io.switchboard.core.streaming.GatewayStream;
import io.switchboard.core.streaming.StreamingAggregator;
import io.switchboard.core.usage.CallLogEntry;
import io.switchboard.core.usage.CallLogStatus;
import io.switchboard.core.usage.CallOutcome;
import io.switchboard.core.usage.UsageRecorder;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers: select, route, record, respond.
 *
 * <p>Provider failures come back as unsuccessful {@link AIResponse}s or {@code ERROR}
 * stream events. Every logical request writes exactly one call log entry.
 */
public final class AiGateway implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AiGateway.class);

    private final ModelRegistry registry;
    private final ModelSelector selector;
    private final RoutingEngine engine;
    private final HealthMonitor health;
    private final UsageRecorder recorder;
    private final StreamingAggregator aggregator;
    private final RoutingTraceLogger traceLogger = new RoutingTraceLogger();
    private final AutoCloseable adapters;
    private final Clock clock;
    private final Duration requestTimeout;

    public AiGateway(
        ModelRegistry registry,
        RoutingEngine engine,
        HealthMonitor health,
        UsageRecorder recorder,
        AutoCloseable adapters,
        Clock clock,
        Duration requestTimeout
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.health = Objects.requireNonNull(health, "health must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.adapters = adapters;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        this.selector = new ModelSelector(registry);
        this.aggregator = new StreamingAggregator(recorder);
    }

    public AIResponse execute(AIRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String requestId = UUID.randomUUID().toString();
        long started = System.nanoTime();
        Deadline deadline = Deadline.after(requestTimeout, clock);

        RoutingOutcome<ProviderResult> outcome;
        try {
            outcome = engine.execute(request, selector.selectCandidates(request), deadline);
        } catch (IOException e) {
            outcome = registryUnavailable(e);
        }
        traceLogger.log(requestId, outcome);
        long durationMs = elapsedMs(started);

        if (!outcome.success()) {
            recorder.record(new CallOutcome(
                requestId, request, outcome.model(), statusOf(outcome), "", null, null,
                durationMs, outcome.error(), outcome.attempts()
            ));
            return AIResponse.failure(requestId, outcome.error().kind(), outcome.error().message(), durationMs);
        }

        ProviderResult result = outcome.value();
        ModelConfig model = outcome.model();
        CallLogEntry entry = recorder.record(new CallOutcome(
            requestId, request, model, CallLogStatus.SUCCESS, result.text(), result.json(), result.usage(),
            durationMs, null, outcome.attempts()
        ));
        return AIResponse.success(
            requestId,
            result.text(),
            result.json(),
            model.id(),
            model.modelName(),
            model.provider(),
            result.usage(),
            entry.cost(),
            durationMs
        );
    }

    public GatewayStream executeStream(AIRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String requestId = UUID.randomUUID().toString();
        long started = System.nanoTime();
        Deadline deadline = Deadline.after(requestTimeout, clock);

        RoutingOutcome<OpenedStream> opened;
        try {
            opened = engine.openStream(request, selector.selectCandidates(request), deadline);
        } catch (IOException e) {
            opened = registryUnavailable(e);
        }
        traceLogger.log(requestId, opened);
        return aggregator.aggregate(requestId, request, opened, started);
    }

    public List<ModelStatsView> modelStats() throws IOException {
        return registry.listActiveModels().stream().map(this::view).toList();
    }

    public List<ModelStatsView> probeAll() throws IOException {
        List<ModelConfig> models = registry.listActiveModels();
        health.probeAll(models, requestTimeout);
        return models.stream().map(this::view).toList();
    }

    @Override
    public void close() {
        health.close();
        if (adapters != null) {
            try {
                adapters.close();
            } catch (Exception e) {
                LOG.warn("Failed to release provider adapters: {}", e.getMessage());
            }
        }
    }

    private ModelStatsView view(ModelConfig model) {
        ModelStatistics stats = model.statistics();
        Optional<HealthStatus> status = health.status(model);
        return new ModelStatsView(
            model.id(),
            model.key(),
            model.provider(),
            model.priority(),
            status.map(s -> s.healthy() ? "healthy" : "unhealthy").orElse("unknown"),
            status.map(HealthStatus::message).orElse(""),
            stats.totalRequests(),
            stats.successfulRequests(),
            stats.failedRequests(),
            stats.successRate(),
            stats.averageResponseTimeMs(),
            stats.totalTokensUsed(),
            stats.totalCost(),
            stats.lastUsedAt()
        );
    }

    private static <T> RoutingOutcome<T> registryUnavailable(IOException e) {
        LOG.error("Model registry unavailable", e);
        return new RoutingOutcome<>(null, null, GatewayError.of(
            ErrorKind.MODEL_SELECTION_ERROR,
            "Model registry unavailable: " + e.getMessage()
        ), List.of());
    }

    private static CallLogStatus statusOf(RoutingOutcome<?> outcome) {
        return outcome.timedOut() ? CallLogStatus.TIMEOUT : CallLogStatus.FAILED;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
