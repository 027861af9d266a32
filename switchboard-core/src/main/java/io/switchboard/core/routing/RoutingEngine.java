package io.switchboard.core.routing;

import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.provider.ProviderAdapter;
import io.switchboard.core.provider.ProviderCall;
import io.switchboard.core.provider.ProviderResult;
import io.switchboard.core.provider.ProviderStream;
import io.switchboard.core.registry.ModelConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential failover over an ordered candidate list.
 *
 * <p>Each candidate gets one attempt plus up to {@code maxRetries} retries; only transient
 * errors are retried, with linear backoff. Every attempt is bounded by the model timeout
 * and by what is left of the request deadline.
 */
public final class RoutingEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RoutingEngine.class);

    private final Function<ModelConfig, ProviderAdapter> adapters;
    private final HealthMonitor health;
    private final Duration backoffUnit;

    public RoutingEngine(Function<ModelConfig, ProviderAdapter> adapters, HealthMonitor health, Duration backoffUnit) {
        this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
        this.health = Objects.requireNonNull(health, "health must not be null");
        this.backoffUnit = backoffUnit == null ? Duration.ZERO : backoffUnit;
    }

    public RoutingOutcome<ProviderResult> execute(AIRequest request, List<ModelConfig> candidates, Deadline deadline) {
        return route(request, candidates, deadline, (adapter, call) -> {
            ProviderResult result = adapter.executeTask(call);
            return result.success() ? Attempt.ok(result) : Attempt.failed(result.error());
        });
    }

    /**
     * Opens a stream with failover. A candidate counts as opened once its first event is not an error;
     * after that the stream belongs to the caller and is never retried.
     */
    public RoutingOutcome<OpenedStream> openStream(AIRequest request, List<ModelConfig> candidates, Deadline deadline) {
        return route(request, candidates, deadline, (adapter, call) -> {
            ProviderStream stream = adapter.executeTaskStream(call);
            if (!stream.hasNext()) {
                stream.close();
                return Attempt.failed(GatewayError.of(ErrorKind.API_ERROR, "stream ended without events"));
            }
            StreamEvent first = stream.next();
            if (first.type() == StreamEvent.Type.ERROR) {
                stream.close();
                return Attempt.failed(first.error());
            }
            return Attempt.ok(new OpenedStream(stream, first));
        });
    }

    private <T> RoutingOutcome<T> route(
        AIRequest request,
        List<ModelConfig> candidates,
        Deadline deadline,
        BiFunction<ProviderAdapter, ProviderCall, Attempt<T>> dispatch
    ) {
        List<AttemptRecord> trace = new ArrayList<>();
        if (candidates.isEmpty()) {
            return failure(null, GatewayError.of(
                ErrorKind.MODEL_SELECTION_ERROR,
                "No active model supports task " + request.taskType()
            ), trace);
        }

        List<ModelConfig> healthy = healthyOnly(candidates);
        if (healthy.isEmpty()) {
            LOG.warn("All {} candidate models are marked unhealthy; re-probing", candidates.size());
            health.probeAll(candidates, deadline.remaining());
            healthy = healthyOnly(candidates);
        }
        if (healthy.isEmpty()) {
            String reasons = candidates.stream()
                .map(model -> model.key() + ": " + health.status(model).map(HealthStatus::message).orElse("unhealthy"))
                .collect(Collectors.joining("; "));
            return failure(null, GatewayError.of(ErrorKind.ALL_MODELS_FAILED, "All candidate models are unhealthy: " + reasons), trace);
        }

        List<String> reasons = new ArrayList<>();
        ModelConfig lastTried = null;
        GatewayError lastError = null;
        for (ModelConfig model : healthy) {
            int maxAttempts = 1 + model.limits().maxRetries();
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Duration timeout = min(model.limits().timeout(), deadline.remaining());
                if (timeout.isZero()) {
                    return timeout(lastTried, lastError, deadline, trace);
                }
                lastTried = model;
                long started = System.nanoTime();
                Attempt<T> result = dispatch.apply(adapters.apply(model), new ProviderCall(request, timeout));
                long durationMs = (System.nanoTime() - started) / 1_000_000;
                trace.add(new AttemptRecord(model.id(), model.key(), attempt, durationMs, result.error()));

                if (result.error() == null) {
                    return new RoutingOutcome<>(result.value(), model, null, trace);
                }
                lastError = result.error();
                if (deadline.expired()) {
                    return timeout(model, lastError, deadline, trace);
                }
                if (!lastError.transientError() || attempt == maxAttempts) {
                    break;
                }
                LOG.debug("Retrying {} after {} (attempt {}/{})", model.key(), lastError, attempt, maxAttempts);
                pause(backoffUnit.multipliedBy(attempt), deadline);
            }
            reasons.add(model.key() + " -> " + lastError);
        }
        return failure(lastTried, GatewayError.of(
            ErrorKind.ALL_MODELS_FAILED,
            "All models failed: " + String.join("; ", reasons)
        ), trace);
    }

    private List<ModelConfig> healthyOnly(List<ModelConfig> candidates) {
        return candidates.stream().filter(health::isHealthy).toList();
    }

    private static <T> RoutingOutcome<T> timeout(
        ModelConfig model,
        GatewayError lastError,
        Deadline deadline,
        List<AttemptRecord> trace
    ) {
        String message = "Request deadline of " + deadline.budget().toMillis() + " ms exceeded after "
            + trace.size() + " attempts" + (lastError == null ? "" : "; last error: " + lastError);
        return failure(model, GatewayError.of(ErrorKind.TIMEOUT_ERROR, message), trace);
    }

    private static <T> RoutingOutcome<T> failure(ModelConfig model, GatewayError error, List<AttemptRecord> trace) {
        return new RoutingOutcome<>(null, model, error, trace);
    }

    private static void pause(Duration backoff, Deadline deadline) {
        Duration wait = min(backoff, deadline.remaining());
        if (wait.isZero() || wait.isNegative()) {
            return;
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private record Attempt<T>(T value, GatewayError error) {

        static <T> Attempt<T> ok(T value) {
            return new Attempt<>(value, null);
        }

        static <T> Attempt<T> failed(GatewayError error) {
            return new Attempt<>(null, error);
        }
    }
}
