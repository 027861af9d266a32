package io.switchboard.core.routing;

import io.switchboard.core.provider.HealthCheckResult;
import io.switchboard.core.registry.ModelConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cached health per model key. Unknown and expired entries count as healthy while a
 * background probe refreshes them; a failed probe excludes the model until its entry expires.
 */
public final class HealthMonitor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);

    private final Map<String, HealthStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, ModelConfig> known = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Function<ModelConfig, HealthCheckResult> probe;
    private final Clock clock;
    private final Duration ttl;
    private final Duration sweepInterval;
    private final ExecutorService workers;
    private final ScheduledExecutorService sweeper;

    public HealthMonitor(
        Function<ModelConfig, HealthCheckResult> probe,
        Clock clock,
        Duration ttl,
        Duration sweepInterval,
        int workerThreads
    ) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval must not be null");
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), daemonThreads("switchboard-health"));
        this.sweeper = Executors.newSingleThreadScheduledExecutor(daemonThreads("switchboard-health-sweep"));
    }

    public void start() {
        long periodMs = Math.max(1, sweepInterval.toMillis());
        sweeper.scheduleAtFixedRate(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.debug("Health sweep scheduled every {} ms (ttl {})", periodMs, ttl);
    }

    public boolean isHealthy(ModelConfig model) {
        known.put(model.key(), model);
        HealthStatus status = statuses.get(model.key());
        if (status == null || expired(status)) {
            scheduleProbe(model);
            return true;
        }
        return status.healthy();
    }

    public Optional<HealthStatus> status(ModelConfig model) {
        return Optional.ofNullable(statuses.get(model.key()));
    }

    public void probeAll(List<ModelConfig> models, Duration timeout) {
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (ModelConfig model : models) {
            known.put(model.key(), model);
            try {
                futures.add(CompletableFuture.runAsync(() -> probeNow(model), workers));
            } catch (RejectedExecutionException e) {
                LOG.debug("Health monitor closed; skipping probe of {}", model.key());
            }
        }
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Health re-probe of {} models did not finish within {}", models.size(), timeout);
        } catch (ExecutionException e) {
            LOG.warn("Health re-probe failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public HealthStatus probeNow(ModelConfig model) {
        HealthCheckResult result;
        try {
            result = probe.apply(model);
        } catch (RuntimeException e) {
            result = HealthCheckResult.down(e.getMessage());
        }
        HealthCheckResult outcome = result;
        HealthStatus next = new HealthStatus(outcome.healthy(), clock.instant(), outcome.message());
        statuses.compute(model.key(), (key, previous) -> {
            if (previous == null || previous.healthy() != next.healthy()) {
                if (next.healthy()) {
                    LOG.info("Model {} is healthy", key);
                } else {
                    LOG.warn("Model {} is unhealthy: {}", key, next.message());
                }
            }
            return next;
        });
        return next;
    }

    void sweep() {
        for (ModelConfig model : known.values()) {
            HealthStatus status = statuses.get(model.key());
            if (status == null || expired(status)) {
                scheduleProbe(model);
            }
        }
    }

    private void scheduleProbe(ModelConfig model) {
        String key = model.key();
        if (!inFlight.add(key)) {
            return;
        }
        try {
            workers.execute(() -> {
                try {
                    probeNow(model);
                } finally {
                    inFlight.remove(key);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            LOG.debug("Health monitor closed; skipping probe of {}", key);
        }
    }

    private boolean expired(HealthStatus status) {
        Instant expiry = status.lastChecked().plus(ttl);
        return !clock.instant().isBefore(expiry);
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
        workers.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
