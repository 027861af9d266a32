package io.switchboard.core.registry;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway-owned read-through cache of the active model list.
 * A failed refresh keeps serving the previous snapshot.
 */
public final class CachedModelRegistry implements ModelRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(CachedModelRegistry.class);

    private final ModelRegistry delegate;
    private final Clock clock;
    private final Duration ttl;
    private volatile Snapshot snapshot;

    public CachedModelRegistry(ModelRegistry delegate, Clock clock, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
    }

    @Override
    public List<ModelConfig> listActiveModels() throws IOException {
        Snapshot current = snapshot;
        if (current != null && !current.expired(clock.instant(), ttl)) {
            return current.models();
        }
        return refresh();
    }

    @Override
    public Optional<ModelConfig> getModel(String id) throws IOException {
        Optional<ModelConfig> cached = listActiveModels().stream()
            .filter(model -> model.id().equals(id))
            .findFirst();
        return cached.isPresent() ? cached : delegate.getModel(id);
    }

    @Override
    public void updateStatistics(String id, StatisticsDelta delta) throws IOException {
        delegate.updateStatistics(id, delta);
    }

    public void invalidate() {
        snapshot = null;
    }

    private synchronized List<ModelConfig> refresh() throws IOException {
        Snapshot current = snapshot;
        Instant now = clock.instant();
        if (current != null && !current.expired(now, ttl)) {
            return current.models();
        }
        try {
            List<ModelConfig> models = deduplicate(delegate.listActiveModels());
            snapshot = new Snapshot(models, now);
            LOG.debug("Model registry refreshed: {} active models", models.size());
            return models;
        } catch (IOException e) {
            if (current == null) {
                throw e;
            }
            LOG.warn("Model registry refresh failed, serving stale snapshot: {}", e.getMessage());
            snapshot = new Snapshot(current.models(), now);
            return current.models();
        }
    }

    private List<ModelConfig> deduplicate(List<ModelConfig> models) {
        List<ModelConfig> ordered = models.stream()
            .filter(ModelConfig::active)
            .sorted(Comparator.comparingInt(ModelConfig::priority).thenComparing(ModelConfig::id))
            .toList();
        Set<String> seen = new HashSet<>();
        List<ModelConfig> unique = new ArrayList<>();
        for (ModelConfig model : ordered) {
            if (seen.add(model.key())) {
                unique.add(model);
            } else {
                LOG.warn("Ignoring duplicate active model {} (id={})", model.key(), model.id());
            }
        }
        return List.copyOf(unique);
    }

    private record Snapshot(List<ModelConfig> models, Instant loadedAt) {
        boolean expired(Instant now, Duration ttl) {
            return !now.isBefore(loadedAt.plus(ttl));
        }
    }
}
