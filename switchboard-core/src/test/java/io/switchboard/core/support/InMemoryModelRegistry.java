package io.switchboard.core.support;

import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.registry.ModelRegistry;
import io.switchboard.core.registry.StatisticsDelta;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryModelRegistry implements ModelRegistry {
    private final Map<String, ModelConfig> models = new LinkedHashMap<>();
    private final List<StatisticsDelta> deltas = new ArrayList<>();
    private int listCalls;
    private boolean failing;

    public InMemoryModelRegistry() {
        this(List.of());
    }

    public InMemoryModelRegistry(List<ModelConfig> initial) {
        initial.forEach(model -> models.put(model.id(), model));
    }

    public synchronized void put(ModelConfig model) {
        models.put(model.id(), model);
    }

    public synchronized void failing(boolean value) {
        this.failing = value;
    }

    public synchronized int listCalls() {
        return listCalls;
    }

    public synchronized List<StatisticsDelta> deltas() {
        return List.copyOf(deltas);
    }

    public synchronized ModelConfig get(String id) {
        return models.get(id);
    }

    @Override
    public synchronized List<ModelConfig> listActiveModels() throws IOException {
        listCalls++;
        if (failing) {
            throw new IOException("registry offline");
        }
        return models.values().stream().filter(ModelConfig::active).toList();
    }

    @Override
    public synchronized Optional<ModelConfig> getModel(String id) {
        return Optional.ofNullable(models.get(id));
    }

    @Override
    public synchronized void updateStatistics(String id, StatisticsDelta delta) throws IOException {
        ModelConfig current = models.get(id);
        if (current == null) {
            throw new IOException("Unknown model id: " + id);
        }
        deltas.add(delta);
        models.put(id, current.withStatistics(current.statistics().apply(delta)));
    }
}
