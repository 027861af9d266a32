package io.switchboard.core.provider;

import io.switchboard.core.registry.ModelConfig;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class AdapterPool implements AutoCloseable {
    private final Map<String, ProviderAdapter> adapters = new ConcurrentHashMap<>();
    private final ProviderAdapterFactory factory;

    public AdapterPool(ProviderAdapterFactory factory) {
        this.factory = factory;
    }

    public ProviderAdapter adapterFor(ModelConfig model) {
        return adapters.compute(model.id(), (id, existing) -> {
            if (existing != null && existing.model().sameAccess(model)) {
                return existing;
            }
            if (existing != null) {
                existing.close();
            }
            return factory.create(model);
        });
    }

    public int size() {
        return adapters.size();
    }

    @Override
    public void close() {
        adapters.values().forEach(ProviderAdapter::close);
        adapters.clear();
    }
}
