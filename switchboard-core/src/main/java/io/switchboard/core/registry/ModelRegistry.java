package io.switchboard.core.registry;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ModelRegistry {
    List<ModelConfig> listActiveModels() throws IOException;

    Optional<ModelConfig> getModel(String id) throws IOException;

    void updateStatistics(String id, StatisticsDelta delta) throws IOException;
}
