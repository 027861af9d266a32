package io.switchboard.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON-file registry. Every mutation rewrites the file through a temp file and an atomic move,
 * so statistics updates for any model are serialized on this instance.
 */
public final class FileModelRegistry implements ModelRegistry {
    private static final TypeReference<List<ModelConfig>> MODEL_LIST = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;

    public FileModelRegistry(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }

    public synchronized List<ModelConfig> list() throws IOException {
        return load();
    }

    @Override
    public synchronized List<ModelConfig> listActiveModels() throws IOException {
        return load().stream().filter(ModelConfig::active).toList();
    }

    @Override
    public synchronized Optional<ModelConfig> getModel(String id) throws IOException {
        return load().stream().filter(model -> model.id().equals(id)).findFirst();
    }

    @Override
    public synchronized void updateStatistics(String id, StatisticsDelta delta) throws IOException {
        List<ModelConfig> models = new ArrayList<>(load());
        int index = indexOf(models, id);
        if (index < 0) {
            throw new IOException("Unknown model id: " + id);
        }
        ModelConfig current = models.get(index);
        models.set(index, current.withStatistics(current.statistics().apply(delta)));
        save(models);
    }

    public synchronized ModelConfig save(ModelConfig model) throws IOException {
        List<ModelConfig> models = new ArrayList<>(load());
        if (model.active()) {
            boolean clash = models.stream().anyMatch(existing ->
                existing.active()
                    && !existing.id().equals(model.id())
                    && existing.provider() == model.provider()
                    && existing.modelName().equals(model.modelName())
            );
            if (clash) {
                throw new IllegalArgumentException("An active model already exists for " + model.key());
            }
        }
        int index = indexOf(models, model.id());
        ModelConfig stored = model;
        if (index >= 0) {
            stored = model.withStatistics(models.get(index).statistics());
            models.set(index, stored);
        } else {
            models.add(stored);
        }
        save(models);
        return stored;
    }

    /**
     * Deletes a model, or deactivates it when it already has recorded traffic.
     *
     * @return false when no model has that id
     */
    public synchronized boolean remove(String id) throws IOException {
        List<ModelConfig> models = new ArrayList<>(load());
        int index = indexOf(models, id);
        if (index < 0) {
            return false;
        }
        ModelConfig current = models.get(index);
        if (current.statistics().totalRequests() > 0) {
            models.set(index, current.withActive(false));
        } else {
            models.remove(index);
        }
        save(models);
        return true;
    }

    public ModelConfig readModel(String json) throws IOException {
        return mapper.readValue(json, ModelConfig.class);
    }

    public Path path() {
        return path;
    }

    private List<ModelConfig> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String raw = Files.readString(path);
        if (raw.isBlank()) {
            return List.of();
        }
        return mapper.readValue(raw, MODEL_LIST);
    }

    private void save(List<ModelConfig> models) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(models);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private int indexOf(List<ModelConfig> models, String id) {
        for (int i = 0; i < models.size(); i++) {
            if (models.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
