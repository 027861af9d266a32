package io.switchboard.core.routing;

import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ProviderType;
import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.registry.ModelRegistry;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the ordered candidate list for a request: capability and task filter,
 * optional preference filter, then priority order.
 */
public final class ModelSelector {
    private static final Logger LOG = LoggerFactory.getLogger(ModelSelector.class);
    static final Comparator<ModelConfig> CANDIDATE_ORDER = Comparator
        .comparingInt(ModelConfig::priority)
        .thenComparing(ModelConfig::modelName)
        .thenComparing(ModelConfig::id);

    private final ModelRegistry registry;

    public ModelSelector(ModelRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public List<ModelConfig> selectCandidates(AIRequest request) throws IOException {
        List<ModelConfig> eligible = registry.listActiveModels().stream()
            .filter(model -> model.supports(request.taskType(), request.hasImage()))
            .toList();

        List<ModelConfig> chosen = eligible;
        if (hasPreference(request)) {
            List<ModelConfig> preferred = eligible.stream().filter(model -> matchesPreference(model, request)).toList();
            if (preferred.isEmpty()) {
                LOG.warn(
                    "No eligible model matches preference model='{}' provider='{}' for {}; using all eligible models",
                    request.preferredModel(),
                    request.preferredProvider(),
                    request.taskType()
                );
            } else {
                chosen = preferred;
            }
        }
        return chosen.stream().sorted(CANDIDATE_ORDER).toList();
    }

    private static boolean hasPreference(AIRequest request) {
        return !request.preferredModel().isEmpty() || !request.preferredProvider().isEmpty();
    }

    private static boolean matchesPreference(ModelConfig model, AIRequest request) {
        if (!request.preferredModel().isEmpty()
            && !request.preferredModel().equalsIgnoreCase(model.modelName())
            && !request.preferredModel().equals(model.id())) {
            return false;
        }
        if (!request.preferredProvider().isEmpty()) {
            try {
                return ProviderType.parse(request.preferredProvider()) == model.provider();
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
        return true;
    }
}
