package io.switchboard.core.registry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.switchboard.core.model.Capability;
import io.switchboard.core.model.ProviderType;
import io.switchboard.core.model.TaskType;
import java.util.Objects;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelConfig(
    String id,
    ProviderType provider,
    @JsonAlias({"model_name", "model"}) String modelName,
    @JsonAlias({"api_key", "credential_ref"}) String credential,
    @JsonAlias({"api_url", "endpoint_ref", "base_url"}) String endpoint,
    int priority,
    @JsonAlias({"is_active"}) boolean active,
    Set<Capability> capabilities,
    @JsonAlias({"supported_task_types", "supported_tasks"}) Set<TaskType> supportedTasks,
    ModelLimits limits,
    Pricing pricing,
    ModelStatistics statistics
) {

    public ModelConfig {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
        credential = credential == null ? "" : credential;
        endpoint = endpoint == null ? "" : endpoint;
        capabilities = capabilities == null ? Set.of(Capability.TEXT) : Set.copyOf(capabilities);
        supportedTasks = supportedTasks == null ? Set.of() : Set.copyOf(supportedTasks);
        limits = limits == null ? ModelLimits.defaults() : limits;
        pricing = pricing == null ? Pricing.free() : pricing;
        statistics = statistics == null ? ModelStatistics.empty() : statistics;
    }

    public String key() {
        return provider.wireName() + ":" + modelName;
    }

    /**
     * A model serves a task when it shares at least one capability with the task.
     * Image input additionally requires {@link Capability#VISION}.
     */
    public boolean supports(TaskType taskType, boolean needsVision) {
        if (!supportedTasks.isEmpty() && !supportedTasks.contains(taskType)) {
            return false;
        }
        if (needsVision && !capabilities.contains(Capability.VISION)) {
            return false;
        }
        return taskType.requiredCapabilities().stream().anyMatch(capabilities::contains);
    }

    public boolean sameAccess(ModelConfig other) {
        return other != null
            && provider == other.provider
            && modelName.equals(other.modelName)
            && credential.equals(other.credential)
            && endpoint.equals(other.endpoint)
            && limits.equals(other.limits);
    }

    public ModelConfig withStatistics(ModelStatistics updated) {
        return new ModelConfig(id, provider, modelName, credential, endpoint, priority, active,
            capabilities, supportedTasks, limits, pricing, updated);
    }

    public ModelConfig withActive(boolean value) {
        return new ModelConfig(id, provider, modelName, credential, endpoint, priority, value,
            capabilities, supportedTasks, limits, pricing, statistics);
    }

    @Override
    public String toString() {
        return "ModelConfig[id=" + id + ", key=" + key() + ", priority=" + priority + ", active=" + active + "]";
    }
}
