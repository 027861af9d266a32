package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthConfig(
    @JsonAlias({"ttl_seconds"}) int ttlSeconds,
    @JsonAlias({"sweep_interval_seconds"}) int sweepIntervalSeconds,
    @JsonAlias({"worker_threads"}) int workerThreads
) {

    public static HealthConfig defaults() {
        return new HealthConfig(300, 60, 4);
    }
}
