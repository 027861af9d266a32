package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingConfig(
    @JsonAlias({"request_timeout_seconds"}) int requestTimeoutSeconds,
    @JsonAlias({"backoff_millis"}) long backoffMillis
) {

    public static RoutingConfig defaults() {
        return new RoutingConfig(120, 1000);
    }
}
