package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    RegistryConfig registry,
    RoutingConfig routing,
    HealthConfig health,
    StorageConfig storage,
    SecurityConfig security
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig(
            RegistryConfig.defaults(),
            RoutingConfig.defaults(),
            HealthConfig.defaults(),
            StorageConfig.defaults(),
            SecurityConfig.defaults()
        );
    }

    public GatewayConfig withStorage(StorageConfig value) {
        return new GatewayConfig(registry, routing, health, value, security);
    }
}
