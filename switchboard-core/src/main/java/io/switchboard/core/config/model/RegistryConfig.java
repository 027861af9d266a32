package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryConfig(
    String path,
    @JsonAlias({"cache_ttl_seconds"}) int cacheTtlSeconds
) {

    public static RegistryConfig defaults() {
        return new RegistryConfig("~/.switchboard/models.json", 30);
    }
}
