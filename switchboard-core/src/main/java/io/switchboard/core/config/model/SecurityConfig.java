package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param masterKeyEnv name of the environment variable holding the base64 AES-256 key for {@code enc:} credentials
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecurityConfig(@JsonAlias({"master_key_env"}) String masterKeyEnv) {

    public static SecurityConfig defaults() {
        return new SecurityConfig("SWITCHBOARD_MASTER_KEY");
    }
}
