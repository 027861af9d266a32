package io.switchboard.core.provider;

import io.switchboard.core.model.AIRequest;
import java.time.Duration;
import java.util.Objects;

public record ProviderCall(AIRequest request, Duration timeout) {

    public ProviderCall {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
