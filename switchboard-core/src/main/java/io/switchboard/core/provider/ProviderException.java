package io.switchboard.core.provider;

import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;

public final class ProviderException extends Exception {
    private final transient GatewayError error;

    public ProviderException(GatewayError error) {
        super(error.message());
        this.error = error;
    }

    public ProviderException(ErrorKind kind, String message) {
        this(GatewayError.of(kind, message));
    }

    public GatewayError error() {
        return error;
    }
}
