package io.switchboard.core.routing;

import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.registry.ModelConfig;
import java.util.List;

/**
 * Result of routing one request.
 *
 * @param value  what the winning attempt produced, null on failure
 * @param model  the model that served the request, or the last one tried; null when none was tried
 * @param error  null on success
 * @param trace  every attempt in dispatch order
 */
public record RoutingOutcome<T>(T value, ModelConfig model, GatewayError error, List<AttemptRecord> trace) {

    public RoutingOutcome {
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public boolean success() {
        return error == null;
    }

    public boolean timedOut() {
        return error != null && error.kind() == ErrorKind.TIMEOUT_ERROR;
    }

    public int attempts() {
        return trace.size();
    }
}
