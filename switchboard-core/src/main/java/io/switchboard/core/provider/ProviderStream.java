package io.switchboard.core.provider;

import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.StreamEvent;
import java.util.Iterator;
import java.util.List;

/**
 * Lazy, finite, single-use sequence of stream events ending in exactly one
 * {@code END} or {@code ERROR}. Closing before the end cancels the backend call.
 */
public interface ProviderStream extends Iterator<StreamEvent>, AutoCloseable {

    @Override
    void close();

    static ProviderStream of(List<StreamEvent> events) {
        return new BufferedProviderStream(events);
    }

    static ProviderStream failed(GatewayError error) {
        return new BufferedProviderStream(List.of(StreamEvent.error(error)));
    }
}
