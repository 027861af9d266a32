package io.switchboard.core.routing;

import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.provider.ProviderStream;

/**
 * A provider stream that produced a non-error first event. {@code first} has already been
 * consumed from {@code stream} and must be relayed before the rest.
 */
public record OpenedStream(ProviderStream stream, StreamEvent first) {
}
