package io.switchboard.core.provider;

import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.model.TokenUsage;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

final class BufferedProviderStream implements ProviderStream {
    private final Deque<StreamEvent> pending;
    private boolean closed;

    BufferedProviderStream(List<StreamEvent> events) {
        this.pending = new ArrayDeque<>();
        for (StreamEvent event : events) {
            pending.add(event);
            if (event.terminal()) {
                return;
            }
        }
        pending.add(StreamEvent.end(TokenUsage.empty()));
    }

    @Override
    public boolean hasNext() {
        return !closed && !pending.isEmpty();
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    @Override
    public void close() {
        closed = true;
        pending.clear();
    }
}
