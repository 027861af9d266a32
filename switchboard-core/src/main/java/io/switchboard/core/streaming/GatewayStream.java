package io.switchboard.core.streaming;

import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.model.TokenUsage;
import io.switchboard.core.provider.ProviderStream;
import io.switchboard.core.usage.CallLogStatus;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Caller-facing stream of {@code CONTENT}, then one {@code END} or {@code ERROR}.
 * Usage events are absorbed and reported on {@code END}.
 *
 * <p>Closing before the terminal event cancels the provider call and nothing further is relayed.
 * Not thread-safe; one consumer.
 */
public final class GatewayStream implements Iterator<StreamEvent>, AutoCloseable {
    private final ProviderStream source;
    private final Listener listener;
    private final Deque<StreamEvent> pending = new ArrayDeque<>();
    private final StringBuilder text = new StringBuilder();
    private TokenUsage usage = TokenUsage.empty();
    private boolean finished;
    private boolean closed;

    @FunctionalInterface
    public interface Listener {
        void finished(CallLogStatus status, String text, TokenUsage usage, GatewayError error);
    }

    GatewayStream(ProviderStream source, StreamEvent first, Listener listener) {
        this.source = source;
        this.listener = listener;
        accept(first);
    }

    private GatewayStream(StreamEvent error) {
        this.source = null;
        this.listener = null;
        this.pending.add(error);
        this.finished = true;
    }

    static GatewayStream failed(GatewayError error) {
        return new GatewayStream(StreamEvent.error(error));
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        while (pending.isEmpty() && !finished) {
            if (!source.hasNext()) {
                finish(StreamEvent.end(usage), CallLogStatus.SUCCESS, null);
                break;
            }
            accept(source.next());
        }
        return !pending.isEmpty();
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    public String text() {
        return text.toString();
    }

    public TokenUsage usage() {
        return usage;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending.clear();
        if (source != null) {
            source.close();
        }
        if (!finished) {
            finished = true;
            notifyListener(CallLogStatus.CANCELLED, GatewayError.of(ErrorKind.CANCELLED, "stream closed by caller"));
        }
    }

    private void accept(StreamEvent event) {
        switch (event.type()) {
            case CONTENT -> {
                text.append(event.content());
                pending.add(event);
            }
            case USAGE -> usage = event.usage();
            case END -> {
                if (event.usage().hasTokens()) {
                    usage = event.usage();
                }
                finish(StreamEvent.end(usage), CallLogStatus.SUCCESS, null);
            }
            case ERROR -> finish(event, CallLogStatus.FAILED, event.error());
        }
    }

    private void finish(StreamEvent terminal, CallLogStatus status, GatewayError error) {
        pending.add(terminal);
        finished = true;
        source.close();
        notifyListener(status, error);
    }

    private void notifyListener(CallLogStatus status, GatewayError error) {
        if (listener != null) {
            listener.finished(status, text.toString(), usage, error);
        }
    }
}
