package io.switchboard.core.support;

import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.provider.HealthCheckResult;
import io.switchboard.core.provider.ProviderAdapter;
import io.switchboard.core.provider.ProviderCall;
import io.switchboard.core.provider.ProviderResult;
import io.switchboard.core.provider.ProviderStream;
import io.switchboard.core.registry.ModelConfig;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter that replays queued results. When the queue runs dry the last result repeats.
 */
public final class ScriptedAdapter implements ProviderAdapter {
    private final ModelConfig model;
    private final Deque<ProviderResult> results = new ArrayDeque<>();
    private final Deque<List<StreamEvent>> streams = new ArrayDeque<>();
    private final List<ProviderCall> calls = new ArrayList<>();
    private final AtomicInteger healthChecks = new AtomicInteger();
    private volatile HealthCheckResult health = HealthCheckResult.up();
    private Runnable onCall = () -> { };
    private ProviderResult last;
    private TrackingStream lastStream;

    public ScriptedAdapter(ModelConfig model) {
        this.model = model;
    }

    public ScriptedAdapter thenReturn(ProviderResult result) {
        results.add(result);
        return this;
    }

    public ScriptedAdapter thenStream(List<StreamEvent> events) {
        streams.add(events);
        return this;
    }

    public ScriptedAdapter health(HealthCheckResult result) {
        this.health = result;
        return this;
    }

    /**
     * Runs before every call, e.g. to advance a test clock.
     */
    public ScriptedAdapter onCall(Runnable action) {
        this.onCall = action;
        return this;
    }

    public synchronized int callCount() {
        return calls.size();
    }

    public synchronized List<ProviderCall> calls() {
        return List.copyOf(calls);
    }

    public int healthChecks() {
        return healthChecks.get();
    }

    public synchronized TrackingStream lastStream() {
        return lastStream;
    }

    @Override
    public ModelConfig model() {
        return model;
    }

    @Override
    public synchronized ProviderResult executeTask(ProviderCall call) {
        calls.add(call);
        onCall.run();
        if (!results.isEmpty()) {
            last = results.poll();
        }
        if (last == null) {
            throw new IllegalStateException("no scripted result for " + model.id());
        }
        return last;
    }

    @Override
    public synchronized ProviderStream executeTaskStream(ProviderCall call) {
        calls.add(call);
        onCall.run();
        List<StreamEvent> events = streams.poll();
        if (events == null) {
            throw new IllegalStateException("no scripted stream for " + model.id());
        }
        lastStream = new TrackingStream(events);
        return lastStream;
    }

    @Override
    public HealthCheckResult checkHealth() {
        healthChecks.incrementAndGet();
        return health;
    }

    @Override
    public void close() {
    }

    /**
     * Replays events and remembers whether the consumer closed it early.
     */
    public static final class TrackingStream implements ProviderStream {
        private final Deque<StreamEvent> events;
        private boolean closed;
        private int delivered;

        TrackingStream(List<StreamEvent> events) {
            this.events = new ArrayDeque<>(events);
        }

        @Override
        public boolean hasNext() {
            return !closed && !events.isEmpty();
        }

        @Override
        public StreamEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            delivered++;
            return events.poll();
        }

        @Override
        public void close() {
            closed = true;
        }

        public boolean closed() {
            return closed;
        }

        public int delivered() {
            return delivered;
        }
    }
}
