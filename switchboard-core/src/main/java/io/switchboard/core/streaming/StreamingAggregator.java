package io.switchboard.core.streaming;

import io.switchboard.core.model.AIRequest;
import io.switchboard.core.routing.OpenedStream;
import io.switchboard.core.routing.RoutingOutcome;
import io.switchboard.core.usage.CallLogStatus;
import io.switchboard.core.usage.CallOutcome;
import io.switchboard.core.usage.UsageRecorder;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps an opened provider stream so that its terminal outcome (or the caller's cancel)
 * produces exactly one call log entry.
 */
public final class StreamingAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(StreamingAggregator.class);

    private final UsageRecorder recorder;

    public StreamingAggregator(UsageRecorder recorder) {
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
    }

    public GatewayStream aggregate(String requestId, AIRequest request, RoutingOutcome<OpenedStream> opened, long startNanos) {
        if (!opened.success()) {
            recorder.record(new CallOutcome(
                requestId,
                request,
                opened.model(),
                opened.timedOut() ? CallLogStatus.TIMEOUT : CallLogStatus.FAILED,
                "",
                null,
                null,
                elapsedMs(startNanos),
                opened.error(),
                opened.attempts()
            ));
            return GatewayStream.failed(opened.error());
        }
        OpenedStream stream = opened.value();
        return new GatewayStream(stream.stream(), stream.first(), (status, text, usage, error) -> {
            LOG.debug("Stream {} on {} finished with {}", requestId, opened.model().key(), status);
            recorder.record(new CallOutcome(
                requestId,
                request,
                opened.model(),
                status,
                text,
                null,
                usage,
                elapsedMs(startNanos),
                error,
                opened.attempts()
            ));
        });
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
