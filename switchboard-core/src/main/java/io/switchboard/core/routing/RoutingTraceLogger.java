package io.switchboard.core.routing;

import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RoutingTraceLogger {
    private static final Logger LOG = LoggerFactory.getLogger(RoutingTraceLogger.class);

    public void log(String requestId, RoutingOutcome<?> outcome) {
        if (outcome.success()) {
            if (outcome.attempts() > 1) {
                LOG.info("Request {} served by {} after {} attempts: {}",
                    requestId, outcome.model().key(), outcome.attempts(), render(outcome));
            } else {
                LOG.debug("Request {} served by {} on first attempt", requestId, outcome.model().key());
            }
            return;
        }
        LOG.warn("Request {} failed after {} attempts ({}): {}",
            requestId, outcome.attempts(), outcome.error().kind().wireName(), render(outcome));
    }

    static String render(RoutingOutcome<?> outcome) {
        return outcome.trace().stream()
            .map(attempt -> attempt.modelKey() + "#" + attempt.attempt() + " "
                + (attempt.succeeded() ? "ok" : attempt.error().toString())
                + " (" + attempt.durationMs() + " ms)")
            .collect(Collectors.joining(" | "));
    }
}
