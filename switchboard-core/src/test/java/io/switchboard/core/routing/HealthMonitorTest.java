package io.switchboard.core.routing;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.model.ProviderType;
import io.switchboard.core.provider.HealthCheckResult;
import io.switchboard.core.registry.ModelConfig;
import io.switchboard.core.support.MutableClock;
import io.switchboard.core.support.TestModels;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HealthMonitorTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-10T12:00:00Z"));
    private final AtomicReference<HealthCheckResult> next = new AtomicReference<>(HealthCheckResult.up());
    private final AtomicInteger probes = new AtomicInteger();
    private final HealthMonitor monitor = new HealthMonitor(
        model -> {
            probes.incrementAndGet();
            return next.get();
        },
        clock,
        Duration.ofMinutes(5),
        Duration.ofMinutes(1),
        1
    );
    private final ModelConfig model = TestModels.model("m", ProviderType.GEMINI, "gemini-1.5-flash", 1);

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    void shouldTreatUnknownModelAsHealthy() {
        assertThat(monitor.isHealthy(model)).isTrue();
    }

    @Test
    void shouldExcludeFailedModelUntilEntryExpires() {
        next.set(HealthCheckResult.down("HTTP 500"));
        monitor.probeNow(model);

        assertThat(monitor.isHealthy(model)).isFalse();
        clock.advance(Duration.ofMinutes(4));
        assertThat(monitor.isHealthy(model)).isFalse();

        clock.advance(Duration.ofMinutes(1));
        assertThat(monitor.isHealthy(model)).isTrue();
    }

    @Test
    void shouldRecordProbeOutcome() {
        next.set(HealthCheckResult.down("authentication_error: HTTP 401"));

        HealthStatus status = monitor.probeNow(model);

        assertThat(status.healthy()).isFalse();
        assertThat(status.lastChecked()).isEqualTo(clock.instant());
        assertThat(monitor.status(model)).contains(status);
    }

    @Test
    void shouldTreatProbeExceptionsAsUnhealthy() {
        HealthMonitor throwing = new HealthMonitor(
            ignored -> {
                throw new IllegalStateException("boom");
            },
            clock,
            Duration.ofMinutes(5),
            Duration.ofMinutes(1),
            1
        );
        try {
            assertThat(throwing.probeNow(model).healthy()).isFalse();
            assertThat(throwing.probeNow(model).message()).isEqualTo("boom");
        } finally {
            throwing.close();
        }
    }

    @Test
    void shouldProbeEveryModelAndWait() {
        ModelConfig other = TestModels.model("o", ProviderType.DEEPSEEK, "deepseek-chat", 2);

        monitor.probeAll(List.of(model, other), Duration.ofSeconds(5));

        assertThat(probes.get()).isEqualTo(2);
        assertThat(monitor.status(model)).isPresent();
        assertThat(monitor.status(other)).isPresent();
    }

    @Test
    void shouldNotProbeFreshEntriesOnSweep() {
        monitor.probeNow(model);
        assertThat(monitor.isHealthy(model)).isTrue();
        int before = probes.get();

        monitor.sweep();

        assertThat(probes.get()).isEqualTo(before);
    }
}
