package io.switchboard.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.switchboard.core.model.ProviderType;
import io.switchboard.core.support.InMemoryModelRegistry;
import io.switchboard.core.support.MutableClock;
import io.switchboard.core.support.TestModels;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CachedModelRegistryTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-10T12:00:00Z"));
    private final InMemoryModelRegistry delegate = new InMemoryModelRegistry();
    private final CachedModelRegistry cache = new CachedModelRegistry(delegate, clock, Duration.ofSeconds(30));

    @Test
    void shouldServeSnapshotUntilTtlExpires() throws Exception {
        delegate.put(TestModels.model("a", ProviderType.OPENAI_COMPATIBLE, "gpt-4o", 1));

        cache.listActiveModels();
        cache.listActiveModels();
        assertThat(delegate.listCalls()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(31));
        cache.listActiveModels();
        assertThat(delegate.listCalls()).isEqualTo(2);
    }

    @Test
    void shouldDropDuplicateKeysKeepingBestPriority() throws Exception {
        delegate.put(TestModels.model("late", ProviderType.OPENAI_COMPATIBLE, "gpt-4o", 5));
        delegate.put(TestModels.model("early", ProviderType.OPENAI_COMPATIBLE, "gpt-4o", 1));
        delegate.put(TestModels.model("other", ProviderType.GEMINI, "gemini-1.5-pro", 3));

        assertThat(cache.listActiveModels()).extracting(ModelConfig::id).containsExactly("early", "other");
    }

    @Test
    void shouldKeepStaleSnapshotWhenRefreshFails() throws Exception {
        delegate.put(TestModels.model("a", ProviderType.OPENAI_COMPATIBLE, "gpt-4o", 1));
        cache.listActiveModels();

        delegate.failing(true);
        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.listActiveModels()).extracting(ModelConfig::id).containsExactly("a");
    }

    @Test
    void shouldPropagateFailureWithoutSnapshot() {
        delegate.failing(true);

        assertThatThrownBy(cache::listActiveModels).isInstanceOf(IOException.class);
    }

    @Test
    void shouldForwardStatisticsToDelegate() throws Exception {
        delegate.put(TestModels.model("a", ProviderType.OPENAI_COMPATIBLE, "gpt-4o", 1));

        cache.updateStatistics("a", StatisticsDelta.success(5, 0.0, 10, clock.instant()));

        assertThat(delegate.deltas()).hasSize(1);
    }
}
