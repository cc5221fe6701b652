package de.mirkosertic.mcp.vaultsearch.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SecretIndexCache Tests")
class SecretIndexCacheTest {

    private MutableClock clock;
    private SecretIndexCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        cache = new SecretIndexCache(clock);
    }

    @Test
    @DisplayName("Should report an empty idle cache before the first build")
    void shouldReportInitialStatus() {
        final IndexStatus status = cache.status();

        assertThat(status.rebuilding()).isFalse();
        assertThat(status.buildDuration()).isEqualTo(Duration.ZERO);
        assertThat(status.cacheAge()).isEqualTo(Duration.ZERO);
        assertThat(status.indexedSecrets()).isZero();
        assertThat(status.progressPercent()).isZero();
        assertThat(status.lastCompletedBuild()).isNull();
        assertThat(status.lastRebuildError()).isNull();
        assertThat(cache.snapshot()).isSameAs(IndexSnapshot.EMPTY);
    }

    @Test
    @DisplayName("Should allow only one transition into building")
    void shouldAllowSingleBuild() {
        assertThat(cache.tryBeginRebuild()).isTrue();
        assertThat(cache.tryBeginRebuild()).isFalse();
        assertThat(cache.state()).isEqualTo(RebuildState.BUILDING);

        cache.publish(IndexSnapshot.EMPTY);

        assertThat(cache.state()).isEqualTo(RebuildState.IDLE);
        assertThat(cache.tryBeginRebuild()).isTrue();
    }

    @Test
    @DisplayName("Should round the running build duration to the nearest ten seconds")
    void shouldRoundRunningBuildDuration() {
        cache.tryBeginRebuild();

        clock.advance(Duration.ofMillis(4_900));
        assertThat(cache.status().buildDuration()).isEqualTo(Duration.ZERO);

        clock.advance(Duration.ofMillis(100));
        assertThat(cache.status().buildDuration()).isEqualTo(Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.status().buildDuration()).isEqualTo(Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.status().buildDuration()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("Should report the exact duration once the build finished")
    void shouldReportExactDurationAfterPublish() {
        cache.tryBeginRebuild();
        clock.advance(Duration.ofMillis(12_345));

        cache.publish(IndexSnapshot.EMPTY);

        assertThat(cache.status().buildDuration()).isEqualTo(Duration.ofMillis(12_345));
    }

    @Test
    @DisplayName("Should compute progress from fetched and discovered paths")
    void shouldComputeProgress() {
        cache.tryBeginRebuild();
        for (int i = 0; i < 4; i++) {
            cache.pathDiscovered();
        }
        cache.secretIndexed(3);

        final IndexStatus status = cache.status();
        assertThat(status.total()).isEqualTo(4);
        assertThat(status.fetched()).isEqualTo(1);
        assertThat(status.totalKeysIndexed()).isEqualTo(3);
        assertThat(status.progressPercent()).isEqualTo(25);
    }

    @Test
    @DisplayName("Should measure cache age from the last published build")
    void shouldMeasureCacheAge() {
        cache.tryBeginRebuild();
        cache.publish(snapshotOf("a", "b"));
        clock.advance(Duration.ofMinutes(3));

        assertThat(cache.status().cacheAge()).isEqualTo(Duration.ofMinutes(3));

        // A running rebuild does not reset the age of the data being served
        cache.tryBeginRebuild();
        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.status().cacheAge()).isEqualTo(Duration.ofMinutes(4));
    }

    @Test
    @DisplayName("Should keep the previous snapshot and restore its counters on abort")
    void shouldRestoreOnAbort() {
        final IndexSnapshot previous = snapshotOf("a", "b");
        cache.tryBeginRebuild();
        cache.publish(previous);

        cache.tryBeginRebuild();
        cache.pathDiscovered();
        cache.secretIndexed(7);
        cache.abort("Failed to list secrets at path prod");

        final IndexStatus status = cache.status();
        assertThat(cache.snapshot()).isSameAs(previous);
        assertThat(status.rebuilding()).isFalse();
        assertThat(status.fetched()).isEqualTo(2);
        assertThat(status.total()).isEqualTo(2);
        assertThat(status.totalKeysIndexed()).isEqualTo(previous.totalKeys());
        assertThat(status.lastRebuildError()).isEqualTo("Failed to list secrets at path prod");
    }

    @Test
    @DisplayName("Should clear the last error after a successful build")
    void shouldClearErrorOnPublish() {
        cache.tryBeginRebuild();
        cache.abort("boom");
        cache.tryBeginRebuild();
        cache.publish(snapshotOf("a"));

        assertThat(cache.status().lastRebuildError()).isNull();
        assertThat(cache.status().lastCompletedBuild()).isEqualTo(clock.instant());
    }

    private static IndexSnapshot snapshotOf(final String... paths) {
        final Map<String, SecretRecord> records = new HashMap<>();
        for (final String path : paths) {
            records.put(path, new SecretRecord(List.of("k1", "k2"), path + " k1 k2"));
        }
        return IndexSnapshot.of(records);
    }
}
