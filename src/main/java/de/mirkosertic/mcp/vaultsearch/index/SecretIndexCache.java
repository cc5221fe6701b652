package de.mirkosertic.mcp.vaultsearch.index;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published {@link IndexSnapshot} together with rebuild state and progress counters.
 * <p>
 * Readers take the snapshot reference once and work on it; a rebuild replaces the reference atomically
 * when it completes. State transitions are owned by {@link IndexRebuildService}.
 */
public class SecretIndexCache {

    private final Clock clock;
    private final AtomicReference<IndexSnapshot> snapshot = new AtomicReference<>(IndexSnapshot.EMPTY);
    private final AtomicReference<RebuildState> state = new AtomicReference<>(RebuildState.IDLE);

    private final AtomicLong discovered = new AtomicLong();
    private final AtomicLong fetched = new AtomicLong();
    private final AtomicLong keysIndexed = new AtomicLong();

    private volatile @Nullable Instant buildStartedAt;
    private volatile @Nullable Instant lastPublishedAt;
    private volatile Duration lastBuildDuration = Duration.ZERO;
    private volatile @Nullable String lastRebuildError;

    public SecretIndexCache() {
        this(Clock.systemUTC());
    }

    public SecretIndexCache(final Clock clock) {
        this.clock = clock;
    }

    public IndexSnapshot snapshot() {
        return snapshot.get();
    }

    public RebuildState state() {
        return state.get();
    }

    public boolean isRebuilding() {
        return state.get() == RebuildState.BUILDING;
    }

    public IndexStatus status() {
        final IndexSnapshot current = snapshot.get();
        final boolean building = state.get() == RebuildState.BUILDING;
        final Instant now = clock.instant();

        final Duration buildDuration;
        final Instant started = buildStartedAt;
        if (building && started != null) {
            buildDuration = IndexStatus.roundToTenSeconds(Duration.between(started, now));
        } else {
            buildDuration = lastBuildDuration;
        }

        final Instant published = lastPublishedAt;
        final Duration cacheAge = published == null ? Duration.ZERO : Duration.between(published, now);

        final long fetchedCount = fetched.get();
        final long discoveredCount = discovered.get();
        return new IndexStatus(
                building,
                buildDuration,
                cacheAge,
                current.estimatedSizeBytes(),
                current.size(),
                fetchedCount,
                discoveredCount,
                keysIndexed.get(),
                IndexStatus.progressPercent(fetchedCount, discoveredCount),
                published,
                lastRebuildError);
    }

    // --- transitions, driven by IndexRebuildService ---

    boolean tryBeginRebuild() {
        if (!state.compareAndSet(RebuildState.IDLE, RebuildState.BUILDING)) {
            return false;
        }
        buildStartedAt = clock.instant();
        discovered.set(0);
        fetched.set(0);
        keysIndexed.set(0);
        return true;
    }

    void pathDiscovered() {
        discovered.incrementAndGet();
    }

    long secretIndexed(final int keyCount) {
        keysIndexed.addAndGet(keyCount);
        return fetched.incrementAndGet();
    }

    void publish(final IndexSnapshot next) {
        final Instant now = clock.instant();
        snapshot.set(next);
        lastPublishedAt = now;
        lastBuildDuration = elapsedSince(buildStartedAt, now);
        lastRebuildError = null;
        // Counters keep their live values, which now describe the published snapshot
        state.set(RebuildState.IDLE);
    }

    void abort(final String error) {
        final Instant now = clock.instant();
        final IndexSnapshot retained = snapshot.get();
        discovered.set(retained.size());
        fetched.set(retained.size());
        keysIndexed.set(retained.totalKeys());
        lastBuildDuration = elapsedSince(buildStartedAt, now);
        lastRebuildError = error;
        state.set(RebuildState.IDLE);
    }

    private static Duration elapsedSince(@Nullable final Instant start, final Instant now) {
        return start == null ? Duration.ZERO : Duration.between(start, now);
    }
}
