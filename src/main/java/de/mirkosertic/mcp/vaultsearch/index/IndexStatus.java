package de.mirkosertic.mcp.vaultsearch.index;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the index cache and of the current or last rebuild.
 */
public record IndexStatus(
        boolean rebuilding,
        /** Running time of the current build rounded to 10 seconds, or exact duration of the last one. */
        Duration buildDuration,
        /** Time since the last published snapshot, zero if none was published yet. */
        Duration cacheAge,
        long approxSizeBytes,
        long indexedSecrets,
        long fetched,
        /** Discovered paths; a growing lower estimate of the total while a build runs. */
        long total,
        long totalKeysIndexed,
        int progressPercent,
        @Nullable Instant lastCompletedBuild,
        @Nullable String lastRebuildError
) {

    static int progressPercent(final long fetched, final long discovered) {
        if (discovered <= 0) {
            return 0;
        }
        return (int) (fetched * 100 / discovered);
    }

    static Duration roundToTenSeconds(final Duration duration) {
        final long tens = (duration.toMillis() + 5_000) / 10_000;
        return Duration.ofSeconds(tens * 10);
    }
}
