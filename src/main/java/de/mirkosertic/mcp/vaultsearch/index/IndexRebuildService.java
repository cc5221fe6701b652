package de.mirkosertic.mcp.vaultsearch.index;

import de.mirkosertic.mcp.vaultsearch.crawler.CrawlExecutorService;
import de.mirkosertic.mcp.vaultsearch.crawler.EnumerationException;
import de.mirkosertic.mcp.vaultsearch.crawler.LeafPathStream;
import de.mirkosertic.mcp.vaultsearch.crawler.SecretTreeEnumerator;
import de.mirkosertic.mcp.vaultsearch.extract.KeyExtractor;
import de.mirkosertic.mcp.vaultsearch.extract.SecretValue;
import de.mirkosertic.mcp.vaultsearch.vault.SecretBackend;
import de.mirkosertic.mcp.vaultsearch.vault.VaultErrors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Rebuilds the secret index: enumerates every leaf path, fetches and extracts the secrets
 * in parallel and publishes the result as a new snapshot.
 * <p>
 * At most one rebuild runs at a time. A failed enumeration leaves the previously published
 * snapshot in place; failures to fetch single secrets only exclude those secrets.
 */
public class IndexRebuildService {

    private static final Logger logger = LoggerFactory.getLogger(IndexRebuildService.class);

    static final int PROGRESS_LOG_INTERVAL = 100;

    private final SecretIndexCache cache;
    private final SecretTreeEnumerator enumerator;
    private final SecretBackend backend;
    private final KeyExtractor extractor;
    private final CrawlExecutorService fetchExecutor;
    private final int fetchConcurrency;
    private final Semaphore fetchSlots;

    private volatile @Nullable Thread coordinatorThread;
    private volatile @Nullable LeafPathStream activeStream;
    private volatile boolean shuttingDown;

    public IndexRebuildService(final SecretIndexCache cache,
                               final SecretTreeEnumerator enumerator,
                               final SecretBackend backend,
                               final KeyExtractor extractor,
                               final CrawlExecutorService fetchExecutor,
                               final int fetchConcurrency) {
        if (fetchConcurrency <= 0) {
            throw new IllegalArgumentException("fetchConcurrency must be positive: " + fetchConcurrency);
        }
        this.cache = cache;
        this.enumerator = enumerator;
        this.backend = backend;
        this.extractor = extractor;
        this.fetchExecutor = fetchExecutor;
        this.fetchConcurrency = fetchConcurrency;
        this.fetchSlots = new Semaphore(fetchConcurrency);
    }

    /**
     * Starts a rebuild in the background unless one is already running.
     */
    public RebuildOutcome triggerRebuild() {
        if (!cache.tryBeginRebuild()) {
            logger.info("Index rebuild already in progress, ignoring request");
            return RebuildOutcome.ALREADY_IN_PROGRESS;
        }

        final Thread coordinator = new Thread(() -> {
            try {
                runRebuild();
            } catch (final EnumerationException e) {
                // Already logged and recorded by runRebuild
                logger.debug("Background index rebuild aborted", e);
            }
        }, "index-rebuild");
        coordinator.setDaemon(true);
        coordinatorThread = coordinator;
        try {
            coordinator.start();
        } catch (final RuntimeException | OutOfMemoryError e) {
            cache.abort("Failed to start rebuild thread: " + e.getMessage());
            throw e;
        }
        return RebuildOutcome.ACCEPTED;
    }

    /**
     * Runs a rebuild on the calling thread.
     *
     * @return {@code false} if another rebuild was already running and nothing was done
     * @throws EnumerationException if the tree could not be enumerated completely; the previous snapshot stays published
     */
    public boolean rebuildNow() throws EnumerationException {
        if (!cache.tryBeginRebuild()) {
            logger.info("Index rebuild already in progress, not starting another one");
            return false;
        }
        runRebuild();
        return true;
    }

    public boolean isRebuilding() {
        return cache.isRebuilding();
    }

    private void runRebuild() throws EnumerationException {
        final long startTime = System.currentTimeMillis();
        logger.info("Starting index rebuild with {} parallel fetches", fetchConcurrency);

        final Map<String, SecretRecord> records = new HashMap<>();
        final LeafPathStream stream;
        try {
            stream = enumerator.enumerate("");
        } catch (final RuntimeException e) {
            logger.error("Failed to start enumeration", e);
            cache.abort("Failed to start enumeration: " + e.getMessage());
            throw new EnumerationException("Failed to start enumeration", e);
        }
        activeStream = stream;
        if (shuttingDown) {
            stream.cancel();
        }

        try {
            String path;
            while ((path = stream.next()) != null) {
                cache.pathDiscovered();
                submitFetch(path, records);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Index rebuild interrupted");
            stream.cancel();
            awaitFetches();
            activeStream = null;
            cache.abort("Index rebuild interrupted");
            throw new EnumerationException("Index rebuild interrupted", e);
        } catch (final RuntimeException e) {
            logger.error("Error during index rebuild coordination", e);
            stream.cancel();
            awaitFetches();
            activeStream = null;
            cache.abort("Index rebuild failed: " + e.getMessage());
            throw new EnumerationException("Index rebuild failed", e);
        }

        awaitFetches();
        activeStream = null;

        final EnumerationException failure = stream.failure();
        if (failure != null) {
            logger.error("Index rebuild aborted after {}ms, keeping previous index: {}",
                    System.currentTimeMillis() - startTime, failure.getMessage());
            cache.abort(failure.getMessage());
            throw failure;
        }

        final IndexSnapshot snapshot;
        synchronized (records) {
            snapshot = IndexSnapshot.of(records);
        }
        cache.publish(snapshot);
        logger.info("Index rebuild completed in {}ms: {} secrets with {} keys indexed, {} collections listed",
                System.currentTimeMillis() - startTime, snapshot.size(), snapshot.totalKeys(),
                stream.getListingsCompleted());
    }

    private void submitFetch(final String path, final Map<String, SecretRecord> records) throws InterruptedException {
        fetchSlots.acquire();
        try {
            fetchExecutor.execute(() -> {
                try {
                    fetchAndIndex(path, records);
                } finally {
                    fetchSlots.release();
                }
            });
        } catch (final RejectedExecutionException e) {
            fetchSlots.release();
            throw e;
        }
    }

    private void awaitFetches() {
        // All slots free means no fetch is running any more
        fetchSlots.acquireUninterruptibly(fetchConcurrency);
        fetchSlots.release(fetchConcurrency);
    }

    private void fetchAndIndex(final String path, final Map<String, SecretRecord> records) {
        final SecretValue data;
        try {
            data = backend.read(path);
        } catch (final IOException e) {
            if (VaultErrors.isPermissionDenied(e)) {
                logger.warn("Permission denied reading secret '{}', skipping", path);
            } else {
                logger.error("Failed to read secret '{}', skipping", path, e);
            }
            return;
        } catch (final RuntimeException e) {
            logger.error("Unexpected error reading secret '{}', skipping", path, e);
            return;
        }

        if (data == null) {
            logger.warn("Secret '{}' has no data, skipping", path);
            return;
        }
        if (!(data instanceof SecretValue.MapValue map)) {
            logger.error("Invalid data format for secret '{}', skipping", path);
            return;
        }

        final SecretRecord record = extractor.extract(path, map);
        synchronized (records) {
            records.put(path, record);
        }
        final long fetched = cache.secretIndexed(record.allKeys().size());
        if (fetched % PROGRESS_LOG_INTERVAL == 0) {
            logger.info("Fetched {} secrets so far", fetched);
        }
    }

    /**
     * Cancels a running rebuild and waits briefly for it to wind down.
     * The previously published snapshot stays in place.
     */
    public void shutdown() {
        logger.info("Shutting down IndexRebuildService");
        shuttingDown = true;
        final LeafPathStream stream = activeStream;
        if (stream != null) {
            stream.cancel();
        }
        final Thread coord = coordinatorThread;
        if (coord != null) {
            try {
                coord.join(10000);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for index rebuild thread");
            }
        }
    }
}
