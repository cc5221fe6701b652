package de.mirkosertic.mcp.vaultsearch.crawler;

import de.mirkosertic.mcp.vaultsearch.vault.SecretBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Walks the secret tree recursively and streams every leaf path.
 * <p>
 * Each collection is listed by its own task on the listing pool. All listings of all
 * walks share one semaphore, so no more than {@code concurrency} LIST requests are ever
 * in flight, independent of tree depth or fan-out. A slot is held only for the LIST call
 * itself, never while waiting for children.
 */
public class SecretTreeEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(SecretTreeEnumerator.class);

    private final SecretBackend backend;
    private final CrawlExecutorService listingExecutor;
    private final Semaphore listingSlots;
    private final int concurrency;
    private final int queueCapacity;

    public SecretTreeEnumerator(final SecretBackend backend,
                                final CrawlExecutorService listingExecutor,
                                final int concurrency,
                                final int queueCapacity) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        this.backend = backend;
        this.listingExecutor = listingExecutor;
        this.listingSlots = new Semaphore(concurrency);
        this.concurrency = concurrency;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Starts walking the tree below {@code rootPath} in the background.
     *
     * @param rootPath collection to start from, {@code ""} for the whole mount
     * @return the stream of discovered leaf paths
     */
    public LeafPathStream enumerate(final String rootPath) {
        final String root = normalize(rootPath);
        final LeafPathStream stream = new LeafPathStream(root, queueCapacity);
        logger.info("Starting enumeration of '{}' with {} concurrent listings", root, concurrency);
        spawn(stream, root);
        return stream;
    }

    public int getConcurrency() {
        return concurrency;
    }

    private void spawn(final LeafPathStream stream, final String path) {
        stream.taskStarted();
        try {
            listingExecutor.execute(() -> {
                try {
                    listCollection(stream, path);
                } finally {
                    stream.taskFinished();
                }
            });
        } catch (final RejectedExecutionException e) {
            logger.error("Listing pool rejected task for path '{}'", path, e);
            stream.recordFailure(new EnumerationException("Failed to schedule listing of path " + path, e));
            stream.taskFinished();
        }
    }

    private void listCollection(final LeafPathStream stream, final String path) {
        if (stream.isCancelled()) {
            return;
        }

        logger.debug("Listing secrets at '{}'", path);
        final List<String> children;
        try {
            listingSlots.acquire();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            stream.cancel();
            return;
        }
        try {
            children = backend.list(path);
            stream.listingCompleted();
        } catch (final IOException e) {
            logger.error("Failed to list secrets at path '{}'", path, e);
            stream.recordFailure(new EnumerationException("Failed to list secrets at path " + path, e));
            return;
        } catch (final RuntimeException e) {
            logger.error("Unexpected error listing secrets at path '{}'", path, e);
            stream.recordFailure(new EnumerationException("Failed to list secrets at path " + path, e));
            return;
        } finally {
            listingSlots.release();
        }

        if (children.isEmpty()) {
            logger.debug("No secrets found at '{}'", path);
            return;
        }

        for (final String child : children) {
            if (stream.isCancelled()) {
                break;
            }
            if (child == null || child.isEmpty() || "/".equals(child)) {
                logger.warn("Ignoring empty child name below '{}'", path);
                continue;
            }
            if (child.endsWith("/")) {
                spawn(stream, join(path, child.substring(0, child.length() - 1)));
            } else {
                final String leaf = join(path, child);
                logger.debug("Found secret '{}'", leaf);
                try {
                    if (!stream.emit(leaf)) {
                        return;
                    }
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stream.cancel();
                    return;
                }
            }
        }
    }

    static String join(final String parent, final String child) {
        return parent.isEmpty() ? child : parent + "/" + child;
    }

    static String normalize(final String path) {
        String result = path == null ? "" : path.trim();
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
