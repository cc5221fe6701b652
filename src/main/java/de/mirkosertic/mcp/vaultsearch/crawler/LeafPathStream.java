package de.mirkosertic.mcp.vaultsearch.crawler;

import org.jspecify.annotations.Nullable;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Leaf paths of one running tree enumeration, in discovery order.
 * <p>
 * The stream ends once every spawned listing task has finished. A listing failure does not
 * end the stream early: remaining branches are still walked and the first failure is reported
 * by {@link #failure()} after the stream is exhausted.
 */
public final class LeafPathStream implements AutoCloseable {

    private static final long POLL_INTERVAL_MS = 100;

    private final String rootPath;
    private final BlockingQueue<String> paths;
    private final AtomicInteger outstandingTasks = new AtomicInteger(0);
    private final CountDownLatch completion = new CountDownLatch(1);
    private final AtomicReference<EnumerationException> firstFailure = new AtomicReference<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong leavesEmitted = new AtomicLong(0);
    private final AtomicLong listingsCompleted = new AtomicLong(0);

    LeafPathStream(final String rootPath, final int queueCapacity) {
        this.rootPath = rootPath;
        this.paths = new LinkedBlockingQueue<>(queueCapacity);
    }

    /**
     * Blocks until the next leaf path is available.
     *
     * @return the next path, or {@code null} once the enumeration finished and all paths were consumed
     */
    public @Nullable String next() throws InterruptedException {
        while (true) {
            final String path = paths.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (path != null) {
                return path;
            }
            if (isFinished()) {
                // Every emit happened before the last task completed
                return paths.poll();
            }
        }
    }

    /**
     * Stops starting new listings. Listings already running finish normally.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isFinished() {
        return completion.getCount() == 0;
    }

    /**
     * Waits until every listing task has finished, without consuming paths.
     */
    public boolean awaitCompletion(final long timeout, final TimeUnit unit) throws InterruptedException {
        return completion.await(timeout, unit);
    }

    /**
     * The first listing failure, or a cancellation failure if the walk was cancelled.
     * Only meaningful after {@link #next()} returned {@code null}.
     */
    public @Nullable EnumerationException failure() {
        final EnumerationException failure = firstFailure.get();
        if (failure != null) {
            return failure;
        }
        if (cancelled.get()) {
            return new EnumerationException("Enumeration of '" + rootPath + "' was cancelled");
        }
        return null;
    }

    public long getLeavesEmitted() {
        return leavesEmitted.get();
    }

    public long getListingsCompleted() {
        return listingsCompleted.get();
    }

    @Override
    public void close() {
        cancel();
    }

    void taskStarted() {
        outstandingTasks.incrementAndGet();
    }

    void taskFinished() {
        if (outstandingTasks.decrementAndGet() == 0) {
            completion.countDown();
        }
    }

    void listingCompleted() {
        listingsCompleted.incrementAndGet();
    }

    void recordFailure(final EnumerationException failure) {
        firstFailure.compareAndSet(null, failure);
    }

    /**
     * Hands a leaf to the consumer, waiting for queue space. Leaves are dropped once
     * the stream is cancelled and the consumer stopped draining.
     */
    boolean emit(final String path) throws InterruptedException {
        while (!paths.offer(path, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
            if (cancelled.get()) {
                return false;
            }
        }
        leavesEmitted.incrementAndGet();
        return true;
    }
}
