package de.mirkosertic.mcp.vaultsearch.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size thread pool for crawler work. One instance runs tree listings,
 * a second, independent one runs secret fetches.
 */
public class CrawlExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(CrawlExecutorService.class);

    private final String name;
    private final ThreadPoolExecutor executor;

    public CrawlExecutorService(final String name, final int threads) {
        this(name, threads, Integer.MAX_VALUE);
    }

    public CrawlExecutorService(final String name, final int threads, final int queueCapacity) {
        this.name = name;
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, name + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                (task, pool) -> {
                    // Caller runs when saturated, but never after shutdown
                    if (pool.isShutdown()) {
                        throw new RejectedExecutionException("CrawlExecutorService '" + name + "' is shut down");
                    }
                    task.run();
                }
        );

        logger.info("CrawlExecutorService '{}' initialized with {} threads", name, threads);
    }

    public void execute(final Runnable task) {
        executor.execute(task);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down CrawlExecutorService '{}'", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("CrawlExecutorService '{}' did not terminate in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for CrawlExecutorService '{}' to terminate", name, e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
