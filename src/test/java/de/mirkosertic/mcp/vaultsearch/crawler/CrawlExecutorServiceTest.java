package de.mirkosertic.mcp.vaultsearch.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CrawlExecutorService Tests")
class CrawlExecutorServiceTest {

    @Test
    @DisplayName("Should run tasks on named daemon threads")
    void shouldRunOnNamedDaemonThreads() throws Exception {
        final CrawlExecutorService executor = new CrawlExecutorService("unit", 2);
        final AtomicReference<Thread> worker = new AtomicReference<>();
        final CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            worker.set(Thread.currentThread());
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(worker.get().getName()).startsWith("unit-");
        assertThat(worker.get().isDaemon()).isTrue();
        executor.shutdown();
    }

    @Test
    @DisplayName("Should run tasks in the caller when the queue is full")
    void shouldRunInCallerWhenSaturated() throws Exception {
        final CrawlExecutorService executor = new CrawlExecutorService("saturated", 1, 1);
        final CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        executor.execute(() -> { });

        // Worker busy, queue full: runs right here
        final AtomicReference<Thread> runner = new AtomicReference<>();
        executor.execute(() -> runner.set(Thread.currentThread()));

        assertThat(runner.get()).isSameAs(Thread.currentThread());
        release.countDown();
        executor.shutdown();
    }

    @Test
    @DisplayName("Should reject tasks after shutdown instead of dropping them")
    void shouldRejectAfterShutdown() {
        final CrawlExecutorService executor = new CrawlExecutorService("closed", 1);
        executor.shutdown();

        assertThat(executor.isShutdown()).isTrue();
        assertThatThrownBy(() -> executor.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class);
    }
}
