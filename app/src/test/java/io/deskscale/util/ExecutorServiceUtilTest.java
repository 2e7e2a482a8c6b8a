package io.deskscale.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorServiceUtilTest {

    @Test
    void testThreadsAreNamedDaemons() throws Exception {
        var executor = ExecutorServiceUtil.newFixedThreadExecutor(1, "retheme-");
        var thread = new AtomicReference<Thread>();
        try {
            executor.submit(() -> thread.set(Thread.currentThread())).get(5, TimeUnit.SECONDS);
        } finally {
            assertTrue(ExecutorServiceUtil.shutdownAndAwait(executor, 5_000, "test"));
        }

        assertEquals("retheme-1", thread.get().getName());
        assertTrue(thread.get().isDaemon());
        assertTrue(executor.isTerminated());
    }

    @Test
    void testShutdownForcesStuckWork() throws Exception {
        var executor = ExecutorServiceUtil.newFixedThreadExecutor(1, "stuck-");
        var started = new CountDownLatch(1);
        executor.execute(() -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertFalse(ExecutorServiceUtil.shutdownAndAwait(executor, 50, "stuck"));
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }
}
