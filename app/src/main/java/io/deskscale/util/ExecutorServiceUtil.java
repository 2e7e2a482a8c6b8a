package io.deskscale.util;

import io.deskscale.exception.GlobalExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /** Fixed pool of daemon threads named {@code threadPrefix + n}, reporting uncaught exceptions. */
    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        assert parallelism >= 1 : "parallelism must be >= 1";
        var factory = new ThreadFactory() {
            private final ThreadFactory delegate = Executors.defaultThreadFactory();
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = delegate.newThread(r);
                t.setName(threadPrefix + ++count);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler(GlobalExceptionHandler::handle);
                return t;
            }
        };
        return Executors.newFixedThreadPool(parallelism, factory);
    }

    /**
     * Shuts the executor down, waiting up to {@code timeoutMillis} for running work before forcing
     * {@code shutdownNow()}.
     *
     * @return true if the executor terminated
     */
    public static boolean shutdownAndAwait(ExecutorService executor, long timeoutMillis, String name) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
            logger.warn("{} did not terminate within {}ms; forcing shutdownNow()", name, timeoutMillis);
            var pending = executor.shutdownNow();
            if (!pending.isEmpty()) {
                logger.debug("Canceled {} queued tasks in {}", pending.size(), name);
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while awaiting termination of {}", name, e);
            executor.shutdownNow();
            return false;
        }
    }
}
