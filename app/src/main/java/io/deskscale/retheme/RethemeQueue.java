package io.deskscale.retheme;

import io.deskscale.exception.RethemeException;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Drives the boot-splash {@link Rethemer} so that at most one call is in flight and only the most recent request is
 * applied.
 *
 * <p>The first submission that finds the queue idle hands its factor to the executor, and that task becomes the
 * worker. Submissions that arrive while the worker runs overwrite a single pending slot and return at once; when the
 * current call finishes the worker picks up whatever is in the slot, so intermediate values are never applied. The
 * worker leaves only after finding the slot empty, which is checked and acted on under the same lock that submitters
 * take, so no request is stranded.
 *
 * <p>Each processed factor emits {@code started} and then {@code done} when notification is requested. The first
 * factor of a worker uses the caller's flag; drained factors always notify. {@code done} is emitted whether or not
 * the call succeeded.
 */
public final class RethemeQueue {
    private static final Logger logger = LogManager.getLogger(RethemeQueue.class);

    private final Rethemer rethemer;
    private final AppliedFactorProbe probe;
    private final ScaleNotifier notifier;
    private final Executor executor;
    private final int minFactor;
    private final int maxFactor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();

    // guarded by lock; pending is null whenever active is false
    private boolean active;
    private @Nullable Integer pending;

    public RethemeQueue(
            Rethemer rethemer,
            AppliedFactorProbe probe,
            ScaleNotifier notifier,
            Executor executor,
            int minFactor,
            int maxFactor) {
        if (minFactor < 1 || maxFactor < minFactor) {
            throw new IllegalArgumentException(
                    "invalid factor bounds [%d, %d]".formatted(minFactor, maxFactor));
        }
        this.rethemer = rethemer;
        this.probe = probe;
        this.notifier = notifier;
        this.executor = executor;
        this.minFactor = minFactor;
        this.maxFactor = maxFactor;
    }

    public int minFactor() {
        return minFactor;
    }

    public int maxFactor() {
        return maxFactor;
    }

    public int clamp(int factor) {
        return Math.max(minFactor, Math.min(maxFactor, factor));
    }

    /**
     * Requests that the boot splash be re-themed at {@code factor}, clamped to {@code [minFactor, maxFactor]}.
     * Never waits for the re-theme itself.
     *
     * @param notify whether started/done should be emitted if this submission starts a worker
     */
    public void submit(int factor, boolean notify) {
        int target = clamp(factor);
        if (target != factor) {
            logger.debug("Clamped re-theme factor {} to {}", factor, target);
        }

        lock.lock();
        try {
            if (active) {
                if (pending != null) {
                    logger.debug("Re-theme factor {} superseded by {}", pending, target);
                }
                pending = target;
                logger.debug("Re-theme in progress, queued factor {}", target);
                return;
            }
            active = true;
        } finally {
            lock.unlock();
        }

        logger.debug("Starting re-theme worker for factor {}", target);
        dispatch(target, notify);
    }

    private void dispatch(int factor, boolean notify) {
        try {
            executor.execute(() -> drain(factor, notify));
        } catch (RejectedExecutionException e) {
            logger.warn("Re-theme to factor {} rejected, executor is shut down", factor);
            lock.lock();
            try {
                pending = null;
                active = false;
                idle.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private void drain(int firstFactor, boolean firstNotify) {
        int factor = firstFactor;
        boolean notify = firstNotify;
        boolean finished = false;
        try {
            while (true) {
                try {
                    process(factor, notify);
                } catch (RuntimeException e) {
                    logger.error("Unexpected failure while re-theming to factor {}", factor, e);
                }

                lock.lock();
                try {
                    if (pending == null) {
                        active = false;
                        idle.signalAll();
                        finished = true;
                        logger.debug("Re-theme worker idle");
                        return;
                    }
                    factor = pending;
                    pending = null;
                    notify = true;
                    logger.debug("Draining queued re-theme factor {}", factor);
                } finally {
                    lock.unlock();
                }
            }
        } finally {
            if (!finished) {
                handOff(factor);
            }
        }
    }

    /** The worker for {@code failedFactor} died on an Error: go idle, or start a fresh worker for the backlog. */
    private void handOff(int failedFactor) {
        Integer next;
        lock.lock();
        try {
            next = pending;
            pending = null;
            if (next == null) {
                active = false;
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
        logger.error("Re-theme worker for factor {} terminated abnormally", failedFactor);
        if (next != null) {
            dispatch(next, true);
        }
    }

    private void process(int factor, boolean notify) {
        int current = currentFactor();
        if (current == factor) {
            logger.debug("Boot splash already at factor {}, skipping re-theme", factor);
            emitStarted(notify);
            emitDone(notify);
            return;
        }

        emitStarted(notify);
        try {
            rethemer.apply(factor);
            logger.info("Boot splash re-themed to factor {}", factor);
        } catch (RethemeException e) {
            logger.warn(e.getMessage(), e);
        } finally {
            emitDone(notify);
        }
    }

    private int currentFactor() {
        try {
            return probe.currentFactor();
        } catch (RuntimeException e) {
            logger.warn("Could not determine applied boot-splash factor", e);
            return AppliedFactorProbe.UNKNOWN;
        }
    }

    private void emitStarted(boolean notify) {
        if (!notify) {
            return;
        }
        try {
            notifier.scalingStarted();
        } catch (RuntimeException e) {
            logger.warn("Failed to emit scaling started", e);
        }
    }

    private void emitDone(boolean notify) {
        if (!notify) {
            return;
        }
        try {
            notifier.scalingDone();
        } catch (RuntimeException e) {
            logger.warn("Failed to emit scaling done", e);
        }
    }

    /** @return true while a worker is running */
    public boolean isActive() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    /** @return the factor waiting behind the running worker, if any */
    public OptionalInt pendingFactor() {
        lock.lock();
        try {
            return pending == null ? OptionalInt.empty() : OptionalInt.of(pending);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until no worker is running.
     *
     * @return true if the queue is idle, false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (active) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "RethemeQueue[" + minFactor + ".." + maxFactor + "]";
    }
}
