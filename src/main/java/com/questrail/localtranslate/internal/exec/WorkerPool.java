package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.internal.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WorkerPool
 * =============================================================================
 * Fixed-capacity executor for blocking translation calls.
 *
 * <h2>Sizing</h2>
 * Only one model instance exists, so unbounded concurrency would only contend
 * for it. The production pool has exactly {@code capacity} threads; further
 * submissions wait in an unbounded FIFO queue. There is no prioritisation.
 *
 * <h2>In-flight accounting</h2>
 * The pool counts submitted workers that have not yet returned from
 * {@code run()} (queued or executing), so shutdown can wait for them.
 *
 * <h2>Executor Ownership</h2>
 * A pool created with {@link #create(int, MonotonicClock)} owns its threads and shuts them down
 * in {@link #shutdown()}. A pool wrapping a caller-supplied executor shuts it
 * down only if it is an {@link ExecutorService}.
 */
public final class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final Executor executor;
    private final int capacity;
    private final MonotonicClock clock;
    private final Object idleLock = new Object();
    private int inFlight;

    public WorkerPool(Executor executor, int capacity, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * Creates a pool of {@code capacity} daemon threads named
     * {@code translate-worker-N}.
     */
    public static WorkerPool create(int capacity, MonotonicClock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                capacity, capacity,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new WorkerThreadFactory());
        log.info("Worker pool created with {} thread(s)", capacity);
        return new WorkerPool(executor, capacity, clock);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Queues a worker for execution.
     *
     * @throws RejectedExecutionException if the pool has been shut down
     */
    public void submit(Runnable worker) {
        Objects.requireNonNull(worker, "worker");
        synchronized (idleLock) {
            inFlight++;
        }
        try {
            executor.execute(() -> {
                try {
                    worker.run();
                } finally {
                    release();
                }
            });
        } catch (RejectedExecutionException e) {
            release();
            throw e;
        }
    }

    /** Workers queued or executing. */
    public int inFlight() {
        synchronized (idleLock) {
            return inFlight;
        }
    }

    /**
     * Blocks until no worker is in flight or the timeout elapses.
     *
     * @return {@code true} if the pool became idle in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = clock.nowNanos() + timeout.toNanos();
        synchronized (idleLock) {
            while (inFlight > 0) {
                long remaining = deadline - clock.nowNanos();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleLock, remaining);
            }
            return true;
        }
    }

    /** Stops accepting work. Running workers are not interrupted. */
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    private void release() {
        synchronized (idleLock) {
            inFlight--;
            if (inFlight == 0) {
                idleLock.notifyAll();
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "translate-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
