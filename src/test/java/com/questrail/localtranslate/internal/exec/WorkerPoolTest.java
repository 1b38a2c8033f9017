package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.internal.time.SystemMonotonicClock;
import com.questrail.localtranslate.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkerPoolTest
 * -----------------------------------------------------------------------------
 * In-flight accounting, FIFO order and bounded concurrency.
 *
 * The concurrency tests use real threads; waits are generous.
 */
class WorkerPoolTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> WorkerPool.create(0, SystemMonotonicClock.INSTANCE));
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(Runnable::run, 0, clock));
    }

    @Test
    void countsQueuedWorkersUntilTheyReturn() throws InterruptedException {
        ManualExecutor executor = new ManualExecutor();
        pool = new WorkerPool(executor, 1, clock);

        pool.submit(() -> {});
        pool.submit(() -> {});
        assertEquals(2, pool.inFlight());
        assertFalse(pool.awaitIdle(Duration.ZERO));

        executor.runNext();
        assertEquals(1, pool.inFlight());

        executor.runAll();
        assertEquals(0, pool.inFlight());
        assertTrue(pool.awaitIdle(Duration.ZERO));
    }

    @Test
    void awaitIdleMeasuresTheTimeoutOnTheInjectedClock() throws InterruptedException {
        ManualExecutor executor = new ManualExecutor();
        pool = new WorkerPool(executor, 1, clock);
        pool.submit(() -> {});

        // Each clock read moves time 10 ms, so a 25 ms wait gives up after a few polls.
        clock.stepPerRead(Duration.ofMillis(10));
        assertFalse(pool.awaitIdle(Duration.ofMillis(25)));
        assertTrue(clock.elapsed().compareTo(Duration.ofMillis(25)) >= 0);
        assertEquals(1, pool.inFlight());

        clock.stepPerRead(Duration.ZERO);
        executor.runAll();
        assertTrue(pool.awaitIdle(Duration.ofMillis(25)));
    }

    @Test
    void throwingWorkerStillReleasesItsSlot() {
        ManualExecutor executor = new ManualExecutor();
        pool = new WorkerPool(executor, 1, clock);

        pool.submit(() -> {
            throw new IllegalStateException("boom");
        });
        assertThrows(IllegalStateException.class, executor::runNext);

        assertEquals(0, pool.inFlight());
    }

    @Test
    void rejectedSubmissionIsNotCounted() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("closed");
        };
        pool = new WorkerPool(rejecting, 1, clock);

        assertThrows(RejectedExecutionException.class, () -> pool.submit(() -> {}));
        assertEquals(0, pool.inFlight());
    }

    @Test
    void submitAfterShutdownIsRejected() {
        pool = WorkerPool.create(1, SystemMonotonicClock.INSTANCE);
        pool.shutdown();

        assertThrows(RejectedExecutionException.class, () -> pool.submit(() -> {}));
    }

    @Test
    void singleThreadPoolRunsWorkersInSubmissionOrder() throws InterruptedException {
        pool = WorkerPool.create(1, SystemMonotonicClock.INSTANCE);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < 5; i++) {
            int n = i;
            pool.submit(() -> order.add(n));
        }

        assertTrue(pool.awaitIdle(Duration.ofSeconds(2)));
        assertEquals(List.of(0, 1, 2, 3, 4), order);
    }

    @Test
    void concurrencyNeverExceedsCapacity() throws InterruptedException {
        pool = WorkerPool.create(2, SystemMonotonicClock.INSTANCE);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        for (int i = 0; i < 6; i++) {
            pool.submit(() -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    running.decrementAndGet();
                }
            });
        }

        Thread.sleep(100);
        assertEquals(6, pool.inFlight());
        release.countDown();

        assertTrue(pool.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(2, peak.get());
    }

    @Test
    void workerThreadsAreNamedDaemons() throws InterruptedException {
        pool = WorkerPool.create(1, SystemMonotonicClock.INSTANCE);
        List<Thread> seen = Collections.synchronizedList(new ArrayList<>());

        pool.submit(() -> seen.add(Thread.currentThread()));
        assertTrue(pool.awaitIdle(Duration.ofSeconds(2)));

        assertTrue(seen.get(0).getName().startsWith("translate-worker-"));
        assertTrue(seen.get(0).isDaemon());
    }
}
