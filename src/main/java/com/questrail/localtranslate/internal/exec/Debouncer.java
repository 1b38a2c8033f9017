package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.api.TaskId;
import com.questrail.localtranslate.api.TranslationRequest;
import com.questrail.localtranslate.internal.events.OrchestratorEvent;
import com.questrail.localtranslate.internal.events.SubmissionEvent;
import com.questrail.localtranslate.internal.time.Cancellable;
import com.questrail.localtranslate.internal.time.MonotonicClock;
import com.questrail.localtranslate.internal.time.MonotonicScheduler;
import com.questrail.localtranslate.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Debouncer
 * =============================================================================
 * Coalesces rapid submissions into a single pending task.
 *
 * <p>Each {@link #offer} replaces the pending request and restarts the delay.
 * When the delay elapses a {@link SubmissionEvent.DebounceElapsed} is posted;
 * only the request still pending at that moment is handed out by
 * {@link #takeIfCurrent(long)}. Expiries of replaced windows are recognised by
 * their sequence number and yield nothing.</p>
 *
 * <p>Not thread-safe: used on the orchestrator's coordinating thread only.
 * Running (already dispatched) tasks are never touched here.</p>
 */
public final class Debouncer {

    private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

    /** A submission waiting for its debounce window to elapse. */
    public record Pending(TaskId taskId, TranslationRequest request) {}

    private final Duration delay;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final Consumer<OrchestratorEvent> eventSink;

    private Pending pending;
    private Cancellable timer;
    private long sequence;

    public Debouncer(Duration delay,
                     MonotonicClock clock,
                     MonotonicScheduler scheduler,
                     WallClock wallClock,
                     Consumer<OrchestratorEvent> eventSink)
    {
        this.delay = Objects.requireNonNull(delay, "delay");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
    }

    /**
     * Makes {@code request} the pending submission and restarts the window.
     *
     * @return the submission it replaced, if any
     */
    public Optional<Pending> offer(TaskId taskId, TranslationRequest request) {
        Pending replaced = pending;
        cancelTimer();

        pending = new Pending(taskId, request);
        long seq = ++sequence;
        timer = scheduler.scheduleAfter(delay, clock,
                () -> eventSink.accept(new SubmissionEvent.DebounceElapsed(wallClock.now(), seq)));

        if (replaced != null) {
            log.debug("Task {} replaces pending task {} (debouncing {}ms)", taskId, replaced.taskId(), delay.toMillis());
        } else {
            log.debug("Task {} pending (debouncing {}ms)", taskId, delay.toMillis());
        }
        return Optional.ofNullable(replaced);
    }

    /**
     * Hands out the pending submission if {@code elapsedSequence} belongs to
     * the window that is still armed.
     */
    public Optional<Pending> takeIfCurrent(long elapsedSequence) {
        if (elapsedSequence != sequence || pending == null) {
            return Optional.empty();
        }
        Pending due = pending;
        pending = null;
        timer = null;
        return Optional.of(due);
    }

    /**
     * Drops the pending submission, if any.
     *
     * @return the dropped submission
     */
    public Optional<Pending> clear() {
        Pending dropped = pending;
        pending = null;
        cancelTimer();
        return Optional.ofNullable(dropped);
    }

    /** Drops the pending submission only if it has the given id. */
    public boolean discard(TaskId taskId) {
        if (pending != null && pending.taskId().equals(taskId)) {
            clear();
            return true;
        }
        return false;
    }

    public boolean hasPending() {
        return pending != null;
    }

    public Optional<TaskId> pendingTaskId() {
        return Optional.ofNullable(pending).map(Pending::taskId);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }
}
