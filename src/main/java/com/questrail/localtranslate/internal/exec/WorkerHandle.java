package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.api.TaskId;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WorkerHandle
 * -----------------------------------------------------------------------------
 * Identity and cancellation flag of one attempt.
 *
 * <p>The cancellation flag is shared with the worker thread and is the only
 * cross-thread state. {@link #outcomeRecorded()} is read and written on the
 * coordinating thread only.</p>
 *
 * <p>Handles compare by identity: two attempts of the same task are different
 * handles.</p>
 */
public final class WorkerHandle {

    private final TaskId taskId;
    private final int attempt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    // Set once a result, an error or a timeout has been accepted for this attempt.
    private boolean outcomeRecorded;

    public WorkerHandle(TaskId taskId, int attempt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        this.attempt = attempt;
    }

    public TaskId taskId() {
        return taskId;
    }

    public int attempt() {
        return attempt;
    }

    /**
     * Requests cooperative cancellation.
     *
     * @return {@code true} if this call set the flag
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    boolean outcomeRecorded() {
        return outcomeRecorded;
    }

    void recordOutcome() {
        outcomeRecorded = true;
    }

    @Override
    public String toString() {
        return taskId + "#" + attempt + (isCancelled() ? " (cancelled)" : "");
    }
}
