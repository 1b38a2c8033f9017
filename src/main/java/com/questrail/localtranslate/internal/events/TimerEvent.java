package com.questrail.localtranslate.internal.events;

import com.questrail.localtranslate.api.TaskId;
import com.questrail.localtranslate.internal.exec.WorkerHandle;

import java.time.Instant;
import java.util.Objects;

/**
 * Expiry of an orchestrator timer. Timers never act directly; they post one of
 * these and the coordinating thread decides whether it is still relevant.
 */
public sealed interface TimerEvent extends OrchestratorEvent
        permits TimerEvent.AttemptTimedOut, TimerEvent.RetryDue
{
    /** The deadline of the attempt identified by {@code handle} passed. */
    final class AttemptTimedOut extends OrchestratorEvent.Base implements TimerEvent {
        private final WorkerHandle handle;

        public AttemptTimedOut(Instant timestamp, WorkerHandle handle) {
            super(timestamp);
            this.handle = Objects.requireNonNull(handle, "handle");
        }

        public WorkerHandle handle() {
            return handle;
        }
    }

    /** The backoff delay following {@code failedAttempt} elapsed. */
    final class RetryDue extends OrchestratorEvent.Base implements TimerEvent {
        private final TaskId taskId;
        private final int failedAttempt;

        public RetryDue(Instant timestamp, TaskId taskId, int failedAttempt) {
            super(timestamp);
            this.taskId = Objects.requireNonNull(taskId, "taskId");
            this.failedAttempt = failedAttempt;
        }

        public TaskId taskId() {
            return taskId;
        }

        public int failedAttempt() {
            return failedAttempt;
        }
    }
}
