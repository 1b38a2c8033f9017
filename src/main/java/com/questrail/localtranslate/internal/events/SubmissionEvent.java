package com.questrail.localtranslate.internal.events;

import com.questrail.localtranslate.api.TaskId;
import com.questrail.localtranslate.api.TranslationRequest;

import java.time.Instant;
import java.util.Objects;

/**
 * Events that bring new work into the orchestrator.
 */
public sealed interface SubmissionEvent extends OrchestratorEvent
        permits SubmissionEvent.Submitted, SubmissionEvent.DebounceElapsed
{
    /** A caller submitted a request under a freshly generated id. */
    final class Submitted extends OrchestratorEvent.Base implements SubmissionEvent {
        private final TaskId taskId;
        private final TranslationRequest request;
        private final boolean debounce;

        public Submitted(Instant timestamp, TaskId taskId, TranslationRequest request, boolean debounce) {
            super(timestamp);
            this.taskId = Objects.requireNonNull(taskId, "taskId");
            this.request = Objects.requireNonNull(request, "request");
            this.debounce = debounce;
        }

        public TaskId taskId() {
            return taskId;
        }

        public TranslationRequest request() {
            return request;
        }

        public boolean debounce() {
            return debounce;
        }
    }

    /**
     * The debounce window armed with {@code sequence} elapsed. Stale when a
     * newer submission re-armed the window in the meantime.
     */
    final class DebounceElapsed extends OrchestratorEvent.Base implements SubmissionEvent {
        private final long sequence;

        public DebounceElapsed(Instant timestamp, long sequence) {
            super(timestamp);
            this.sequence = sequence;
        }

        public long sequence() {
            return sequence;
        }
    }
}
