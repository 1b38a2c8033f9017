package com.questrail.localtranslate.internal.events;

import com.questrail.localtranslate.api.TranslationResult;
import com.questrail.localtranslate.internal.exec.WorkerHandle;

import java.time.Instant;
import java.util.Objects;

/**
 * WorkerEvent
 * -----------------------------------------------------------------------------
 * Lifecycle reports of one attempt, posted from a worker-pool thread.
 *
 * <p>For a given handle the worker posts, in order:
 * {@code Started, Progress*, (Succeeded | Failed), Finished}. A worker that
 * observes cancellation posts {@code Finished} only (possibly after
 * {@code Started}/{@code Progress}).</p>
 *
 * <p>Every event carries the {@link WorkerHandle} of its attempt so the
 * orchestrator can discard reports from superseded attempts.</p>
 */
public sealed interface WorkerEvent extends OrchestratorEvent
        permits WorkerEvent.Started, WorkerEvent.Progress, WorkerEvent.Succeeded,
                WorkerEvent.Failed, WorkerEvent.Finished
{
    WorkerHandle handle();

    abstract class HandleBase extends OrchestratorEvent.Base {
        private final WorkerHandle handle;

        protected HandleBase(Instant timestamp, WorkerHandle handle) {
            super(timestamp);
            this.handle = Objects.requireNonNull(handle, "handle");
        }

        public WorkerHandle handle() {
            return handle;
        }
    }

    final class Started extends HandleBase implements WorkerEvent {
        public Started(Instant timestamp, WorkerHandle handle) {
            super(timestamp, handle);
        }
    }

    final class Progress extends HandleBase implements WorkerEvent {
        private final int percent;
        private final String message;

        public Progress(Instant timestamp, WorkerHandle handle, int percent, String message) {
            super(timestamp, handle);
            this.percent = percent;
            this.message = Objects.requireNonNull(message, "message");
        }

        public int percent() {
            return percent;
        }

        public String message() {
            return message;
        }
    }

    final class Succeeded extends HandleBase implements WorkerEvent {
        private final TranslationResult result;

        public Succeeded(Instant timestamp, WorkerHandle handle, TranslationResult result) {
            super(timestamp, handle);
            this.result = Objects.requireNonNull(result, "result");
        }

        public TranslationResult result() {
            return result;
        }
    }

    /**
     * The blocking call threw. Carries the raw failure; classification is the
     * orchestrator's job.
     */
    final class Failed extends HandleBase implements WorkerEvent {
        private final Throwable exception;
        private final String message;
        private final String trace;

        public Failed(Instant timestamp, WorkerHandle handle, Throwable exception, String message, String trace) {
            super(timestamp, handle);
            this.exception = Objects.requireNonNull(exception, "exception");
            this.message = Objects.requireNonNull(message, "message");
            this.trace = trace;
        }

        public Throwable exception() {
            return exception;
        }

        public String message() {
            return message;
        }

        public String trace() {
            return trace;
        }
    }

    final class Finished extends HandleBase implements WorkerEvent {
        public Finished(Instant timestamp, WorkerHandle handle) {
            super(timestamp, handle);
        }
    }
}
