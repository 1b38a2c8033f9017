package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.api.TaskId;
import com.questrail.localtranslate.api.TranslationRequest;
import com.questrail.localtranslate.error.TranslationError;
import com.questrail.localtranslate.observability.TaskState;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-task retry bookkeeping.
 *
 * - Exists from the first attempt until the task succeeds, fails or is cancelled
 * - Counts attempts; does not encode retry policy
 * - Owned and mutated by the coordinating thread only
 */
public final class RetryState {

    private final TaskId taskId;
    private final TranslationRequest request;
    private int attempt;
    private int maxAttempts;
    private TaskState state = TaskState.PENDING;
    private TranslationError lastError;

    public RetryState(TaskId taskId, TranslationRequest request, int maxAttempts) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.request = Objects.requireNonNull(request, "request");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    public TaskId taskId() {
        return taskId;
    }

    public TranslationRequest request() {
        return request;
    }

    /** Number of attempts started so far (0 before the first). */
    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public TaskState state() {
        return state;
    }

    public Optional<TranslationError> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Record that a new attempt is starting.
     *
     * @return the new attempt number
     */
    int beginAttempt() {
        attempt++;
        return attempt;
    }

    /** Narrows the budget once the failure kind is known (memory failures get fewer attempts). */
    void limitAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    void recordFailure(TranslationError error) {
        this.lastError = error;
    }

    TaskState transitionTo(TaskState next) {
        TaskState previous = state;
        state = next;
        return previous;
    }

    @Override
    public String toString() {
        return "RetryState{" + taskId + ", attempt=" + attempt + "/" + maxAttempts + ", " + state + "}";
    }
}
