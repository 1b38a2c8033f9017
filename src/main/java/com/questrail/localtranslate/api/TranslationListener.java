package com.questrail.localtranslate.api;

import com.questrail.localtranslate.error.TranslationError;

/**
 * TranslationListener
 * -----------------------------------------------------------------------------
 * Typed event channel from the orchestrator to its caller (UI, CLI).
 *
 * <h2>Threading</h2>
 * All callbacks are invoked on the orchestrator's coordinating thread, one at a
 * time. Implementations must return quickly and must not block; they may call
 * back into the {@link TranslationClient}.
 *
 * <h2>Ordering per task</h2>
 * <pre>
 *   (onStarted onProgress* [onRetrying])*  then  onComplete | onError  then  onFinished
 * </pre>
 * A cancelled task receives no {@code onError}; it receives {@code onFinished}
 * once its in-flight attempt (if any) has returned.
 */
public interface TranslationListener
{
    TranslationListener NONE = new TranslationListener() {};

    /** An attempt of the task began executing on a worker thread. */
    default void onStarted(TaskId taskId) {}

    default void onProgress(TaskId taskId, int percent, String message) {}

    /** Terminal success. Emitted exactly once for a successful task. */
    default void onComplete(TaskId taskId, String detectedLanguage, String text) {}

    /** Terminal failure, carrying the full classification. */
    default void onError(TaskId taskId, TranslationError error) {}

    /**
     * A failed attempt will be retried after {@code delayMs}.
     *
     * @param attempt     the attempt that just failed (1-based)
     * @param maxAttempts total attempts allowed for this kind of failure
     */
    default void onRetrying(TaskId taskId, int attempt, int maxAttempts, long delayMs) {}

    /** The task has left the orchestrator; no further events follow. */
    default void onFinished(TaskId taskId) {}
}
