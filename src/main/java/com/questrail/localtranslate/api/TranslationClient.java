package com.questrail.localtranslate.api;

/**
 * TranslationClient
 * -----------------------------------------------------------------------------
 * Caller-facing surface of the orchestration engine.
 *
 * <p>Only the most recent submission is ever worked on: dispatching a task
 * cancels every task that is still active ("most-recent-wins").</p>
 */
public interface TranslationClient
{
    /**
     * Submits a translation.
     *
     * @param debounce when {@code true} the request waits for the debounce
     *                 window and is replaced by any later debounced submission
     * @return the id under which all events for this submission are reported
     */
    TaskId submit(String text, String sourceLanguage, String targetLanguage, boolean debounce);

    /**
     * Requests cooperative cancellation.
     *
     * @return {@code false} if the task is not pending, running or awaiting a retry
     */
    boolean cancel(TaskId taskId);

    void cancelAll();

    /**
     * Cancels everything and waits for in-flight workers to return.
     *
     * @return {@code true} if all workers reported finished within {@code waitMs}
     */
    boolean shutdown(long waitMs);
}
