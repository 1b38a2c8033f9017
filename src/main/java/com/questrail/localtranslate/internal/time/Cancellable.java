package com.questrail.localtranslate.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled timers (debounce windows, attempt
 * deadlines, retry delays).
 *
 * <p>
 * Implemented by both the {@code ScheduledExecutorService}-backed production
 * scheduler and the deterministic test scheduler.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
