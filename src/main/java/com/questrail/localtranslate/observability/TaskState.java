package com.questrail.localtranslate.observability;

/**
 * Lifecycle state of one task.
 *
 * <pre>
 *   PENDING → RUNNING(n) → SUCCEEDED
 *                        → RETRYING → RUNNING(n+1)
 *                        → FAILED
 *   PENDING | RUNNING | RETRYING → CANCELLED
 * </pre>
 */
public enum TaskState
{
    PENDING,
    RUNNING,
    RETRYING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
