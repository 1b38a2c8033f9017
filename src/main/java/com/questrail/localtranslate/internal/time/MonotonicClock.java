package com.questrail.localtranslate.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for orchestration correctness.
 *
 * <h2>Binding invariant</h2>
 * Debounce windows, attempt timeouts and retry backoff MUST be computed from a
 * monotonic time source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
