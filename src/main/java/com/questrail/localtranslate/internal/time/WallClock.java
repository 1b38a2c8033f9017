package com.questrail.localtranslate.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for event timestamps and logging.
 * It MUST NOT drive timeouts, debounce or backoff.
 */
public interface WallClock
{
    Instant now();
}
