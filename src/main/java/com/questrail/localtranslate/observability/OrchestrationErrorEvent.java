package com.questrail.localtranslate.observability;

import java.time.Instant;

/**
 * Record representing an anomaly inside the orchestrator itself (a listener
 * that threw, an unexpected processing failure). Translation failures are not
 * reported here; they reach the caller as {@code onError}.
 */
public record OrchestrationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
