package com.questrail.localtranslate.observability;

/**
 * Receives orchestration observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Called on the coordinating thread; implementations must not block.</p>
 */
public interface OrchestrationObservabilitySink {

    void onTaskTransition(TaskTransitionEvent event);

    void onError(OrchestrationErrorEvent event);
}
