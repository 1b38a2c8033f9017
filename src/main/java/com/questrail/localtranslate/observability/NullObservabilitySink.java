package com.questrail.localtranslate.observability;

/**
 * No-op implementation of {@link OrchestrationObservabilitySink}.
 */
public final class NullObservabilitySink implements OrchestrationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTaskTransition(TaskTransitionEvent event) {}

    @Override
    public void onError(OrchestrationErrorEvent event) {}
}
