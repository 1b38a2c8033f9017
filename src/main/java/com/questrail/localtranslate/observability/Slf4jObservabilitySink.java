package com.questrail.localtranslate.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of {@link OrchestrationObservabilitySink} that
 * emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements OrchestrationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onTaskTransition(TaskTransitionEvent event) {
        TaskState to = event.newState();
        String from = event.oldState() != null ? event.oldState().name() : "NEW";

        switch (to) {
            case FAILED -> log.warn("Task {}: {} -> {} (attempt {}) {}",
                    event.taskId(), from, to, event.attempt(), detail(event));
            case RUNNING, PENDING -> log.debug("Task {}: {} -> {} (attempt {}) {}",
                    event.taskId(), from, to, event.attempt(), detail(event));
            default -> log.info("Task {}: {} -> {} (attempt {}) {}",
                    event.taskId(), from, to, event.attempt(), detail(event));
        }
    }

    @Override
    public void onError(OrchestrationErrorEvent event) {
        log.error("Orchestrator error: {}", event.message(), event.cause());
    }

    private static String detail(TaskTransitionEvent event) {
        return event.detail() == null ? "" : event.detail();
    }
}
