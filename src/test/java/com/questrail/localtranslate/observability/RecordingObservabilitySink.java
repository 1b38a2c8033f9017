package com.questrail.localtranslate.observability;

import com.questrail.localtranslate.api.TaskId;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements OrchestrationObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTaskTransition(TaskTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(OrchestrationErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<TaskState> statesOf(TaskId taskId) {
        return events.stream()
            .filter(e -> e instanceof TaskTransitionEvent)
            .map(e -> (TaskTransitionEvent) e)
            .filter(e -> e.taskId().equals(taskId))
            .map(TaskTransitionEvent::newState)
            .collect(Collectors.toList());
    }

    public synchronized List<OrchestrationErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof OrchestrationErrorEvent)
            .map(e -> (OrchestrationErrorEvent) e)
            .collect(Collectors.toList());
    }
}
