package com.questrail.localtranslate.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Work handed to the coordinating thread by a caller that needs an answer
 * (e.g. {@code cancel} returning whether the task was active).
 */
public sealed interface ControlEvent extends OrchestratorEvent
        permits ControlEvent.Invoke
{
    final class Invoke extends OrchestratorEvent.Base implements ControlEvent {
        private final Runnable action;

        public Invoke(Instant timestamp, Runnable action) {
            super(timestamp);
            this.action = Objects.requireNonNull(action, "action");
        }

        public Runnable action() {
            return action;
        }
    }
}
