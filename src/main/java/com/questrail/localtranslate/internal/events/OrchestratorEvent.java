package com.questrail.localtranslate.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * OrchestratorEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything processed by the orchestrator's coordinating
 * thread.
 *
 * <h2>Role in the architecture</h2>
 * Orchestrator state (active tasks, retry states, timers) changes strictly in
 * response to events that are queued and processed one at a time. This covers:
 * <ul>
 *   <li>caller submissions</li>
 *   <li>worker lifecycle reports, posted from pool threads</li>
 *   <li>timer expiries (debounce, attempt deadline, retry delay)</li>
 *   <li>control commands that need an answer (cancel, cancel-all)</li>
 * </ul>
 *
 * Events are immutable. The timestamp is wall-clock and observational only.
 */
public interface OrchestratorEvent
{
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements OrchestratorEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
