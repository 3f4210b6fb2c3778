package com.questrail.btlink.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * LinkManagerEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every input processed by the connection manager's
 * state machine.
 *
 * <h2>Role in the architecture</h2>
 * The connection manager is modeled as an actor: all changes to link state
 * happen strictly in response to {@code LinkManagerEvent}s that are queued and
 * processed one at a time. This includes:
 * <ul>
 *   <li>Radio and link-layer notifications from the adapter</li>
 *   <li>Outcomes of listen and connect attempts</li>
 *   <li>Termination of the active channel's read loop</li>
 *   <li>Caller commands (connect, listen, disconnect, stop)</li>
 * </ul>
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events are immutable</li>
 *   <li>Events carry only the information needed to advance state</li>
 *   <li>Outcome events carry the attempt or generation they belong to, so late
 *       results of abandoned attempts can be recognized and dropped</li>
 * </ul>
 */
public interface LinkManagerEvent
{
    /**
     * Time at which the event was generated. Used for tracing only.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements LinkManagerEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName();
        }
    }
}
