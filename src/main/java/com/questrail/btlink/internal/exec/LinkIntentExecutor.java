package com.questrail.btlink.internal.exec;

import com.questrail.btlink.internal.state.LinkIntents;

/**
 * LinkIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure link state machine and the impure world
 * of sockets, multiplexers and timers.
 *
 * <h2>Role in the architecture</h2>
 * {@code LinkIntentExecutor} realizes the intentions produced by the
 * {@link com.questrail.btlink.internal.state.LinkStateReducer}. It is the ONLY
 * layer allowed to:
 * <ul>
 *   <li>Start or abandon listen attempts</li>
 *   <li>Create, route and close multiplexers</li>
 *   <li>Publish connection statuses</li>
 *   <li>Schedule future events</li>
 * </ul>
 *
 * <h2>Actor-style execution model</h2>
 * Implementations are called from the manager's serialized drain loop only.
 * Outcomes (accepted channels, failures, read-loop termination, elapsed
 * delays) are reported back as {@code LinkManagerEvent}s, never returned.
 */
public interface LinkIntentExecutor
{
    /**
     * Execute the supplied intentions in order.
     * <p>
     * Execution must not block on I/O. Channel-producing work is subscribed on
     * a scheduler and reports back through events.
     *
     * @param intents ordered actions to perform
     */
    void execute(LinkIntents intents);
}
