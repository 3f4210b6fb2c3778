package com.questrail.btlink.observability;

import com.questrail.btlink.api.LinkEvent;

/**
 * Main interface for receiving connection manager observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface LinkObservabilitySink {
    /**
     * Called after every processed manager event.
     * @param event the transition event details
     */
    void onStateTransition(LinkStateTransitionEvent event);

    /**
     * Called when the adapter reports a link-layer event, before it is processed.
     * @param event the link event
     */
    void onLinkEvent(LinkEvent event);

    /**
     * Called when an error or anomaly occurs in the link stack.
     * @param event the error event
     */
    void onError(LinkErrorEvent event);
}
