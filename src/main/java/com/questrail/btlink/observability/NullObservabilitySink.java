package com.questrail.btlink.observability;

import com.questrail.btlink.api.LinkEvent;

/**
 * No-op implementation of LinkObservabilitySink.
 */
public final class NullObservabilitySink implements LinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {}

    @Override
    public void onLinkEvent(LinkEvent event) {}

    @Override
    public void onError(LinkErrorEvent event) {}
}
