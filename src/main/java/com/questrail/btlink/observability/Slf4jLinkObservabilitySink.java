package com.questrail.btlink.observability;

import com.questrail.btlink.api.LinkEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLinkObservabilitySink implements LinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLinkObservabilitySink.class);

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Link phase: {} -> {} on {}",
                event.oldState().phase(),
                event.newState().phase(),
                event.triggeringEvent());
        }
        if (event.isStatusChange()) {
            log.info("Connection status: {} -> {}",
                event.oldState().status(),
                event.newState().status());
        }
        if (!event.resultingIntents().isEmpty()) {
            log.debug("Intents for {}: {}", event.triggeringEvent(), event.resultingIntents());
        }
    }

    @Override
    public void onLinkEvent(LinkEvent event) {
        log.info("Link event: {} {}", event.kind(), event.peer());
    }

    @Override
    public void onError(LinkErrorEvent event) {
        log.error("Link error: {}", event.message(), event.cause());
    }
}
