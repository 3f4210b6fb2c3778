package com.questrail.btlink.observability;

import com.questrail.btlink.api.LinkEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements LinkObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(LinkStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onLinkEvent(LinkEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(LinkErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<LinkStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof LinkStateTransitionEvent)
            .map(e -> (LinkStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<LinkErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof LinkErrorEvent)
            .map(e -> (LinkErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
