package com.questrail.btlink.internal.events;

import com.questrail.btlink.api.LinkEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * AdapterEvent
 * -----------------------------------------------------------------------------
 * Events that originate from the local radio adapter: radio state and
 * link-layer notifications.
 */
public sealed interface AdapterEvent extends LinkManagerEvent
        permits AdapterEvent.RadioStateChanged, AdapterEvent.LinkEventReceived
{
    /** The radio was observed enabled or disabled. */
    final class RadioStateChanged extends LinkManagerEvent.Base implements AdapterEvent {
        private final boolean enabled;

        public RadioStateChanged(Instant timestamp, boolean enabled) {
            super(timestamp);
            this.enabled = enabled;
        }

        public boolean enabled() {
            return enabled;
        }

        @Override
        public String toString() {
            return "RadioStateChanged[" + enabled + "]";
        }
    }

    /** A link-layer notification arrived. */
    final class LinkEventReceived extends LinkManagerEvent.Base implements AdapterEvent {
        private final LinkEvent linkEvent;

        public LinkEventReceived(Instant timestamp, LinkEvent linkEvent) {
            super(timestamp);
            this.linkEvent = Objects.requireNonNull(linkEvent, "linkEvent");
        }

        public LinkEvent linkEvent() {
            return linkEvent;
        }

        @Override
        public String toString() {
            return "LinkEventReceived[" + linkEvent.kind() + " " + linkEvent.peer() + "]";
        }
    }
}
