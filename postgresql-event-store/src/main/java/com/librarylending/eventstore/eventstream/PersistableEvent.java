package com.librarylending.eventstore.eventstream;

import com.librarylending.common.types.EventId;
import com.librarylending.eventstore.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event that's ready to be appended to a stream. The <code>event</code> payload is serialized to JSON by the event store.
 */
public final class PersistableEvent {
    public final EventId       eventId;
    public final EventType     eventType;
    public final EventRevision eventRevision;
    public final Object        event;
    public final EventMetaData metaData;

    public PersistableEvent(EventId eventId, EventType eventType, EventRevision eventRevision, Object event, EventMetaData metaData) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.eventRevision = requireNonNull(eventRevision, "No eventRevision provided");
        this.event = requireNonNull(event, "No event provided");
        this.metaData = requireNonNull(metaData, "No metaData provided");
    }

    public static PersistableEvent from(EventType eventType, EventRevision eventRevision, Object event, EventMetaData metaData) {
        return new PersistableEvent(EventId.random(), eventType, eventRevision, event, metaData);
    }

    @Override
    public String toString() {
        return "PersistableEvent{" +
                "eventId=" + eventId +
                ", eventType=" + eventType +
                ", eventRevision=" + eventRevision +
                '}';
    }
}
