package com.librarylending.eventstore.eventstream;

import com.librarylending.common.types.EventId;
import com.librarylending.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event as it was persisted in a stream
 */
public final class RecordedEvent {
    private final EventId        eventId;
    private final StreamName     streamName;
    private final StreamRevision streamRevision;
    private final GlobalPosition globalPosition;
    private final EventJSON      event;
    private final EventMetaData  metaData;
    private final OffsetDateTime timestamp;

    public RecordedEvent(EventId eventId,
                         StreamName streamName,
                         StreamRevision streamRevision,
                         GlobalPosition globalPosition,
                         EventJSON event,
                         EventMetaData metaData,
                         OffsetDateTime timestamp) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.streamRevision = requireNonNull(streamRevision, "No streamRevision provided");
        this.globalPosition = requireNonNull(globalPosition, "No globalPosition provided");
        this.event = requireNonNull(event, "No event provided");
        this.metaData = requireNonNull(metaData, "No metaData provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public EventId eventId() {
        return eventId;
    }

    public StreamName streamName() {
        return streamName;
    }

    public StreamRevision streamRevision() {
        return streamRevision;
    }

    public GlobalPosition globalPosition() {
        return globalPosition;
    }

    public EventType eventType() {
        return event.eventType();
    }

    public EventRevision eventRevision() {
        return event.eventRevision();
    }

    public EventJSON event() {
        return event;
    }

    public EventMetaData metaData() {
        return metaData;
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordedEvent)) return false;
        return eventId.equals(((RecordedEvent) o).eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "RecordedEvent{" +
                "streamName=" + streamName +
                ", streamRevision=" + streamRevision +
                ", globalPosition=" + globalPosition +
                ", eventType=" + event.eventType() +
                ", eventId=" + eventId +
                '}';
    }
}
