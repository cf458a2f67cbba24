package com.librarylending.eventstore.eventstream;

import com.librarylending.eventstore.types.*;

import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * All {@link RecordedEvent}'s of a single stream in revision order
 */
public final class EventStream {
    private final StreamName          streamName;
    private final List<RecordedEvent> events;

    public EventStream(StreamName streamName, List<RecordedEvent> events) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        requireNonNull(events, "No events provided");
        requireTrue(!events.isEmpty(), "An EventStream must contain at least one event");
        this.events = List.copyOf(events);
    }

    public StreamName streamName() {
        return streamName;
    }

    public List<RecordedEvent> eventList() {
        return events;
    }

    public Stream<RecordedEvent> events() {
        return events.stream();
    }

    /**
     * @return the revision of the last event in the stream
     */
    public StreamRevision lastRevision() {
        return events.get(events.size() - 1).streamRevision();
    }

    @Override
    public String toString() {
        return "EventStream{" +
                "streamName=" + streamName +
                ", numberOfEvents=" + events.size() +
                ", lastRevision=" + lastRevision() +
                '}';
    }
}
