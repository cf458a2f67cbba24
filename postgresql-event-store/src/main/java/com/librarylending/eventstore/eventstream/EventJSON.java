package com.librarylending.eventstore.eventstream;

import com.librarylending.eventstore.serializer.json.JSONSerializer;
import com.librarylending.eventstore.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The serialized payload of a persisted event, which can be deserialized on demand using the
 * {@link JSONSerializer} the event store was configured with
 */
public final class EventJSON {
    private final JSONSerializer jsonSerializer;
    private final EventType      eventType;
    private final EventRevision  eventRevision;
    private final String         json;

    public EventJSON(JSONSerializer jsonSerializer, EventType eventType, EventRevision eventRevision, String json) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.eventRevision = requireNonNull(eventRevision, "No eventRevision provided");
        this.json = requireNonNull(json, "No json provided");
    }

    public EventType eventType() {
        return eventType;
    }

    public EventRevision eventRevision() {
        return eventRevision;
    }

    public String json() {
        return json;
    }

    public <T> T deserialize(Class<T> javaType) {
        return jsonSerializer.deserialize(json, javaType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventJSON)) return false;
        var that = (EventJSON) o;
        return eventType.equals(that.eventType) && eventRevision.equals(that.eventRevision) && json.equals(that.json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, eventRevision, json);
    }

    @Override
    public String toString() {
        return "EventJSON{" +
                "eventType=" + eventType +
                ", eventRevision=" + eventRevision +
                ", json='" + json + '\'' +
                '}';
    }
}
