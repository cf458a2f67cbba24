package com.librarylending.eventstore.eventstream;

import com.librarylending.common.types.*;

import java.util.*;

/**
 * Additional information persisted together with an event, e.g. the correlation id of the command that caused it
 */
public class EventMetaData extends HashMap<String, String> {
    public static final String CORRELATION_ID = "correlationId";
    public static final String CAUSATION_ID   = "causationId";

    public EventMetaData() {
    }

    public EventMetaData(Map<String, String> metaData) {
        super(metaData);
    }

    public static EventMetaData empty() {
        return new EventMetaData();
    }

    public static EventMetaData correlatedBy(CorrelationId correlationId) {
        return new EventMetaData().withCorrelationId(correlationId);
    }

    public EventMetaData withCorrelationId(CorrelationId correlationId) {
        put(CORRELATION_ID, correlationId.value());
        return this;
    }

    /**
     * @param causationId the id of the event that caused the event this metadata belongs to
     */
    public EventMetaData withCausationId(EventId causationId) {
        put(CAUSATION_ID, causationId.value());
        return this;
    }

    public Optional<CorrelationId> correlationId() {
        return CorrelationId.optionalFrom(get(CORRELATION_ID));
    }

    public Optional<EventId> causationId() {
        return EventId.optionalFrom(get(CAUSATION_ID));
    }
}
