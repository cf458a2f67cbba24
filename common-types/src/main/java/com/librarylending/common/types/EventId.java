package com.librarylending.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;

/**
 * Unique id of a single persisted event
 */
public final class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    public static Optional<EventId> optionalFrom(CharSequence value) {
        return value == null ? Optional.empty() : Optional.of(new EventId(value));
    }
}
