package com.librarylending.eventstore.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The type tag persisted with every event, e.g. <code>BookPlacedOnHold</code>
 */
public final class EventType extends CharSequenceType<EventType> {
    public EventType(CharSequence value) {
        super(value);
    }

    public static EventType of(CharSequence value) {
        return new EventType(value);
    }
}
