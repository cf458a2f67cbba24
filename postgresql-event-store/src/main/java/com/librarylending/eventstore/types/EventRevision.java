package com.librarylending.eventstore.types;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;

/**
 * The schema revision of an event type. Must be increased whenever the payload of an event type changes in a
 * way that old readers can't handle.
 */
public final class EventRevision implements Comparable<EventRevision> {
    public static final EventRevision FIRST = new EventRevision(1);

    private final int value;

    private EventRevision(int value) {
        this.value = value;
    }

    public static EventRevision of(int value) {
        requireTrue(value >= 1, "An EventRevision must be >= 1");
        return new EventRevision(value);
    }

    public int intValue() {
        return value;
    }

    @Override
    public int compareTo(EventRevision o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventRevision)) return false;
        return value == ((EventRevision) o).value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
