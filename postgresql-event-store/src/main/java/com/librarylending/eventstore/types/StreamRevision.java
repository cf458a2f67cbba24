package com.librarylending.eventstore.types;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;

/**
 * The zero based position of an event within its stream.<br>
 * Revisions in a stream start at {@link #FIRST} and grow by one for every appended event.
 */
public final class StreamRevision extends LongType<StreamRevision> {
    public static final StreamRevision FIRST = new StreamRevision(0L);

    public StreamRevision(Long value) {
        super(value);
        requireTrue(value >= 0, "A StreamRevision must be >= 0");
    }

    public static StreamRevision of(long value) {
        return new StreamRevision(value);
    }

    public StreamRevision next() {
        return new StreamRevision(value + 1);
    }
}
