package com.librarylending.eventstore.types;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;

/**
 * The one based position of an event in the global commit order, across all streams.<br>
 * Catch-up subscriptions resume from a {@link GlobalPosition}.
 */
public final class GlobalPosition extends LongType<GlobalPosition> {
    public static final GlobalPosition FIRST = new GlobalPosition(1L);

    public GlobalPosition(Long value) {
        super(value);
        requireTrue(value >= 1, "A GlobalPosition must be >= 1");
    }

    public static GlobalPosition of(long value) {
        return new GlobalPosition(value);
    }

    public GlobalPosition next() {
        return new GlobalPosition(value + 1);
    }
}
