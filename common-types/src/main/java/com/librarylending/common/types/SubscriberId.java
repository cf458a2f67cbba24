package com.librarylending.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;

/**
 * Identifies a subscriber, such as a projection or a background process, in an event store subscription
 */
public final class SubscriberId extends CharSequenceType<SubscriberId> {
    public SubscriberId(CharSequence value) {
        super(value);
    }

    public static SubscriberId of(CharSequence value) {
        return new SubscriberId(value);
    }

    public static SubscriberId random() {
        return new SubscriberId(UUID.randomUUID().toString());
    }

    public static Optional<SubscriberId> optionalFrom(CharSequence value) {
        return value == null ? Optional.empty() : Optional.of(new SubscriberId(value));
    }
}
