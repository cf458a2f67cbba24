package com.librarylending.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;

/**
 * Correlates all events appended as the result of the same command
 */
public final class CorrelationId extends CharSequenceType<CorrelationId> {
    public CorrelationId(CharSequence value) {
        super(value);
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    public static Optional<CorrelationId> optionalFrom(CharSequence value) {
        return value == null ? Optional.empty() : Optional.of(new CorrelationId(value));
    }
}
