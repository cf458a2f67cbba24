package com.librarylending.lending.domain;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

/**
 * Identifier of a patron (the id part of the <code>patron-{id}</code> stream)
 */
public final class PatronId extends CharSequenceType<PatronId> {
    public PatronId(CharSequence value) {
        super(value);
    }

    public static PatronId of(CharSequence value) {
        return new PatronId(value);
    }

    public static PatronId random() {
        return new PatronId(UUID.randomUUID().toString());
    }
}
