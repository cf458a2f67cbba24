package com.librarylending.lending.domain;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

/**
 * Identifier of a book (the id part of the <code>book-{id}</code> stream)
 */
public final class BookId extends CharSequenceType<BookId> {
    public BookId(CharSequence value) {
        super(value);
    }

    public static BookId of(CharSequence value) {
        return new BookId(value);
    }

    public static BookId random() {
        return new BookId(UUID.randomUUID().toString());
    }
}
