package com.librarylending.lending.domain;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public final class LibraryBranchId extends CharSequenceType<LibraryBranchId> {
    public LibraryBranchId(CharSequence value) {
        super(value);
    }

    public static LibraryBranchId of(CharSequence value) {
        return new LibraryBranchId(value);
    }

    public static LibraryBranchId random() {
        return new LibraryBranchId(UUID.randomUUID().toString());
    }
}
