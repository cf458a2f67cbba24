package com.librarylending.lending.domain;

import com.fasterxml.jackson.annotation.*;

import java.util.Arrays;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public enum BookType {
    CIRCULATING("Circulating"),
    RESTRICTED("Restricted");

    private final String label;

    BookType(String label) {
        this.label = label;
    }

    /**
     * The label used on the wire and in messages
     */
    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BookType fromLabel(String label) {
        return Arrays.stream(values())
                     .filter(value -> value.label.equals(label))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException(msg("Unknown BookType '{}'", label)));
    }
}
