package com.librarylending.lending.domain;

import com.fasterxml.jackson.annotation.*;

import java.util.Arrays;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public enum PatronType {
    REGULAR("Regular"),
    RESEARCHER("Researcher");

    private final String label;

    PatronType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static PatronType fromLabel(String label) {
        return Arrays.stream(values())
                     .filter(value -> value.label.equals(label))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException(msg("Unknown PatronType '{}'", label)));
    }
}
