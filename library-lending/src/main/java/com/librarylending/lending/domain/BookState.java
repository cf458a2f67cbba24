package com.librarylending.lending.domain;

import com.fasterxml.jackson.annotation.*;

import java.util.Arrays;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public enum BookState {
    AVAILABLE("Available"),
    ON_HOLD("OnHold"),
    CHECKED_OUT("CheckedOut");

    private final String label;

    BookState(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BookState fromLabel(String label) {
        return Arrays.stream(values())
                     .filter(value -> value.label.equals(label))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException(msg("Unknown BookState '{}'", label)));
    }
}
