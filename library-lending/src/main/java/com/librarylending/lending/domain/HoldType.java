package com.librarylending.lending.domain;

import com.fasterxml.jackson.annotation.*;

import java.util.Arrays;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A closed-ended hold expires after a fixed duration, an open-ended hold (researchers only) never expires
 */
public enum HoldType {
    OPEN_ENDED("OpenEnded"),
    CLOSED_ENDED("ClosedEnded");

    private final String label;

    HoldType(String label) {
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
    public static HoldType fromLabel(String label) {
        return Arrays.stream(values())
                     .filter(value -> value.label.equals(label))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException(msg("Unknown HoldType '{}'", label)));
    }
}
