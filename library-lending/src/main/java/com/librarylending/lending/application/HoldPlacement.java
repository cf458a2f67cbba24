package com.librarylending.lending.application;

import com.librarylending.lending.domain.HoldType;

import java.time.Instant;
import java.util.Objects;

/**
 * Value of a successful {@link LibraryService#placeHold}
 */
public final class HoldPlacement {
    public final HoldType holdType;
    /**
     * null for open-ended holds
     */
    public final Instant  holdTill;

    public HoldPlacement(HoldType holdType, Instant holdTill) {
        this.holdType = holdType;
        this.holdTill = holdTill;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HoldPlacement)) return false;
        var that = (HoldPlacement) o;
        return holdType == that.holdType && Objects.equals(holdTill, that.holdTill);
    }

    @Override
    public int hashCode() {
        return Objects.hash(holdType, holdTill);
    }

    @Override
    public String toString() {
        return "HoldPlacement{" +
                "holdType=" + holdType +
                ", holdTill=" + holdTill +
                '}';
    }
}
