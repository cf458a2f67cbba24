package com.librarylending.lending.application;

import java.util.Objects;

/**
 * Outcome of a single {@link DailySheetSweeper#sweep()}
 */
public final class SweepResult {
    public static final SweepResult NOTHING_SWEPT = new SweepResult(0, 0, 0);

    public final int holdsExpired;
    public final int overduesRegistered;
    /**
     * Expirations and registrations the aggregates rejected or that failed with a concurrency conflict.
     * They're retried on the next sweep if they still apply.
     */
    public final int rejected;

    public SweepResult(int holdsExpired, int overduesRegistered, int rejected) {
        this.holdsExpired = holdsExpired;
        this.overduesRegistered = overduesRegistered;
        this.rejected = rejected;
    }

    public boolean sweptAnything() {
        return holdsExpired > 0 || overduesRegistered > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SweepResult)) return false;
        var that = (SweepResult) o;
        return holdsExpired == that.holdsExpired && overduesRegistered == that.overduesRegistered && rejected == that.rejected;
    }

    @Override
    public int hashCode() {
        return Objects.hash(holdsExpired, overduesRegistered, rejected);
    }

    @Override
    public String toString() {
        return "SweepResult{" +
                "holdsExpired=" + holdsExpired +
                ", overduesRegistered=" + overduesRegistered +
                ", rejected=" + rejected +
                '}';
    }
}
