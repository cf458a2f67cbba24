package com.librarylending.lending.projections;

import java.util.Objects;

public final class DailySheetStatistics {
    public final int activeHoldsCount;
    public final int activeCheckoutsCount;
    public final int expiringTodayCount;
    /**
     * Number of patrons with at least one overdue checkout
     */
    public final int overduePatronsCount;

    public DailySheetStatistics(int activeHoldsCount, int activeCheckoutsCount, int expiringTodayCount, int overduePatronsCount) {
        this.activeHoldsCount = activeHoldsCount;
        this.activeCheckoutsCount = activeCheckoutsCount;
        this.expiringTodayCount = expiringTodayCount;
        this.overduePatronsCount = overduePatronsCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DailySheetStatistics)) return false;
        var that = (DailySheetStatistics) o;
        return activeHoldsCount == that.activeHoldsCount && activeCheckoutsCount == that.activeCheckoutsCount &&
                expiringTodayCount == that.expiringTodayCount && overduePatronsCount == that.overduePatronsCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(activeHoldsCount, activeCheckoutsCount, expiringTodayCount, overduePatronsCount);
    }

    @Override
    public String toString() {
        return "DailySheetStatistics{" +
                "activeHoldsCount=" + activeHoldsCount +
                ", activeCheckoutsCount=" + activeCheckoutsCount +
                ", expiringTodayCount=" + expiringTodayCount +
                ", overduePatronsCount=" + overduePatronsCount +
                '}';
    }
}
