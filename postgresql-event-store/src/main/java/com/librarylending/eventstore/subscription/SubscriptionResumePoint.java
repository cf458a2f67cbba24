package com.librarylending.eventstore.subscription;

import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventstore.types.GlobalPosition;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The position a subscription continues from after a restart
 */
public final class SubscriptionResumePoint {
    private final SubscriberId   subscriberId;
    private       GlobalPosition resumeFromAndIncluding;
    private       OffsetDateTime lastUpdated;

    public SubscriptionResumePoint(SubscriberId subscriberId, GlobalPosition resumeFromAndIncluding, OffsetDateTime lastUpdated) {
        this.subscriberId = requireNonNull(subscriberId, "No subscriberId provided");
        this.resumeFromAndIncluding = requireNonNull(resumeFromAndIncluding, "No resumeFromAndIncluding provided");
        this.lastUpdated = requireNonNull(lastUpdated, "No lastUpdated provided");
    }

    public SubscriberId getSubscriberId() {
        return subscriberId;
    }

    public GlobalPosition getResumeFromAndIncluding() {
        return resumeFromAndIncluding;
    }

    public OffsetDateTime getLastUpdated() {
        return lastUpdated;
    }

    void setResumeFromAndIncluding(GlobalPosition resumeFromAndIncluding, OffsetDateTime lastUpdated) {
        this.resumeFromAndIncluding = requireNonNull(resumeFromAndIncluding, "No resumeFromAndIncluding provided");
        this.lastUpdated = requireNonNull(lastUpdated, "No lastUpdated provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionResumePoint)) return false;
        var that = (SubscriptionResumePoint) o;
        return subscriberId.equals(that.subscriberId) && resumeFromAndIncluding.equals(that.resumeFromAndIncluding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subscriberId, resumeFromAndIncluding);
    }

    @Override
    public String toString() {
        return "SubscriptionResumePoint{" +
                "subscriberId=" + subscriberId +
                ", resumeFromAndIncluding=" + resumeFromAndIncluding +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
