package com.librarylending.eventstore.subscription;

import com.librarylending.common.types.SubscriberId;

import java.util.Optional;

/**
 * Durable storage of {@link SubscriptionResumePoint}'s
 */
public interface SubscriptionResumePointStore {
    Optional<SubscriptionResumePoint> load(SubscriberId subscriberId);

    /**
     * Insert or update the resume point
     */
    void save(SubscriptionResumePoint resumePoint);

    void delete(SubscriberId subscriberId);
}
