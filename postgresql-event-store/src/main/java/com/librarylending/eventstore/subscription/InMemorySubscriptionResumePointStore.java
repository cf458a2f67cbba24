package com.librarylending.eventstore.subscription;

import com.librarylending.common.types.SubscriberId;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public class InMemorySubscriptionResumePointStore implements SubscriptionResumePointStore {
    private final ConcurrentHashMap<SubscriberId, SubscriptionResumePoint> resumePoints = new ConcurrentHashMap<>();

    @Override
    public Optional<SubscriptionResumePoint> load(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        return Optional.ofNullable(resumePoints.get(subscriberId))
                       .map(resumePoint -> new SubscriptionResumePoint(resumePoint.getSubscriberId(),
                                                                       resumePoint.getResumeFromAndIncluding(),
                                                                       resumePoint.getLastUpdated()));
    }

    @Override
    public void save(SubscriptionResumePoint resumePoint) {
        requireNonNull(resumePoint, "No resumePoint provided");
        resumePoints.put(resumePoint.getSubscriberId(),
                         new SubscriptionResumePoint(resumePoint.getSubscriberId(),
                                                     resumePoint.getResumeFromAndIncluding(),
                                                     resumePoint.getLastUpdated()));
    }

    @Override
    public void delete(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        resumePoints.remove(subscriberId);
    }
}
