package com.librarylending.eventstore.subscription;

import com.librarylending.common.Lifecycle;
import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.types.GlobalPosition;

public interface EventStoreSubscription extends Lifecycle {
    /**
     * the unique id for the subscriber
     *
     * @return the unique id for the subscriber
     */
    SubscriberId subscriberId();

    /**
     * the streams that we're subscribing for {@link RecordedEvent}'s related to
     */
    EventStreamFilter filter();

    /**
     * Get the subscriptions resume point
     *
     * @return the subscriptions resume point
     */
    SubscriptionResumePoint currentResumePoint();

    /**
     * Reset the subscription point.<br>
     *
     * @param subscribeFromAndIncludingPosition this {@link GlobalPosition} will become the starting point in the
     *                                          global order
     */
    void resetFrom(GlobalPosition subscribeFromAndIncludingPosition);

    /**
     * Synchronously deliver every event that's available right now, starting at the current resume point
     *
     * @return the number of events delivered to the handler
     */
    int catchUp();

    void unsubscribe();

    boolean isActive();
}
