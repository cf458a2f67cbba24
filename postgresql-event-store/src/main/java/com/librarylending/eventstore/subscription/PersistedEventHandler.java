package com.librarylending.eventstore.subscription;

import com.librarylending.eventstore.eventstream.RecordedEvent;
import com.librarylending.eventstore.types.GlobalPosition;

/**
 * {@link RecordedEvent} handler driven by an {@link EventStoreSubscription}
 */
public interface PersistedEventHandler {
    /**
     * Called when ever a {@link RecordedEvent} matching the subscription's filter is delivered
     *
     * @param event the event
     */
    void handle(RecordedEvent event);

    /**
     * Called if {@link EventStoreSubscription#resetFrom(GlobalPosition)} is called, before any event from the new
     * position is delivered. Handlers that keep derived state should clear it here.
     *
     * @param globalPosition the value provided to {@link EventStoreSubscription#resetFrom(GlobalPosition)}
     */
    default void onResetFrom(GlobalPosition globalPosition) {
    }
}
