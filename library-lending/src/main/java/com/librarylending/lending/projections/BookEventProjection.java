package com.librarylending.lending.projections;

import com.librarylending.common.Lifecycle;
import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventsourced.aggregates.EventTypeRegistry;
import com.librarylending.eventstore.EventStore;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.subscription.*;
import com.librarylending.eventstore.types.GlobalPosition;
import com.librarylending.lending.application.LibraryConfiguration;
import com.librarylending.lending.domain.book.*;
import org.slf4j.*;

import java.time.Clock;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base class for in-memory read models built from the <code>book-</code> streams.<br>
 * Each projection owns its subscription and its own, in-memory, resume point, so every instance rebuilds its state
 * from {@link GlobalPosition#FIRST} when it's created. Events are applied one at a time while holding the projection's
 * monitor, which is also held by the query methods of the subclasses.
 */
public abstract class BookEventProjection implements Lifecycle {
    private final   Logger                        log = LoggerFactory.getLogger(getClass());
    private final   EventTypeRegistry<BookEvent>  eventTypeRegistry;
    private final   PollingEventStoreSubscription subscription;
    protected final Clock                         clock;

    protected BookEventProjection(SubscriberId subscriberId, EventStore eventStore, LibraryConfiguration configuration, Clock clock) {
        requireNonNull(subscriberId, "No subscriberId provided");
        requireNonNull(eventStore, "No eventStore provided");
        requireNonNull(configuration, "No configuration provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.eventTypeRegistry = BookEvent.eventTypeRegistry();
        this.subscription = new PollingEventStoreSubscription(subscriberId,
                                                              eventStore,
                                                              EventStreamFilter.streamNamePrefixes(Book.STREAM_CATEGORY + "-"),
                                                              new ProjectionEventHandler(),
                                                              new InMemorySubscriptionResumePointStore(),
                                                              GlobalPosition.FIRST,
                                                              Optional.of(configuration.subscriptionBatchSize),
                                                              Optional.of(configuration.pollingInterval),
                                                              clock);
    }

    @Override
    public void start() {
        subscription.start();
    }

    @Override
    public void stop() {
        subscription.stop();
    }

    @Override
    public boolean isStarted() {
        return subscription.isStarted();
    }

    /**
     * Synchronously apply every event that has been appended since the last applied event
     *
     * @return the number of events applied
     */
    public int catchUp() {
        return subscription.catchUp();
    }

    /**
     * Clear the projection and rebuild it from the first event
     */
    public void rebuild() {
        subscription.resetFrom(GlobalPosition.FIRST);
    }

    /**
     * The position of the next event the projection will apply
     */
    public GlobalPosition position() {
        return subscription.currentResumePoint().getResumeFromAndIncluding();
    }

    /**
     * Apply a single book event. Called while holding the projection's monitor
     */
    protected abstract void apply(BookEvent event, RecordedEvent recordedEvent);

    /**
     * Forget all derived state. Called while holding the projection's monitor
     */
    protected abstract void clear();

    private class ProjectionEventHandler implements PersistedEventHandler {
        @Override
        public void handle(RecordedEvent event) {
            var bookEvent = eventTypeRegistry.fromRecordedEvent(event);
            synchronized (BookEventProjection.this) {
                log.trace("[{}] Applying '{}' at global position {}", event.streamName(), event.eventType(), event.globalPosition());
                apply(bookEvent, event);
            }
        }

        @Override
        public void onResetFrom(GlobalPosition globalPosition) {
            synchronized (BookEventProjection.this) {
                log.info("Clearing projection before replaying from global position {}", globalPosition);
                clear();
            }
        }
    }
}
