package com.librarylending.eventstore;

import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.persistence.*;
import com.librarylending.eventstore.types.*;
import org.slf4j.*;
import reactor.core.publisher.*;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Append-only, per stream, event persistence with optimistic concurrency control and a global order across all streams
 *
 * @see InMemoryEventStore
 * @see PostgresqlEventStore
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public interface EventStore {
    int      DEFAULT_BATCH_SIZE       = 100;
    Duration DEFAULT_POLLING_INTERVAL = Duration.ofMillis(500);

    /**
     * Atomically append <code>events</code> to the stream, provided that <code>expectedRevision</code> matches the stream
     *
     * @param streamName       the stream to append to
     * @param expectedRevision the optimistic concurrency guard
     * @param events           the events to append (in order)
     * @return the result of the append
     * @throws OptimisticAppendToStreamException if <code>expectedRevision</code> didn't match the current revision of the stream
     * @throws AppendToStreamException           in case the append failed for other reasons
     */
    AppendResult appendToStream(StreamName streamName, ExpectedRevision expectedRevision, List<PersistableEvent> events);

    /**
     * Read all events of a stream
     *
     * @param streamName the stream to read
     * @return the {@link EventStream} or {@link Optional#empty()} if the stream doesn't exist
     */
    Optional<EventStream> readStream(StreamName streamName);

    boolean streamExists(StreamName streamName);

    /**
     * Read events across all streams in global order
     *
     * @param fromInclusive the first global position to include
     * @param maxCount      the maximum number of events returned
     * @param filter        the streams to include
     * @return up to <code>maxCount</code> matching events ordered by {@link RecordedEvent#globalPosition()}
     */
    List<RecordedEvent> readAll(GlobalPosition fromInclusive, int maxCount, EventStreamFilter filter);

    /**
     * Create an infinite, lazy, catch-up stream of events by polling {@link #readAll(GlobalPosition, int, EventStreamFilter)}.<br>
     * Every subscription to the returned {@link Flux} continues from the position after the last event it emitted,
     * so a {@link Flux} that's resubscribed after an error resumes where it left off.
     *
     * @param fromInclusive   the first global position to include
     * @param filter          the streams to include
     * @param batchSize       option with the maximum number of events read per poll (default {@value #DEFAULT_BATCH_SIZE})
     * @param pollingInterval option with the delay between polls (default 500 ms)
     * @param subscriberId    option with the id of the subscriber, used for logging
     * @return a {@link Flux} of {@link RecordedEvent}'s in global order
     */
    default Flux<RecordedEvent> pollEvents(GlobalPosition fromInclusive,
                                           EventStreamFilter filter,
                                           Optional<Integer> batchSize,
                                           Optional<Duration> pollingInterval,
                                           Optional<SubscriberId> subscriberId) {
        requireNonNull(fromInclusive, "You must supply a fromInclusive position");
        requireNonNull(filter, "You must supply a filter");
        requireNonNull(batchSize, "You must supply a batchSize option");
        requireNonNull(pollingInterval, "You must supply a pollingInterval option");
        requireNonNull(subscriberId, "You must supply a subscriberId option");

        var eventStreamLogName  = "EventStream:" + filter + ":" + subscriberId.map(SubscriberId::toString).orElseGet(() -> SubscriberId.random().toString());
        var eventStoreStreamLog = LoggerFactory.getLogger(EventStore.class.getName() + ".PollingEventStream");

        int batchFetchSize = batchSize.orElse(DEFAULT_BATCH_SIZE);
        requireTrue(batchFetchSize > 0, "batchSize must be > 0");
        eventStoreStreamLog.debug("[{}] Creating polling EventStream with fromInclusive {} and batch size {}",
                                  eventStreamLogName,
                                  fromInclusive,
                                  batchFetchSize);
        final AtomicLong nextFromInclusive = new AtomicLong(fromInclusive.longValue());
        var recordedEventsFlux = Flux.defer(() -> {
            try {
                var recordedEvents = readAll(GlobalPosition.of(nextFromInclusive.get()), batchFetchSize, filter);
                if (recordedEvents.size() > 0) {
                    eventStoreStreamLog.debug("[{}] readAll using fromInclusive {} returned {} events",
                                              eventStreamLogName,
                                              nextFromInclusive.get(),
                                              recordedEvents.size());
                } else {
                    eventStoreStreamLog.trace("[{}] readAll using fromInclusive {} returned no events",
                                              eventStreamLogName,
                                              nextFromInclusive.get());
                }
                return Flux.fromIterable(recordedEvents);
            } catch (RuntimeException e) {
                eventStoreStreamLog.error(msg("[{}] Polling failed with nextFromInclusive {}",
                                              eventStreamLogName,
                                              nextFromInclusive.get()),
                                          e);
                return Flux.error(e);
            }
        }).doOnNext(event -> {
            final long nextGlobalPosition = event.globalPosition().longValue() + 1L;
            eventStoreStreamLog.trace("[{}] Updating nextFromInclusive from {} to {}",
                                      eventStreamLogName,
                                      nextFromInclusive.get(),
                                      nextGlobalPosition);
            nextFromInclusive.set(nextGlobalPosition);
        });

        return recordedEventsFlux
                .repeatWhen(completedPolls -> completedPolls.concatMap(numberOfEventsInLastPoll -> Mono.delay(pollingInterval.orElse(DEFAULT_POLLING_INTERVAL), Schedulers.boundedElastic())));
    }
}
