package com.librarylending.eventsourced.aggregates;

import com.librarylending.eventstore.EventStore;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.persistence.OptimisticAppendToStreamException;
import com.librarylending.eventstore.types.*;
import org.slf4j.*;

import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Repository that loads an {@link AggregateRoot} by replaying its stream and persists the aggregate's
 * {@link AggregateRoot#uncommittedChanges()} using the revision observed at load time as the expected-revision guard.
 * <p>
 * Usage:
 * <pre>{@code
 * var books = new EventSourcedAggregateRepository<>(eventStore,
 *                                                   BookEvent.REGISTRY,
 *                                                   Book.class,
 *                                                   bookId -> StreamName.of("book", bookId),
 *                                                   Book::new);
 * var book = books.load(bookId);
 * var decision = book.checkout(patronId, now);
 * if (decision.isAccepted()) {
 *     books.persist(book, EventMetaData.correlatedBy(correlationId));
 * }
 * }</pre>
 *
 * @param <ID>             the aggregate id type
 * @param <EVENT>          the base type of the aggregate's events
 * @param <AGGREGATE_TYPE> the aggregate type
 */
public class EventSourcedAggregateRepository<ID, EVENT, AGGREGATE_TYPE extends AggregateRoot<ID, EVENT, AGGREGATE_TYPE>> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedAggregateRepository.class);

    private final EventStore                     eventStore;
    private final EventTypeRegistry<EVENT>       eventTypeRegistry;
    private final Class<AGGREGATE_TYPE>          aggregateType;
    private final Function<ID, StreamName>       streamNameResolver;
    private final Function<ID, AGGREGATE_TYPE>   aggregateFactory;

    /**
     * @param eventStore         the event store
     * @param eventTypeRegistry  the registry for the aggregate's event hierarchy
     * @param aggregateType      the aggregate type
     * @param streamNameResolver resolves the stream name of an aggregate id (e.g. <code>book-{id}</code>)
     * @param aggregateFactory   creates an empty aggregate instance, ready to be rehydrated
     */
    public EventSourcedAggregateRepository(EventStore eventStore,
                                           EventTypeRegistry<EVENT> eventTypeRegistry,
                                           Class<AGGREGATE_TYPE> aggregateType,
                                           Function<ID, StreamName> streamNameResolver,
                                           Function<ID, AGGREGATE_TYPE> aggregateFactory) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.eventTypeRegistry = requireNonNull(eventTypeRegistry, "No eventTypeRegistry provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.streamNameResolver = requireNonNull(streamNameResolver, "No streamNameResolver provided");
        this.aggregateFactory = requireNonNull(aggregateFactory, "No aggregateFactory provided");
    }

    public StreamName streamNameFor(ID aggregateId) {
        return streamNameResolver.apply(requireNonNull(aggregateId, "No aggregateId provided"));
    }

    /**
     * Try to load an aggregate instance
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return an {@link Optional} with the rehydrated aggregate or {@link Optional#empty()} if the stream has no events
     */
    public Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId) {
        var streamName = streamNameFor(aggregateId);
        var eventStream = eventStore.readStream(streamName);
        if (eventStream.isEmpty()) {
            log.trace("[{}] No '{}' aggregate found", streamName, aggregateType.getSimpleName());
            return Optional.empty();
        }
        var aggregate = aggregateFactory.apply(aggregateId)
                                        .rehydrate(eventStream.get()
                                                              .events()
                                                              .map(eventTypeRegistry::fromRecordedEvent));
        log.trace("[{}] Loaded '{}' aggregate at revision {}", streamName, aggregateType.getSimpleName(), aggregate.eventOrderOfLastRehydratedEvent());
        return Optional.of(aggregate);
    }

    /**
     * Load an aggregate instance
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return the rehydrated aggregate
     * @throws AggregateNotFoundException in case the stream has no events
     */
    public AGGREGATE_TYPE load(ID aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateType, streamNameFor(aggregateId)));
    }

    public boolean exists(ID aggregateId) {
        return eventStore.streamExists(streamNameFor(aggregateId));
    }

    /**
     * Append the aggregate's {@link AggregateRoot#uncommittedChanges()} to its stream and mark them as committed.<br>
     * A new aggregate is appended using {@link ExpectedRevision#noStream()}, a loaded aggregate using the revision
     * observed when it was loaded.
     *
     * @param aggregate the aggregate with uncommitted changes
     * @param metaData  metadata added to every appended event
     * @return the result of the append
     * @throws OptimisticAppendToStreamException if the stream was modified since the aggregate was loaded
     */
    public AppendResult persist(AGGREGATE_TYPE aggregate, EventMetaData metaData) {
        requireNonNull(aggregate, "No aggregate provided");
        requireNonNull(metaData, "No metaData provided");
        requireTrue(aggregate.hasUncommittedChanges(), "The aggregate has no uncommitted changes");

        var streamName = streamNameFor(aggregate.aggregateId());
        var lastPersistedEventOrder = aggregate.eventOrderOfLastRehydratedEvent();
        var expectedRevision = lastPersistedEventOrder == AggregateRoot.NO_EVENTS_HAVE_BEEN_APPLIED ?
                               ExpectedRevision.noStream() :
                               ExpectedRevision.exactly(lastPersistedEventOrder);
        var persistableEvents = aggregate.uncommittedChanges()
                                         .stream()
                                         .map(event -> eventTypeRegistry.toPersistableEvent(event, metaData))
                                         .collect(Collectors.toList());

        var appendResult = eventStore.appendToStream(streamName, expectedRevision, persistableEvents);
        aggregate.markChangesAsCommitted();
        log.debug("[{}] Persisted {} event(s) for '{}' aggregate, now at revision {}",
                  streamName,
                  persistableEvents.size(),
                  aggregateType.getSimpleName(),
                  appendResult.nextExpectedRevision);
        return appendResult;
    }
}
