package com.librarylending.eventsourced.aggregates;

import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A mutable {@link Aggregate} whose state is derived solely from the events applied to it.<br>
 * Concrete aggregates implement {@link #applyEventToTheAggregate(Object)}, which must only update fields (no I/O,
 * no validation), and expose decision methods that validate the business rules and call {@link #apply(Object)}
 * (directly or through {@link #accept(Object)}) when the change is accepted.<p>
 * Historic events are applied using {@link #rehydrate(Stream)}. The {@link AggregateRoot} keeps track of the zero based
 * event order, which is the same as the stream revision of the event in the aggregate's stream.
 *
 * @param <ID>             the aggregate id type
 * @param <EVENT>          the base type of the events the aggregate applies
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class AggregateRoot<ID, EVENT, AGGREGATE_TYPE extends AggregateRoot<ID, EVENT, AGGREGATE_TYPE>> implements Aggregate<ID> {
    public static final long NO_EVENTS_HAVE_BEEN_APPLIED = -1;

    private final ID          aggregateId;
    private final List<EVENT> uncommittedChanges = new ArrayList<>();
    /**
     * Zero based event order
     */
    private long              eventOrderOfLastAppliedEvent    = NO_EVENTS_HAVE_BEEN_APPLIED;
    private long              eventOrderOfLastRehydratedEvent = NO_EVENTS_HAVE_BEEN_APPLIED;
    private boolean           hasBeenRehydrated;
    private boolean           isRehydrating;

    protected AggregateRoot(ID aggregateId) {
        this.aggregateId = requireNonNull(aggregateId, "You must provide an aggregateId");
    }

    /**
     * Effectively performs a leftFold over all the previously persisted events related to this aggregate instance
     *
     * @param previousEvents the previous events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    @SuppressWarnings("unchecked")
    public AGGREGATE_TYPE rehydrate(Stream<EVENT> previousEvents) {
        requireNonNull(previousEvents, "You must provide a previousEvents stream");
        isRehydrating = true;
        try {
            previousEvents.forEach(event -> {
                applyEventToTheAggregate(event);
                eventOrderOfLastAppliedEvent++;
            });
        } finally {
            isRehydrating = false;
        }
        eventOrderOfLastRehydratedEvent = eventOrderOfLastAppliedEvent;
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Apply a new non persisted/uncommitted event to this aggregate instance
     *
     * @param event the event to apply
     */
    protected void apply(EVENT event) {
        requireNonNull(event, "You must supply an event");
        applyEventToTheAggregate(event);
        eventOrderOfLastAppliedEvent++;
        uncommittedChanges.add(event);
    }

    /**
     * {@link #apply(Object)} the event and return it as an accepted {@link Decision}
     */
    protected Decision<EVENT> accept(EVENT event) {
        apply(event);
        return Decision.accepted(event);
    }

    /**
     * Apply the event to the aggregate instance to reflect the event as a state change to the aggregate
     *
     * @param event the event to apply to the aggregate
     * @see #isRehydrating()
     */
    protected abstract void applyEventToTheAggregate(EVENT event);

    /**
     * Is the event being supplied to {@link #applyEventToTheAggregate(Object)} a historic event
     */
    protected final boolean isRehydrating() {
        return isRehydrating;
    }

    @Override
    public ID aggregateId() {
        return aggregateId;
    }

    @Override
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    /**
     * @return the event order of the last event that was applied to the {@link AggregateRoot}
     * (either using {@link #rehydrate(Stream)} or using {@link #apply(Object)}) or {@link #NO_EVENTS_HAVE_BEEN_APPLIED}
     */
    public long eventOrderOfLastAppliedEvent() {
        return eventOrderOfLastAppliedEvent;
    }

    @Override
    public long eventOrderOfLastRehydratedEvent() {
        return eventOrderOfLastRehydratedEvent;
    }

    /**
     * The events that have been applied to this aggregate instance but not yet persisted
     */
    public List<EVENT> uncommittedChanges() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedChanges));
    }

    public boolean hasUncommittedChanges() {
        return !uncommittedChanges.isEmpty();
    }

    /**
     * Resets the {@link #uncommittedChanges()}. Called after the changes have been persisted, after which the
     * last applied event counts as part of the persisted history.
     */
    public void markChangesAsCommitted() {
        uncommittedChanges.clear();
        eventOrderOfLastRehydratedEvent = eventOrderOfLastAppliedEvent;
    }
}
