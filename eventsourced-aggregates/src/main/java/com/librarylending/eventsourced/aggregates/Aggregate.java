package com.librarylending.eventsourced.aggregates;

/**
 * Common interface that all concrete aggregates must implement
 *
 * @param <ID> the aggregate id type
 */
public interface Aggregate<ID> {
    /**
     * The id of the aggregate (aka. the stream id)
     */
    ID aggregateId();

    /**
     * Has the aggregate instance been rehydrated from its persisted events
     */
    boolean hasBeenRehydrated();

    /**
     * Zero based event order of the last event that was part of the aggregate's persisted history, i.e. the
     * stream revision that was observed when the aggregate was loaded (or last persisted).<br>
     * {@link AggregateRoot#NO_EVENTS_HAVE_BEEN_APPLIED} if the aggregate has no persisted history.
     */
    long eventOrderOfLastRehydratedEvent();
}
