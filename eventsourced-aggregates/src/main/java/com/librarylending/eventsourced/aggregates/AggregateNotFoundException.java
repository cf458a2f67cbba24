package com.librarylending.eventsourced.aggregates;

import com.librarylending.eventstore.types.StreamName;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by {@link EventSourcedAggregateRepository#load(Object)} if the aggregate's stream has no events
 */
public class AggregateNotFoundException extends AggregateException {
    public final Object     aggregateId;
    public final Class<?>   aggregateType;
    public final StreamName streamName;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateType, StreamName streamName) {
        super(msg("Couldn't find a '{}' aggregate with id '{}' in stream '{}'",
                  requireNonNull(aggregateType, "No aggregateType provided").getSimpleName(),
                  aggregateId,
                  streamName));
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateType = aggregateType;
        this.streamName = requireNonNull(streamName, "No streamName provided");
    }
}
