package com.librarylending.eventstore;

import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.persistence.OptimisticAppendToStreamException;
import com.librarylending.eventstore.serializer.json.JSONSerializer;
import com.librarylending.eventstore.types.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * {@link EventStore} that keeps all events in memory.<br>
 * Events are serialized on append, exactly like the {@link PostgresqlEventStore} does, so readers always work on
 * {@link EventJSON} and a test using this store exercises the same (de)serialization as production.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final JSONSerializer                        jsonSerializer;
    private final Clock                                 clock;
    private final List<RecordedEvent>                   allEvents = new ArrayList<>();
    private final Map<StreamName, List<RecordedEvent>> streams   = new HashMap<>();

    public InMemoryEventStore(JSONSerializer jsonSerializer, Clock clock) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public synchronized AppendResult appendToStream(StreamName streamName, ExpectedRevision expectedRevision, List<PersistableEvent> events) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(expectedRevision, "No expectedRevision provided");
        requireNonNull(events, "No events provided");
        requireTrue(!events.isEmpty(), "At least one event must be provided");

        var stream          = streams.get(streamName);
        var currentRevision = stream == null ? Optional.<StreamRevision>empty() : Optional.of(stream.get(stream.size() - 1).streamRevision());
        if (!expectedRevision.isSatisfiedBy(currentRevision)) {
            log.debug("[{}] Rejecting append of {} event(s): expected revision '{}' but was '{}'",
                      streamName,
                      events.size(),
                      expectedRevision,
                      currentRevision.map(String::valueOf).orElse("NO_STREAM"));
            throw new OptimisticAppendToStreamException(streamName, expectedRevision, currentRevision);
        }

        // Serialize everything before changing any state, so a serialization failure leaves the store untouched
        var now      = OffsetDateTime.now(clock);
        var revision = currentRevision.map(StreamRevision::next).orElse(StreamRevision.FIRST);
        var position = allEvents.isEmpty() ? GlobalPosition.FIRST : lastGlobalPosition().next();
        var recorded = new ArrayList<RecordedEvent>(events.size());
        for (var event : events) {
            recorded.add(new RecordedEvent(event.eventId,
                                           streamName,
                                           revision,
                                           position,
                                           new EventJSON(jsonSerializer, event.eventType, event.eventRevision, jsonSerializer.serialize(event.event)),
                                           new EventMetaData(event.metaData),
                                           now));
            revision = revision.next();
            position = position.next();
        }

        if (stream == null) {
            stream = new ArrayList<>();
            streams.put(streamName, stream);
        }
        stream.addAll(recorded);
        allEvents.addAll(recorded);
        var last = recorded.get(recorded.size() - 1);
        log.debug("[{}] Appended {} event(s) with last revision '{}' and global position '{}'",
                  streamName,
                  recorded.size(),
                  last.streamRevision(),
                  last.globalPosition());
        return new AppendResult(streamName, last.streamRevision(), last.globalPosition());
    }

    @Override
    public synchronized Optional<EventStream> readStream(StreamName streamName) {
        requireNonNull(streamName, "No streamName provided");
        var stream = streams.get(streamName);
        if (stream == null) {
            return Optional.empty();
        }
        return Optional.of(new EventStream(streamName, stream));
    }

    @Override
    public synchronized boolean streamExists(StreamName streamName) {
        requireNonNull(streamName, "No streamName provided");
        return streams.containsKey(streamName);
    }

    @Override
    public synchronized List<RecordedEvent> readAll(GlobalPosition fromInclusive, int maxCount, EventStreamFilter filter) {
        requireNonNull(fromInclusive, "No fromInclusive provided");
        requireNonNull(filter, "No filter provided");
        requireTrue(maxCount > 0, "maxCount must be > 0");
        var fromIndex = (int) Math.min(fromInclusive.longValue() - 1, allEvents.size());
        return allEvents.subList(fromIndex, allEvents.size())
                        .stream()
                        .filter(event -> filter.matches(event.streamName()))
                        .limit(maxCount)
                        .collect(Collectors.toList());
    }

    private GlobalPosition lastGlobalPosition() {
        return allEvents.get(allEvents.size() - 1).globalPosition();
    }
}
