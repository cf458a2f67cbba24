package com.librarylending.eventsourced.aggregates;

import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.types.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Maps the concrete event classes of one event hierarchy to their persisted {@link EventType} and {@link EventRevision}.<br>
 * A {@link RecordedEvent} whose type isn't registered, or whose schema revision is newer than the registered one,
 * is turned into the "unknown" variant created by the <code>unknownEventMapper</code>, so replaying a stream
 * written by a newer version of the application never fails.
 *
 * @param <EVENT> the base type of the event hierarchy
 */
public final class EventTypeRegistry<EVENT> {
    private static final Logger log = LoggerFactory.getLogger(EventTypeRegistry.class);

    private final Class<EVENT>                                  eventBaseType;
    private final Function<RecordedEvent, ? extends EVENT>      unknownEventMapper;
    private final Map<Class<?>, Registration<? extends EVENT>>  registrationsByClass = new ConcurrentHashMap<>();
    private final Map<EventType, Registration<? extends EVENT>> registrationsByType  = new ConcurrentHashMap<>();

    /**
     * @param eventBaseType      the base type of the event hierarchy
     * @param unknownEventMapper creates the "unknown" variant for events this registry can't deserialize
     */
    public EventTypeRegistry(Class<EVENT> eventBaseType, Function<RecordedEvent, ? extends EVENT> unknownEventMapper) {
        this.eventBaseType = requireNonNull(eventBaseType, "No eventBaseType provided");
        this.unknownEventMapper = requireNonNull(unknownEventMapper, "No unknownEventMapper provided");
    }

    public EventTypeRegistry<EVENT> register(EventType eventType, EventRevision eventRevision, Class<? extends EVENT> eventClass) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(eventRevision, "No eventRevision provided");
        requireNonNull(eventClass, "No eventClass provided");
        requireTrue(!registrationsByType.containsKey(eventType), msg("EventType '{}' is already registered", eventType));
        requireTrue(!registrationsByClass.containsKey(eventClass), msg("Event class '{}' is already registered", eventClass.getName()));
        var registration = new Registration<>(eventType, eventRevision, eventClass);
        registrationsByType.put(eventType, registration);
        registrationsByClass.put(eventClass, registration);
        return this;
    }

    public Class<EVENT> eventBaseType() {
        return eventBaseType;
    }

    public boolean isRegistered(EventType eventType) {
        return registrationsByType.containsKey(requireNonNull(eventType, "No eventType provided"));
    }

    /**
     * @throws AggregateException if the class of the event isn't registered
     */
    public EventType eventTypeOf(EVENT event) {
        return registrationOf(event).eventType;
    }

    /**
     * Wrap the event, together with its registered type and schema revision, in a {@link PersistableEvent}
     *
     * @throws AggregateException if the class of the event isn't registered (e.g. the "unknown" variant)
     */
    public PersistableEvent toPersistableEvent(EVENT event, EventMetaData metaData) {
        requireNonNull(metaData, "No metaData provided");
        var registration = registrationOf(event);
        return PersistableEvent.from(registration.eventType, registration.eventRevision, event, new EventMetaData(metaData));
    }

    /**
     * Deserialize the payload of a {@link RecordedEvent} into the registered event class
     */
    public EVENT fromRecordedEvent(RecordedEvent recordedEvent) {
        requireNonNull(recordedEvent, "No recordedEvent provided");
        var registration = registrationsByType.get(recordedEvent.eventType());
        if (registration == null) {
            log.trace("[{}] Event type '{}' at revision '{}' isn't registered, mapping it to the unknown variant",
                      recordedEvent.streamName(),
                      recordedEvent.eventType(),
                      recordedEvent.streamRevision());
            return unknownEventMapper.apply(recordedEvent);
        }
        if (recordedEvent.eventRevision().compareTo(registration.eventRevision) > 0) {
            log.debug("[{}] Event type '{}' has schema revision {} which is newer than the supported revision {}, mapping it to the unknown variant",
                      recordedEvent.streamName(),
                      recordedEvent.eventType(),
                      recordedEvent.eventRevision(),
                      registration.eventRevision);
            return unknownEventMapper.apply(recordedEvent);
        }
        return recordedEvent.event().deserialize(registration.eventClass);
    }

    private Registration<? extends EVENT> registrationOf(EVENT event) {
        requireNonNull(event, "No event provided");
        var registration = registrationsByClass.get(event.getClass());
        if (registration == null) {
            throw new AggregateException(msg("Event class '{}' isn't registered as a '{}' event type",
                                             event.getClass().getName(),
                                             eventBaseType.getSimpleName()));
        }
        return registration;
    }

    private static final class Registration<T> {
        private final EventType     eventType;
        private final EventRevision eventRevision;
        private final Class<T>      eventClass;

        private Registration(EventType eventType, EventRevision eventRevision, Class<T> eventClass) {
            this.eventType = eventType;
            this.eventRevision = eventRevision;
            this.eventClass = eventClass;
        }
    }
}
