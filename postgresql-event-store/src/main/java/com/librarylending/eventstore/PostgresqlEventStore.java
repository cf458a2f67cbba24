package com.librarylending.eventstore;

import com.librarylending.common.transaction.JdbiUnitOfWorkFactory;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.persistence.*;
import com.librarylending.eventstore.serializer.json.JSONSerializer;
import com.librarylending.eventstore.types.*;
import dk.cloudcreate.essentials.shared.Exceptions;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * {@link EventStore} that persists all streams into a single Postgresql table.<br>
 * <br>
 * Every append takes the same transaction scoped advisory lock before it inserts, which serializes appends across
 * writers. As a result global positions become visible in the order they were assigned and a catch-up reader
 * that has seen global position <code>n</code> can never later observe an event with a position below <code>n</code>.<br>
 * <br>
 * All database access runs through the {@link JdbiUnitOfWorkFactory}: an append or read joins the unit of work bound
 * to the current thread, or runs in its own unit of work when none is active.
 */
public class PostgresqlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private final JdbiUnitOfWorkFactory              unitOfWorkFactory;
    private final PostgresqlEventStoreConfiguration  configuration;
    private final JSONSerializer                     jsonSerializer;
    private final Clock                              clock;
    private final RecordedEventRowMapper             rowMapper;
    private final String                             insertSql;

    public PostgresqlEventStore(JdbiUnitOfWorkFactory unitOfWorkFactory,
                                PostgresqlEventStoreConfiguration configuration,
                                JSONSerializer jsonSerializer,
                                Clock clock) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.rowMapper = new RecordedEventRowMapper(jsonSerializer);
        this.insertSql = bind("INSERT INTO {:tableName} (\n" +
                                      "       stream_name, stream_revision, event_id, event_type, event_revision, timestamp, event_payload, event_metadata\n" +
                                      "   ) VALUES (\n" +
                                      "       :streamName, :streamRevision, :eventId, :eventType, :eventRevision, :timestamp, CAST(:eventPayload AS {:payloadType}), CAST(:eventMetaData AS {:metaDataType})\n" +
                                      "   )",
                              arg("tableName", configuration.eventsTableName),
                              arg("payloadType", configuration.eventJsonColumnType),
                              arg("metaDataType", configuration.eventMetadataJsonColumnType));

        unitOfWorkFactory.getJdbi().setSqlLogger(new EventStoreSqlLogger());
        initializeEventStorage();
    }

    public PostgresqlEventStoreConfiguration getConfiguration() {
        return configuration;
    }

    private void initializeEventStorage() {
        log.info("Initializing event storage using {}", configuration);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            Optional<String> eventTable = unitOfWork.handle().select("SELECT to_regclass(?)", configuration.eventsTableName)
                                                    .mapTo(String.class)
                                                    .findOne();
            if (eventTable.isEmpty()) {
                createEventsTable(unitOfWork.handle());
            }
            ensureIndexes(unitOfWork.handle());
        });
    }

    private void createEventsTable(Handle handle) {
        log.info("Creating events table '{}'", configuration.eventsTableName);
        handle.execute(bind("CREATE TABLE {:tableName} (\n" +
                                    "            global_position bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                    "            stream_name text NOT NULL,\n" +
                                    "            stream_revision bigint NOT NULL,\n" +
                                    "            event_id text NOT NULL,\n" +
                                    "            event_type text NOT NULL,\n" +
                                    "            event_revision integer NOT NULL,\n" +
                                    "            timestamp TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "            event_payload {:payloadType} NOT NULL,\n" +
                                    "            event_metadata {:metaDataType} NOT NULL,\n" +
                                    "          UNIQUE (stream_name, stream_revision),\n" +
                                    "          UNIQUE (event_id)\n" +
                                    "        )",
                            arg("tableName", configuration.eventsTableName),
                            arg("payloadType", configuration.eventJsonColumnType),
                            arg("metaDataType", configuration.eventMetadataJsonColumnType)));
    }

    private void ensureIndexes(Handle handle) {
        var numberOfChanges = handle.execute(bind("CREATE INDEX IF NOT EXISTS {:tableName}_event_type ON {:tableName} (event_type)",
                                                  arg("tableName", configuration.eventsTableName)));
        log.debug("'{}' index on 'event_type' {}",
                  configuration.eventsTableName,
                  numberOfChanges == 1 ? "created" : "already existed");
    }

    /**
     * Drop and recreate the events table. Intended for tests.
     */
    public void resetEventStorage() {
        log.info("Resetting events table '{}'", configuration.eventsTableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute("DROP TABLE IF EXISTS " + configuration.eventsTableName));
        initializeEventStorage();
    }

    @Override
    public AppendResult appendToStream(StreamName streamName, ExpectedRevision expectedRevision, List<PersistableEvent> events) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(expectedRevision, "No expectedRevision provided");
        requireNonNull(events, "No events provided");
        requireTrue(!events.isEmpty(), "At least one event must be provided");

        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            handle.createQuery("SELECT 1 FROM pg_advisory_xact_lock(hashtext(:lockName))")
                  .bind("lockName", configuration.eventsTableName)
                  .mapTo(Integer.class)
                  .one();

            var currentRevision = loadCurrentRevision(handle, streamName);
            if (!expectedRevision.isSatisfiedBy(currentRevision)) {
                log.debug("[{}] Rejecting append of {} event(s): expected revision '{}' but was '{}'",
                          streamName,
                          events.size(),
                          expectedRevision,
                          currentRevision.map(String::valueOf).orElse("NO_STREAM"));
                throw new OptimisticAppendToStreamException(streamName, expectedRevision, currentRevision);
            }

            var firstRevision = currentRevision.map(StreamRevision::next).orElse(StreamRevision.FIRST);
            var timestamp     = OffsetDateTime.now(clock);
            var batch         = handle.prepareBatch(insertSql);
            var revision      = firstRevision;
            for (var event : events) {
                batch.bind("streamName", streamName.value())
                     .bind("streamRevision", revision.longValue())
                     .bind("eventId", event.eventId.value())
                     .bind("eventType", event.eventType.value())
                     .bind("eventRevision", event.eventRevision.intValue())
                     .bind("timestamp", timestamp)
                     .bind("eventPayload", jsonSerializer.serialize(event.event))
                     .bind("eventMetaData", jsonSerializer.serialize(event.metaData))
                     .add();
                revision = revision.next();
            }

            try {
                var globalPositions = batch.executePreparedBatch("global_position")
                                           .mapTo(Long.class)
                                           .list();
                var lastRevision = StreamRevision.of(firstRevision.longValue() + events.size() - 1);
                var lastPosition = GlobalPosition.of(globalPositions.stream().mapToLong(Long::longValue).max().orElseThrow());
                log.debug("[{}] Appended {} event(s) with last revision '{}' and global position '{}'",
                          streamName,
                          events.size(),
                          lastRevision,
                          lastPosition);
                return new AppendResult(streamName, lastRevision, lastPosition);
            } catch (RuntimeException e) {
                var cause = Exceptions.getRootCause(e);
                if (cause.getMessage() != null && cause.getMessage().contains("duplicate key value violates unique constraint") && cause.getMessage().contains("stream_name_stream_revision_key")) {
                    throw new OptimisticAppendToStreamException(streamName, expectedRevision, currentRevision, e);
                }
                throw new AppendToStreamException(msg("[{}] Failed to append {} event(s) starting at revision '{}'",
                                                      streamName,
                                                      events.size(),
                                                      firstRevision),
                                                  e);
            }
        });
    }

    private Optional<StreamRevision> loadCurrentRevision(Handle handle, StreamName streamName) {
        return handle.createQuery(bind("SELECT stream_revision FROM {:tableName} WHERE stream_name = :streamName ORDER BY stream_revision DESC LIMIT 1",
                                       arg("tableName", configuration.eventsTableName)))
                     .bind("streamName", streamName.value())
                     .mapTo(Long.class)
                     .findOne()
                     .map(StreamRevision::of);
    }

    @Override
    public Optional<EventStream> readStream(StreamName streamName) {
        requireNonNull(streamName, "No streamName provided");
        var events = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                              .createQuery(bind("SELECT * FROM {:tableName} WHERE stream_name = :streamName ORDER BY stream_revision",
                                                                                                arg("tableName", configuration.eventsTableName)))
                                                                              .bind("streamName", streamName.value())
                                                                              .setFetchSize(configuration.queryFetchSize)
                                                                              .map(rowMapper)
                                                                              .list());
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new EventStream(streamName, events));
    }

    @Override
    public boolean streamExists(StreamName streamName) {
        requireNonNull(streamName, "No streamName provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> loadCurrentRevision(unitOfWork.handle(), streamName).isPresent());
    }

    @Override
    public List<RecordedEvent> readAll(GlobalPosition fromInclusive, int maxCount, EventStreamFilter filter) {
        requireNonNull(fromInclusive, "No fromInclusive provided");
        requireNonNull(filter, "No filter provided");
        requireTrue(maxCount > 0, "maxCount must be > 0");

        var prefixes = filter.streamNamePrefixes();
        var prefixCriteria = filter.isAllStreams() ? "" :
                             IntStream.range(0, prefixes.size())
                                      .mapToObj(index -> "starts_with(stream_name, :prefix" + index + ")")
                                      .collect(Collectors.joining(" OR ", " AND (", ")"));
        var sql = bind("SELECT * FROM {:tableName} WHERE global_position >= :fromInclusive{:prefixCriteria} ORDER BY global_position LIMIT :maxCount",
                       arg("tableName", configuration.eventsTableName),
                       arg("prefixCriteria", prefixCriteria));
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var query = unitOfWork.handle()
                                  .createQuery(sql)
                                  .bind("fromInclusive", fromInclusive.longValue())
                                  .bind("maxCount", maxCount)
                                  .setFetchSize(configuration.queryFetchSize);
            for (var index = 0; index < prefixes.size(); index++) {
                query.bind("prefix" + index, prefixes.get(index));
            }
            return query.map(rowMapper).list();
        });
    }
}
