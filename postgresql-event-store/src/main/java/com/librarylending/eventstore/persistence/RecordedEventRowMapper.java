package com.librarylending.eventstore.persistence;

import com.librarylending.common.types.EventId;
import com.librarylending.eventstore.EventStoreException;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.serializer.json.JSONSerializer;
import com.librarylending.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Maps a row of the events table to a {@link RecordedEvent}
 */
public class RecordedEventRowMapper implements RowMapper<RecordedEvent> {
    private final JSONSerializer jsonSerializer;

    public RecordedEventRowMapper(JSONSerializer jsonSerializer) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    @Override
    public RecordedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventType = getString(rs, "event_type");
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalStateException(msg("Row: {} - Column 'event_type' was empty or blank", rs.getRow()));
        }
        var eventRevision = EventRevision.of(rs.getInt("event_revision"));
        return new RecordedEvent(EventId.of(getString(rs, "event_id")),
                                 StreamName.of(getString(rs, "stream_name")),
                                 StreamRevision.of(rs.getLong("stream_revision")),
                                 GlobalPosition.of(rs.getLong("global_position")),
                                 new EventJSON(jsonSerializer,
                                               EventType.of(eventType),
                                               eventRevision,
                                               getString(rs, "event_payload")),
                                 jsonSerializer.deserialize(getString(rs, "event_metadata"), EventMetaData.class),
                                 rs.getObject("timestamp", OffsetDateTime.class));
    }

    private String getString(ResultSet resultSet, String columnName) {
        try {
            return resultSet.getString(columnName);
        } catch (SQLException e) {
            throw new EventStoreException(msg("Failed to getString from ResultSet in relation to columnName '{}'", columnName), e);
        }
    }
}
