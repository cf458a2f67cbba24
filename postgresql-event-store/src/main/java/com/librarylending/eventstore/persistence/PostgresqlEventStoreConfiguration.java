package com.librarylending.eventstore.persistence;

import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Storage settings for the PostgresqlEventStore.<br>
 * The table name is used to build SQL statements, so it's restricted to a plain lower case Postgresql identifier.
 */
public final class PostgresqlEventStoreConfiguration {
    public static final String  DEFAULT_EVENTS_TABLE_NAME = "library_events";
    public static final int     DEFAULT_QUERY_FETCH_SIZE  = 100;
    private static final Pattern VALID_TABLE_NAME          = Pattern.compile("[a-z_][a-z0-9_]*");

    public final String         eventsTableName;
    /**
     * The JDBC fetch size used when reading streams and catching up
     */
    public final int            queryFetchSize;
    public final JSONColumnType eventJsonColumnType;
    public final JSONColumnType eventMetadataJsonColumnType;

    public PostgresqlEventStoreConfiguration(String eventsTableName,
                                             int queryFetchSize,
                                             JSONColumnType eventJsonColumnType,
                                             JSONColumnType eventMetadataJsonColumnType) {
        this.eventsTableName = requireNonNull(eventsTableName, "No eventsTableName provided");
        requireTrue(VALID_TABLE_NAME.matcher(eventsTableName).matches(),
                    msg("Invalid eventsTableName '{}'. Only lower case letters, digits and underscores are allowed", eventsTableName));
        requireTrue(queryFetchSize > 0, "queryFetchSize must be > 0");
        this.queryFetchSize = queryFetchSize;
        this.eventJsonColumnType = requireNonNull(eventJsonColumnType, "No eventJsonColumnType provided");
        this.eventMetadataJsonColumnType = requireNonNull(eventMetadataJsonColumnType, "No eventMetadataJsonColumnType provided");
    }

    /**
     * Table <code>library_events</code> with JSONB payload and metadata columns
     */
    public static PostgresqlEventStoreConfiguration defaultConfiguration() {
        return new PostgresqlEventStoreConfiguration(DEFAULT_EVENTS_TABLE_NAME,
                                                     DEFAULT_QUERY_FETCH_SIZE,
                                                     JSONColumnType.JSONB,
                                                     JSONColumnType.JSONB);
    }

    public static PostgresqlEventStoreConfiguration usingTable(String eventsTableName) {
        return new PostgresqlEventStoreConfiguration(eventsTableName,
                                                     DEFAULT_QUERY_FETCH_SIZE,
                                                     JSONColumnType.JSONB,
                                                     JSONColumnType.JSONB);
    }

    @Override
    public String toString() {
        return "PostgresqlEventStoreConfiguration{" +
                "eventsTableName='" + eventsTableName + '\'' +
                ", queryFetchSize=" + queryFetchSize +
                ", eventJsonColumnType=" + eventJsonColumnType +
                ", eventMetadataJsonColumnType=" + eventMetadataJsonColumnType +
                '}';
    }
}
