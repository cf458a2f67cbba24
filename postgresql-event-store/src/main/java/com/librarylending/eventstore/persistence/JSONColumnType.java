package com.librarylending.eventstore.persistence;

/**
 * The Postgresql column type used for the event payload and metadata columns
 */
public enum JSONColumnType {
    JSON,
    JSONB
}
