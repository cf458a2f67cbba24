package com.librarylending.eventstore;

/**
 * Root of the unchecked exceptions raised by an {@link EventStore} for infrastructure failures
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
