package com.librarylending.eventstore.persistence;

import com.librarylending.eventstore.EventStoreException;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
