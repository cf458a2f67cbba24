package com.librarylending.eventstore.serializer.json;

import com.librarylending.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
