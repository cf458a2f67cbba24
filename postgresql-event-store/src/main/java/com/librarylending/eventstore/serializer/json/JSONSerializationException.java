package com.librarylending.eventstore.serializer.json;

import com.librarylending.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
