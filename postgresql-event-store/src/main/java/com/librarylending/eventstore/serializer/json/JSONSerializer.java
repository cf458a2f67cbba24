package com.librarylending.eventstore.serializer.json;

/**
 * JSON serializer and deserializer used for event payloads and metadata
 */
public interface JSONSerializer {
    /**
     * Serialize a java object to JSON
     *
     * @param objectToSerialize the java object that will be serialized to JSON
     * @return the JSON
     * @throws JSONSerializationException in case the <code>objectToSerialize</code> couldn't be serialized to JSON
     */
    String serialize(Object objectToSerialize);

    /**
     * Deserialize the <code>json</code> payload into the Java type specified by <code>javaType</code>
     *
     * @param json     the json payload
     * @param javaType the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);
}
