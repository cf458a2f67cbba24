package com.librarylending.eventstore.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.types.jackson.EssentialTypesJacksonModule;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private final ObjectMapper objectMapper;

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper instance provided");
    }

    /**
     * Create a {@link JacksonJSONSerializer} using {@link #createDefaultObjectMapper()}
     */
    public JacksonJSONSerializer() {
        this(createDefaultObjectMapper());
    }

    /**
     * {@link ObjectMapper} with <code>java.time</code> support that writes timestamps as ISO-8601 strings and
     * ignores unknown properties, so events written by a newer version of an event type can still be read.<br>
     * Identifier types (e.g. <code>BookId</code> or <code>EventId</code>) are written as their plain value through the {@link EssentialTypesJacksonModule}
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule())
                                 .registerModule(new EssentialTypesJacksonModule())
                                 .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                 .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                 .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    @Override
    public String serialize(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return objectMapper.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
