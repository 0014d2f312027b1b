package com.questrail.testhost.protocol.tcp.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson binding shared by every JSON payload on the engine link.
 *
 * <p>Unknown properties are ignored so that newer peers can add fields without
 * breaking older ones.</p>
 */
public final class EngineJson
{
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EngineJson() {}

    public static ObjectMapper mapper()
    {
        return MAPPER;
    }

    public static byte[] write(Object value)
    {
        Objects.requireNonNull(value, "value");
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new EngineJsonException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(byte[] json, Class<T> type)
    {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(type, "type");
        try {
            T value = MAPPER.readValue(json, type);
            if (value == null) {
                throw new EngineJsonException("JSON payload for " + type.getSimpleName() + " is null");
            }
            return value;
        } catch (IOException e) {
            throw new EngineJsonException("Cannot deserialize " + type.getSimpleName(), e);
        }
    }

    public static JsonNode readTree(byte[] json)
    {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new EngineJsonException("Malformed JSON payload", e);
        }
    }
}
