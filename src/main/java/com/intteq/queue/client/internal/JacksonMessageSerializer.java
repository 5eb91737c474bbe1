package com.intteq.queue.client.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.queue.client.MessageSerializer;
import com.intteq.queue.client.exception.SerializationException;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON {@link MessageSerializer} backed by the application's {@link ObjectMapper}.
 */
@RequiredArgsConstructor
public class JacksonMessageSerializer implements MessageSerializer {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }

    @Override
    public byte[] serialize(Object payload) {
        if (payload instanceof byte[]) {
            return (byte[]) payload;
        }
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new SerializationException(
                    "Failed to serialize message payload to JSON: " + typeName(payload), e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T deserialize(byte[] body, Class<T> type) {
        if (type == byte[].class) {
            return (T) body;
        }
        if (type == String.class) {
            return (T) new String(body, StandardCharsets.UTF_8);
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new SerializationException(
                    "Failed to deserialize message body to " + type.getName(), e);
        }
    }

    private static String typeName(Object payload) {
        return payload == null ? "null" : payload.getClass().getName();
    }
}
