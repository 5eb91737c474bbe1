package com.intteq.queue.client;

import com.intteq.queue.client.exception.SerializationException;

/**
 * Converts between wire bytes and typed payloads.
 *
 * <p>{@code String} and {@code byte[]} payload types bypass structured serialization: they map
 * to the UTF-8 text and the raw body respectively.
 */
public interface MessageSerializer {

    /**
     * Content type written on messages produced by {@link #serialize(Object)}.
     */
    String contentType();

    /**
     * @throws SerializationException if the payload cannot be written
     */
    byte[] serialize(Object payload);

    /**
     * @throws SerializationException if the body cannot be read as {@code type}
     */
    <T> T deserialize(byte[] body, Class<T> type);
}
