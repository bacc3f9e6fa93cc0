package com.genstream.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genstream.exception.SerializationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Deserializes one complete JSON value into a response type.
 * Stateless; safe to share between streams.
 */
public class ResponseDecoder {

    private final ObjectMapper objectMapper;

    public ResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode a frame.
     *
     * @throws SerializationException if the bytes do not match {@code type}
     */
    public <T> T decode(byte[] frame, Class<T> type) {
        try {
            T value = objectMapper.readValue(frame, type);
            if (value == null) {
                throw new SerializationException("Response was JSON null, expected " + type.getSimpleName());
            }
            return value;
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize " + type.getSimpleName() + ": "
                    + preview(frame), e);
        }
    }

    /**
     * Decode a fully buffered body.
     */
    public <T> T decode(String body, Class<T> type) {
        return decode(body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8), type);
    }

    private static String preview(byte[] frame) {
        String text = new String(frame, StandardCharsets.UTF_8);
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
