package com.genstream.exception;

/**
 * The response bytes could not be turned into a response object: an unclosed
 * frame, a frame that does not match the schema, or a response with no usable
 * content.
 */
public class SerializationException extends GenerativeAiException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
