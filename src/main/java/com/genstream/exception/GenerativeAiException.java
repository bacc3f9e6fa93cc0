package com.genstream.exception;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.concurrent.TimeoutException;

/**
 * Base class for every failure raised by the client.
 */
public abstract class GenerativeAiException extends RuntimeException {

    protected GenerativeAiException(String message) {
        super(message);
    }

    protected GenerativeAiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Translate any throwable into a client exception.
     * Client exceptions are returned as is.
     */
    public static GenerativeAiException from(Throwable throwable) {
        if (throwable instanceof GenerativeAiException e) {
            return e;
        }
        if (throwable instanceof TimeoutException
                || throwable instanceof io.netty.handler.timeout.TimeoutException) {
            return new RequestTimeoutException("The request did not complete in time", throwable);
        }
        if (throwable instanceof JsonProcessingException) {
            return new SerializationException("Failed to deserialize response: " + throwable.getMessage(), throwable);
        }
        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable
                && (cause instanceof TimeoutException || cause instanceof io.netty.handler.timeout.TimeoutException)) {
            return new RequestTimeoutException("The request did not complete in time", cause);
        }
        return new UnknownException("Something unexpected happened: " + throwable.getMessage(), throwable);
    }
}
