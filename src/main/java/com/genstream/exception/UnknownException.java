package com.genstream.exception;

/**
 * Wraps a failure that has no more specific client exception, such as a
 * connection error.
 */
public class UnknownException extends GenerativeAiException {

    public UnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
