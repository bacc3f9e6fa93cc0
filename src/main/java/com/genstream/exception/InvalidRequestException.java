package com.genstream.exception;

/**
 * The request cannot be sent as built, for example because it names no model.
 */
public class InvalidRequestException extends GenerativeAiException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
