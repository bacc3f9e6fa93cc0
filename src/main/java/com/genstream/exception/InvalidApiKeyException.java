package com.genstream.exception;

/**
 * The server rejected the configured API key.
 */
public class InvalidApiKeyException extends ServerException {

    public InvalidApiKeyException(int statusCode, String message) {
        super(statusCode, message);
    }
}
