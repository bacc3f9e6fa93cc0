package com.genstream.exception;

public class RequestTimeoutException extends GenerativeAiException {

    public RequestTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
