package com.genstream.exception;

import lombok.Getter;

/**
 * The server answered with a non-2xx status.
 */
@Getter
public class ServerException extends GenerativeAiException {

    private final int statusCode;

    public ServerException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
}
