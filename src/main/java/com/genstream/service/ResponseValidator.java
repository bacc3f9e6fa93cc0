package com.genstream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genstream.exception.InvalidApiKeyException;
import com.genstream.exception.ServerException;
import com.genstream.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks the HTTP status of an exchange before any of its body is decoded.
 */
@Slf4j
public class ResponseValidator {

    private static final int UNAUTHORIZED = 401;
    private static final String INVALID_KEY_MESSAGE = "API key not valid";

    private final ObjectMapper objectMapper;

    public ResponseValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Check if a status lets the body through to decoding.
     */
    public boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Validate an exchange.
     *
     * @param statusCode HTTP status
     * @param body       response body, only read for failed exchanges; may be null
     * @throws ServerException if the status is not 2xx
     */
    public void validate(int statusCode, String body) {
        if (!isSuccess(statusCode)) {
            throw toException(statusCode, body);
        }
    }

    /**
     * Build the exception for a failed exchange. The message comes from the
     * error envelope when the body has one, otherwise it is the body itself.
     */
    public ServerException toException(int statusCode, String body) {
        String message = extractMessage(body);
        log.debug("Request failed with HTTP {}: {}", statusCode, message);

        if (statusCode == UNAUTHORIZED || message.contains(INVALID_KEY_MESSAGE)) {
            return new InvalidApiKeyException(statusCode, message);
        }
        return new ServerException(statusCode, message);
    }

    private String extractMessage(String body) {
        if (body == null || body.isBlank()) {
            return body == null ? "" : body;
        }

        try {
            ErrorResponse envelope = objectMapper.readValue(body, ErrorResponse.class);
            if (envelope != null && envelope.getError() != null && envelope.getError().getMessage() != null) {
                return envelope.getError().getMessage();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not a JSON error envelope", e);
        }
        return body;
    }
}
