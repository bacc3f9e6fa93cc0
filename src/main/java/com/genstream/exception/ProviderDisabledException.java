package com.genstream.exception;

/**
 * Raised instead of sending a request when the provider is switched off or has
 * no API key.
 */
public class ProviderDisabledException extends GenerativeAiException {

    public ProviderDisabledException(String message) {
        super(message);
    }
}
