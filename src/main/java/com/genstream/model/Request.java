package com.genstream.model;

/**
 * Body of a call to a model endpoint. Each variant maps to one endpoint.
 */
public sealed interface Request permits GenerateContentRequest, CountTokensRequest {

    /**
     * Model the request is addressed to, e.g. "gemini-pro" or "models/gemini-pro".
     */
    String getModel();
}
