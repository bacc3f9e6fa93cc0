package com.genstream.provider;

import com.genstream.model.CountTokensRequest;
import com.genstream.model.CountTokensResponse;
import com.genstream.model.GenerateContentRequest;
import com.genstream.model.GenerateContentResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Interface for generative model backends.
 * Implementations handle authentication, endpoint layout and response decoding
 * for one API.
 *
 * All operations are lazy: no request is sent until the returned publisher is
 * subscribed, and each subscription is one independent HTTP exchange.
 */
public interface GenerativeModelProvider {

    /**
     * Get provider name (e.g., "google-ai").
     *
     * @return provider name
     */
    String getName();

    /**
     * Generate a complete response in one exchange.
     *
     * @param request generation request
     * @return the response, or a {@link com.genstream.exception.GenerativeAiException}
     */
    Mono<GenerateContentResponse> generateContent(GenerateContentRequest request);

    /**
     * Generate a response as a stream of partial responses.
     * Cancelling the subscription aborts the HTTP read and releases the connection.
     *
     * @param request generation request
     * @return zero or more responses, in arrival order, optionally terminated by a
     *         {@link com.genstream.exception.GenerativeAiException}
     */
    Flux<GenerateContentResponse> generateContentStream(GenerateContentRequest request);

    /**
     * Count the tokens a request would use.
     *
     * @param request token count request
     * @return token count
     */
    Mono<CountTokensResponse> countTokens(CountTokensRequest request);

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();
}
