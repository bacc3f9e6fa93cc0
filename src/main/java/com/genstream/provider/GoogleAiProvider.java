package com.genstream.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genstream.config.GenstreamProperties;
import com.genstream.exception.InvalidRequestException;
import com.genstream.exception.SerializationException;
import com.genstream.model.CountTokensRequest;
import com.genstream.model.CountTokensResponse;
import com.genstream.model.GenerateContentRequest;
import com.genstream.model.GenerateContentResponse;
import com.genstream.model.Request;
import com.genstream.service.ResponseClassifier;
import com.genstream.service.ResponseValidator;
import com.genstream.stream.ResponseDecoder;
import com.genstream.stream.ResponseStreamDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Provider for the Google AI generative language API.
 *
 * Every exchange is validated before its body is read. Streamed bodies go
 * through {@link ResponseStreamDecoder} and every element through
 * {@link ResponseClassifier}; the first failure ends the stream.
 */
@Slf4j
public class GoogleAiProvider extends AbstractGenerativeModelProvider {

    public static final String CLIENT_VERSION = "0.1.0";

    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final String API_CLIENT_HEADER = "x-goog-api-client";

    private final ObjectMapper objectMapper;
    private final ResponseValidator responseValidator;
    private final ResponseClassifier responseClassifier;
    private final ResponseDecoder responseDecoder;
    private final ResponseStreamDecoder responseStreamDecoder;

    public GoogleAiProvider(
            WebClient webClient,
            GenstreamProperties properties,
            ObjectMapper objectMapper,
            ResponseValidator responseValidator,
            ResponseClassifier responseClassifier) {
        super(webClient, properties);
        this.objectMapper = objectMapper;
        this.responseValidator = responseValidator;
        this.responseClassifier = responseClassifier;
        this.responseDecoder = new ResponseDecoder(objectMapper);
        this.responseStreamDecoder = new ResponseStreamDecoder(responseDecoder);
    }

    @Override
    public String getName() {
        return "google-ai";
    }

    @Override
    public Mono<GenerateContentResponse> generateContent(GenerateContentRequest request) {
        log.debug("Sending generateContent request: model={}", request.getModel());

        Mono<GenerateContentResponse> responseMono = Mono.defer(() -> post(endpoint(request, "generateContent"),
                        request, MediaType.APPLICATION_JSON)
                        .exchangeToMono(response -> readBody(response, GenerateContentResponse.class)))
                .map(responseClassifier::classify);

        return executeUnary("generateContent", responseMono);
    }

    @Override
    public Flux<GenerateContentResponse> generateContentStream(GenerateContentRequest request) {
        log.debug("Opening streamGenerateContent request: model={}", request.getModel());

        Flux<GenerateContentResponse> responseFlux = Flux.defer(() -> post(
                        endpoint(request, "streamGenerateContent") + "?alt=sse", request, MediaType.TEXT_EVENT_STREAM)
                .exchangeToFlux(response -> {
                    int status = response.statusCode().value();
                    if (!responseValidator.isSuccess(status)) {
                        return this.<GenerateContentResponse>failure(response, status).flux();
                    }

                    Flux<byte[]> chunks = response.bodyToFlux(DataBuffer.class)
                            .map(AbstractGenerativeModelProvider::toBytes);
                    return responseStreamDecoder.decode(chunks, GenerateContentResponse.class)
                            .map(responseClassifier::classify);
                }));

        return executeStream("streamGenerateContent", responseFlux);
    }

    @Override
    public Mono<CountTokensResponse> countTokens(CountTokensRequest request) {
        log.debug("Sending countTokens request: model={}", request.getModel());

        Mono<CountTokensResponse> responseMono = Mono.defer(() -> post(endpoint(request, "countTokens"),
                        request, MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> readBody(response, CountTokensResponse.class)));

        return executeUnary("countTokens", responseMono);
    }

    /**
     * Resolved per subscription, so a bad model name fails the returned publisher.
     */
    private String endpoint(Request request, String method) {
        return properties.getBaseUrl() + "/" + properties.getApiVersion() + "/"
                + ModelNames.fullName(request.getModel()) + ":" + method;
    }

    private WebClient.RequestHeadersSpec<?> post(String endpoint, Request request, MediaType accept) {
        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.ACCEPT, accept.toString())
                .header(API_KEY_HEADER, properties.getApiKey())
                .header(API_CLIENT_HEADER, "genstream-java/" + CLIENT_VERSION)
                .bodyValue(serialize(request));
    }

    /**
     * Build the body for each kind of request.
     */
    private String serialize(Request request) {
        try {
            if (request instanceof GenerateContentRequest generate) {
                return objectMapper.writeValueAsString(generate);
            }
            if (request instanceof CountTokensRequest countTokens) {
                return objectMapper.writeValueAsString(countTokens);
            }
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + request.getClass().getSimpleName(), e);
        }
        throw new InvalidRequestException("Unsupported request type: " + request.getClass().getName());
    }

    private <T> Mono<T> readBody(ClientResponse response, Class<T> type) {
        int status = response.statusCode().value();
        if (!responseValidator.isSuccess(status)) {
            return failure(response, status);
        }
        return readBytes(response)
                .map(body -> responseDecoder.decode(body, type));
    }

    private <T> Mono<T> failure(ClientResponse response, int status) {
        return readBytes(response)
                .map(body -> new String(body, StandardCharsets.UTF_8))
                .flatMap(body -> Mono.error(responseValidator.toException(status, body)));
    }

    /**
     * Buffer the whole body as raw bytes, whatever its content type.
     */
    private static Mono<byte[]> readBytes(ClientResponse response) {
        return DataBufferUtils.join(response.bodyToFlux(DataBuffer.class))
                .map(AbstractGenerativeModelProvider::toBytes)
                .defaultIfEmpty(new byte[0]);
    }
}
