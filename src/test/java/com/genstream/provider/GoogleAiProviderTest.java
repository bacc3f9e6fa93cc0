package com.genstream.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genstream.GoldenFiles;
import com.genstream.config.GenstreamProperties;
import com.genstream.config.JacksonConfiguration;
import com.genstream.exception.InvalidApiKeyException;
import com.genstream.exception.InvalidRequestException;
import com.genstream.exception.PromptBlockedException;
import com.genstream.exception.ProviderDisabledException;
import com.genstream.exception.RequestTimeoutException;
import com.genstream.exception.ResponseStoppedException;
import com.genstream.exception.SerializationException;
import com.genstream.exception.ServerException;
import com.genstream.model.BlockReason;
import com.genstream.model.Content;
import com.genstream.model.CountTokensRequest;
import com.genstream.model.CountTokensResponse;
import com.genstream.model.FinishReason;
import com.genstream.model.GenerateContentRequest;
import com.genstream.model.GenerateContentResponse;
import com.genstream.model.GenerationConfig;
import com.genstream.model.HarmBlockThreshold;
import com.genstream.model.HarmCategory;
import com.genstream.model.SafetySetting;
import com.genstream.service.ResponseClassifier;
import com.genstream.service.ResponseValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GoogleAiProvider against recorded responses.
 */
class GoogleAiProviderTest {

    private static final int CHUNK_SIZE = 37;

    private GenstreamProperties properties;
    private ObjectMapper objectMapper;
    private GenerateContentRequest request;

    @BeforeEach
    void setUp() {
        properties = new GenstreamProperties();
        properties.setApiKey("test-key");
        properties.setTimeout(Duration.ofSeconds(5));
        objectMapper = JacksonConfiguration.createObjectMapper();
        request = GenerateContentRequest.builder()
                .model("gemini-pro")
                .contents(List.of(Content.user("Where is Cheyenne?")))
                .generationConfig(GenerationConfig.builder().temperature(0.2).build())
                .safetySettings(List.of(SafetySetting.builder()
                        .category(HarmCategory.HARASSMENT)
                        .threshold(HarmBlockThreshold.ONLY_HIGH)
                        .build()))
                .build();
    }

    @Test
    void testShortReply() {
        List<GenerateContentResponse> responses = streamAll("success-basic-reply-short.txt");

        assertFalse(responses.isEmpty());
        GenerateContentResponse first = responses.get(0);
        assertEquals(FinishReason.STOP, first.getCandidates().get(0).getFinishReason());
        assertFalse(first.getCandidates().get(0).getContent().getParts().isEmpty());
        assertFalse(first.getCandidates().get(0).getSafetyRatings().isEmpty());
        assertEquals("Cheyenne", first.text());
    }

    @Test
    void testLongReply() {
        List<GenerateContentResponse> responses = streamAll("success-basic-reply-long.txt");

        assertEquals(4, responses.size());
        responses.forEach(response -> {
            assertEquals(FinishReason.STOP, response.getCandidates().get(0).getFinishReason());
            assertFalse(response.getCandidates().get(0).getContent().getParts().isEmpty());
            assertFalse(response.getCandidates().get(0).getSafetyRatings().isEmpty());
        });
        assertEquals(58, responses.get(3).getUsageMetadata().getTotalTokenCount());
    }

    @Test
    void testUnknownEnum() {
        List<GenerateContentResponse> responses = streamAll("success-unknown-enum.txt");

        assertTrue(responses.stream()
                .flatMap(response -> response.getCandidates().stream())
                .flatMap(candidate -> candidate.getSafetyRatings().stream())
                .anyMatch(rating -> rating.getCategory() == HarmCategory.UNKNOWN));
    }

    @Test
    void testQuotesEscaped() {
        List<GenerateContentResponse> responses = streamAll("success-quotes-escaped.txt");

        assertEquals(1, responses.size());
        assertEquals("Quote: \"to be, or not to be\" {\\} [\"}\"]", responses.get(0).text());
    }

    @Test
    void testCitationsParsed() {
        List<GenerateContentResponse> responses = streamAll("success-citations.txt");

        assertTrue(responses.stream()
                .flatMap(response -> response.getCandidates().stream())
                .anyMatch(candidate -> candidate.getCitationMetadata() != null
                        && !candidate.getCitationMetadata().getCitationSources().isEmpty()));
    }

    @Test
    void testPromptBlockedForSafety() {
        List<GenerateContentResponse> received = new ArrayList<>();

        PromptBlockedException e = assertThrows(PromptBlockedException.class,
                () -> stream("failure-prompt-blocked-safety.txt", 200, received));

        assertEquals(BlockReason.SAFETY, e.getResponse().getPromptFeedback().getBlockReason());
        assertTrue(received.isEmpty());
    }

    @Test
    void testEmptyContent() {
        assertThrows(SerializationException.class, () -> streamAll("failure-empty-content.txt"));
    }

    @Test
    void testStoppedForSafetyAfterOneItem() {
        List<GenerateContentResponse> received = new ArrayList<>();

        ResponseStoppedException e = assertThrows(ResponseStoppedException.class,
                () -> stream("failure-finish-reason-safety.txt", 200, received));

        assertEquals(1, received.size());
        assertEquals("The first part of the answer", received.get(0).text());
        assertEquals(FinishReason.SAFETY, e.getFinishReason());
        assertEquals(FinishReason.SAFETY, e.getResponse().getCandidates().get(0).getFinishReason());
    }

    @Test
    void testStoppedForRecitation() {
        ResponseStoppedException e = assertThrows(ResponseStoppedException.class,
                () -> streamAll("failure-recitation-no-content.txt"));

        assertEquals(FinishReason.RECITATION, e.getResponse().getCandidates().get(0).getFinishReason());
    }

    @Test
    void testHttpErrorFailsBeforeAnyItem() {
        List<GenerateContentResponse> received = new ArrayList<>();

        ServerException e = assertThrows(ServerException.class,
                () -> stream("failure-http-error.txt", 412, received));

        assertEquals(412, e.getStatusCode());
        assertEquals("Precondition Failed", e.getMessage());
        assertTrue(received.isEmpty());
    }

    @Test
    void testImageRejected() {
        ServerException e = assertThrows(ServerException.class,
                () -> stream("failure-image-rejected.txt", 400, new ArrayList<>()));

        assertFalse(e instanceof InvalidApiKeyException);
    }

    @Test
    void testUnknownModel() {
        ServerException e = assertThrows(ServerException.class,
                () -> stream("failure-unknown-model.txt", 404, new ArrayList<>()));

        assertEquals(404, e.getStatusCode());
        assertTrue(e.getMessage().contains("is not found"));
    }

    @Test
    void testInvalidApiKey() {
        assertThrows(InvalidApiKeyException.class,
                () -> stream("failure-api-key.txt", 400, new ArrayList<>()));
    }

    @Test
    void testErrorStatusWithSuccessfulLookingBodyStillFails() {
        assertThrows(ServerException.class,
                () -> stream("success-basic-reply-short.txt", 500, new ArrayList<>()));
    }

    @Test
    void testTruncatedStream() {
        assertThrows(SerializationException.class, () -> streamAll("failure-truncated.txt"));
    }

    @Test
    void testStreamRequest() {
        StubExchangeFunction exchange = streaming("success-basic-reply-short.txt", 200);

        provider(exchange).generateContentStream(request).blockLast();

        assertEquals(HttpMethod.POST, exchange.lastRequest().method());
        assertEquals("https://generativelanguage.googleapis.com/v1beta/models/gemini-pro:streamGenerateContent?alt=sse",
                exchange.lastRequest().url().toString());
        assertEquals("test-key", exchange.lastRequest().headers().getFirst("x-goog-api-key"));
        assertEquals("genstream-java/" + GoogleAiProvider.CLIENT_VERSION,
                exchange.lastRequest().headers().getFirst("x-goog-api-client"));
        assertEquals(MediaType.APPLICATION_JSON_VALUE, exchange.lastRequest().headers().getFirst("Content-Type"));

        String body = exchange.lastRequestBody();
        assertTrue(body.contains("\"contents\""));
        assertTrue(body.contains("\"temperature\":0.2"));
        assertTrue(body.contains("{\"category\":\"HARM_CATEGORY_HARASSMENT\",\"threshold\":\"BLOCK_ONLY_HIGH\"}"));
        assertFalse(body.contains("\"model\""));
        assertFalse(body.contains("null"));
    }

    @Test
    void testStreamIsLazy() {
        StubExchangeFunction exchange = streaming("success-basic-reply-short.txt", 200);

        Flux<GenerateContentResponse> responses = provider(exchange).generateContentStream(request);

        assertEquals(0, exchange.requestCount());
        responses.blockLast();
        assertEquals(1, exchange.requestCount());
    }

    @Test
    void testCancellationStopsReading() {
        byte[] body = GoldenFiles.streaming("success-basic-reply-long.txt");
        StubExchangeFunction exchange = new StubExchangeFunction(200, MediaType.TEXT_EVENT_STREAM,
                GoldenFiles.chunks(body, 16));

        List<GenerateContentResponse> first = provider(exchange).generateContentStream(request)
                .take(1)
                .collectList()
                .block();

        assertEquals(1, first.size());
        assertTrue(exchange.isCancelled());
        assertTrue(exchange.chunksDelivered() < exchange.chunkCount());
    }

    @Test
    void testGenerateContent() throws Exception {
        StubExchangeFunction exchange = unary("success-basic-reply.json", 200);

        GenerateContentResponse response = provider(exchange).generateContent(request).toFuture().get();

        assertEquals("Mountain View, California", response.text());
        assertEquals(12, response.getUsageMetadata().getTotalTokenCount());
        assertEquals("https://generativelanguage.googleapis.com/v1beta/models/gemini-pro:generateContent",
                exchange.lastRequest().url().toString());
    }

    @Test
    void testGenerateContentPromptBlocked() {
        StubExchangeFunction exchange = unary("failure-prompt-blocked-safety.json", 200);

        PromptBlockedException e = assertThrows(PromptBlockedException.class,
                () -> provider(exchange).generateContent(request).block());

        assertEquals(BlockReason.SAFETY, e.getBlockReason());
    }

    @Test
    void testGenerateContentInvalidApiKey() {
        StubExchangeFunction exchange = new StubExchangeFunction(400, MediaType.APPLICATION_JSON,
                List.of(GoldenFiles.streaming("failure-api-key.txt")));

        InvalidApiKeyException e = assertThrows(InvalidApiKeyException.class,
                () -> provider(exchange).generateContent(request).block());

        assertEquals("API key not valid. Please pass a valid API key.", e.getMessage());
    }

    @Test
    void testGenerateContentEmptyBody() {
        StubExchangeFunction exchange = new StubExchangeFunction(200, MediaType.APPLICATION_JSON, List.of());

        assertThrows(SerializationException.class, () -> provider(exchange).generateContent(request).block());
    }

    @Test
    void testGenerateContentTimeout() {
        properties.setTimeout(Duration.ofMillis(100));
        ExchangeFunction silent = clientRequest -> Mono.never();

        assertThrows(RequestTimeoutException.class,
                () -> provider(WebClient.builder().exchangeFunction(silent).build()).generateContent(request).block());
    }

    @Test
    void testCountTokens() {
        StubExchangeFunction exchange = unary("success-count-tokens.json", 200);
        CountTokensRequest countRequest = CountTokensRequest.builder()
                .model("tunedModels/my-model")
                .contents(List.of(Content.user("hello")))
                .build();

        CountTokensResponse response = provider(exchange).countTokens(countRequest).block();

        assertEquals(6, response.getTotalTokens());
        assertEquals("https://generativelanguage.googleapis.com/v1beta/tunedModels/my-model:countTokens",
                exchange.lastRequest().url().toString());
    }

    @Test
    void testDisabledProvider() {
        properties.setEnabled(false);
        StubExchangeFunction exchange = streaming("success-basic-reply-short.txt", 200);
        GoogleAiProvider provider = provider(exchange);

        assertFalse(provider.isEnabled());
        assertThrows(ProviderDisabledException.class, () -> provider.generateContentStream(request).blockLast());
        assertThrows(ProviderDisabledException.class, () -> provider.generateContent(request).block());
        assertEquals(0, exchange.requestCount());
    }

    @Test
    void testMissingApiKeyDisablesProvider() {
        properties.setApiKey(" ");
        StubExchangeFunction exchange = unary("success-count-tokens.json", 200);
        CountTokensRequest countRequest = CountTokensRequest.builder()
                .model("gemini-pro")
                .contents(List.of(Content.user("hello")))
                .build();

        assertThrows(ProviderDisabledException.class, () -> provider(exchange).countTokens(countRequest).block());
        assertEquals(0, exchange.requestCount());
    }

    @Test
    void testMissingModelIsRejected() {
        GenerateContentRequest noModel = GenerateContentRequest.builder()
                .contents(List.of(Content.user("hi")))
                .build();

        StubExchangeFunction exchange = streaming("success-basic-reply-short.txt", 200);

        Flux<GenerateContentResponse> responses = assertDoesNotThrow(
                () -> provider(exchange).generateContentStream(noModel));

        assertThrows(InvalidRequestException.class, responses::blockLast);
        assertThrows(InvalidRequestException.class, () -> provider(exchange).generateContent(noModel).block());
        assertEquals(0, exchange.requestCount());
    }

    @Test
    void testHtmlBodyWithSuccessStatusFails() {
        List<GenerateContentResponse> received = new ArrayList<>();

        SerializationException e = assertThrows(SerializationException.class,
                () -> stream("failure-gateway-html.txt", 200, received));

        assertTrue(e.getMessage().contains("502 Bad Gateway"));
        assertTrue(received.isEmpty());
    }

    @Test
    void testRequestBodyIsRecorded() {
        StubExchangeFunction exchange = unary("success-basic-reply.json", 200);

        provider(exchange).generateContent(request).block();

        assertEquals(1, exchange.requestCount());
        assertTrue(exchange.lastRequestBody().startsWith("{\"contents\":"));
    }

    private List<GenerateContentResponse> streamAll(String golden) {
        return stream(golden, 200, new ArrayList<>());
    }

    private List<GenerateContentResponse> stream(String golden, int status, List<GenerateContentResponse> received) {
        provider(streaming(golden, status)).generateContentStream(request)
                .doOnNext(received::add)
                .blockLast();
        return received;
    }

    private StubExchangeFunction streaming(String golden, int status) {
        MediaType contentType = status == 200 ? MediaType.TEXT_EVENT_STREAM : MediaType.APPLICATION_JSON;
        return new StubExchangeFunction(status, contentType,
                GoldenFiles.chunks(GoldenFiles.streaming(golden), CHUNK_SIZE));
    }

    private StubExchangeFunction unary(String golden, int status) {
        return new StubExchangeFunction(status, MediaType.APPLICATION_JSON,
                GoldenFiles.chunks(GoldenFiles.unary(golden), CHUNK_SIZE));
    }

    private GoogleAiProvider provider(StubExchangeFunction exchange) {
        return provider(WebClient.builder().exchangeFunction(exchange).build());
    }

    private GoogleAiProvider provider(WebClient webClient) {
        return new GoogleAiProvider(webClient, properties, objectMapper,
                new ResponseValidator(objectMapper), new ResponseClassifier());
    }
}
