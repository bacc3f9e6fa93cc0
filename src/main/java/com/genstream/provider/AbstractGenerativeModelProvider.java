package com.genstream.provider;

import com.genstream.config.GenstreamProperties;
import com.genstream.exception.GenerativeAiException;
import com.genstream.exception.ProviderDisabledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Abstract base class for providers with common functionality.
 */
@Slf4j
public abstract class AbstractGenerativeModelProvider implements GenerativeModelProvider {

    protected final WebClient webClient;
    protected final GenstreamProperties properties;

    protected AbstractGenerativeModelProvider(WebClient webClient, GenstreamProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled()
                && properties.getApiKey() != null
                && !properties.getApiKey().isBlank();
    }

    /**
     * Execute a single-shot request with the configured timeout. Failures that
     * are not client exceptions are translated.
     */
    protected <T> Mono<T> executeUnary(String operation, Mono<T> request) {
        if (!isEnabled()) {
            return Mono.error(new ProviderDisabledException(getName() + " provider is not enabled"));
        }

        return request
                .timeout(properties.getTimeout())
                .onErrorMap(error -> !(error instanceof GenerativeAiException), GenerativeAiException::from)
                .doOnSuccess(response -> log.debug("{} succeeded for provider: {}", operation, getName()))
                .doOnError(error -> log.error("{} failed for provider {}: {}", operation, getName(),
                        error.getMessage()));
    }

    /**
     * Execute a streaming request. Stalled reads are bounded by the transport's
     * response timeout, not by a limit on the whole stream.
     */
    protected <T> Flux<T> executeStream(String operation, Flux<T> request) {
        if (!isEnabled()) {
            return Flux.error(new ProviderDisabledException(getName() + " provider is not enabled"));
        }

        return request
                .onErrorMap(error -> !(error instanceof GenerativeAiException), GenerativeAiException::from)
                .doOnCancel(() -> log.debug("{} cancelled for provider: {}", operation, getName()))
                .doOnError(error -> log.error("{} failed for provider {}: {}", operation, getName(),
                        error.getMessage()));
    }

    /**
     * Copy a transport buffer and release it.
     */
    protected static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
