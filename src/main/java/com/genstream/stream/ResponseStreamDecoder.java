package com.genstream.stream;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a chunked SSE body into a lazy sequence of decoded values.
 *
 * Every subscription gets its own {@link SseEventDecoder} and
 * {@link JsonFrameSplitter}, so the returned flux can be subscribed more than
 * once when the source allows it, each time with fresh parse state. Values are
 * emitted in the order their frames close; upstream demand follows downstream
 * demand.
 */
@Slf4j
public class ResponseStreamDecoder {

    // Chunks requested ahead of the frames already handed downstream
    private static final int CHUNK_PREFETCH = 4;

    private final ResponseDecoder responseDecoder;

    public ResponseStreamDecoder(ResponseDecoder responseDecoder) {
        this.responseDecoder = responseDecoder;
    }

    public <T> Flux<T> decode(Flux<byte[]> chunks, Class<T> type) {
        return frames(chunks).map(frame -> responseDecoder.decode(frame, type));
    }

    /**
     * Split a chunked body into raw JSON frames.
     */
    public Flux<byte[]> frames(Flux<byte[]> chunks) {
        return Flux.defer(() -> {
            SseEventDecoder events = new SseEventDecoder();
            JsonFrameSplitter splitter = new JsonFrameSplitter();

            Flux<byte[]> tail = Flux.defer(() -> Flux.fromIterable(split(splitter, events.finish())))
                    .concatWith(Mono.<byte[]>fromRunnable(splitter::finish))
                    .doOnComplete(() -> log.debug("Stream complete after {} frames", splitter.getFramesEmitted()));

            return chunks
                    .concatMapIterable(chunk -> split(splitter, events.decode(chunk)), CHUNK_PREFETCH)
                    .concatWith(tail);
        });
    }

    private static List<byte[]> split(JsonFrameSplitter splitter, List<byte[]> payload) {
        if (payload.isEmpty()) {
            return List.of();
        }
        List<byte[]> frames = new ArrayList<>();
        for (byte[] fragment : payload) {
            frames.addAll(splitter.split(fragment));
        }
        return frames;
    }
}
