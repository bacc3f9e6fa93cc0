package com.genstream.stream;

import com.genstream.exception.SerializationException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Extracts the payload of server-sent events from a chunked byte stream.
 *
 * Payload bytes are handed out as soon as a {@code data:} line is complete,
 * without waiting for the blank line that ends the event. Lines of one event
 * are joined with a line feed; payloads of consecutive events are simply
 * concatenated, so the result is the stream of JSON text the server meant to
 * send. Comments and the {@code event}, {@code id} and {@code retry} fields
 * are dropped. Any other line means the body is not an event stream at all
 * (an HTML error page, plain text) and fails the stream.
 *
 * A body that starts with {@code [} or <code>{</code> is not SSE framed and is
 * passed through unchanged.
 *
 * Not thread-safe. One instance per stream.
 */
public class SseEventDecoder {

    private static final Set<String> IGNORED_FIELDS = Set.of("event", "id", "retry");

    // Longest prefix of an unexpected line quoted in the error
    private static final int SNIPPET_LENGTH = 80;

    private enum Mode { UNDECIDED, SSE, RAW }

    private final ByteArrayOutputStream line = new ByteArrayOutputStream();

    private Mode mode = Mode.UNDECIDED;
    private boolean lastWasCarriageReturn;
    private int dataLinesInEvent;

    /**
     * Decode the next chunk of the body.
     *
     * @param chunk raw bytes, any length
     * @return payload fragments completed by this chunk, in order
     */
    public List<byte[]> decode(byte[] chunk) {
        List<byte[]> payload = new ArrayList<>();
        int offset = 0;

        if (mode == Mode.UNDECIDED) {
            while (offset < chunk.length && isWhitespace(chunk[offset])) {
                offset++;
            }
            if (offset == chunk.length) {
                return payload;
            }
            mode = (chunk[offset] == '{' || chunk[offset] == '[') ? Mode.RAW : Mode.SSE;
        }

        if (mode == Mode.RAW) {
            if (offset < chunk.length) {
                payload.add(slice(chunk, offset, chunk.length));
            }
            return payload;
        }

        for (int i = offset; i < chunk.length; i++) {
            byte b = chunk[i];
            if (b == '\n') {
                if (lastWasCarriageReturn) {
                    lastWasCarriageReturn = false;
                    continue;
                }
                endLine(payload);
            } else if (b == '\r') {
                endLine(payload);
                lastWasCarriageReturn = true;
            } else {
                lastWasCarriageReturn = false;
                line.write(b);
            }
        }
        return payload;
    }

    /**
     * Flush a trailing line that was not terminated before the end of the body.
     */
    public List<byte[]> finish() {
        List<byte[]> payload = new ArrayList<>();
        if (mode == Mode.SSE && line.size() > 0) {
            endLine(payload);
        }
        return payload;
    }

    private void endLine(List<byte[]> payload) {
        byte[] bytes = line.toByteArray();
        line.reset();

        if (bytes.length == 0) {
            dataLinesInEvent = 0;
            return;
        }
        if (bytes[0] == ':') {
            return; // comment
        }

        int colon = indexOf(bytes, (byte) ':');
        int nameEnd = colon < 0 ? bytes.length : colon;
        String field = new String(bytes, 0, nameEnd, StandardCharsets.UTF_8);
        if (IGNORED_FIELDS.contains(field)) {
            return;
        }
        if (!"data".equals(field)) {
            throw new SerializationException("Unexpected line in event stream: " + snippet(bytes));
        }

        int valueStart = colon < 0 ? bytes.length : colon + 1;
        if (valueStart < bytes.length && bytes[valueStart] == ' ') {
            valueStart++;
        }

        if (dataLinesInEvent > 0) {
            payload.add(new byte[] {'\n'});
        }
        if (valueStart < bytes.length) {
            payload.add(slice(bytes, valueStart, bytes.length));
        }
        dataLinesInEvent++;
    }

    private static String snippet(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
    }

    private static int indexOf(byte[] bytes, byte target) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == target) {
                return i;
            }
        }
        return -1;
    }

    private static byte[] slice(byte[] bytes, int from, int to) {
        byte[] out = new byte[to - from];
        System.arraycopy(bytes, from, out, 0, out.length);
        return out;
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }
}
