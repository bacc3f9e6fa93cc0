package com.genstream.stream;

import com.genstream.exception.SerializationException;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits concatenated JSON text into complete top-level values ("frames")
 * while the bytes are still arriving.
 *
 * <p>Two layouts are accepted:
 * <ul>
 *   <li>bare values back to back: <code>{...}{...}</code>, the layout SSE streams use</li>
 *   <li>one outer array: <code>[{...}, {...}]</code>; the array brackets and the
 *       commas between elements are never part of a frame</li>
 * </ul>
 *
 * <p>The scanner tracks nesting depth, whether it is inside a string literal
 * and whether the previous byte was an unescaped backslash. Structural bytes
 * are all ASCII, so multi-byte UTF-8 sequences never disturb the state. State
 * carries over between calls; a frame may span any number of chunks and the
 * frames produced do not depend on where the chunks were cut.
 *
 * <p>Not thread-safe. One instance per stream.
 */
public class JsonFrameSplitter {

    private final ByteArrayOutputStream frame = new ByteArrayOutputStream();

    private int depth;
    private boolean inString;
    private boolean escaped;
    private boolean inFrame;
    private boolean envelopeOpen;
    private boolean envelopeClosed;
    private int framesEmitted;

    /**
     * Consume the next piece of JSON text.
     *
     * @param payload bytes, possibly empty
     * @return frames closed by these bytes, in order
     * @throws SerializationException if the text cannot be a sequence of JSON values
     */
    public List<byte[]> split(byte[] payload) {
        List<byte[]> frames = new ArrayList<>();
        for (byte b : payload) {
            if (inFrame) {
                consumeFrameByte(b, frames);
            } else {
                consumeSeparatorByte(b);
            }
        }
        return frames;
    }

    /**
     * Signal the end of the text.
     *
     * @throws SerializationException if a value or the outer array is still open
     */
    public void finish() {
        if (inFrame) {
            throw new SerializationException(
                    "Stream ended in the middle of a JSON value (" + frame.size() + " bytes pending)");
        }
        if (envelopeOpen) {
            throw new SerializationException("Stream ended before the outer JSON array was closed");
        }
    }

    public int getFramesEmitted() {
        return framesEmitted;
    }

    private void consumeFrameByte(byte b, List<byte[]> frames) {
        frame.write(b);

        if (inString) {
            if (escaped) {
                escaped = false;
            } else if (b == '\\') {
                escaped = true;
            } else if (b == '"') {
                inString = false;
            }
            return;
        }

        switch (b) {
            case '"' -> inString = true;
            case '{', '[' -> depth++;
            case '}', ']' -> {
                depth--;
                if (depth == elementDepth()) {
                    frames.add(frame.toByteArray());
                    frame.reset();
                    inFrame = false;
                    framesEmitted++;
                }
            }
            default -> {
                // literal, number or whitespace inside the value
            }
        }
    }

    private void consumeSeparatorByte(byte b) {
        if (isWhitespace(b)) {
            return;
        }
        if (b == ',') {
            return;
        }
        if (b == '[' && depth == 0 && !envelopeOpen && !envelopeClosed && framesEmitted == 0) {
            envelopeOpen = true;
            depth = 1;
            return;
        }
        if (b == ']' && envelopeOpen) {
            envelopeOpen = false;
            envelopeClosed = true;
            depth = 0;
            return;
        }
        if (b == '{' || b == '[') {
            if (envelopeClosed) {
                throw new SerializationException("Unexpected JSON value after the outer array was closed");
            }
            inFrame = true;
            depth++;
            frame.write(b);
            return;
        }
        throw new SerializationException(
                "Unexpected character '" + (char) (b & 0xFF) + "' between JSON values");
    }

    private int elementDepth() {
        return envelopeOpen ? 1 : 0;
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }
}
