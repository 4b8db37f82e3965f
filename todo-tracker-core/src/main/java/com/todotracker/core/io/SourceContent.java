package com.todotracker.core.io;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Byte-addressable, read-only view of a file's content.
 *
 * <p>Backed either by a heap array (small files) or by a memory-mapped buffer (large files).
 * Scanners address the content by byte offset and decode only the slices they need, so a
 * mapped file is never copied into the heap as a whole. Content is UTF-8; a leading byte
 * order mark is excluded from the scanned range via {@link #start()}.
 */
public final class SourceContent {

    private static final int VALIDATION_CHUNK = 8192;

    private final ByteBuffer buffer;
    private final boolean mapped;
    private final int start;

    private SourceContent(ByteBuffer buffer, boolean mapped) {
        this.buffer = Objects.requireNonNull(buffer, "buffer must not be null").asReadOnlyBuffer();
        this.mapped = mapped;
        this.start = hasBom(this.buffer) ? 3 : 0;
    }

    /**
     * Wraps an in-memory byte array.
     */
    public static SourceContent ofBytes(byte[] bytes) {
        return new SourceContent(ByteBuffer.wrap(bytes), false);
    }

    /**
     * Wraps a string, encoded as UTF-8. Convenient for tests and in-memory sources.
     */
    public static SourceContent ofString(String text) {
        return ofBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Wraps a memory-mapped buffer without copying it.
     */
    public static SourceContent ofMapped(ByteBuffer mappedBuffer) {
        return new SourceContent(mappedBuffer, true);
    }

    private static boolean hasBom(ByteBuffer buffer) {
        return buffer.limit() >= 3
            && (buffer.get(0) & 0xFF) == 0xEF
            && (buffer.get(1) & 0xFF) == 0xBB
            && (buffer.get(2) & 0xFF) == 0xBF;
    }

    /**
     * Total length in bytes, including any byte order mark.
     */
    public int length() {
        return buffer.limit();
    }

    /**
     * Offset of the first content byte (3 when the content starts with a UTF-8 BOM, else 0).
     */
    public int start() {
        return start;
    }

    public byte byteAt(int index) {
        return buffer.get(index);
    }

    public boolean isMapped() {
        return mapped;
    }

    /**
     * Decodes a byte range as UTF-8.
     *
     * @param from start offset (inclusive)
     * @param to end offset (exclusive)
     * @return decoded text
     */
    public String decode(int from, int to) {
        if (from < 0 || to > length() || from > to) {
            throw new IndexOutOfBoundsException("range " + from + ".." + to + " outside 0.." + length());
        }
        if (from == to) {
            return "";
        }
        return StandardCharsets.UTF_8.decode(buffer.slice(from, to - from)).toString();
    }

    /**
     * Decodes the whole content (after any BOM) as UTF-8.
     */
    public String text() {
        return decode(start, length());
    }

    /**
     * Checks whether the bytes at {@code offset} match {@code token} exactly.
     */
    public boolean regionMatches(int offset, byte[] token) {
        if (offset < 0 || offset + token.length > length()) {
            return false;
        }
        for (int i = 0; i < token.length; i++) {
            if (buffer.get(offset + i) != token[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Verifies that the content is text: valid UTF-8 with no NUL bytes.
     *
     * <p>Decodes in fixed-size chunks so validating a mapped file does not materialise it.
     *
     * @throws EncodingException at the first invalid byte
     */
    public void validateText() throws EncodingException {
        for (int i = start; i < length(); i++) {
            if (buffer.get(i) == 0) {
                throw new EncodingException("binary content (NUL byte) at offset " + i, i);
            }
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer input = buffer.slice(start, length() - start);
        CharBuffer chunk = CharBuffer.allocate(VALIDATION_CHUNK);
        while (true) {
            CoderResult result = decoder.decode(input, chunk, true);
            if (result.isError()) {
                long offset = (long) start + input.position();
                throw new EncodingException("invalid UTF-8 at offset " + offset, offset);
            }
            chunk.clear();
            if (result.isUnderflow()) {
                break;
            }
        }
        CoderResult flushed = decoder.flush(chunk);
        if (flushed.isError()) {
            throw new EncodingException("truncated UTF-8 sequence at end of content", length());
        }
    }
}
