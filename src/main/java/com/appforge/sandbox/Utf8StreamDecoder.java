package com.appforge.sandbox;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes one output stream that arrives in arbitrary byte chunks. A multibyte
 * character split across two chunks is held back until its remaining bytes arrive.
 */
final class Utf8StreamDecoder {

    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private ByteBuffer pending = EMPTY;

    /**
     * @return the text completed by {@code bytes}; may be empty
     */
    synchronized String decode(byte[] bytes) {
        ByteBuffer in = ByteBuffer.allocate(pending.remaining() + bytes.length);
        in.put(pending).put(bytes).flip();
        CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        decoder.decode(in, out, false);
        pending = in.hasRemaining() ? in.slice() : EMPTY;
        return out.flip().toString();
    }

    /**
     * Ends the stream. Bytes of a character that never completed come back as U+FFFD.
     */
    synchronized String finish() {
        CharBuffer out = CharBuffer.allocate(pending.remaining() + 2);
        decoder.decode(pending, out, true);
        decoder.flush(out);
        decoder.reset();
        pending = EMPTY;
        return out.flip().toString();
    }
}
