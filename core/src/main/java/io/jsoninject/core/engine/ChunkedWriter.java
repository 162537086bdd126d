package io.jsoninject.core.engine;

import io.jsoninject.core.spi.PageOutput;
import java.io.IOException;
import java.util.Objects;

/**
 * Writes arbitrarily long text to a {@link PageOutput} in sequential chunks of bounded size.
 * Order is preserved exactly; a surrogate pair is never split across two writes.
 *
 * <p>Thread-safe: holds only the immutable chunk size.
 */
public final class ChunkedWriter {

    /** Default chunk size in UTF-16 code units. */
    public static final int DEFAULT_CHUNK_SIZE = 4000;

    private final int chunkSize;

    /**
     * @param chunkSize maximum code units per write; at least 2 so that a surrogate pair fits
     */
    public ChunkedWriter(int chunkSize) {
        if (chunkSize < 2) {
            throw new IllegalArgumentException("chunkSize must be at least 2, got: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /** The configured chunk size. */
    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Writes {@code text} in chunks.
     *
     * @return the number of writes issued (0 for empty text)
     * @throws IOException if the output rejects a write; earlier chunks remain written
     */
    public int write(String text, PageOutput out) throws IOException {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(out, "out must not be null");
        int length = text.length();
        int chunks = 0;
        int start = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length && Character.isHighSurrogate(text.charAt(end - 1))
                    && Character.isLowSurrogate(text.charAt(end))) {
                end--;
            }
            out.write(text.substring(start, end));
            chunks++;
            start = end;
        }
        return chunks;
    }
}
