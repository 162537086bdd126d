package io.jsoninject.core.spi;

import java.io.IOException;
import java.util.Objects;

/** The page's output stream. Each call appends text in order. */
@FunctionalInterface
public interface PageOutput {

    /**
     * Appends {@code text}.
     *
     * @throws IOException if the underlying stream rejects the write
     */
    void write(String text) throws IOException;

    /** Adapts any {@link Appendable} (a {@code StringBuilder}, a {@code Writer}). */
    static PageOutput of(Appendable target) {
        Objects.requireNonNull(target, "target must not be null");
        return target::append;
    }
}
