package io.jsoninject.core.model;

import java.util.Objects;

/**
 * Serialized JSON text produced by a source adapter and embedded verbatim into the emitted script.
 *
 * <p>The core never parses or escapes a payload unless payload verification is switched on; it
 * is trusted to be one syntactically valid JSON document. Length is unbounded (it may exceed the
 * size of any configuration field).
 *
 * <p>{@link #toString()} prints only the length to keep payloads out of logs.
 */
public record JsonPayload(String text) {

    private static final JsonPayload EMPTY_ARRAY = new JsonPayload("[]");

    /** Canonical constructor: text is required. */
    public JsonPayload {
        Objects.requireNonNull(text, "text must not be null");
    }

    /** Wraps already-serialized JSON text. */
    public static JsonPayload of(String text) {
        return new JsonPayload(text);
    }

    /** The payload of a query that returned no rows. */
    public static JsonPayload emptyArray() {
        return EMPTY_ARRAY;
    }

    /** Length in UTF-16 code units. */
    public int length() {
        return text.length();
    }

    /** True when the text is empty or whitespace only. */
    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return "JsonPayload[length=" + text.length() + "]";
    }
}
