package io.jsoninject.core.json;

/**
 * How SQL/absent values are rendered in generated JSON.
 *
 * <p>The two options are not equivalent for a consumer: {@code JSON_NULL} keeps the distinction
 * between "no value" and "empty text", {@code EMPTY_STRING} reproduces the output of older page
 * plugins that rendered every null as {@code ""}.
 */
public enum NullPolicy {
    /** Render as JSON {@code null} (default). */
    JSON_NULL,
    /** Render as the empty string {@code ""}. */
    EMPTY_STRING
}
