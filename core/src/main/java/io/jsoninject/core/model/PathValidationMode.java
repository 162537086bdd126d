package io.jsoninject.core.model;

/**
 * How strictly target path segments are checked.
 *
 * <ul>
 * <li>{@code STRICT}: every segment must be a JavaScript identifier
 * ({@code [A-Za-z_$][A-Za-z0-9_$]*}).</li>
 * <li>{@code LENIENT}: any non-blank segment is accepted; the emitter only ever
 * embeds segments inside escaped string literals.</li>
 * </ul>
 */
public enum PathValidationMode {
    STRICT,
    LENIENT
}
