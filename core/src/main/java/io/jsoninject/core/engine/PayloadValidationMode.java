package io.jsoninject.core.engine;

/**
 * Whether payloads are checked before they are embedded.
 *
 * <ul>
 * <li>{@code TRUSTED}: payloads are embedded as produced; only blank payloads are refused
 * (default).</li>
 * <li>{@code VERIFY}: payloads are streamed through a JSON parser first and must form exactly one
 * JSON document; anything else is a contract violation.</li>
 * </ul>
 */
public enum PayloadValidationMode {
    TRUSTED,
    VERIFY
}
