package io.jsoninject.core.model;

/**
 * Outcome of one successful injection, returned by {@code JsonInjector.inject}.
 *
 * @param name         component name of the request
 * @param source       source that produced the payload
 * @param targetPath   dotted target path the payload was merged into
 * @param payloadChars payload length in UTF-16 code units
 * @param chunks       number of output writes used for the payload
 * @param durationMs   wall-clock time for produce + emit
 */
public record InjectionSummary(
        String name, SourceType source, String targetPath, int payloadChars, int chunks, long durationMs) {}
