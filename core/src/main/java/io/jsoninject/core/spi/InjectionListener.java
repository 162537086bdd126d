package io.jsoninject.core.spi;

import io.jsoninject.core.model.SourceType;

/**
 * Observability hooks for injections. Adapters bridge these to their metrics or tracing systems;
 * the core has no telemetry dependency.
 *
 * <p>Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners are
 * caught and logged by the engine: they never affect the injection.
 */
public interface InjectionListener {

    /** Called after validation, before the source runs. */
    void onInjectionStarted(InjectionStartedEvent event);

    /** Called after the whole fragment was written. */
    void onInjectionCompleted(InjectionCompletedEvent event);

    /** Called when validation, the source or the output fails. */
    void onInjectionFailed(InjectionFailedEvent event);

    // --- Event records ---

    /** Event emitted when an injection starts. */
    record InjectionStartedEvent(String name, SourceType source, String targetPath) {}

    /** Event emitted when an injection completes. */
    record InjectionCompletedEvent(String name, SourceType source, String targetPath, int payloadChars, long durationMs) {}

    /** Event emitted when an injection fails. */
    record InjectionFailedEvent(String name, SourceType source, String errorUrn, String errorDetail, long durationMs) {}
}
