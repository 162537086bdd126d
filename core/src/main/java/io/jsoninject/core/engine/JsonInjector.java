package io.jsoninject.core.engine;

import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.error.ContractViolationException;
import io.jsoninject.core.error.InjectionException;
import io.jsoninject.core.error.OutputWriteException;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.model.InjectionSummary;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.SourceType;
import io.jsoninject.core.model.TargetPath;
import io.jsoninject.core.spi.InjectionListener;
import io.jsoninject.core.spi.InjectionListener.InjectionCompletedEvent;
import io.jsoninject.core.spi.InjectionListener.InjectionFailedEvent;
import io.jsoninject.core.spi.InjectionListener.InjectionStartedEvent;
import io.jsoninject.core.spi.PageOutput;
import io.jsoninject.core.spi.SourceAdapter;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Dispatcher for one injection: validates the request, asks the selected {@link SourceAdapter} for
 * the payload, and writes the script fragment (prefix, chunked payload, suffix) to the page output.
 *
 * <p>The payload is produced completely before the first character is written. Configuration
 * errors, source failures and contract violations therefore never leave a partial fragment in the
 * output; only an {@link OutputWriteException} can interrupt a fragment midway.
 *
 * <p>Thread-safe: holds only immutable collaborators. Each call is independent.
 */
public final class JsonInjector {

    private static final Logger LOG = LoggerFactory.getLogger(JsonInjector.class);

    /** MDC key holding the component name while an injection runs. */
    static final String MDC_INJECTION = "injection";

    private final AdapterRegistry adapters;
    private final InjectionSettings settings;
    private final InjectionListener listener;
    private final ScriptEmitter emitter;
    private final ChunkedWriter chunkedWriter;

    /** Creates an injector with default settings and no listener. */
    public JsonInjector(AdapterRegistry adapters) {
        this(adapters, InjectionSettings.DEFAULT, null);
    }

    /** Creates an injector with the given settings and no listener. */
    public JsonInjector(AdapterRegistry adapters, InjectionSettings settings) {
        this(adapters, settings, null);
    }

    /**
     * Creates an injector with all options.
     *
     * @param adapters source adapters by source type
     * @param settings engine settings
     * @param listener lifecycle listener, or {@code null} for none
     */
    public JsonInjector(AdapterRegistry adapters, InjectionSettings settings, InjectionListener listener) {
        this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.listener = listener;
        this.emitter = new ScriptEmitter(settings.globalObject());
        this.chunkedWriter = new ChunkedWriter(settings.chunkSize());
    }

    /** The settings this injector was built with. */
    public InjectionSettings settings() {
        return settings;
    }

    /**
     * Validates a request without executing anything.
     *
     * @return the parsed target path
     * @throws ConfigurationException if the source is missing, its text is blank, another source
     *     field is populated, or the target path is invalid
     */
    public TargetPath validate(InjectionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String name = request.name();
        SourceType source = request.source();
        if (source == null) {
            throw new ConfigurationException("Source is required", name, "source");
        }
        String text = request.sourceText();
        if (text == null || text.isBlank()) {
            String field = InjectionRequest.fieldFor(source);
            throw new ConfigurationException(
                    "Source '" + source.id() + "' requires a non-empty '" + field + "'", name, field);
        }
        for (SourceType other : SourceType.values()) {
            if (other == source) {
                continue;
            }
            String otherText = request.textFor(other);
            if (otherText != null && !otherText.isBlank()) {
                String field = InjectionRequest.fieldFor(other);
                throw new ConfigurationException(
                        "Source '" + source.id() + "' does not use '" + field + "'; exactly one source field may be set",
                        name,
                        field);
            }
        }
        return TargetPath.parse(request.targetPath(), settings.pathValidation(), name);
    }

    /** Renders the complete fragment into a string. */
    public String render(InjectionRequest request, BindContext binds) {
        StringBuilder out = new StringBuilder();
        inject(request, binds, PageOutput.of(out), null);
        return out.toString();
    }

    /** Injects without a CSP nonce. */
    public InjectionSummary inject(InjectionRequest request, BindContext binds, PageOutput out) {
        return inject(request, binds, out, null);
    }

    /**
     * Produces the payload for {@code request} and writes the merge fragment to {@code out}.
     *
     * @param request the injection to perform
     * @param binds   page items for bind-variable substitution; {@code null} treated as empty
     * @param out     page output
     * @param nonce   CSP nonce for the script element, or {@code null}
     * @return a summary of what was written
     * @throws ConfigurationException      if the request is invalid (nothing written)
     * @throws io.jsoninject.core.error.SourceExecutionException if the source fails (nothing
     *     written)
     * @throws OutputWriteException        if the output rejects a write
     */
    public InjectionSummary inject(InjectionRequest request, BindContext binds, PageOutput out, String nonce) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(out, "out must not be null");
        BindContext effectiveBinds = binds != null ? binds : BindContext.empty();
        String name = request.name();
        MDC.put(MDC_INJECTION, name != null ? name : "unnamed");
        try {
            return injectInternal(request, effectiveBinds, out, nonce);
        } finally {
            MDC.remove(MDC_INJECTION);
        }
    }

    private InjectionSummary injectInternal(
            InjectionRequest request, BindContext binds, PageOutput out, String nonce) {
        long startNanos = System.nanoTime();
        String name = request.name();
        SourceType source = request.source();
        try {
            TargetPath path = validate(request);
            String prefix = emitter.prefix(path, nonce, name);
            SourceAdapter adapter = adapters.requireAdapter(source, name);

            LOG.debug("injection.started: name={}, source={}, target={}", name, source.id(), path);
            notifyListener(() -> listener.onInjectionStarted(new InjectionStartedEvent(name, source, path.dotted())));

            JsonPayload payload = adapter.produce(request, binds);
            checkPayload(payload, name, source);

            int chunks = writeFragment(prefix, payload, out, name);
            long durationMs = elapsedMs(startNanos);

            LOG.info(
                    "injection.completed: name={}, source={}, target={}, payload_chars={}, chunks={}, duration_ms={}",
                    name,
                    source.id(),
                    path,
                    payload.length(),
                    chunks,
                    durationMs);
            notifyListener(() -> listener.onInjectionCompleted(
                    new InjectionCompletedEvent(name, source, path.dotted(), payload.length(), durationMs)));

            return new InjectionSummary(name, source, path.dotted(), payload.length(), chunks, durationMs);
        } catch (InjectionException e) {
            long durationMs = elapsedMs(startNanos);
            LOG.warn(
                    "injection.failed: name={}, source={}, phase={}, urn={}, detail={}",
                    name,
                    source != null ? source.id() : null,
                    e.phase(),
                    e.urn(),
                    e.detail());
            notifyListener(() -> listener.onInjectionFailed(
                    new InjectionFailedEvent(name, source, e.urn(), e.detail(), durationMs)));
            throw e;
        }
    }

    private void checkPayload(JsonPayload payload, String name, SourceType source) {
        if (payload == null || payload.isBlank()) {
            throw new ContractViolationException("Source produced no JSON", name, source);
        }
        if (settings.payloadValidation() == PayloadValidationMode.VERIFY) {
            PayloadVerifier.verify(payload, name, source);
        }
    }

    private int writeFragment(String prefix, JsonPayload payload, PageOutput out, String name) {
        try {
            out.write(prefix);
            int chunks = chunkedWriter.write(payload.text(), out);
            out.write(emitter.suffix());
            return chunks;
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write script fragment: " + e.getMessage(), e, name);
        }
    }

    /** Invokes a listener callback, logging and discarding any exception it throws. */
    private void notifyListener(Runnable callback) {
        if (listener == null) {
            return;
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Injection listener threw an exception (ignored): {}", e.getMessage(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
