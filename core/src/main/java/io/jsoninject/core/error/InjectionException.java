package io.jsoninject.core.error;

/**
 * Abstract base for all json-inject exceptions. Never thrown directly: use {@link
 * ConfigurationException}, one of the {@link SourceExecutionException} subclasses, or {@link
 * OutputWriteException}.
 */
public abstract class InjectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /** Request validation, before any source is executed. */
        CONFIGURATION,
        /** Payload production by a source adapter. */
        EXECUTION,
        /** Writing the fragment to the page output. */
        OUTPUT
    }

    private final String injectionName;
    private final Phase phase;

    protected InjectionException(String message, String injectionName, Phase phase) {
        super(message);
        this.injectionName = injectionName;
        this.phase = phase;
    }

    protected InjectionException(String message, Throwable cause, String injectionName, Phase phase) {
        super(message, cause);
        this.injectionName = injectionName;
        this.phase = phase;
    }

    /** The injection (component name) that triggered the error, or {@code null} if unknown. */
    public String injectionName() {
        return injectionName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** URN identifying the error type in problem responses. */
    public abstract String urn();
}
