package io.jsoninject.core.error;

import io.jsoninject.core.model.SourceType;

/**
 * Abstract parent for failures while a source adapter produces its payload. Propagated to the
 * caller after every resource acquired by the adapter has been released. Carries the {@link
 * SourceType} that failed.
 */
public abstract class SourceExecutionException extends InjectionException {

    private static final long serialVersionUID = 1L;

    private final SourceType source;

    protected SourceExecutionException(String message, String injectionName, SourceType source) {
        super(message, injectionName, Phase.EXECUTION);
        this.source = source;
    }

    protected SourceExecutionException(String message, Throwable cause, String injectionName, SourceType source) {
        super(message, cause, injectionName, Phase.EXECUTION);
        this.source = source;
    }

    /** The source whose execution failed. */
    public SourceType source() {
        return source;
    }
}
