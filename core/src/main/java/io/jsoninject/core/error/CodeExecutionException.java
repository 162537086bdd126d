package io.jsoninject.core.error;

import io.jsoninject.core.model.SourceType;

/**
 * Thrown when a procedural code block raises an error. The original failure is kept as the cause.
 * URN: {@code urn:json-inject:error:code-execution-failed}
 */
public final class CodeExecutionException extends SourceExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:json-inject:error:code-execution-failed";

    public CodeExecutionException(String message, String injectionName) {
        super(message, injectionName, SourceType.PROCEDURAL_JSON);
    }

    public CodeExecutionException(String message, Throwable cause, String injectionName) {
        super(message, cause, injectionName, SourceType.PROCEDURAL_JSON);
    }

    @Override
    public String urn() {
        return URN;
    }
}
