package io.jsoninject.core.error;

/**
 * Thrown when the page output rejects a write. The fragment may be incomplete at that point; the
 * caller must discard the response. URN: {@code urn:json-inject:error:output-write-failed}
 */
public final class OutputWriteException extends InjectionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:json-inject:error:output-write-failed";

    public OutputWriteException(String message, Throwable cause, String injectionName) {
        super(message, cause, injectionName, Phase.OUTPUT);
    }

    @Override
    public String urn() {
        return URN;
    }
}
