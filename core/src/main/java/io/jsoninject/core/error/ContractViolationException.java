package io.jsoninject.core.error;

import io.jsoninject.core.model.SourceType;

/**
 * Thrown when a source ran but did not honour its output contract: a JSON query returning zero or
 * several rows, several columns or a null value; a code block leaving the writer unbalanced or
 * empty; or, with payload verification on, a payload that is not exactly one JSON document. Never
 * replaced by a best-guess default. URN: {@code urn:json-inject:error:contract-violation}
 */
public final class ContractViolationException extends SourceExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:json-inject:error:contract-violation";

    public ContractViolationException(String message, String injectionName, SourceType source) {
        super(message, injectionName, source);
    }

    public ContractViolationException(String message, Throwable cause, String injectionName, SourceType source) {
        super(message, cause, injectionName, source);
    }

    @Override
    public String urn() {
        return URN;
    }
}
