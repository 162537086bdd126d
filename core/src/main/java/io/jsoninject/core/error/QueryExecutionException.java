package io.jsoninject.core.error;

import io.jsoninject.core.model.SourceType;

/**
 * Thrown when a SQL statement fails to open, fetch or serialize. URN: {@code
 * urn:json-inject:error:query-execution-failed}
 */
public final class QueryExecutionException extends SourceExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:json-inject:error:query-execution-failed";

    public QueryExecutionException(String message, String injectionName, SourceType source) {
        super(message, injectionName, source);
    }

    public QueryExecutionException(String message, Throwable cause, String injectionName, SourceType source) {
        super(message, cause, injectionName, source);
    }

    @Override
    public String urn() {
        return URN;
    }
}
