package io.jsoninject.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.error.ContractViolationException;
import io.jsoninject.core.error.InjectionException;
import io.jsoninject.core.error.SourceExecutionException;

/**
 * Builds RFC 9457 Problem Details bodies for failed page requests.
 *
 * <pre>{@code
 * {
 *   "type": "urn:json-inject:error:query-execution-failed",
 *   "title": "Source Execution Failed",
 *   "status": 502,
 *   "detail": "Query failed: ORA-00942: table or view does not exist",
 *   "instance": "/pages/employees",
 *   "injection": "load-employees"
 * }
 * }</pre>
 *
 * <p>Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_PAGE_NOT_FOUND = "urn:json-inject:server:page-not-found";
    static final String URN_INTERNAL_ERROR = "urn:json-inject:server:internal-error";

    /** Media type of every problem body. */
    public static final String CONTENT_TYPE = "application/problem+json";

    private ProblemDetail() {
        // utility class
    }

    /** Unknown page id (404). */
    public static JsonNode pageNotFound(String pageId, String instancePath) {
        return build(URN_PAGE_NOT_FOUND, "Page Not Found", 404, "No page with id '" + pageId + "'", instancePath);
    }

    /** Unexpected failure outside the injection error model (500). */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    /**
     * Maps an injection failure: source failures are upstream errors (502), everything else is a
     * server fault (500). The exception URN becomes the problem type.
     */
    public static JsonNode fromInjection(InjectionException e, String instancePath) {
        ObjectNode node = build(e.urn(), titleFor(e), statusFor(e), e.detail(), instancePath);
        if (e.injectionName() != null) {
            node.put("injection", e.injectionName());
        }
        return node;
    }

    /** HTTP status for an injection failure. */
    public static int statusFor(InjectionException e) {
        return e instanceof SourceExecutionException ? 502 : 500;
    }

    private static String titleFor(InjectionException e) {
        if (e instanceof ConfigurationException) {
            return "Injection Misconfigured";
        }
        if (e instanceof ContractViolationException) {
            return "Source Contract Violated";
        }
        if (e instanceof SourceExecutionException) {
            return "Source Execution Failed";
        }
        return "Output Write Failed";
    }

    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
