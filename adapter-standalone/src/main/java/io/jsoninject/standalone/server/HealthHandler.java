package io.jsoninject.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness probe. Returns {@code 200} with the number of loaded pages and the injection outcome
 * counters, e.g. {@code {"status":"UP","pages":3,"injections":{"completed":12,"failed":0}}}.
 */
public final class HealthHandler implements Handler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int pageCount;
    private final InjectionCounters counters;

    public HealthHandler(int pageCount, InjectionCounters counters) {
        this.pageCount = pageCount;
        this.counters = counters;
    }

    @Override
    public void handle(Context ctx) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", "UP");
        body.put("pages", pageCount);
        ObjectNode injections = body.putObject("injections");
        injections.put("completed", counters.completed());
        injections.put("failed", counters.failed());

        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body.toString());
    }
}
