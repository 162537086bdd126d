package io.jsoninject.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.jsoninject.core.error.InjectionException;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.standalone.page.PageDefinition;
import io.jsoninject.standalone.page.PageRenderer;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * {@code GET /pages/{id}}: renders a page with the request's query parameters as page items. Only
 * the first value of a repeated parameter is used.
 *
 * <p>When CSP nonces are enabled, a fresh nonce goes on every injected script and into a {@code
 * Content-Security-Policy: script-src 'nonce-...'} response header.
 */
public final class PageHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(PageHandler.class);

    static final String MDC_PAGE = "page";

    private final Map<String, PageDefinition> pages;
    private final PageRenderer renderer;
    private final boolean cspNonce;
    private final SecureRandom random = new SecureRandom();

    public PageHandler(Map<String, PageDefinition> pages, PageRenderer renderer, boolean cspNonce) {
        this.pages = Map.copyOf(pages);
        this.renderer = renderer;
        this.cspNonce = cspNonce;
    }

    @Override
    public void handle(Context ctx) {
        String id = ctx.pathParam("id");
        PageDefinition page = pages.get(id);
        if (page == null) {
            LOG.debug("page.not_found: id={}", id);
            problem(ctx, 404, ProblemDetail.pageNotFound(id, ctx.path()));
            return;
        }

        MDC.put(MDC_PAGE, id);
        try {
            String nonce = cspNonce ? newNonce() : null;
            String html = renderer.render(page, bindsFrom(ctx.queryParamMap()), nonce);
            if (nonce != null) {
                ctx.header("Content-Security-Policy", "script-src 'nonce-" + nonce + "'");
            }
            ctx.status(200);
            ctx.contentType("text/html; charset=utf-8");
            ctx.result(html);
        } catch (InjectionException e) {
            LOG.warn(
                    "page.failed: id={}, injection={}, urn={}, detail={}",
                    id,
                    e.injectionName(),
                    e.urn(),
                    e.detail());
            problem(ctx, ProblemDetail.statusFor(e), ProblemDetail.fromInjection(e, ctx.path()));
        } finally {
            MDC.remove(MDC_PAGE);
        }
    }

    static BindContext bindsFrom(Map<String, List<String>> params) {
        Map<String, Object> items = new LinkedHashMap<>();
        params.forEach((name, values) -> items.put(name, values.isEmpty() ? null : values.get(0)));
        return BindContext.of(items);
    }

    private String newNonce() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }

    private static void problem(Context ctx, int status, JsonNode body) {
        ctx.status(status);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(body.toString());
    }
}
