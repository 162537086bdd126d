package io.jsoninject.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.javalin.http.Context;
import io.jsoninject.core.engine.InjectionSettings;
import io.jsoninject.core.engine.JsonInjector;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.source.SourceAdapters;
import io.jsoninject.core.spi.CodeBlockExecutor;
import io.jsoninject.core.spi.QueryExecutor;
import io.jsoninject.standalone.page.PageDefinition;
import io.jsoninject.standalone.page.PageRenderer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

@DisplayName("PageHandler")
class PageHandlerTest {

    private Map<String, PageDefinition> pages;
    private PageRenderer renderer;
    private Context ctx;

    @BeforeEach
    void setUp() {
        pages = Map.of(
                "home",
                new PageDefinition(
                        "home",
                        "<head></head>",
                        List.of(InjectionRequest.staticJson("flags", "app.flags", "{\"beta\":true}"))));
        renderer = new PageRenderer(new JsonInjector(SourceAdapters.defaults(
                mock(QueryExecutor.class), mock(CodeBlockExecutor.class), InjectionSettings.DEFAULT)));
        ctx = mock(Context.class);
        when(ctx.queryParamMap()).thenReturn(Map.of());
    }

    @Test
    @DisplayName("renders a known page as HTML without a CSP header")
    void rendersPage() {
        when(ctx.pathParam("id")).thenReturn("home");

        new PageHandler(pages, renderer, false).handle(ctx);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(ctx).status(200);
        verify(ctx).contentType("text/html; charset=utf-8");
        verify(ctx).result(body.capture());
        verify(ctx, never()).header(eq("Content-Security-Policy"), anyString());
        assertThat(body.getValue()).contains("<script>\n").contains("{\"beta\":true}");
        assertThat(MDC.get(PageHandler.MDC_PAGE)).isNull();
    }

    @Test
    @DisplayName("nonce in the header matches the script attribute")
    void nonce() {
        when(ctx.pathParam("id")).thenReturn("home");

        new PageHandler(pages, renderer, true).handle(ctx);

        ArgumentCaptor<String> header = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(ctx).header(eq("Content-Security-Policy"), header.capture());
        verify(ctx).result(body.capture());
        Matcher m = Pattern.compile("script-src 'nonce-([A-Za-z0-9+/=]+)'").matcher(header.getValue());
        assertThat(m.matches()).isTrue();
        assertThat(body.getValue()).contains("<script nonce=\"" + m.group(1) + "\">");
    }

    @Test
    @DisplayName("unknown page id answers 404 problem details")
    void unknownPage() {
        when(ctx.pathParam("id")).thenReturn("nope");
        when(ctx.path()).thenReturn("/pages/nope");

        new PageHandler(pages, renderer, false).handle(ctx);

        verify(ctx).status(404);
        verify(ctx).contentType(ProblemDetail.CONTENT_TYPE);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(ctx).result(body.capture());
        assertThat(body.getValue()).contains("page-not-found").contains("/pages/nope");
    }

    @Test
    @DisplayName("query parameters become page items, first value wins")
    void bindsFromQuery() {
        Map<String, List<String>> params = new LinkedHashMap<>();
        params.put("deptno", List.of("10", "20"));
        params.put("flag", List.of());

        BindContext binds = PageHandler.bindsFrom(params);

        assertThat(binds.get("DEPTNO")).isEqualTo("10");
        assertThat(binds.has("FLAG")).isTrue();
        assertThat(binds.get("FLAG")).isNull();
    }
}
