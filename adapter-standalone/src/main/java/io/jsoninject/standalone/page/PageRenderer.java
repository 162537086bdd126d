package io.jsoninject.standalone.page;

import io.jsoninject.core.engine.JsonInjector;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.spi.PageOutput;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link PageDefinition}: runs its injections in order into one buffer and places the
 * resulting scripts into the template.
 *
 * <p>Placement: at the {@code <!-- json-inject -->} comment if the template has one, otherwise just before
 * {@code </head>}, otherwise at the very start of the document. Scripts run in page order, so a
 * later injection on the same target merges over an earlier one.
 *
 * <p>All injections finish before the page is assembled: if any of them fails, the exception
 * propagates and no HTML is produced.
 */
public final class PageRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(PageRenderer.class);

    /** Placeholder replaced by the injected scripts. */
    public static final String MARKER = "<!-- json-inject -->";

    private final JsonInjector injector;

    public PageRenderer(JsonInjector injector) {
        this.injector = Objects.requireNonNull(injector, "injector must not be null");
    }

    /** Renders without a CSP nonce. */
    public String render(PageDefinition page, BindContext binds) {
        return render(page, binds, null);
    }

    /**
     * Renders {@code page}.
     *
     * @param binds page items (request parameters) for bind substitution
     * @param nonce CSP nonce for every script element, or {@code null}
     * @return the complete HTML document
     * @throws io.jsoninject.core.error.InjectionException if any injection fails
     */
    public String render(PageDefinition page, BindContext binds, String nonce) {
        long startNanos = System.nanoTime();
        StringBuilder scripts = new StringBuilder();
        PageOutput out = PageOutput.of(scripts);
        for (InjectionRequest request : page.injections()) {
            injector.inject(request, binds, out, nonce);
        }
        String html = insert(page.template(), scripts.toString());
        LOG.info(
                "page.rendered: id={}, injections={}, script_chars={}, duration_ms={}",
                page.id(),
                page.injections().size(),
                scripts.length(),
                (System.nanoTime() - startNanos) / 1_000_000);
        return html;
    }

    static String insert(String template, String scripts) {
        int marker = template.indexOf(MARKER);
        if (marker >= 0) {
            return template.substring(0, marker) + scripts + template.substring(marker + MARKER.length());
        }
        int head = indexOfIgnoreCase(template, "</head>");
        if (head >= 0) {
            return template.substring(0, head) + scripts + template.substring(head);
        }
        return scripts + template;
    }

    private static int indexOfIgnoreCase(String text, String needle) {
        for (int i = 0; i + needle.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
