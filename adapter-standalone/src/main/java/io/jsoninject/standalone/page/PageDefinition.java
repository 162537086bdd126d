package io.jsoninject.standalone.page;

import io.jsoninject.core.model.InjectionRequest;
import java.util.List;
import java.util.Objects;

/**
 * A page served by the standalone server: an HTML template plus the injections rendered into it,
 * in order.
 *
 * @param id         page id, the {@code {id}} of {@code GET /pages/{id}}
 * @param template   HTML template
 * @param injections injections rendered into the template, in declaration order
 */
public record PageDefinition(String id, String template, List<InjectionRequest> injections) {

    public PageDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(template, "template must not be null");
        injections = List.copyOf(injections);
    }
}
