package io.jsoninject.core.spi;

import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.SourceType;

/**
 * Strategy that obtains a serialized JSON payload from one kind of data origin. Exactly one
 * adapter runs per injection, selected by {@link InjectionRequest#source()}.
 *
 * <p>Implementations MUST be stateless and thread-safe, and MUST release every resource they
 * acquire (query contexts, writer sinks) before {@link #produce} returns or throws.
 */
public interface SourceAdapter {

    /** The source this adapter serves. */
    SourceType type();

    /**
     * Produces the payload for a validated request.
     *
     * @param request the request; its source text for {@link #type()} is non-blank
     * @param binds   page items available for bind-variable substitution
     * @return one complete JSON document, never {@code null}
     * @throws io.jsoninject.core.error.SourceExecutionException if the source fails or breaks its
     *     output contract
     */
    JsonPayload produce(InjectionRequest request, BindContext binds);
}
