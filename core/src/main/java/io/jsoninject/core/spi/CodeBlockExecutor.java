package io.jsoninject.core.spi;

import io.jsoninject.core.json.JsonWriter;
import io.jsoninject.core.model.BindContext;

/**
 * Host collaborator that runs a trusted procedural code block. The block builds its JSON result
 * through the supplied {@link JsonWriter}; whatever it writes becomes the payload.
 */
public interface CodeBlockExecutor {

    /**
     * Runs {@code code}.
     *
     * @param code  the code block as configured
     * @param binds page items available to the block
     * @param out   capture sink; owned by the caller, must not be closed by the block
     * @throws Exception any failure raised by the block
     */
    void execute(String code, BindContext binds, JsonWriter out) throws Exception;
}
