package io.jsoninject.core.source;

import io.jsoninject.core.engine.AdapterRegistry;
import io.jsoninject.core.engine.InjectionSettings;
import io.jsoninject.core.spi.CodeBlockExecutor;
import io.jsoninject.core.spi.QueryExecutor;

/** Factory for the built-in adapter set. */
public final class SourceAdapters {

    private SourceAdapters() {}

    /**
     * Builds a registry holding all four built-in adapters.
     *
     * @param queryExecutor executor for the {@code sql} and {@code jsonsql} sources
     * @param codeExecutor  executor for the {@code procedure} source
     * @param settings      supplies the null policy for query rows and captured blocks
     */
    public static AdapterRegistry defaults(
            QueryExecutor queryExecutor, CodeBlockExecutor codeExecutor, InjectionSettings settings) {
        return new AdapterRegistry()
                .register(new RawQuerySourceAdapter(queryExecutor, settings.nullPolicy()))
                .register(new JsonQuerySourceAdapter(queryExecutor))
                .register(new ProceduralSourceAdapter(codeExecutor, settings.nullPolicy()))
                .register(new StaticSourceAdapter());
    }
}
