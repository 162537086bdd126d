package io.jsoninject.standalone.procedure;

import io.jsoninject.core.json.JsonWriter;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.spi.CodeBlockExecutor;
import io.jsoninject.core.spi.QueryExecutor;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CodeBlockExecutor} that treats the configured code block as the name of a registered
 * {@link Procedure}. A trailing semicolon and surrounding whitespace are ignored, so {@code
 * build_menu;} and {@code BUILD_MENU} name the same procedure.
 *
 * <p>Thread-safe: backed by a {@link ConcurrentHashMap}.
 */
public final class ProcedureRegistry implements CodeBlockExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ProcedureRegistry.class);

    private final Map<String, Procedure> procedures = new ConcurrentHashMap<>();
    private final QueryExecutor queries;

    /**
     * @param queries executor handed to procedures through {@link ProcedureContext}
     */
    public ProcedureRegistry(QueryExecutor queries) {
        this.queries = Objects.requireNonNull(queries, "queries must not be null");
    }

    /**
     * Builds a registry holding every procedure contributed by a {@link ProcedureProvider} on the
     * class path.
     */
    public static ProcedureRegistry discover(QueryExecutor queries, ClassLoader classLoader) {
        ProcedureRegistry registry = new ProcedureRegistry(queries);
        for (ProcedureProvider provider : ServiceLoader.load(ProcedureProvider.class, classLoader)) {
            provider.procedures().forEach(registry::register);
            LOG.info(
                    "Procedure provider loaded: {} ({} procedures)",
                    provider.getClass().getName(),
                    provider.procedures().size());
        }
        return registry;
    }

    /**
     * Registers a procedure; an existing one of the same name is replaced.
     *
     * @throws IllegalArgumentException if the name is blank
     */
    public ProcedureRegistry register(String name, Procedure procedure) {
        Objects.requireNonNull(procedure, "procedure must not be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("procedure name must not be blank");
        }
        Procedure previous = procedures.put(normalize(name), procedure);
        if (previous != null) {
            LOG.warn("Procedure '{}' registered twice; the later registration wins", normalize(name));
        }
        return this;
    }

    /** Looks up a procedure by name. */
    public Optional<Procedure> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(procedures.get(normalize(name)));
    }

    /** Registered procedure names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(procedures.keySet());
    }

    @Override
    public void execute(String code, BindContext binds, JsonWriter out) throws Exception {
        Procedure procedure = get(code)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown procedure '" + normalize(code) + "'; registered: " + names()));
        procedure.run(new ProcedureContext(out, binds != null ? binds : BindContext.empty(), queries));
    }

    private static String normalize(String name) {
        String trimmed = name.strip();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
