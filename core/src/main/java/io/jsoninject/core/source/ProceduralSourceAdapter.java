package io.jsoninject.core.source;

import io.jsoninject.core.error.CodeExecutionException;
import io.jsoninject.core.error.ContractViolationException;
import io.jsoninject.core.error.InjectionException;
import io.jsoninject.core.json.JsonWriter;
import io.jsoninject.core.json.NullPolicy;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.SourceType;
import io.jsoninject.core.spi.CodeBlockExecutor;
import io.jsoninject.core.spi.SourceAdapter;
import java.util.Objects;

/**
 * Runs a trusted code block against a fresh {@link JsonWriter} and returns what it wrote.
 *
 * <p>The block must write exactly one complete root value. Nothing written, containers left open,
 * or several root values are contract violations.
 */
public final class ProceduralSourceAdapter implements SourceAdapter {

    private final CodeBlockExecutor executor;
    private final NullPolicy nullPolicy;

    public ProceduralSourceAdapter(CodeBlockExecutor executor) {
        this(executor, NullPolicy.JSON_NULL);
    }

    public ProceduralSourceAdapter(CodeBlockExecutor executor, NullPolicy nullPolicy) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.nullPolicy = Objects.requireNonNull(nullPolicy, "nullPolicy must not be null");
    }

    @Override
    public SourceType type() {
        return SourceType.PROCEDURAL_JSON;
    }

    @Override
    public JsonPayload produce(InjectionRequest request, BindContext binds) {
        String name = request.name();
        JsonWriter writer = JsonWriter.create(nullPolicy);
        try {
            try {
                executor.execute(request.proceduralBlock(), binds, writer);
            } catch (InjectionException e) {
                throw e;
            } catch (Exception e) {
                throw new CodeExecutionException("Code block failed: " + e.getMessage(), e, name);
            }
            if (writer.isClosed()) {
                throw violation("Code block closed the capture writer", name);
            }
            if (!writer.isBalanced()) {
                throw violation("Code block left a JSON object or array unclosed", name);
            }
            int roots = writer.rootValueCount();
            if (roots == 0) {
                throw violation("Code block wrote no JSON", name);
            }
            if (roots > 1) {
                throw violation("Code block wrote " + roots + " root values, expected one", name);
            }
            return JsonPayload.of(writer.toJson());
        } finally {
            writer.close();
        }
    }

    private static ContractViolationException violation(String message, String name) {
        return new ContractViolationException(message, name, SourceType.PROCEDURAL_JSON);
    }
}
