package io.jsoninject.core.source;

import io.jsoninject.core.error.QueryExecutionException;
import io.jsoninject.core.json.JsonWriter;
import io.jsoninject.core.json.NullPolicy;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.SourceType;
import io.jsoninject.core.spi.QueryContext;
import io.jsoninject.core.spi.QueryExecutor;
import io.jsoninject.core.spi.SourceAdapter;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Runs the configured query and serializes the whole result set as a JSON array with one object
 * per row, keyed by column label. An empty result set yields {@code []}.
 */
public final class RawQuerySourceAdapter implements SourceAdapter {

    private final QueryExecutor executor;
    private final NullPolicy nullPolicy;

    public RawQuerySourceAdapter(QueryExecutor executor) {
        this(executor, NullPolicy.JSON_NULL);
    }

    public RawQuerySourceAdapter(QueryExecutor executor, NullPolicy nullPolicy) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.nullPolicy = Objects.requireNonNull(nullPolicy, "nullPolicy must not be null");
    }

    @Override
    public SourceType type() {
        return SourceType.RAW_QUERY;
    }

    @Override
    public JsonPayload produce(InjectionRequest request, BindContext binds) {
        String name = request.name();
        try (QueryContext context = executor.open(request.query(), binds);
                JsonWriter writer = JsonWriter.create(nullPolicy)) {
            List<String> columns = context.columnNames();
            writer.openArray();
            while (context.next()) {
                writer.openObject();
                for (int i = 0; i < columns.size(); i++) {
                    writer.writeValue(columns.get(i), context.value(i));
                }
                writer.closeObject();
            }
            writer.closeArray();
            return JsonPayload.of(writer.toJson());
        } catch (SQLException e) {
            throw new QueryExecutionException(
                    "Query failed: " + e.getMessage(), e, name, SourceType.RAW_QUERY);
        } catch (RuntimeException e) {
            throw new QueryExecutionException(
                    "Query result could not be serialized: " + e.getMessage(), e, name, SourceType.RAW_QUERY);
        }
    }
}
