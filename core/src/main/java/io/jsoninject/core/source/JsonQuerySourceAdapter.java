package io.jsoninject.core.source;

import io.jsoninject.core.error.ContractViolationException;
import io.jsoninject.core.error.QueryExecutionException;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.SourceType;
import io.jsoninject.core.spi.QueryContext;
import io.jsoninject.core.spi.QueryExecutor;
import io.jsoninject.core.spi.SourceAdapter;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Runs a query that builds the JSON document itself (e.g. with {@code json_object}) and returns the
 * single value it selects.
 *
 * <p>The result must be exactly one row with exactly one non-blank column. Anything else is a
 * {@link ContractViolationException}; no default payload is ever substituted.
 */
public final class JsonQuerySourceAdapter implements SourceAdapter {

    private final QueryExecutor executor;

    public JsonQuerySourceAdapter(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public SourceType type() {
        return SourceType.JSON_QUERY;
    }

    @Override
    public JsonPayload produce(InjectionRequest request, BindContext binds) {
        String name = request.name();
        try (QueryContext context = executor.open(request.jsonQuery(), binds)) {
            int columns = context.columnNames().size();
            if (columns != 1) {
                throw violation("JSON query must select exactly one column, got " + columns, name);
            }
            if (!context.next()) {
                throw violation("JSON query returned no rows", name);
            }
            String text = asText(context.value(0));
            if (context.next()) {
                throw violation("JSON query returned more than one row", name);
            }
            if (text == null || text.isBlank()) {
                throw violation("JSON query returned a null or blank value", name);
            }
            return JsonPayload.of(text);
        } catch (SQLException e) {
            throw new QueryExecutionException(
                    "JSON query failed: " + e.getMessage(), e, name, SourceType.JSON_QUERY);
        } catch (UncheckedIOException e) {
            throw new QueryExecutionException(
                    "JSON query value could not be read: " + e.getCause().getMessage(),
                    e.getCause(),
                    name,
                    SourceType.JSON_QUERY);
        }
    }

    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Reader reader) {
            return drain(reader);
        }
        if (value instanceof char[] chars) {
            return new String(chars);
        }
        return value.toString();
    }

    private static String drain(Reader reader) {
        StringBuilder sb = new StringBuilder();
        char[] buf = new char[8192];
        try (reader) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                sb.append(buf, 0, n);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    private static ContractViolationException violation(String message, String name) {
        return new ContractViolationException(message, name, SourceType.JSON_QUERY);
    }
}
