package io.jsoninject.standalone.procedure;

import io.jsoninject.core.json.JsonWriter;
import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.spi.QueryContext;
import io.jsoninject.core.spi.QueryExecutor;
import java.sql.SQLException;

/**
 * What a {@link Procedure} gets to work with: the capture writer, the page items, and the database.
 *
 * @param out     capture sink; must not be closed by the procedure
 * @param binds   page items of the current render
 * @param queries query executor for the configured database
 */
public record ProcedureContext(JsonWriter out, BindContext binds, QueryExecutor queries) {

    /**
     * Runs {@code sql} with the current page items as binds. The caller must close the returned
     * context.
     */
    public QueryContext query(String sql) throws SQLException {
        return queries.open(sql, binds);
    }
}
