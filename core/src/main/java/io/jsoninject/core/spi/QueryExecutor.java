package io.jsoninject.core.spi;

import io.jsoninject.core.model.BindContext;
import java.sql.SQLException;

/**
 * Host collaborator that executes SQL. Bind references in the statement (e.g. {@code :P1_ID}) are
 * substituted automatically from the supplied {@link BindContext}.
 */
public interface QueryExecutor {

    /**
     * Parses, binds and executes {@code sql}, returning a context positioned before the first row.
     * The caller owns the returned context and must close it.
     *
     * @param sql   the statement text
     * @param binds page items for automatic binding
     * @return an open query context
     * @throws SQLException if the statement cannot be prepared or executed
     */
    QueryContext open(String sql, BindContext binds) throws SQLException;
}
