package io.jsoninject.standalone.jdbc;

import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.spi.QueryContext;
import io.jsoninject.core.spi.QueryExecutor;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryExecutor} over a JDBC {@link DataSource}. {@code :NAME} references are bound from the
 * {@link BindContext}; names without a matching item bind SQL NULL.
 *
 * <p>Thread-safe: each call borrows its own connection, which the returned context gives back on
 * close.
 */
public final class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final DataSource dataSource;

    public JdbcQueryExecutor(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    @Override
    public QueryContext open(String sql, BindContext binds) throws SQLException {
        NamedParameterSql statement = NamedParameterSql.parse(sql);
        BindContext items = binds != null ? binds : BindContext.empty();
        LOG.debug("query.open: binds={}", statement.names());

        Connection connection = null;
        PreparedStatement prepared = null;
        ResultSet resultSet = null;
        try {
            connection = dataSource.getConnection();
            prepared = connection.prepareStatement(statement.sql());
            bind(prepared, statement.names(), items);
            resultSet = prepared.executeQuery();
            return new JdbcQueryContext(connection, prepared, resultSet);
        } catch (SQLException | RuntimeException e) {
            JdbcQueryContext.closeQuietly(resultSet, "result set");
            JdbcQueryContext.closeQuietly(prepared, "statement");
            JdbcQueryContext.closeQuietly(connection, "connection");
            throw e;
        }
    }

    private static void bind(PreparedStatement prepared, List<String> names, BindContext binds) throws SQLException {
        for (int i = 0; i < names.size(); i++) {
            Object value = binds.get(names.get(i));
            if (value == null) {
                prepared.setNull(i + 1, Types.NULL);
            } else {
                prepared.setObject(i + 1, value);
            }
        }
    }
}
