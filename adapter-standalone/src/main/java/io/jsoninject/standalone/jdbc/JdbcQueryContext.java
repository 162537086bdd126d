package io.jsoninject.standalone.jdbc;

import io.jsoninject.core.spi.QueryContext;
import java.io.IOException;
import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open JDBC cursor. Owns the connection, the statement and the result set; closing the context
 * releases all three. Large objects are read into memory so that values stay valid after the
 * cursor moves.
 */
final class JdbcQueryContext implements QueryContext {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueryContext.class);

    private final Connection connection;
    private final PreparedStatement statement;
    private final ResultSet resultSet;
    private final List<String> columnNames;
    private boolean closed;

    JdbcQueryContext(Connection connection, PreparedStatement statement, ResultSet resultSet) throws SQLException {
        this.connection = connection;
        this.statement = statement;
        this.resultSet = resultSet;
        ResultSetMetaData meta = resultSet.getMetaData();
        List<String> labels = new ArrayList<>(meta.getColumnCount());
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            labels.add(meta.getColumnLabel(i));
        }
        this.columnNames = Collections.unmodifiableList(labels);
    }

    @Override
    public List<String> columnNames() {
        return columnNames;
    }

    @Override
    public boolean next() throws SQLException {
        return resultSet.next();
    }

    @Override
    public Object value(int column) throws SQLException {
        Object value = resultSet.getObject(column + 1);
        if (value instanceof Clob clob) {
            try {
                return readClob(clob);
            } finally {
                clob.free();
            }
        }
        if (value instanceof Blob blob) {
            try {
                return blob.getBytes(1, Math.toIntExact(blob.length()));
            } finally {
                blob.free();
            }
        }
        if (value instanceof SQLXML xml) {
            try {
                return xml.getString();
            } finally {
                xml.free();
            }
        }
        return value;
    }

    private static String readClob(Clob clob) throws SQLException {
        StringBuilder sb = new StringBuilder();
        char[] buf = new char[8192];
        try (Reader reader = clob.getCharacterStream()) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                sb.append(buf, 0, n);
            }
        } catch (IOException e) {
            throw new SQLException("Failed to read CLOB: " + e.getMessage(), e);
        }
        return sb.toString();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly(resultSet, "result set");
        closeQuietly(statement, "statement");
        closeQuietly(connection, "connection");
    }

    /** Close failures cannot change the outcome of the render; they are logged. */
    static void closeQuietly(AutoCloseable resource, String what) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            LOG.warn("Failed to close JDBC {}: {}", what, e.getMessage(), e);
        }
    }
}
