package io.jsoninject.core.spi;

import java.sql.SQLException;
import java.util.List;

/**
 * An open query result: column labels plus a forward-only row cursor. Values are plain Java
 * objects (String, Number, Boolean, temporal types, {@code byte[]}); large-object columns are
 * materialized by the implementation.
 *
 * <p>{@link #close()} must be idempotent and must not throw.
 */
public interface QueryContext extends AutoCloseable {

    /** Column labels in select-list order. */
    List<String> columnNames();

    /** Advances to the next row. */
    boolean next() throws SQLException;

    /**
     * Value of a column in the current row.
     *
     * @param column zero-based column index
     * @return the value, or {@code null} for SQL NULL
     */
    Object value(int column) throws SQLException;

    @Override
    void close();
}
