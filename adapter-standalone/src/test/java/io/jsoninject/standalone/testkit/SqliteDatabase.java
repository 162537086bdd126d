package io.jsoninject.standalone.testkit;

import com.zaxxer.hikari.HikariDataSource;
import io.jsoninject.standalone.config.DataSourceConfig;
import io.jsoninject.standalone.jdbc.DataSourceFactory;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/** File-backed SQLite database behind a small HikariCP pool, seeded with a demo schema. */
public final class SqliteDatabase implements AutoCloseable {

    private final HikariDataSource dataSource;

    private SqliteDatabase(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    /** Creates {@code demo.db} in {@code dir} holding the {@code emp} and {@code settings} tables. */
    public static SqliteDatabase create(Path dir) throws SQLException {
        SqliteDatabase db = new SqliteDatabase(DataSourceFactory.create(config(dir)));
        db.execute(
                "create table emp (empno integer primary key, ename text not null, deptno integer, comm real)",
                "insert into emp values (7782, 'CLARK', 10, null)",
                "insert into emp values (7839, 'KING', 10, 500.5)",
                "insert into emp values (7369, 'SMITH', 20, null)",
                "create table settings (id integer primary key, doc text)",
                "insert into settings values (1, '{\"theme\":\"dark\",\"pageSize\":25}')",
                "insert into settings values (2, null)");
        return db;
    }

    /** Connection settings pointing at {@code demo.db} in {@code dir}. */
    public static DataSourceConfig config(Path dir) {
        return new DataSourceConfig("jdbc:sqlite:" + dir.resolve("demo.db"), null, null, 2, 5000, false);
    }

    public HikariDataSource dataSource() {
        return dataSource;
    }

    /** Connections currently borrowed from the pool. */
    public int activeConnections() {
        return dataSource.getHikariPoolMXBean().getActiveConnections();
    }

    public void execute(String... statements) throws SQLException {
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
