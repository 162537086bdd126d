package io.jsoninject.standalone.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.jsoninject.standalone.config.DataSourceConfig;

/** Builds the pooled {@link javax.sql.DataSource} behind query sources. */
public final class DataSourceFactory {

    private DataSourceFactory() {
        // utility class
    }

    /**
     * Creates a HikariCP pool. The caller owns the pool and must close it on shutdown.
     *
     * @throws IllegalArgumentException if no JDBC URL is configured
     */
    public static HikariDataSource create(DataSourceConfig config) {
        if (!config.configured()) {
            throw new IllegalArgumentException("datasource.url is not configured");
        }
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("json-inject");
        hikari.setJdbcUrl(config.url());
        if (config.username() != null) {
            hikari.setUsername(config.username());
        }
        if (config.password() != null) {
            hikari.setPassword(config.password());
        }
        hikari.setMaximumPoolSize(config.maxPoolSize());
        hikari.setConnectionTimeout(config.connectionTimeoutMs());
        hikari.setReadOnly(config.readOnly());
        return new HikariDataSource(hikari);
    }
}
