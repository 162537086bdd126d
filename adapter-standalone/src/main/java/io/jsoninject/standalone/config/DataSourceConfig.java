package io.jsoninject.standalone.config;

/**
 * JDBC connection settings for query sources.
 *
 * @param url                 JDBC URL; {@code null} when no database is configured
 * @param username            database user, may be {@code null}
 * @param password            database password, may be {@code null}
 * @param maxPoolSize         maximum pooled connections
 * @param connectionTimeoutMs how long a render waits for a free connection
 * @param readOnly            open connections read-only
 */
public record DataSourceConfig(
        String url, String username, String password, int maxPoolSize, int connectionTimeoutMs, boolean readOnly) {

    /** No database: query sources fail with a query execution error. */
    public static final DataSourceConfig NONE = new DataSourceConfig(null, null, null, 10, 30000, false);

    public DataSourceConfig {
        if (maxPoolSize < 1) {
            throw new IllegalArgumentException("maxPoolSize must be at least 1, got: " + maxPoolSize);
        }
        if (connectionTimeoutMs < 250) {
            throw new IllegalArgumentException("connectionTimeoutMs must be at least 250, got: " + connectionTimeoutMs);
        }
    }

    /** True when a JDBC URL is present. */
    public boolean configured() {
        return url != null && !url.isBlank();
    }

    /** Masks the password. */
    @Override
    public String toString() {
        return "DataSourceConfig[url=" + url + ", username=" + username + ", password="
                + (password == null ? null : "****") + ", maxPoolSize=" + maxPoolSize + ", connectionTimeoutMs="
                + connectionTimeoutMs + ", readOnly=" + readOnly + "]";
    }
}
