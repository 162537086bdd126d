package io.jsoninject.standalone.config;

import io.jsoninject.core.engine.InjectionSettings;
import java.util.Objects;

/**
 * Root configuration for the standalone page server. Every field has a default; use {@link
 * #builder()} to construct instances.
 *
 * @param host          bind address for the HTTP server
 * @param port          listen port (0 picks a free port)
 * @param pagesDir      directory containing page definition YAML files
 * @param dataSource    JDBC settings for query sources
 * @param injection     engine settings (chunk size, null policy, validation modes, global object)
 * @param cspNonce      generate a per-request CSP nonce for injected scripts
 * @param healthEnabled register the liveness endpoint
 * @param healthPath    liveness probe path
 * @param loggingFormat {@code json} or {@code text}
 * @param loggingLevel  root log level
 */
public record ServerConfig(
        String host,
        int port,
        String pagesDir,
        DataSourceConfig dataSource,
        InjectionSettings injection,
        boolean cspNonce,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        Objects.requireNonNull(pagesDir, "pagesDir must not be null");
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        Objects.requireNonNull(injection, "injection must not be null");
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private String pagesDir = "./pages";
        private DataSourceConfig dataSource = DataSourceConfig.NONE;
        private InjectionSettings injection = InjectionSettings.DEFAULT;
        private boolean cspNonce = false;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder pagesDir(String pagesDir) {
            this.pagesDir = pagesDir;
            return this;
        }

        public Builder dataSource(DataSourceConfig dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder injection(InjectionSettings injection) {
            this.injection = injection;
            return this;
        }

        public Builder cspNonce(boolean cspNonce) {
            this.cspNonce = cspNonce;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    pagesDir,
                    dataSource,
                    injection,
                    cspNonce,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
