package io.jsoninject.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsoninject.core.engine.PayloadValidationMode;
import io.jsoninject.core.json.NullPolicy;
import io.jsoninject.core.model.PathValidationMode;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Environment variables override YAML values. A variable counts as set only when it is defined and
 * its trimmed value is non-empty.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path minimalConfigPath;
    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        minimalConfigPath = ConfigLoaderTest.fixture("minimal-config.yaml");
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("Server and pages")
    class ServerOverrides {

        @Test
        @DisplayName("SERVER_HOST and SERVER_PORT override the server section")
        void hostAndPort() {
            envVars.put("SERVER_HOST", "10.0.0.1");
            envVars.put("SERVER_PORT", "7070");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.host()).isEqualTo("10.0.0.1");
            assertThat(config.port()).isEqualTo(7070);
        }

        @Test
        @DisplayName("PAGES_DIR and SERVER_CSP_NONCE apply over defaults")
        void pagesDirAndNonce() {
            envVars.put("PAGES_DIR", "/opt/pages");
            envVars.put("SERVER_CSP_NONCE", "true");

            ServerConfig config = ConfigLoader.load(minimalConfigPath, envLookup());

            assertThat(config.pagesDir()).isEqualTo("/opt/pages");
            assertThat(config.cspNonce()).isTrue();
        }

        @Test
        @DisplayName("HEALTH_* and LOG_* override their sections")
        void healthAndLogging() {
            envVars.put("HEALTH_ENABLED", "true");
            envVars.put("HEALTH_PATH", "/livez");
            envVars.put("LOG_FORMAT", "text");
            envVars.put("LOG_LEVEL", "WARN");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.healthEnabled()).isTrue();
            assertThat(config.healthPath()).isEqualTo("/livez");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }
    }

    @Nested
    @DisplayName("Datasource")
    class DataSourceOverrides {

        @Test
        @DisplayName("DB_URL alone configures a datasource")
        void urlOnly() {
            envVars.put("DB_URL", "jdbc:sqlite::memory:");

            DataSourceConfig db = ConfigLoader.load(minimalConfigPath, envLookup()).dataSource();

            assertThat(db.configured()).isTrue();
            assertThat(db.url()).isEqualTo("jdbc:sqlite::memory:");
            assertThat(db.maxPoolSize()).isEqualTo(10);
        }

        @Test
        @DisplayName("every DB_* variable wins over YAML")
        void allFields() {
            envVars.put("DB_USERNAME", "reporter");
            envVars.put("DB_PASSWORD", "other");
            envVars.put("DB_MAX_POOL_SIZE", "2");
            envVars.put("DB_CONNECTION_TIMEOUT_MS", "500");
            envVars.put("DB_READ_ONLY", "false");

            DataSourceConfig db = ConfigLoader.load(fullConfigPath, envLookup()).dataSource();

            assertThat(db.url()).isEqualTo("jdbc:sqlite:/var/data/app.db");
            assertThat(db.username()).isEqualTo("reporter");
            assertThat(db.password()).isEqualTo("other");
            assertThat(db.maxPoolSize()).isEqualTo(2);
            assertThat(db.connectionTimeoutMs()).isEqualTo(500);
            assertThat(db.readOnly()).isFalse();
        }
    }

    @Nested
    @DisplayName("Injection settings")
    class InjectionOverrides {

        @Test
        @DisplayName("INJECT_* variables accept enum names in either spelling")
        void enums() {
            envVars.put("INJECT_NULL_POLICY", "EMPTY_STRING");
            envVars.put("INJECT_PATH_VALIDATION", "lenient");
            envVars.put("INJECT_PAYLOAD_VALIDATION", "verify");

            var injection = ConfigLoader.load(minimalConfigPath, envLookup()).injection();

            assertThat(injection.nullPolicy()).isEqualTo(NullPolicy.EMPTY_STRING);
            assertThat(injection.pathValidation()).isEqualTo(PathValidationMode.LENIENT);
            assertThat(injection.payloadValidation()).isEqualTo(PayloadValidationMode.VERIFY);
        }

        @Test
        @DisplayName("INJECT_CHUNK_SIZE and INJECT_GLOBAL_OBJECT override YAML")
        void chunkSizeAndGlobal() {
            envVars.put("INJECT_CHUNK_SIZE", "64");
            envVars.put("INJECT_GLOBAL_OBJECT", "self");

            var injection = ConfigLoader.load(fullConfigPath, envLookup()).injection();

            assertThat(injection.chunkSize()).isEqualTo(64);
            assertThat(injection.globalObject()).isEqualTo("self");
        }
    }

    @Nested
    @DisplayName("Unset semantics")
    class UnsetSemantics {

        @Test
        @DisplayName("blank values leave the YAML value in place")
        void blankIgnored() {
            envVars.put("SERVER_HOST", "   ");
            envVars.put("DB_URL", "");
            envVars.put("INJECT_NULL_POLICY", " ");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.host()).isEqualTo("127.0.0.1");
            assertThat(config.dataSource().url()).isEqualTo("jdbc:sqlite:/var/data/app.db");
            assertThat(config.injection().nullPolicy()).isEqualTo(NullPolicy.EMPTY_STRING);
        }

        @Test
        @DisplayName("values are trimmed")
        void trimmed() {
            envVars.put("SERVER_PORT", " 8181 ");

            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).port()).isEqualTo(8181);
        }

        @Test
        @DisplayName("non-numeric integer is a load error")
        void invalidInteger() {
            envVars.put("SERVER_PORT", "eighty");

            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("SERVER_PORT");
        }
    }
}
