package io.jsoninject.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsoninject.core.engine.InjectionSettings;
import io.jsoninject.core.engine.PayloadValidationMode;
import io.jsoninject.core.json.NullPolicy;
import io.jsoninject.core.model.PathValidationMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = Map.<String, String>of()::get;

    static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("minimal file keeps every default")
        void minimalConfig_defaults() throws Exception {
            ServerConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.host()).isEqualTo("0.0.0.0");
            assertThat(config.port()).isEqualTo(8080);
            assertThat(config.pagesDir()).isEqualTo("./pages");
            assertThat(config.cspNonce()).isFalse();
            assertThat(config.healthEnabled()).isTrue();
            assertThat(config.healthPath()).isEqualTo("/health");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.dataSource()).isEqualTo(DataSourceConfig.NONE);
            assertThat(config.dataSource().configured()).isFalse();
            assertThat(config.injection()).isEqualTo(InjectionSettings.DEFAULT);
        }

        @Test
        @DisplayName("full file maps every section")
        void fullConfig_allFields() throws Exception {
            ServerConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.host()).isEqualTo("127.0.0.1");
            assertThat(config.port()).isEqualTo(9090);
            assertThat(config.cspNonce()).isTrue();
            assertThat(config.pagesDir()).isEqualTo("/srv/pages");
            assertThat(config.healthEnabled()).isFalse();
            assertThat(config.healthPath()).isEqualTo("/alive");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");

            DataSourceConfig db = config.dataSource();
            assertThat(db.url()).isEqualTo("jdbc:sqlite:/var/data/app.db");
            assertThat(db.username()).isEqualTo("app");
            assertThat(db.password()).isEqualTo("s3cret");
            assertThat(db.maxPoolSize()).isEqualTo(4);
            assertThat(db.connectionTimeoutMs()).isEqualTo(2000);
            assertThat(db.readOnly()).isTrue();

            InjectionSettings injection = config.injection();
            assertThat(injection.chunkSize()).isEqualTo(1000);
            assertThat(injection.nullPolicy()).isEqualTo(NullPolicy.EMPTY_STRING);
            assertThat(injection.pathValidation()).isEqualTo(PathValidationMode.LENIENT);
            assertThat(injection.payloadValidation()).isEqualTo(PayloadValidationMode.VERIFY);
            assertThat(injection.globalObject()).isEqualTo("globalThis");
        }

        @Test
        @DisplayName("empty file is accepted as all defaults")
        void emptyFile_defaults(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("empty.yaml"), "");

            ServerConfig config = ConfigLoader.load(file, NO_ENV);

            assertThat(config.port()).isEqualTo(8080);
        }

        @Test
        @DisplayName("password is masked in toString")
        void passwordMasked() throws Exception {
            ServerConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.dataSource().toString()).contains("password=****").doesNotContain("s3cret");
        }
    }

    @Nested
    @DisplayName("Invalid configuration")
    class Invalid {

        @Test
        @DisplayName("missing file names the --config option")
        void missingFile() {
            assertThatThrownBy(() -> ConfigLoader.load(Path.of("does-not-exist.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("malformed YAML is reported with the file")
        void malformedYaml() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("malformed.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("malformed.yaml");
        }

        @Test
        @DisplayName("unknown enum value lists the accepted ones")
        void unknownNullPolicy() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("bad-null-policy.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("injection.null-policy")
                    .hasMessageContaining("json-null")
                    .hasMessageContaining("empty-string");
        }

        @Test
        @DisplayName("record validation failures become ConfigLoadException")
        void chunkSizeTooSmall() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("bad-chunk-size.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("chunkSize must be at least 2");
        }
    }

    @Nested
    @DisplayName("Config path resolution")
    class PathResolution {

        @Test
        @DisplayName("defaults to json-inject.yaml")
        void defaultPath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("json-inject.yaml"));
        }

        @Test
        @DisplayName("--config selects the file")
        void explicitPath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "conf/app.yaml"}))
                    .isEqualTo(Path.of("conf/app.yaml"));
        }

        @Test
        @DisplayName("--config without a value is rejected")
        void missingValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config");
        }
    }
}
