package io.jsoninject.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.model.SourceType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("InjectionSpecParser")
class InjectionSpecParserTest {

    private final InjectionSpecParser parser = new InjectionSpecParser();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("raw query definition from a file")
    void rawQueryFile() throws IOException {
        Path file = tempDir.resolve("employees.yaml");
        Files.writeString(file, """
                name: load-employees
                source: sql
                target: myApp.employees
                query: select * from emp where deptno = :DEPTNO
                """);

        InjectionRequest request = parser.parse(file);

        assertThat(request.name()).isEqualTo("load-employees");
        assertThat(request.source()).isEqualTo(SourceType.RAW_QUERY);
        assertThat(request.targetPath()).isEqualTo("myApp.employees");
        assertThat(request.query()).isEqualTo("select * from emp where deptno = :DEPTNO");
        assertThat(request.jsonQuery()).isNull();
    }

    @Test
    @DisplayName("legacy plsql id maps to the procedure source")
    void legacyProcedureId() {
        InjectionRequest request = parser.parse("""
                name: menu
                source: plsql
                target: app.menu
                procedure: build_menu
                """);

        assertThat(request.source()).isEqualTo(SourceType.PROCEDURAL_JSON);
        assertThat(request.proceduralBlock()).isEqualTo("build_menu");
    }

    @Test
    @DisplayName("static JSON written as a YAML mapping is re-serialized as JSON")
    void structuredStatic() {
        InjectionRequest request = parser.parse("""
                name: flags
                source: static
                target: app.flags
                static:
                  beta: true
                  limits: [1, 2]
                """);

        assertThat(request.staticText()).isEqualTo("{\"beta\":true,\"limits\":[1,2]}");
    }

    @Test
    @DisplayName("static JSON written as a block string is kept as text")
    void textStatic() {
        InjectionRequest request = parser.parse("""
                name: flags
                source: static
                target: app.flags
                static: |
                  {"beta": true}
                """);

        assertThat(request.staticText()).isEqualTo("{\"beta\": true}\n");
    }

    @Test
    @DisplayName("unknown keys are rejected")
    void unknownKey() {
        assertThatThrownBy(() -> parser.parse("""
                        name: cfg
                        source: jsonsql
                        target: app.cfg
                        json_query: select 1 from dual
                        """))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("json_query")
                .satisfies(e -> assertThat(((ConfigurationException) e).injectionName()).isEqualTo("cfg"));
    }

    @Test
    @DisplayName("unknown source id is rejected")
    void unknownSource() {
        assertThatThrownBy(() -> parser.parse("""
                        name: cfg
                        source: graphql
                        target: app.cfg
                        """))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).field()).isEqualTo("source"));
    }

    @Test
    @DisplayName("missing required field is reported by name")
    void missingTarget() {
        assertThatThrownBy(() -> parser.parse("""
                        name: cfg
                        source: static
                        static: "{}"
                        """))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).field()).isEqualTo("target"));
    }

    @Test
    @DisplayName("non-mapping document is rejected")
    void notAMapping() {
        assertThatThrownBy(() -> parser.parse("- a\n- b\n")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("unreadable file is a configuration error")
    void missingFile() {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("nope.yaml")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nope.yaml");
    }
}
