package io.jsoninject.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.PathValidationMode;
import io.jsoninject.core.model.TargetPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScriptEmitter")
class ScriptEmitterTest {

    private final ScriptEmitter emitter = new ScriptEmitter();

    private static TargetPath strict(String path) {
        return TargetPath.parse(path, PathValidationMode.STRICT, "c1");
    }

    @Test
    @DisplayName("fragment wraps the payload in an IIFE with the helper and merge")
    void fragmentLayout() {
        String fragment = emitter.emit(strict("myApp.data"), JsonPayload.of("{\"a\":1}"));

        assertThat(fragment)
                .isEqualTo("<script>\n"
                        + "(function(){\n"
                        + ScriptEmitter.HELPER + "\n"
                        + "var c=createNestedObject(window,\"myApp.data\"),k=\"data\";\n"
                        + "if(!isOwnObject(c,k)){c[k]={};}\n"
                        + "Object.assign(c[k],{\"a\":1});\n"
                        + "})();\n"
                        + "</script>\n");
    }

    @Test
    @DisplayName("presence checks use own properties only")
    void ownPropertyChecks() {
        assertThat(ScriptEmitter.HELPER)
                .contains("Object.prototype.hasOwnProperty.call(o,n)")
                .contains("if(!isOwnObject(r,n)){r[n]={};}")
                .doesNotContain("===undefined");
        assertThat(emitter.prefix(strict("app.toString"))).contains("if(!isOwnObject(c,k)){c[k]={};}\n");
    }

    @Test
    @DisplayName("prefix and suffix bracket the payload exactly")
    void prefixSuffix() {
        TargetPath path = strict("x");

        assertThat(emitter.prefix(path)).endsWith("Object.assign(c[k],");
        assertThat(emitter.suffix()).isEqualTo(");\n})();\n</script>\n");
        assertThat(emitter.prefix(path) + "[]" + emitter.suffix())
                .isEqualTo(emitter.emit(path, JsonPayload.emptyArray()));
    }

    @Test
    @DisplayName("helper is declared with var inside the function scope only")
    void helperIsScoped() {
        String fragment = emitter.emit(strict("a"), JsonPayload.of("{}"));

        assertThat(fragment.indexOf("(function(){")).isLessThan(fragment.indexOf("var createNestedObject"));
        assertThat(fragment).doesNotContain("window.createNestedObject");
    }

    @Test
    @DisplayName("hostile lenient path is embedded only as escaped string literals")
    void escapesHostilePath() {
        TargetPath path = TargetPath.parse("app.x\"</script><script>alert(1)//", PathValidationMode.LENIENT, "c1");

        String prefix = emitter.prefix(path);

        assertThat(prefix).doesNotContain("</script>");
        assertThat(prefix).contains("k=\"x\\\"\\u003c\\/script\\u003e\\u003cscript\\u003ealert(1)\\/\\/\"");
    }

    @Test
    @DisplayName("configured global object replaces window")
    void customGlobalObject() {
        String prefix = new ScriptEmitter("globalThis").prefix(strict("a.b"));

        assertThat(prefix).contains("createNestedObject(globalThis,\"a.b\")");
        assertThat(new ScriptEmitter("globalThis").globalObject()).isEqualTo("globalThis");
    }

    @Test
    @DisplayName("global object must be an identifier")
    void rejectsBadGlobalObject() {
        assertThatThrownBy(() -> new ScriptEmitter("window;alert(1)")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("nonce is written on the script element")
    void nonce() {
        assertThat(emitter.prefix(strict("a"), "r4nd0m+/=", "c1")).startsWith("<script nonce=\"r4nd0m+/=\">\n");
        assertThat(emitter.prefix(strict("a"), "", "c1")).startsWith("<script>\n");
    }

    @Test
    @DisplayName("nonce with markup characters is a configuration error")
    void rejectsBadNonce() {
        assertThatThrownBy(() -> emitter.prefix(strict("a"), "x\" onload=\"alert(1)", "c1"))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).field()).isEqualTo("nonce"));
    }
}
