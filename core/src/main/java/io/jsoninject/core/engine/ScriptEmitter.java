package io.jsoninject.core.engine;

import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.TargetPath;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Builds the script fragment that merges a payload into a nested global path.
 *
 * <p>Fragment layout for target {@code myApp.data}:
 *
 * <pre>
 * &lt;script&gt;
 * (function(){
 * var isOwnObject=function(o,n){...};var createNestedObject=function(r,p){...return r;};
 * var c=createNestedObject(window,"myApp.data"),k="data";
 * if(!isOwnObject(c,k)){c[k]={};}
 * Object.assign(c[k],  PAYLOAD  );
 * })();
 * &lt;/script&gt;
 * </pre>
 *
 * <p>The helper is declared inside the fragment's own function scope: every fragment carries its
 * own definition, nothing is added to the global object except the target path, and any number
 * of fragments may appear on one page. A segment counts as present only when it is an own
 * property holding an object or function; anything else (missing, {@code null}, a primitive, or a
 * member inherited from a prototype) is replaced by a fresh {@code {}}. The merge keeps properties already present at the target
 * and overwrites same-named ones, so two fragments writing {@code {a:1}} and {@code {b:2}} to one
 * path compose into {@code {a:1,b:2}}.
 *
 * <p>Path text is embedded only through {@link JsLiteral}. The payload is <em>not</em> escaped:
 * it is trusted, pre-serialized JSON and is written by the caller between {@link #prefix} and
 * {@link #suffix()}.
 *
 * <p>Thread-safe: immutable.
 */
public final class ScriptEmitter {

    static final String HELPER_NAME = "createNestedObject";

    static final String OWN_CHECK_NAME = "isOwnObject";

    /**
     * True when {@code o} has an own property {@code n} holding an object or function. Inherited
     * members such as {@code toString} do not count, so they are shadowed instead of written to.
     */
    static final String OWN_CHECK = "var " + OWN_CHECK_NAME + "=function(o,n){"
            + "if(!Object.prototype.hasOwnProperty.call(o,n)){return false;}"
            + "var v=o[n];return v!==null&&(typeof v===\"object\"||typeof v===\"function\");};";

    /** Walks {@code p} from {@code r}, creating missing intermediates; returns the leaf's container. */
    static final String HELPER = OWN_CHECK + "var " + HELPER_NAME + "=function(r,p){"
            + "for(var s=p.split(\".\"),i=0;i<s.length-1;++i){"
            + "var n=s[i];if(!" + OWN_CHECK_NAME + "(r,n)){r[n]={};}r=r[n];}"
            + "return r;};";

    static final String LEAF_INIT = "if(!" + OWN_CHECK_NAME + "(c,k)){c[k]={};}";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern NONCE = Pattern.compile("[A-Za-z0-9+/=_-]+");

    private static final String SUFFIX = ");\n})();\n</script>\n";

    private final String globalObject;

    /** Emitter resolving paths from {@code window}. */
    public ScriptEmitter() {
        this("window");
    }

    /**
     * @param globalObject identifier of the global root, e.g. {@code window} or {@code globalThis}
     */
    public ScriptEmitter(String globalObject) {
        if (globalObject == null || !IDENTIFIER.matcher(globalObject).matches()) {
            throw new IllegalArgumentException("globalObject must be a JavaScript identifier, got: " + globalObject);
        }
        this.globalObject = globalObject;
    }

    /** Prefix without a CSP nonce. */
    public String prefix(TargetPath path) {
        return prefix(path, null, null);
    }

    /**
     * Everything up to and including {@code Object.assign(c[k],}.
     *
     * @param path          validated target path
     * @param nonce         CSP nonce for the script element, or {@code null}
     * @param injectionName component name for error reporting
     * @throws ConfigurationException if the nonce contains characters outside the base64 alphabet
     */
    public String prefix(TargetPath path, String nonce, String injectionName) {
        Objects.requireNonNull(path, "path must not be null");
        StringBuilder script = new StringBuilder(256);
        if (nonce == null || nonce.isEmpty()) {
            script.append("<script>\n");
        } else {
            if (!NONCE.matcher(nonce).matches()) {
                throw new ConfigurationException("Script nonce contains invalid characters", injectionName, "nonce");
            }
            script.append("<script nonce=\"").append(nonce).append("\">\n");
        }
        script.append("(function(){\n");
        script.append(HELPER).append('\n');
        script.append("var c=")
                .append(HELPER_NAME)
                .append('(')
                .append(globalObject)
                .append(',')
                .append(JsLiteral.quote(path.dotted(), '"'))
                .append("),k=")
                .append(JsLiteral.quote(path.leaf(), '"'))
                .append(";\n");
        script.append(LEAF_INIT).append('\n');
        script.append("Object.assign(c[k],");
        return script.toString();
    }

    /** Closes the merge call, the function scope and the script element. */
    public String suffix() {
        return SUFFIX;
    }

    /** Complete fragment for a payload small enough to build in memory. */
    public String emit(TargetPath path, JsonPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        return prefix(path) + payload.text() + SUFFIX;
    }

    /** The global root identifier. */
    public String globalObject() {
        return globalObject;
    }
}
