package io.jsoninject.core.engine;

import io.jsoninject.core.json.NullPolicy;
import io.jsoninject.core.model.PathValidationMode;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Engine-wide settings. Immutable and thread-safe.
 *
 * @param chunkSize         maximum UTF-16 code units per payload write (default 4000, at least 2)
 * @param nullPolicy        rendering of SQL NULL and null writer values (default JSON null)
 * @param pathValidation    target path segment checks (default STRICT)
 * @param payloadValidation payload checks before embedding (default TRUSTED)
 * @param globalObject      identifier of the global root the path is resolved from (default
 *                          {@code window})
 */
public record InjectionSettings(
        int chunkSize,
        NullPolicy nullPolicy,
        PathValidationMode pathValidation,
        PayloadValidationMode payloadValidation,
        String globalObject) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    /** Defaults: 4000-char chunks, JSON null, strict paths, trusted payloads, {@code window}. */
    public static final InjectionSettings DEFAULT = builder().build();

    public InjectionSettings {
        if (chunkSize < 2) {
            throw new IllegalArgumentException("chunkSize must be at least 2, got: " + chunkSize);
        }
        Objects.requireNonNull(nullPolicy, "nullPolicy must not be null");
        Objects.requireNonNull(pathValidation, "pathValidation must not be null");
        Objects.requireNonNull(payloadValidation, "payloadValidation must not be null");
        if (globalObject == null || !IDENTIFIER.matcher(globalObject).matches()) {
            throw new IllegalArgumentException("globalObject must be a JavaScript identifier, got: " + globalObject);
        }
    }

    /** Creates a new builder with the default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link InjectionSettings}. */
    public static final class Builder {
        private int chunkSize = ChunkedWriter.DEFAULT_CHUNK_SIZE;
        private NullPolicy nullPolicy = NullPolicy.JSON_NULL;
        private PathValidationMode pathValidation = PathValidationMode.STRICT;
        private PayloadValidationMode payloadValidation = PayloadValidationMode.TRUSTED;
        private String globalObject = "window";

        private Builder() {}

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder nullPolicy(NullPolicy nullPolicy) {
            this.nullPolicy = nullPolicy;
            return this;
        }

        public Builder pathValidation(PathValidationMode pathValidation) {
            this.pathValidation = pathValidation;
            return this;
        }

        public Builder payloadValidation(PayloadValidationMode payloadValidation) {
            this.payloadValidation = payloadValidation;
            return this;
        }

        public Builder globalObject(String globalObject) {
            this.globalObject = globalObject;
            return this;
        }

        public InjectionSettings build() {
            return new InjectionSettings(chunkSize, nullPolicy, pathValidation, payloadValidation, globalObject);
        }
    }
}
