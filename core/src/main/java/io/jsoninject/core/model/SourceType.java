package io.jsoninject.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Origin of the JSON payload for one injection. Each constant maps to exactly one field of {@link
 * InjectionRequest} and to one {@code io.jsoninject.core.spi.SourceAdapter}.
 */
public enum SourceType {

    /** A SQL query whose whole result set is serialized as a JSON array of row objects. */
    RAW_QUERY("sql"),

    /** A SQL query returning exactly one row and one column holding a JSON document. */
    JSON_QUERY("jsonsql"),

    /** A trusted code block that writes JSON incrementally through a writer sink. */
    PROCEDURAL_JSON("procedure"),

    /** Literal JSON text supplied at design time. */
    STATIC_JSON("static");

    /** Legacy configuration id for {@link #PROCEDURAL_JSON}. */
    private static final String LEGACY_PROCEDURE_ID = "plsql";

    private final String id;

    SourceType(String id) {
        this.id = id;
    }

    /** The configuration id used in injection definition files (e.g. {@code "sql"}). */
    public String id() {
        return id;
    }

    /**
     * Resolves a configuration id (case-insensitive). {@code "plsql"} is accepted as an alias for
     * {@link #PROCEDURAL_JSON}.
     *
     * @param id the configuration id
     * @return the matching source type, or empty if unknown
     */
    public static Optional<SourceType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        if (LEGACY_PROCEDURE_ID.equals(normalized)) {
            return Optional.of(PROCEDURAL_JSON);
        }
        for (SourceType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
