package io.jsoninject.core.model;

/**
 * Configuration for one injection (one page-render invocation). Exactly one of the four source
 * fields is populated, selected by {@link #source()}; consistency is enforced by {@code
 * JsonInjector} before anything is executed or written.
 *
 * <p>Instances are built once per render and discarded afterwards. Use the factory methods for
 * well-formed requests; the canonical constructor accepts any combination so that configuration
 * errors can be reported with a proper {@link io.jsoninject.core.error.ConfigurationException}.
 *
 * @param name            component name, used in logs and error messages
 * @param source          which source field is authoritative
 * @param query           SQL for {@link SourceType#RAW_QUERY}
 * @param jsonQuery       SQL for {@link SourceType#JSON_QUERY}
 * @param proceduralBlock code block for {@link SourceType#PROCEDURAL_JSON}
 * @param staticText      JSON text for {@link SourceType#STATIC_JSON}
 * @param targetPath      dotted global variable path, e.g. {@code myApp.data}
 */
public record InjectionRequest(
        String name,
        SourceType source,
        String query,
        String jsonQuery,
        String proceduralBlock,
        String staticText,
        String targetPath) {

    /** Returns the text of the field selected by {@link #source()}, or {@code null}. */
    public String sourceText() {
        return source == null ? null : textFor(source);
    }

    /** Returns the text of the field that serves {@code type}, regardless of {@link #source()}. */
    public String textFor(SourceType type) {
        return switch (type) {
            case RAW_QUERY -> query;
            case JSON_QUERY -> jsonQuery;
            case PROCEDURAL_JSON -> proceduralBlock;
            case STATIC_JSON -> staticText;
        };
    }

    /** Returns the configuration field name that holds the text for the given source. */
    public static String fieldFor(SourceType source) {
        return switch (source) {
            case RAW_QUERY -> "query";
            case JSON_QUERY -> "json-query";
            case PROCEDURAL_JSON -> "procedure";
            case STATIC_JSON -> "static";
        };
    }

    // Factory methods

    /** A request merging the rows of {@code sql} into {@code targetPath}. */
    public static InjectionRequest rawQuery(String name, String targetPath, String sql) {
        return new InjectionRequest(name, SourceType.RAW_QUERY, sql, null, null, null, targetPath);
    }

    /** A request merging the single JSON value returned by {@code sql} into {@code targetPath}. */
    public static InjectionRequest jsonQuery(String name, String targetPath, String sql) {
        return new InjectionRequest(name, SourceType.JSON_QUERY, null, sql, null, null, targetPath);
    }

    /** A request merging the JSON written by {@code block} into {@code targetPath}. */
    public static InjectionRequest procedural(String name, String targetPath, String block) {
        return new InjectionRequest(name, SourceType.PROCEDURAL_JSON, null, null, block, null, targetPath);
    }

    /** A request merging literal {@code json} into {@code targetPath}. */
    public static InjectionRequest staticJson(String name, String targetPath, String json) {
        return new InjectionRequest(name, SourceType.STATIC_JSON, null, null, null, json, targetPath);
    }

    /** Short description without source text, which may hold SQL or large literals. */
    @Override
    public String toString() {
        return "InjectionRequest[name=" + name + ", source=" + source + ", targetPath=" + targetPath + "]";
    }
}
