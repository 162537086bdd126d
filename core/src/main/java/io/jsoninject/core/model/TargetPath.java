package io.jsoninject.core.model;

import io.jsoninject.core.error.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A parsed dotted target path such as {@code myApp.data}. Always has at least one segment and never
 * names the global root itself.
 */
public final class TargetPath {

    static final String FIELD = "target";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    /** Segments that would walk into prototype objects instead of plain properties. */
    private static final Set<String> FORBIDDEN_SEGMENTS = Set.of("__proto__", "prototype", "constructor");

    private final List<String> segments;

    private TargetPath(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    /**
     * Parses and validates a dotted path.
     *
     * @param raw           the configured path, e.g. {@code "myApp.data"}
     * @param mode          segment validation mode
     * @param injectionName component name for error reporting
     * @return the parsed path
     * @throws ConfigurationException if the path is missing, has empty segments, or a segment is
     *     rejected by {@code mode}
     */
    public static TargetPath parse(String raw, PathValidationMode mode, String injectionName) {
        Objects.requireNonNull(mode, "mode must not be null");
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Target path is required", injectionName, FIELD);
        }
        String trimmed = raw.strip();
        // split with limit -1 keeps trailing empty segments ("a.b." is invalid)
        String[] parts = trimmed.split("\\.", -1);
        List<String> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.isBlank()) {
                throw new ConfigurationException(
                        "Target path '" + trimmed + "' contains an empty segment", injectionName, FIELD);
            }
            if (FORBIDDEN_SEGMENTS.contains(part)) {
                throw new ConfigurationException(
                        "Target path '" + trimmed + "' uses reserved segment '" + part + "'", injectionName, FIELD);
            }
            if (mode == PathValidationMode.STRICT && !IDENTIFIER.matcher(part).matches()) {
                throw new ConfigurationException(
                        "Target path segment '" + part + "' is not a JavaScript identifier", injectionName, FIELD);
            }
            segments.add(part);
        }
        return new TargetPath(segments);
    }

    /** Path segments, root-first. */
    public List<String> segments() {
        return segments;
    }

    /** The last segment: the property that receives the merge. */
    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    /** Number of segments (at least one). */
    public int depth() {
        return segments.size();
    }

    /** The dotted form, e.g. {@code myApp.data}. */
    public String dotted() {
        return String.join(".", segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetPath that)) return false;
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return dotted();
    }
}
