package io.jsoninject.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Page and session item values available for automatic bind-variable substitution.
 *
 * <p>Item names are case-insensitive: they are stored upper-cased, so a query referencing {@code
 * :p1_deptno} binds the item supplied as {@code P1_DEPTNO}.
 *
 * <p>{@link #toString()} prints only item names (not values) to keep request data out of logs.
 */
public final class BindContext {

    private static final BindContext EMPTY = new BindContext(Map.of());

    private final Map<String, Object> items;

    private BindContext(Map<String, Object> items) {
        this.items = items;
    }

    /**
     * Raw item value by name.
     *
     * @return the value, or {@code null} if absent
     */
    public Object get(String name) {
        return name == null ? null : items.get(normalize(name));
    }

    /**
     * String-typed item value by name.
     *
     * @return the string value, or {@code null} if absent or not a string
     */
    public String getString(String name) {
        Object value = get(name);
        return value instanceof String s ? s : null;
    }

    /** True if an item with the given name exists (its value may still be {@code null}). */
    public boolean has(String name) {
        return name != null && items.containsKey(normalize(name));
    }

    /** True if no items are present. */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /** Normalized (upper-case) item names, in insertion order. */
    public Set<String> names() {
        return items.keySet();
    }

    /**
     * Returns a copy with one additional item; an existing item of the same name is replaced.
     *
     * @param name  item name
     * @param value item value, may be {@code null}
     */
    public BindContext with(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        Map<String, Object> copy = new LinkedHashMap<>(items);
        copy.put(normalize(name), value);
        return new BindContext(Collections.unmodifiableMap(copy));
    }

    // Factory methods

    /**
     * Creates a bind context from the given items.
     *
     * @param items item values (defensive copy is made); {@code null} treated as empty
     * @return immutable {@code BindContext}
     */
    public static BindContext of(Map<String, ?> items) {
        if (items == null || items.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        items.forEach((name, value) -> copy.put(normalize(name), value));
        return new BindContext(Collections.unmodifiableMap(copy));
    }

    /** Returns the empty bind context (singleton). */
    public static BindContext empty() {
        return EMPTY;
    }

    private static String normalize(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BindContext that)) return false;
        return Objects.equals(items, that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items);
    }

    @Override
    public String toString() {
        return "BindContext" + items.keySet();
    }
}
