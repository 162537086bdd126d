package io.jsoninject.core.engine;

import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.model.SourceType;
import io.jsoninject.core.spi.SourceAdapter;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of source adapters keyed by {@link SourceType}. Thread-safe: registration and lookup
 * can happen concurrently.
 */
public final class AdapterRegistry {

    private final Map<SourceType, SourceAdapter> adapters = new ConcurrentHashMap<>();

    /**
     * Registers an adapter. An adapter already registered for the same source is replaced
     * (last-write-wins).
     *
     * @throws NullPointerException if adapter or adapter.type() is null
     */
    public AdapterRegistry register(SourceAdapter adapter) {
        if (adapter == null) {
            throw new NullPointerException("adapter must not be null");
        }
        SourceType type = adapter.type();
        if (type == null) {
            throw new NullPointerException("adapter type must not be null");
        }
        adapters.put(type, adapter);
        return this;
    }

    /** Looks up the adapter for a source. */
    public Optional<SourceAdapter> getAdapter(SourceType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(adapters.get(type));
    }

    /**
     * Looks up the adapter for a source, throwing if none is registered.
     *
     * @throws ConfigurationException if no adapter serves {@code type}
     */
    public SourceAdapter requireAdapter(SourceType type, String injectionName) {
        return getAdapter(type)
                .orElseThrow(() -> new ConfigurationException(
                        "No source adapter registered for source '" + (type == null ? null : type.id()) + "'",
                        injectionName,
                        "source"));
    }

    /** Returns the number of registered adapters. */
    public int size() {
        return adapters.size();
    }

    /** Returns {@code true} if an adapter is registered for the given source. */
    public boolean hasAdapter(SourceType type) {
        return type != null && adapters.containsKey(type);
    }
}
