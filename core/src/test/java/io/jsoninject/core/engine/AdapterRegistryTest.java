package io.jsoninject.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.model.SourceType;
import io.jsoninject.core.source.SourceAdapters;
import io.jsoninject.core.source.StaticSourceAdapter;
import io.jsoninject.core.testkit.InMemoryQueryExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AdapterRegistry")
class AdapterRegistryTest {

    @Test
    @DisplayName("defaults register one adapter per source")
    void defaults() {
        AdapterRegistry registry = SourceAdapters.defaults(
                InMemoryQueryExecutor.withColumns("X"), (code, binds, out) -> {}, InjectionSettings.DEFAULT);

        assertThat(registry.size()).isEqualTo(4);
        for (SourceType type : SourceType.values()) {
            assertThat(registry.requireAdapter(type, "c1").type()).isEqualTo(type);
        }
    }

    @Test
    @DisplayName("re-registering a source replaces the adapter")
    void lastWriteWins() {
        StaticSourceAdapter first = new StaticSourceAdapter();
        StaticSourceAdapter second = new StaticSourceAdapter();
        AdapterRegistry registry = new AdapterRegistry().register(first).register(second);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.getAdapter(SourceType.STATIC_JSON)).containsSame(second);
    }

    @Test
    @DisplayName("requireAdapter fails with a configuration error for unregistered sources")
    void requireMissing() {
        AdapterRegistry registry = new AdapterRegistry();

        assertThat(registry.hasAdapter(SourceType.RAW_QUERY)).isFalse();
        assertThat(registry.getAdapter(null)).isEmpty();
        assertThatThrownBy(() -> registry.requireAdapter(SourceType.RAW_QUERY, "c1"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'sql'");
    }

    @Test
    @DisplayName("null adapter is rejected")
    void nullAdapter() {
        assertThatThrownBy(() -> new AdapterRegistry().register(null)).isInstanceOf(NullPointerException.class);
    }
}
