package tech.bizsuite.entitlements.derived;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.config.EntitlementsConfig;
import tech.bizsuite.entitlements.support.EntitlementFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DerivedMapCache.
 * Builders are mocked to count how often the maps are rebuilt.
 */
@ExtendWith(MockitoExtension.class)
class DerivedMapCacheTest {

    private static final Map<String, List<String>> KEYWORDS = Map.of("invoices", List.of("invoices"));
    private static final Map<String, List<String>> ACTIONS = Map.of("manage_invoices", List.of("accounting.invoices.read"));

    private final CapabilityCatalog catalog = EntitlementFixtures.invoicesCatalog();

    @Mock
    private ModuleAccessMapBuilder moduleAccessMapBuilder;

    @Mock
    private LegacyActionMapBuilder legacyActionMapBuilder;

    private DerivedMapCache cache(boolean enabled) {
        EntitlementsConfig config = EntitlementFixtures.config(
            Map.of("bizsuite.entitlements.derived-maps.cache-enabled", String.valueOf(enabled)));
        return new DerivedMapCache(catalog, moduleAccessMapBuilder, legacyActionMapBuilder, config);
    }

    @Test
    @DisplayName("disabled cache should rebuild the map on every call")
    void moduleAccessMap_shouldRebuild_whenCacheDisabled() {
        when(moduleAccessMapBuilder.build("accounting")).thenReturn(KEYWORDS);
        DerivedMapCache cache = cache(false);

        cache.moduleAccessMap();
        cache.moduleAccessMap();

        verify(moduleAccessMapBuilder, times(2)).build("accounting");
        assertThat(cache.cachedEntries()).isZero();
    }

    @Test
    @DisplayName("enabled cache should build each map once per application")
    void maps_shouldBeMemoized_whenCacheEnabled() {
        when(moduleAccessMapBuilder.build("accounting")).thenReturn(KEYWORDS);
        when(legacyActionMapBuilder.build("accounting")).thenReturn(ACTIONS);
        DerivedMapCache cache = cache(true);

        assertThat(cache.moduleAccessMap()).isEqualTo(KEYWORDS);
        assertThat(cache.moduleAccessMap()).isEqualTo(KEYWORDS);
        assertThat(cache.legacyActionMap()).isEqualTo(ACTIONS);
        assertThat(cache.legacyActionMap()).isEqualTo(ACTIONS);

        verify(moduleAccessMapBuilder, times(1)).build("accounting");
        verify(legacyActionMapBuilder, times(1)).build("accounting");
        assertThat(cache.cachedEntries()).isEqualTo(2);
    }

    @Test
    @DisplayName("invalidateAll should force a rebuild")
    void invalidateAll_shouldForceRebuild() {
        when(legacyActionMapBuilder.build("accounting")).thenReturn(ACTIONS);
        DerivedMapCache cache = cache(true);

        cache.legacyActionMap();
        cache.invalidateAll();
        cache.legacyActionMap();

        verify(legacyActionMapBuilder, times(2)).build("accounting");
    }
}
