package tech.bizsuite.entitlements.derived;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.config.EntitlementsConfig;

import java.util.List;
import java.util.Map;

/**
 * Entry point for the derived maps, optionally memoized with Caffeine.
 *
 * <p>The maps are pure functions of the catalog, so rebuilding them on every call is always
 * correct. With {@code bizsuite.entitlements.derived-maps.cache-enabled=true} results are kept
 * per (application, catalog fingerprint).
 */
@ApplicationScoped
public class DerivedMapCache {

    private static final Logger LOG = Logger.getLogger(DerivedMapCache.class);

    record Key(String appCode, String catalogFingerprint) {}

    private final CapabilityCatalog catalog;
    private final ModuleAccessMapBuilder moduleAccessMapBuilder;
    private final LegacyActionMapBuilder legacyActionMapBuilder;
    private final EntitlementsConfig.DerivedMaps config;

    private final Cache<Key, Map<String, List<String>>> moduleAccessMaps;
    private final Cache<Key, Map<String, List<String>>> legacyActionMaps;

    @Inject
    public DerivedMapCache(CapabilityCatalog catalog,
                           ModuleAccessMapBuilder moduleAccessMapBuilder,
                           LegacyActionMapBuilder legacyActionMapBuilder,
                           EntitlementsConfig config) {
        this.catalog = catalog;
        this.moduleAccessMapBuilder = moduleAccessMapBuilder;
        this.legacyActionMapBuilder = legacyActionMapBuilder;
        this.config = config.derivedMaps();
        this.moduleAccessMaps = newCache();
        this.legacyActionMaps = newCache();
        LOG.debugf("Derived map cache enabled=%s maxSize=%d", this.config.cacheEnabled(), this.config.cacheMaxSize());
    }

    private Cache<Key, Map<String, List<String>>> newCache() {
        return Caffeine.newBuilder()
            .maximumSize(config.cacheMaxSize())
            .build();
    }

    /**
     * Keyword → modules map of the configured application.
     */
    public Map<String, List<String>> moduleAccessMap() {
        return moduleAccessMap(config.application());
    }

    public Map<String, List<String>> moduleAccessMap(String appCode) {
        if (!config.cacheEnabled()) {
            return moduleAccessMapBuilder.build(appCode);
        }
        return moduleAccessMaps.get(key(appCode), k -> moduleAccessMapBuilder.build(k.appCode()));
    }

    /**
     * Legacy action → permissions map of the configured application.
     */
    public Map<String, List<String>> legacyActionMap() {
        return legacyActionMap(config.application());
    }

    public Map<String, List<String>> legacyActionMap(String appCode) {
        if (!config.cacheEnabled()) {
            return legacyActionMapBuilder.build(appCode);
        }
        return legacyActionMaps.get(key(appCode), k -> legacyActionMapBuilder.build(k.appCode()));
    }

    public String application() {
        return config.application();
    }

    /**
     * Number of memoized maps, both kinds together.
     */
    public long cachedEntries() {
        return moduleAccessMaps.estimatedSize() + legacyActionMaps.estimatedSize();
    }

    public void invalidateAll() {
        moduleAccessMaps.invalidateAll();
        legacyActionMaps.invalidateAll();
    }

    private Key key(String appCode) {
        return new Key(appCode, catalog.fingerprint());
    }
}
