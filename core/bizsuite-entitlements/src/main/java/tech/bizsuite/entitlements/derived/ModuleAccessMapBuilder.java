package tech.bizsuite.entitlements.derived;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the keyword → modules map of one application.
 *
 * <p>Every module is its own keyword. The application's {@link UmbrellaAliases} then append the
 * umbrella and legacy module names each keyword also unlocks. Value lists are deduplicated and
 * keep first-seen order.
 */
@ApplicationScoped
public class ModuleAccessMapBuilder {

    private final CapabilityCatalog catalog;

    @Inject
    public ModuleAccessMapBuilder(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @param appCode Application whose modules are mapped
     * @return keyword → module names, empty when the application is unknown
     */
    public Map<String, List<String>> build(String appCode) {
        return build(appCode, UmbrellaAliases.forApplication(appCode));
    }

    public Map<String, List<String>> build(String appCode, UmbrellaAliases aliases) {
        Optional<ApplicationDefinition> application = catalog.findApplication(appCode);
        if (application.isEmpty()) {
            return Map.of();
        }

        Map<String, Set<String>> keywords = new LinkedHashMap<>();
        for (ModuleDefinition module : application.get().modules()) {
            keywords.computeIfAbsent(module.moduleCode(), k -> new LinkedHashSet<>()).add(module.moduleCode());
        }
        aliases.moduleAliases().forEach((keyword, modules) ->
            keywords.computeIfAbsent(keyword, k -> new LinkedHashSet<>()).addAll(modules));

        Map<String, List<String>> result = new LinkedHashMap<>();
        keywords.forEach((keyword, modules) -> result.put(keyword, List.copyOf(modules)));
        return Collections.unmodifiableMap(result);
    }
}
