package tech.bizsuite.entitlements.derived;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.catalog.PermissionDefinition;
import tech.bizsuite.entitlements.catalog.ResolvedPermission;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the legacy action → fully-qualified permissions map of one application.
 *
 * <p>For every module:
 * <ul>
 *   <li>{@code manage_<module>} - every permission of the module</li>
 *   <li>{@code view_<module>} - its {@code read} and {@code read_all} permissions, only when it has one</li>
 * </ul>
 * Composite actions from {@link UmbrellaAliases} are the union of their source actions and are
 * only added when every source action exists.
 */
@ApplicationScoped
public class LegacyActionMapBuilder {

    public static final String MANAGE_PREFIX = "manage_";
    public static final String VIEW_PREFIX = "view_";

    private static final Set<String> VIEW_CODES = Set.of("read", "read_all");

    private final CapabilityCatalog catalog;

    @Inject
    public LegacyActionMapBuilder(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    public Map<String, List<String>> build(String appCode) {
        return build(appCode, UmbrellaAliases.forApplication(appCode));
    }

    public Map<String, List<String>> build(String appCode, UmbrellaAliases aliases) {
        Optional<ApplicationDefinition> application = catalog.findApplication(appCode);
        if (application.isEmpty()) {
            return Map.of();
        }

        Map<String, List<String>> actions = new LinkedHashMap<>();
        for (ModuleDefinition module : application.get().modules()) {
            List<String> all = new ArrayList<>();
            List<String> read = new ArrayList<>();
            for (PermissionDefinition permission : module.permissions()) {
                String fullCode = ResolvedPermission.fullCode(appCode, module.moduleCode(), permission.code());
                all.add(fullCode);
                if (VIEW_CODES.contains(permission.code())) {
                    read.add(fullCode);
                }
            }
            actions.put(MANAGE_PREFIX + module.moduleCode(), List.copyOf(all));
            if (!read.isEmpty()) {
                actions.put(VIEW_PREFIX + module.moduleCode(), List.copyOf(read));
            }
        }

        aliases.compositeActions().forEach((action, sources) -> {
            if (!actions.keySet().containsAll(sources)) {
                return;
            }
            Set<String> union = new LinkedHashSet<>();
            sources.forEach(source -> union.addAll(actions.get(source)));
            actions.put(action, List.copyOf(union));
        });

        return Collections.unmodifiableMap(actions);
    }
}
