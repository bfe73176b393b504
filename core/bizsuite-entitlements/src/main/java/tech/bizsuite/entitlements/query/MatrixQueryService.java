package tech.bizsuite.entitlements.query;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.catalog.PermissionDefinition;
import tech.bizsuite.entitlements.catalog.ResolvedPermission;

import java.util.List;

/**
 * Read-only accessors over the capability catalog.
 *
 * Lookups here are lenient: an unknown application or module yields an empty list and
 * unknown permissions fall back to a display value. These methods feed display contexts
 * where "nothing to show" is a valid outcome, so nothing here throws for a missing key.
 * Use {@link CapabilityCatalog} directly when a miss must be distinguished.
 */
@ApplicationScoped
public class MatrixQueryService {

    private final CapabilityCatalog catalog;

    @Inject
    public MatrixQueryService(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Every application in declaration order.
     */
    public List<ApplicationDefinition> listApplications() {
        return catalog.applications();
    }

    /**
     * Every application in display order ({@code sortOrder}).
     */
    public List<ApplicationDefinition> listApplicationsBySortOrder() {
        return catalog.applicationsBySortOrder();
    }

    /**
     * Modules of an application, or an empty list if the application is unknown.
     */
    public List<ModuleDefinition> listModules(String appCode) {
        return catalog.findApplication(appCode)
            .map(ApplicationDefinition::modules)
            .orElse(List.of());
    }

    /**
     * Permissions of a module with their fully-qualified codes attached,
     * or an empty list if either code is unknown.
     */
    public List<ResolvedPermission> listPermissions(String appCode, String moduleCode) {
        return catalog.findModule(appCode, moduleCode)
            .map(module -> module.permissions().stream()
                .map(permission -> ResolvedPermission.of(appCode, moduleCode, permission))
                .toList())
            .orElse(List.of());
    }

    /**
     * Display name of a permission, or the raw code when the permission is not in the catalog.
     */
    public String permissionName(String appCode, String moduleCode, String code) {
        return catalog.findPermission(appCode, moduleCode, code)
            .map(PermissionDefinition::name)
            .filter(name -> !name.isEmpty())
            .orElse(code);
    }

    /**
     * Description of a permission, or an empty string when the permission is not in the catalog.
     */
    public String permissionDescription(String appCode, String moduleCode, String code) {
        return catalog.findPermission(appCode, moduleCode, code)
            .map(PermissionDefinition::description)
            .orElse("");
    }

    public MatrixSummary summary() {
        return MatrixSummary.of(catalog);
    }

    public CapabilityCatalog catalog() {
        return catalog;
    }
}
