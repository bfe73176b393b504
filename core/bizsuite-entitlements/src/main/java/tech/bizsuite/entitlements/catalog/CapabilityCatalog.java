package tech.bizsuite.entitlements.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable Application → Module → Permission tree of every grantable capability.
 *
 * The catalog is built once (from the suite declarations in production, from fixtures
 * in tests) and handed to the services that read it. Lookups that may miss return
 * {@link Optional}; nothing here mutates after construction, so a catalog can be
 * shared freely between threads.
 */
public final class CapabilityCatalog {

    // appCode -> application, in declaration order
    private final Map<String, ApplicationDefinition> applications;
    private final int hash;

    private CapabilityCatalog(Map<String, ApplicationDefinition> applications) {
        this.applications = Collections.unmodifiableMap(applications);
        this.hash = List.copyOf(applications.values()).hashCode();
    }

    /**
     * Build a catalog from application definitions.
     *
     * @throws IllegalStateException if two applications share an appCode
     */
    public static CapabilityCatalog of(Collection<ApplicationDefinition> applications) {
        Map<String, ApplicationDefinition> byCode = new LinkedHashMap<>();
        for (ApplicationDefinition application : applications) {
            ApplicationDefinition previous = byCode.putIfAbsent(application.appCode(), application);
            if (previous != null) {
                throw new IllegalStateException("Duplicate application code in catalog: " + application.appCode());
            }
        }
        return new CapabilityCatalog(byCode);
    }

    public static CapabilityCatalog of(ApplicationDefinition... applications) {
        return of(List.of(applications));
    }

    /**
     * All applications in declaration order.
     */
    public List<ApplicationDefinition> applications() {
        return List.copyOf(applications.values());
    }

    /**
     * All applications ordered by their display sort order, ties kept in declaration order.
     */
    public List<ApplicationDefinition> applicationsBySortOrder() {
        List<ApplicationDefinition> sorted = new ArrayList<>(applications.values());
        sorted.sort(Comparator.comparingInt(ApplicationDefinition::sortOrder));
        return sorted;
    }

    public Optional<ApplicationDefinition> findApplication(String appCode) {
        if (appCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(applications.get(appCode));
    }

    public Optional<ModuleDefinition> findModule(String appCode, String moduleCode) {
        return findApplication(appCode).flatMap(app -> app.findModule(moduleCode));
    }

    public Optional<PermissionDefinition> findPermission(String appCode, String moduleCode, String code) {
        return findModule(appCode, moduleCode).flatMap(module -> module.findPermission(code));
    }

    public Optional<PermissionDefinition> findPermission(PermissionCode permissionCode) {
        return findPermission(permissionCode.appCode(), permissionCode.moduleCode(), permissionCode.code());
    }

    public boolean hasApplication(String appCode) {
        return appCode != null && applications.containsKey(appCode);
    }

    public int applicationCount() {
        return applications.size();
    }

    public int moduleCount() {
        return applications.values().stream()
            .mapToInt(app -> app.modules().size())
            .sum();
    }

    public int permissionCount() {
        return applications.values().stream()
            .flatMap(app -> app.modules().stream())
            .mapToInt(module -> module.permissions().size())
            .sum();
    }

    /**
     * Content hash of the whole tree. Two catalogs with the same declarations share a
     * fingerprint, which makes it usable as a memoization key for derived data.
     */
    public String fingerprint() {
        return Integer.toHexString(hash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CapabilityCatalog other)) {
            return false;
        }
        return hash == other.hash && applications.equals(other.applications);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "CapabilityCatalog(" + applicationCount() + " applications, "
            + moduleCount() + " modules, " + permissionCount() + " permissions)";
    }
}
