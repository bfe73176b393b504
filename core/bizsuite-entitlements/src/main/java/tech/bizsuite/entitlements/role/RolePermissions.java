package tech.bizsuite.entitlements.role;

import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ResolvedPermission;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers over the nested {@code appCode -> moduleCode -> [code]} grant shape stored on roles.
 */
public final class RolePermissions {

    private RolePermissions() {
    }

    /**
     * Application codes present in the grants that also exist in the catalog, in grant order.
     */
    public static List<String> extractApplications(Map<String, Map<String, List<String>>> permissions,
                                                   CapabilityCatalog catalog) {
        if (permissions == null) {
            return List.of();
        }
        List<String> applications = new ArrayList<>();
        for (String appCode : permissions.keySet()) {
            if (catalog.hasApplication(appCode)) {
                applications.add(appCode);
            }
        }
        return applications;
    }

    /**
     * The grants of a single application, or an empty map when the application is not granted.
     */
    public static Map<String, Map<String, List<String>>> filterByApplication(
            Map<String, Map<String, List<String>>> permissions, String appCode) {
        if (permissions == null || appCode == null) {
            return Map.of();
        }
        Map<String, List<String>> modules = permissions.get(appCode);
        return modules == null ? Map.of() : Map.of(appCode, modules);
    }

    public static boolean grants(Map<String, Map<String, List<String>>> permissions,
                                 String appCode, String moduleCode, String code) {
        if (permissions == null) {
            return false;
        }
        Map<String, List<String>> modules = permissions.get(appCode);
        if (modules == null) {
            return false;
        }
        List<String> codes = modules.get(moduleCode);
        return codes != null && codes.contains(code);
    }

    /**
     * Whether a fully-qualified code ({@code app.module.code}) is granted.
     * Malformed codes are never granted.
     */
    public static boolean grants(Map<String, Map<String, List<String>>> permissions, String fullCode) {
        if (fullCode == null) {
            return false;
        }
        String[] parts = fullCode.split("\\.", -1);
        if (parts.length != 3) {
            return false;
        }
        return grants(permissions, parts[0], parts[1], parts[2]);
    }

    /**
     * All fully-qualified codes of the grants, in grant order without duplicates.
     */
    public static Set<String> flatten(Map<String, Map<String, List<String>>> permissions) {
        Set<String> codes = new LinkedHashSet<>();
        if (permissions == null) {
            return codes;
        }
        permissions.forEach((appCode, modules) ->
            modules.forEach((moduleCode, moduleCodes) ->
                moduleCodes.forEach(code -> codes.add(ResolvedPermission.fullCode(appCode, moduleCode, code)))));
        return codes;
    }
}
