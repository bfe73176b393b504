package tech.bizsuite.entitlements.query;

import tech.bizsuite.entitlements.catalog.CapabilityCatalog;

/**
 * Size of the catalog at each level.
 */
public record MatrixSummary(
    int totalApplications,
    int totalModules,
    int totalPermissions
) {

    public static MatrixSummary of(CapabilityCatalog catalog) {
        return new MatrixSummary(catalog.applicationCount(), catalog.moduleCount(), catalog.permissionCount());
    }
}
