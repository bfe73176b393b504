package tech.bizsuite.entitlements.resolve;

import tech.bizsuite.entitlements.catalog.ResolvedPermission;
import tech.bizsuite.entitlements.plan.PlanAccessEntry;

import java.util.List;

/**
 * Read model describing one plan: its projection entry and the permissions it resolves to.
 */
public record PlanAccessDetails(
    String planId,
    PlanAccessEntry entry,
    int permissionCount,
    List<ResolvedPermission> detailedPermissions
) {

    public PlanAccessDetails {
        detailedPermissions = List.copyOf(detailedPermissions);
    }

    static PlanAccessDetails of(PlanAccessEntry entry, List<ResolvedPermission> permissions) {
        return new PlanAccessDetails(entry.planId(), entry, permissions.size(), permissions);
    }
}
