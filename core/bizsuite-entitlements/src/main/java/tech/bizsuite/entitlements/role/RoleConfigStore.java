package tech.bizsuite.entitlements.role;

import java.util.Optional;

/**
 * Persistence seam for provisioned roles.
 *
 * <p>The entitlement engine only hands off an immutable {@link RoleConfig}; how and where it is
 * stored belongs to the implementation. Roles are keyed by tenant id.
 */
public interface RoleConfigStore {

    /**
     * Store the role for its tenant, replacing any previous role of that tenant.
     *
     * @param role The role to store
     */
    void save(RoleConfig role);

    /**
     * Get the role stored for a tenant.
     *
     * @param tenantId The tenant id
     * @return The stored role, or empty if none
     */
    Optional<RoleConfig> findByTenant(String tenantId);

    /**
     * Remove the role stored for a tenant. No-op if none.
     */
    void delete(String tenantId);
}
