package tech.bizsuite.entitlements.role;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.config.EntitlementsConfig;
import tech.bizsuite.entitlements.plan.ApplicationGrant;
import tech.bizsuite.entitlements.plan.PermissionGrant;
import tech.bizsuite.entitlements.plan.PlanAccessEntry;
import tech.bizsuite.entitlements.plan.PlanAccessProjection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the administrator role handed to every newly onboarded tenant.
 *
 * <p>Unlike {@link tech.bizsuite.entitlements.resolve.PlanResolver}, an unknown plan id is not an
 * error here: the configured fallback plan ({@code free} by default) is used instead and a
 * warning is logged, so tenant creation never blocks on a bad plan id. Only a missing fallback
 * plan is fatal.
 *
 * <p>The role carries the plan's own nested grant shape. Wildcards are expanded against the
 * catalog at build time, so a stored role always holds plain code lists. A stored role never
 * carries a {@code "*"} marker: permissions added to the catalog later do not widen it.
 */
@ApplicationScoped
public class RoleProvisioner {

    private static final Logger LOG = Logger.getLogger(RoleProvisioner.class);

    private final CapabilityCatalog catalog;
    private final PlanAccessProjection projection;
    private final EntitlementsConfig config;

    @Inject
    public RoleProvisioner(CapabilityCatalog catalog, PlanAccessProjection projection, EntitlementsConfig config) {
        this.catalog = catalog;
        this.projection = projection;
        this.config = config;
    }

    /**
     * Build the super-admin role for a tenant.
     *
     * @param planId    Subscription plan the tenant signed up for
     * @param tenantId  Tenant the role belongs to (also used as organization id)
     * @param createdBy User creating the role
     * @return The role configuration, never null
     * @throws IllegalStateException if the fallback plan is missing from the projection
     */
    public RoleConfig buildSuperAdminRole(String planId, String tenantId, String createdBy) {
        PlanAccessEntry plan = effectivePlan(planId);
        EntitlementsConfig.SuperAdmin admin = config.superAdmin();

        return RoleConfig.builder()
            .tenantId(tenantId)
            .organizationId(tenantId)
            .roleName(admin.roleName())
            .description(admin.description())
            .permissions(nestedPermissions(plan))
            .systemRole(true)
            .defaultRole(true)
            .priority(admin.priority())
            .scope(admin.scope())
            .inheritable(true)
            .color(admin.color())
            .createdBy(createdBy)
            .restrictions(Map.of())
            .build();
    }

    /**
     * The plan a provisioning request actually uses: the requested one, or the fallback plan.
     */
    public PlanAccessEntry effectivePlan(String planId) {
        return projection.find(planId).orElseGet(() -> {
            String fallback = config.fallbackPlan();
            LOG.warnf("Plan %s not found in plan access projection, using '%s' plan", planId, fallback);
            return projection.find(fallback).orElseThrow(() ->
                new IllegalStateException("Fallback plan '" + fallback + "' is missing from the plan access projection"));
        });
    }

    /**
     * The plan's grants as {@code appCode -> moduleCode -> codes}, in plan declaration order.
     */
    Map<String, Map<String, List<String>>> nestedPermissions(PlanAccessEntry plan) {
        Map<String, Map<String, List<String>>> nested = new LinkedHashMap<>();
        for (Map.Entry<String, ApplicationGrant> entry : plan.permissions().entrySet()) {
            String appCode = entry.getKey();
            Map<String, List<String>> modules = new LinkedHashMap<>();

            if (entry.getValue() instanceof ApplicationGrant.ModuleGrants grants) {
                for (Map.Entry<String, PermissionGrant> module : grants.modules().entrySet()) {
                    modules.put(module.getKey(),
                        module.getValue().expand(catalog.findModule(appCode, module.getKey())));
                }
            } else {
                // application wildcard
                for (ModuleDefinition module : catalog.findApplication(appCode)
                        .map(app -> app.modules()).orElse(List.of())) {
                    modules.put(module.moduleCode(), module.permissionCodes());
                }
            }
            nested.put(appCode, modules);
        }
        return nested;
    }
}
