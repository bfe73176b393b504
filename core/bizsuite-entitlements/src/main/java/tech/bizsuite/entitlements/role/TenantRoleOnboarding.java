package tech.bizsuite.entitlements.role;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bizsuite.entitlements.plan.PlanAccessEntry;

/**
 * Onboarding step that provisions the admin role of a new tenant and stores it.
 *
 * <p>Never fails on an unknown plan id; see {@link RoleProvisioner}.
 */
@ApplicationScoped
public class TenantRoleOnboarding {

    private static final Logger LOG = Logger.getLogger(TenantRoleOnboarding.class);

    private final RoleProvisioner provisioner;
    private final RoleConfigStore store;

    @Inject
    public TenantRoleOnboarding(RoleProvisioner provisioner, RoleConfigStore store) {
        this.provisioner = provisioner;
        this.store = store;
    }

    public ProvisionedRole provision(String planId, String tenantId, String createdBy) {
        PlanAccessEntry plan = provisioner.effectivePlan(planId);
        RoleConfig role = provisioner.buildSuperAdminRole(plan.planId(), tenantId, createdBy);
        store.save(role);

        LOG.infof("Provisioned role '%s' for tenant %s on plan %s", role.roleName(), tenantId, plan.planId());
        return new ProvisionedRole(plan.planId(), role, plan.credits());
    }
}
