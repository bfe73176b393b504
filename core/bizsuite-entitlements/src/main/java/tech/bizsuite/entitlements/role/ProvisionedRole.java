package tech.bizsuite.entitlements.role;

import tech.bizsuite.entitlements.plan.CreditAllocation;

/**
 * Outcome of onboarding a tenant: the stored admin role, the plan it was built from
 * (the fallback plan when the requested one was unknown) and that plan's credit allocation.
 */
public record ProvisionedRole(
    String planId,
    RoleConfig role,
    CreditAllocation credits
) {
}
