package tech.bizsuite.entitlements.plan.suite;

import tech.bizsuite.entitlements.plan.PlanAccessProjection;

/**
 * The built-in plan-access projection: one entry per subscription plan the billing side can emit.
 */
public final class SubscriptionPlans {

    private SubscriptionPlans() {}

    public static PlanAccessProjection create() {
        return PlanAccessProjection.of(
            FreePlan.INSTANCE,
            StarterPlan.INSTANCE,
            ProfessionalPlan.INSTANCE,
            EnterprisePlan.INSTANCE
        );
    }
}
