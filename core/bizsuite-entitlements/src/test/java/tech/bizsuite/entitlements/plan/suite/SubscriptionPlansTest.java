package tech.bizsuite.entitlements.plan.suite;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.plan.CreditAllocation;
import tech.bizsuite.entitlements.plan.PlanAccessEntry;
import tech.bizsuite.entitlements.plan.PlanAccessProjection;

import static org.assertj.core.api.Assertions.*;

class SubscriptionPlansTest {

    private final PlanAccessProjection plans = SubscriptionPlans.create();

    @Test
    @DisplayName("shipped projection should contain the four subscription tiers")
    void create_shouldContainTiers() {
        assertThat(plans.planIds()).containsExactly("free", "starter", "professional", "enterprise");
    }

    @Test
    @DisplayName("shipped plans should carry their credit allocations")
    void plans_shouldCarryCredits() {
        assertThat(plans.find("free").map(PlanAccessEntry::credits)).contains(new CreditAllocation(1000, 0, 30));
        assertThat(plans.find("starter").map(PlanAccessEntry::credits)).contains(new CreditAllocation(60000, 0, 365));
        assertThat(plans.find("professional").map(PlanAccessEntry::credits)).contains(new CreditAllocation(300000, 0, 365));
        assertThat(plans.find("enterprise").map(PlanAccessEntry::credits)).contains(new CreditAllocation(1200000, 0, 365));
    }

    @Test
    @DisplayName("free plan should grant crm and accounting only")
    void freePlan_shouldGrantCrmAndAccounting() {
        PlanAccessEntry free = plans.find(FreePlan.PLAN_ID).orElseThrow();

        assertThat(free.applications()).containsExactly("crm", "accounting");
        assertThat(free.modules().get("crm")).containsExactly("leads", "contacts", "dashboard");
        assertThat(free.grantsModule("accounting", "invoices")).isTrue();
        assertThat(free.grantsModule("hr", "employees")).isFalse();
    }

    @Test
    @DisplayName("enterprise plan should grant every suite application")
    void enterprisePlan_shouldGrantEveryApplication() {
        PlanAccessEntry enterprise = plans.find(EnterprisePlan.PLAN_ID).orElseThrow();

        assertThat(enterprise.applications())
            .containsExactlyInAnyOrder("crm", "hr", "affiliate_connect", "project_management", "operations", "accounting");
    }
}
