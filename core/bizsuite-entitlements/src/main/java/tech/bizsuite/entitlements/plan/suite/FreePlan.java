package tech.bizsuite.entitlements.plan.suite;

import tech.bizsuite.entitlements.plan.PlanAccessEntry;

/**
 * Free tier: core CRM contact management and basic bookkeeping.
 */
public final class FreePlan {

    public static final String PLAN_ID = "free";

    public static final PlanAccessEntry INSTANCE = PlanAccessEntry.builder(PLAN_ID)
        .grant("crm", "leads", "read", "create", "update", "delete")
        .grant("crm", "contacts", "read", "create", "update", "delete")
        .grant("crm", "dashboard", "view")
        .grant("accounting", "dashboard", "view")
        .grant("accounting", "general_ledger", "read", "create", "update")
        .grant("accounting", "chart_of_accounts", "read", "create", "update")
        .grant("accounting", "journal_entries", "read", "create", "update")
        .grant("accounting", "invoices", "read", "create", "update", "delete")
        .grant("accounting", "customers", "read", "create", "update", "delete")
        .grant("accounting", "bills", "read", "create", "update", "delete")
        .grant("accounting", "vendors", "read", "create", "update", "delete")
        .grant("accounting", "reports", "read", "export")
        .grant("accounting", "multi_entity", "read")
        .credits(1000, 0, 30)
        .build();

    private FreePlan() {}
}
