package tech.bizsuite.entitlements.plan.suite;

import tech.bizsuite.entitlements.plan.PlanAccessEntry;

/**
 * Starter tier: CRM pipeline, HR basics, project tracking and the accounting essentials.
 */
public final class StarterPlan {

    public static final String PLAN_ID = "starter";

    public static final PlanAccessEntry INSTANCE = PlanAccessEntry.builder(PLAN_ID)
        .grant("crm", "leads", "read", "read_all", "create", "update", "delete", "export", "import",
            "assign", "convert")
        .grant("crm", "contacts", "read", "read_all", "create", "update", "delete", "export", "import")
        .grant("crm", "accounts", "read", "read_all", "create", "update", "delete", "export", "import",
            "assign")
        .grant("crm", "opportunities", "read", "read_all", "create", "update", "delete", "export",
            "import", "close", "assign")
        .grant("crm", "dashboard", "view")
        .grant("hr", "employees", "read", "create", "update", "delete")
        .grant("hr", "leave", "read", "create", "approve")
        .grant("hr", "dashboard", "view")
        .grant("project_management", "projects", "read", "create", "update", "delete", "export",
            "assign")
        .grant("project_management", "tasks", "read", "read_all", "create", "update", "delete", "export",
            "assign", "change_status")
        .grant("project_management", "team", "read", "read_all", "create", "update", "delete", "export")
        .grant("project_management", "dashboard", "view")
        .grant("accounting", "dashboard", "view", "customize")
        .grant("accounting", "general_ledger", "read", "create", "update", "delete", "post", "export")
        .grant("accounting", "chart_of_accounts", "read", "create", "update", "delete", "export")
        .grant("accounting", "journal_entries", "read", "create", "update", "delete", "post", "export")
        .grant("accounting", "invoices", "read", "read_all", "create", "update", "delete", "send",
            "export")
        .grant("accounting", "customers", "read", "read_all", "create", "update", "delete", "export",
            "import")
        .grant("accounting", "credit_notes", "read", "create", "update")
        .grant("accounting", "sales_orders", "read", "create", "update", "delete")
        .grant("accounting", "estimates", "read", "create", "update", "delete", "send")
        .grant("accounting", "bills", "read", "read_all", "create", "update", "delete", "pay", "export")
        .grant("accounting", "vendors", "read", "read_all", "create", "update", "delete", "export",
            "import")
        .grant("accounting", "purchase_orders", "read", "create", "update", "delete", "approve")
        .grant("accounting", "expense_reports", "read", "create", "update", "approve")
        .grant("accounting", "vendor_credits", "read", "create", "update")
        .grant("accounting", "banking", "read", "create", "update", "reconcile", "export")
        .grant("accounting", "tax", "read", "create", "update", "configure")
        .grant("accounting", "reports", "read", "create", "export")
        .grant("accounting", "analytics", "read", "export")
        .grant("accounting", "workflows", "read", "approve")
        .grant("accounting", "documents", "read", "create", "update")
        .grant("accounting", "notifications", "read", "update")
        .grant("accounting", "system", "settings_read", "users_read", "roles_read", "audit_read")
        .credits(60000, 0, 365)
        .build();

    private StarterPlan() {}
}
