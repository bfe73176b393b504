package tech.bizsuite.entitlements.plan.suite;

import tech.bizsuite.entitlements.plan.PlanAccessEntry;

/**
 * Enterprise tier: every application of the suite.
 *
 * <p>Modules granted in full use the wildcard so that permissions added to the catalog
 * reach enterprise tenants without a plan change.
 */
public final class EnterprisePlan {

    public static final String PLAN_ID = "enterprise";

    public static final PlanAccessEntry INSTANCE = PlanAccessEntry.builder(PLAN_ID)
        .grantAll("crm", "leads")
        .grantAll("crm", "accounts")
        .grant("crm", "contacts", "read", "read_all", "create", "update", "delete", "export", "import")
        .grantAll("crm", "opportunities")
        .grantAll("crm", "quotations")
        .grant("crm", "invoices", "read", "read_all", "create", "update", "delete", "send", "mark_paid",
            "generate_pdf", "export")
        .grantAll("crm", "inventory")
        .grant("crm", "product_orders", "read", "read_all", "create", "update", "delete", "process",
            "export", "import")
        .grantAll("crm", "sales_orders")
        .grantAll("crm", "tickets")
        .grantAll("crm", "communications")
        .grantAll("crm", "calendar")
        .grantAll("crm", "ai_insights")
        .grantAll("crm", "form_builder")
        .grantAll("crm", "analytics")
        .grantAll("crm", "dashboard")
        .grant("crm", "system", "settings_read", "settings_update", "configurations_read",
            "configurations_create", "configurations_update", "configurations_delete",
            "tenant_config_read", "tenant_config_update", "admin_tenants_read", "credit_config_view",
            "credit_config_edit", "credit_config_reset", "credit_config_bulk_update",
            "system_config_read", "system_config_update", "dropdowns_read", "dropdowns_create",
            "dropdowns_update", "dropdowns_delete", "integrations_read", "integrations_create",
            "integrations_update", "integrations_delete", "backup_read", "backup_create",
            "backup_restore", "maintenance_read", "maintenance_perform", "maintenance_schedule",
            "users_read", "users_read_all", "users_create", "users_update", "users_delete",
            "users_activate", "users_reset_password", "users_export", "users_import", "roles_read",
            "roles_read_all", "roles_create", "roles_update", "roles_delete", "roles_assign",
            "roles_export", "reports_read", "reports_read_all", "reports_create", "reports_update",
            "reports_delete", "reports_export", "reports_schedule", "audit_read", "audit_read_all",
            "audit_export", "audit_view_details", "audit_generate_reports", "activity_logs_read",
            "activity_logs_read_all", "activity_logs_export", "activity_logs_view_details",
            "activity_logs_generate_reports")
        .grantAll("hr", "employees")
        .grantAll("hr", "payroll")
        .grantAll("hr", "leave")
        .grantAll("hr", "dashboard")
        .grantAll("affiliate_connect", "dashboard")
        .grantAll("affiliate_connect", "products")
        .grantAll("affiliate_connect", "affiliates")
        .grantAll("affiliate_connect", "tracking")
        .grantAll("affiliate_connect", "commissions")
        .grantAll("affiliate_connect", "campaigns")
        .grantAll("affiliate_connect", "influencers")
        .grantAll("affiliate_connect", "payments")
        .grantAll("affiliate_connect", "analytics")
        .grantAll("affiliate_connect", "fraud")
        .grantAll("affiliate_connect", "communications")
        .grantAll("affiliate_connect", "integrations")
        .grantAll("affiliate_connect", "settings")
        .grantAll("affiliate_connect", "support")
        .grantAll("project_management", "projects")
        .grantAll("project_management", "tasks")
        .grantAll("project_management", "sprints")
        .grantAll("project_management", "time_tracking")
        .grantAll("project_management", "team")
        .grantAll("project_management", "backlog")
        .grantAll("project_management", "documents")
        .grantAll("project_management", "analytics")
        .grantAll("project_management", "reports")
        .grantAll("project_management", "chat")
        .grantAll("project_management", "calendar")
        .grantAll("project_management", "kanban")
        .grantAll("project_management", "dashboard")
        .grantAll("project_management", "notifications")
        .grantAll("project_management", "workspace")
        .grantAll("project_management", "workflow")
        .grantAll("project_management", "system")
        .grantAll("operations", "dashboard")
        .grantAll("operations", "inventory")
        .grantAll("operations", "warehouse")
        .grantAll("operations", "procurement")
        .grantAll("operations", "suppliers")
        .grantAll("operations", "transportation")
        .grantAll("operations", "orders")
        .grantAll("operations", "fulfillments")
        .grantAll("operations", "shipments")
        .grantAll("operations", "catalog")
        .grantAll("operations", "quality")
        .grantAll("operations", "rfx")
        .grantAll("operations", "finance")
        .grantAll("operations", "tax_compliance")
        .grantAll("operations", "supply_chain")
        .grantAll("operations", "analytics")
        .grantAll("operations", "contracts")
        .grantAll("operations", "service_appointments")
        .grantAll("operations", "notifications")
        .grantAll("operations", "system")
        .grantAll("operations", "marketing")
        .grantAll("operations", "customers")
        .grantAll("operations", "returns")
        .grantAll("operations", "customer_portal")
        .grantAll("operations", "vendor_management")
        .grantAll("operations", "service_providers")
        .grantAll("accounting", "dashboard")
        .grantAll("accounting", "general_ledger")
        .grantAll("accounting", "chart_of_accounts")
        .grantAll("accounting", "journal_entries")
        .grantAll("accounting", "invoices")
        .grantAll("accounting", "customers")
        .grantAll("accounting", "credit_notes")
        .grantAll("accounting", "sales_orders")
        .grantAll("accounting", "estimates")
        .grantAll("accounting", "bills")
        .grantAll("accounting", "vendors")
        .grantAll("accounting", "purchase_orders")
        .grantAll("accounting", "expense_reports")
        .grantAll("accounting", "vendor_credits")
        .grantAll("accounting", "banking")
        .grantAll("accounting", "tax")
        .grantAll("accounting", "reports")
        .grantAll("accounting", "analytics")
        .grantAll("accounting", "budgeting")
        .grantAll("accounting", "cost_accounting")
        .grantAll("accounting", "fixed_assets")
        .grantAll("accounting", "payroll")
        .grantAll("accounting", "projects")
        .grantAll("accounting", "inventory")
        .grantAll("accounting", "multi_entity")
        .grantAll("accounting", "compliance")
        .grantAll("accounting", "workflows")
        .grantAll("accounting", "documents")
        .grantAll("accounting", "integrations")
        .grantAll("accounting", "ai_insights")
        .grantAll("accounting", "security")
        .grantAll("accounting", "performance")
        .grantAll("accounting", "notifications")
        .grantAll("accounting", "system")
        .credits(1200000, 0, 365)
        .build();

    private EnterprisePlan() {}
}
