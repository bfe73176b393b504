package tech.bizsuite.entitlements.plan.suite;

import tech.bizsuite.entitlements.plan.PlanAccessEntry;

/**
 * Professional tier: full CRM sales cycle, payroll, agile project management and advanced accounting.
 */
public final class ProfessionalPlan {

    public static final String PLAN_ID = "professional";

    public static final PlanAccessEntry INSTANCE = PlanAccessEntry.builder(PLAN_ID)
        .grant("crm", "leads", "read", "read_all", "create", "update", "delete", "export", "import",
            "assign", "convert")
        .grant("crm", "contacts", "read", "read_all", "create", "update", "delete", "export", "import")
        .grant("crm", "accounts", "read", "read_all", "create", "update", "delete", "export", "import",
            "assign")
        .grant("crm", "opportunities", "read", "read_all", "create", "update", "delete", "export",
            "import", "close", "assign")
        .grant("crm", "quotations", "read", "read_all", "create", "update", "delete", "approve")
        .grant("crm", "invoices", "read", "read_all", "create", "update", "delete", "export", "send")
        .grant("crm", "inventory", "read", "create", "update", "delete", "adjust")
        .grant("crm", "product_orders", "read", "create", "update", "delete")
        .grant("crm", "tickets", "read", "read_all", "create", "update", "delete", "assign")
        .grant("crm", "communications", "read", "create", "update", "delete", "send")
        .grant("crm", "calendar", "read", "create", "update", "delete")
        .grant("crm", "dashboard", "view")
        .grant("hr", "employees", "read", "read_all", "create", "update", "delete")
        .grant("hr", "payroll", "read", "process")
        .grant("hr", "leave", "read", "create", "approve", "reject")
        .grant("hr", "dashboard", "view")
        .grant("project_management", "projects", "read", "read_all", "create", "update", "delete",
            "export", "import", "assign", "archive", "restore", "manage_budget", "manage_timeline",
            "manage_settings")
        .grant("project_management", "tasks", "read", "read_all", "create", "update", "delete", "export",
            "import", "assign", "reassign", "change_status", "change_priority", "add_subtasks",
            "manage_dependencies", "add_attachments", "add_comments", "time_track")
        .grant("project_management", "sprints", "read", "read_all", "create", "update", "delete",
            "export", "start", "complete", "cancel", "manage_capacity", "assign_tasks", "view_burndown")
        .grant("project_management", "time_tracking", "read", "read_all", "create", "update", "delete",
            "export", "import", "approve", "reject", "view_reports", "manage_billable")
        .grant("project_management", "team", "read", "read_all", "create", "update", "delete", "export",
            "import", "assign_roles", "manage_permissions", "view_performance", "manage_availability")
        .grant("project_management", "backlog", "read", "read_all", "create", "update", "delete",
            "export", "import", "prioritize", "estimate", "move_to_sprint", "manage_epics")
        .grant("project_management", "documents", "read", "read_all", "create", "update", "delete",
            "export", "download", "share", "version_control", "add_comments", "approve",
            "manage_permissions")
        .grant("project_management", "analytics", "read", "read_all", "create", "update", "delete",
            "export", "schedule", "view_dashboards", "customize_dashboards", "view_project_health",
            "view_team_performance", "view_burndown", "view_velocity")
        .grant("project_management", "reports", "read", "read_all", "create", "update", "delete",
            "export", "schedule", "share", "generate_pdf", "customize")
        .grant("project_management", "chat", "read", "read_all", "create", "update", "delete",
            "create_channels", "manage_channels", "delete_channels", "mention_users", "share_files",
            "pin_messages")
        .grant("project_management", "calendar", "read", "read_all", "create", "update", "delete",
            "export", "import", "share", "manage_recurring")
        .grant("project_management", "kanban", "read", "read_all", "create", "update", "delete",
            "move_cards", "manage_columns", "manage_filters", "export")
        .grant("project_management", "dashboard", "view", "customize", "export", "share",
            "create_widgets", "manage_widgets")
        .grant("project_management", "notifications", "read", "read_all", "create", "update", "delete",
            "manage_preferences", "mark_read", "bulk_actions")
        .grant("project_management", "workspace", "read", "read_all", "create", "update", "delete",
            "manage_members", "manage_roles", "manage_settings", "export", "archive", "restore")
        .grant("accounting", "dashboard", "view", "customize", "export")
        .grant("accounting", "general_ledger", "read", "create", "update", "delete", "post", "approve",
            "close_period", "export")
        .grant("accounting", "chart_of_accounts", "read", "create", "update", "delete", "import",
            "export")
        .grant("accounting", "journal_entries", "read", "create", "update", "delete", "post", "approve",
            "reverse", "export")
        .grant("accounting", "invoices", "read", "read_all", "create", "update", "delete", "send",
            "post", "export", "import", "generate_pdf")
        .grant("accounting", "customers", "read", "read_all", "create", "update", "delete", "export",
            "import")
        .grant("accounting", "credit_notes", "read", "create", "update", "delete", "apply", "export")
        .grant("accounting", "sales_orders", "read", "read_all", "create", "update", "delete", "approve",
            "convert", "export")
        .grant("accounting", "estimates", "read", "create", "update", "delete", "send", "convert",
            "export", "generate_pdf")
        .grant("accounting", "bills", "read", "read_all", "create", "update", "delete", "pay", "approve",
            "export")
        .grant("accounting", "vendors", "read", "read_all", "create", "update", "delete", "export",
            "import")
        .grant("accounting", "purchase_orders", "read", "read_all", "create", "update", "delete",
            "approve", "receive", "export")
        .grant("accounting", "expense_reports", "read", "read_all", "create", "update", "delete",
            "approve", "reimburse", "export")
        .grant("accounting", "vendor_credits", "read", "create", "update", "delete", "apply", "export")
        .grant("accounting", "banking", "read", "read_all", "create", "update", "delete", "reconcile",
            "import_feeds", "transfer", "export")
        .grant("accounting", "tax", "read", "create", "update", "delete", "configure", "file_returns",
            "reconcile", "export")
        .grant("accounting", "reports", "read", "read_all", "create", "export", "schedule",
            "generate_pdf")
        .grant("accounting", "analytics", "read", "read_all", "create", "export", "schedule",
            "customize_dashboards")
        .grant("accounting", "budgeting", "read", "read_all", "create", "update", "delete", "approve",
            "forecast", "export")
        .grant("accounting", "cost_accounting", "read", "read_all", "create", "update", "delete",
            "allocate", "export")
        .grant("accounting", "fixed_assets", "read", "read_all", "create", "update", "delete",
            "depreciate", "dispose", "transfer", "export")
        .grant("accounting", "payroll", "read", "read_all", "create", "update", "run", "approve",
            "view_salary", "export")
        .grant("accounting", "projects", "read", "read_all", "create", "update", "delete", "track_time",
            "bill", "allocate_resources", "export")
        .grant("accounting", "inventory", "read", "read_all", "create", "update", "delete", "adjust",
            "movement", "count", "export", "import")
        .grant("accounting", "compliance", "read", "read_all", "create", "update", "manage_controls",
            "audit_trail", "export")
        .grant("accounting", "workflows", "read", "read_all", "create", "update", "delete", "approve",
            "manage_templates", "export")
        .grant("accounting", "documents", "read", "read_all", "create", "update", "delete", "download",
            "export")
        .grant("accounting", "integrations", "read", "create", "update", "delete", "manage_api_keys",
            "manage_webhooks", "sync")
        .grant("accounting", "notifications", "read", "update", "manage_preferences")
        .grant("accounting", "system", "settings_read", "settings_update", "users_read",
            "users_read_all", "users_create", "users_update", "users_delete", "users_activate",
            "users_export", "roles_read", "roles_read_all", "roles_create", "roles_update",
            "roles_delete", "roles_assign", "roles_export", "audit_read", "audit_read_all",
            "audit_export", "tenant_config_read", "tenant_config_update", "credit_config_view",
            "credit_config_edit", "dropdowns_read", "dropdowns_manage", "fiscal_year_manage",
            "sequences_manage")
        .credits(300000, 0, 365)
        .build();

    private ProfessionalPlan() {}
}
