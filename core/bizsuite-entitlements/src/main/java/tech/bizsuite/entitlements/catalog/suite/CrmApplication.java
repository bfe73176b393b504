package tech.bizsuite.entitlements.catalog.suite;

import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;

/**
 * Customer relationship management: leads, accounts, opportunities, quoting, ticketing
 * and the CRM system administration module.
 */
public final class CrmApplication {

    public static final String APP_CODE = "crm";

    public static final ApplicationDefinition INSTANCE = ApplicationDefinition.builder(APP_CODE)
        .name("Customer Relationship Management")
        .description("Complete CRM solution for managing customers, deals, and sales pipeline")
        .icon("🎫")
        .baseUrl("https://crm.zopkit.com")
        .version("2.0.0")
        .core(true)
        .sortOrder(1)
        .module(ModuleDefinition.builder("leads")
            .name("Lead Management")
            .description("Manage sales leads and prospects")
            .core(true)
            .permission("read", "View Leads", "View and browse lead information")
            .permission("read_all", "View All Leads", "View all leads in organization")
            .permission("create", "Create Leads", "Add new leads to the system")
            .permission("update", "Edit Leads", "Modify existing lead information")
            .permission("delete", "Delete Leads", "Remove leads from the system")
            .permission("export", "Export Leads", "Export lead data to various formats")
            .permission("import", "Import Leads", "Import leads from external files")
            .permission("assign", "Assign Leads", "Assign leads to other users")
            .permission("convert", "Convert Leads", "Convert leads to opportunities")
            .build())
        .module(ModuleDefinition.builder("accounts")
            .name("Account Management")
            .description("Manage customer accounts and companies")
            .core(true)
            .permission("read", "View Accounts", "View and browse account information")
            .permission("read_all", "View All Accounts", "View all accounts in organization")
            .permission("create", "Create Accounts", "Add new accounts to the system")
            .permission("update", "Edit Accounts", "Modify existing account information")
            .permission("delete", "Delete Accounts", "Remove accounts from the system")
            .permission("export", "Export Accounts", "Export account data")
            .permission("import", "Import Accounts", "Import accounts from files")
            .permission("assign", "Assign Accounts", "Assign accounts to other users")
            .build())
        .module(ModuleDefinition.builder("contacts")
            .name("Contact Management")
            .description("Manage customer contacts and relationships")
            .core(true)
            .permission("read", "View Contacts", "View and browse contact information")
            .permission("read_all", "View All Contacts", "View all contacts in organization")
            .permission("create", "Create Contacts", "Add new contacts to the system")
            .permission("update", "Edit Contacts", "Modify existing contact information")
            .permission("delete", "Delete Contacts", "Remove contacts from the system")
            .permission("export", "Export Contacts", "Export contact data")
            .permission("import", "Import Contacts", "Import contacts from files")
            .permission("assign", "Assign Contacts", "Assign contacts to other users")
            .build())
        .module(ModuleDefinition.builder("opportunities")
            .name("Opportunity Management")
            .description("Manage sales opportunities and deals")
            .core(true)
            .permission("read", "View Opportunities", "View opportunity information")
            .permission("read_all", "View All Opportunities", "View all opportunities in organization")
            .permission("create", "Create Opportunities", "Add new opportunities")
            .permission("update", "Edit Opportunities", "Modify opportunity information")
            .permission("delete", "Delete Opportunities", "Remove opportunities")
            .permission("export", "Export Opportunities", "Export opportunity data")
            .permission("import", "Import Opportunities", "Import opportunities from files")
            .permission("close", "Close Opportunities", "Mark opportunities as won/lost")
            .permission("assign", "Assign Opportunities", "Assign opportunities to other users")
            .build())
        .module(ModuleDefinition.builder("quotations")
            .name("Quote Management")
            .description("Create and manage sales quotations")
            .core(false)
            .permission("read", "View Quotations", "View quotation information")
            .permission("read_all", "View All Quotations", "View all quotations in organization")
            .permission("create", "Create Quotations", "Create new quotations")
            .permission("update", "Edit Quotations", "Modify quotation information")
            .permission("delete", "Delete Quotations", "Remove quotations")
            .permission("generate_pdf", "Generate PDF", "Generate PDF versions of quotations")
            .permission("send", "Send Quotations", "Send quotations to customers")
            .permission("approve", "Approve Quotations", "Approve quotations for sending")
            .permission("assign", "Assign Quotations", "Assign quotations to other users")
            .build())
        .module(ModuleDefinition.builder("invoices")
            .name("Invoice Management")
            .description("Create and manage customer invoices")
            .core(true)
            .permission("read", "View Invoices", "View invoice information")
            .permission("read_all", "View All Invoices", "View all invoices in organization")
            .permission("create", "Create Invoices", "Create new invoices")
            .permission("update", "Edit Invoices", "Modify invoice information")
            .permission("delete", "Delete Invoices", "Remove invoices")
            .permission("export", "Export Invoices", "Export invoice data")
            .permission("send", "Send Invoices", "Send invoices to customers")
            .permission("mark_paid", "Mark as Paid", "Mark invoices as paid")
            .permission("generate_pdf", "Generate PDF", "Generate PDF versions")
            .permission("assign", "Assign Invoices", "Assign invoices to other users")
            .build())
        .module(ModuleDefinition.builder("inventory")
            .name("Inventory Management")
            .description("Manage product inventory and stock levels")
            .core(true)
            .permission("read", "View Inventory", "View inventory information")
            .permission("read_all", "View All Inventory", "View all inventory items")
            .permission("create", "Create Inventory Items", "Add new inventory items")
            .permission("update", "Edit Inventory", "Modify inventory information")
            .permission("delete", "Delete Inventory", "Remove inventory items")
            .permission("export", "Export Inventory", "Export inventory data")
            .permission("import", "Import Inventory", "Import inventory from files")
            .permission("adjust", "Adjust Stock Levels", "Adjust inventory quantities")
            .permission("movement", "Track Movements", "Track inventory movements")
            .build())
        .module(ModuleDefinition.builder("product_orders")
            .name("Product Order Management")
            .description("Manage product orders and fulfillment")
            .core(true)
            .permission("read", "View Product Orders", "View product order information")
            .permission("read_all", "View All Product Orders", "View all product orders")
            .permission("create", "Create Product Orders", "Create new product orders")
            .permission("update", "Edit Product Orders", "Modify order information")
            .permission("delete", "Delete Product Orders", "Remove product orders")
            .permission("export", "Export Orders", "Export order data")
            .permission("import", "Import Orders", "Import orders from files")
            .permission("process", "Process Orders", "Process and fulfill orders")
            .permission("assign", "Assign Orders", "Assign orders to other users")
            .build())
        .module(ModuleDefinition.builder("sales_orders")
            .name("Sales Order Management")
            .description("Manage sales orders and transactions")
            .core(true)
            .permission("read", "View Sales Orders", "View sales order information")
            .permission("read_all", "View All Sales Orders", "View all sales orders")
            .permission("create", "Create Sales Orders", "Create new sales orders")
            .permission("update", "Edit Sales Orders", "Modify sales order information")
            .permission("delete", "Delete Sales Orders", "Remove sales orders")
            .permission("export", "Export Sales Orders", "Export sales order data")
            .permission("import", "Import Sales Orders", "Import sales orders from files")
            .permission("approve", "Approve Sales Orders", "Approve sales orders")
            .permission("assign", "Assign Sales Orders", "Assign sales orders to other users")
            .build())
        .module(ModuleDefinition.builder("tickets")
            .name("Support Ticket Management")
            .description("Manage customer support tickets and issues")
            .core(true)
            .permission("read", "View Tickets", "View ticket information")
            .permission("read_all", "View All Tickets", "View all tickets in organization")
            .permission("create", "Create Tickets", "Create new support tickets")
            .permission("update", "Edit Tickets", "Modify ticket information")
            .permission("delete", "Delete Tickets", "Remove tickets")
            .permission("assign", "Assign Tickets", "Assign tickets to agents")
            .permission("resolve", "Resolve Tickets", "Mark tickets as resolved")
            .permission("escalate", "Escalate Tickets", "Escalate urgent tickets")
            .permission("export", "Export Tickets", "Export ticket data")
            .permission("import", "Import Tickets", "Import tickets from files")
            .build())
        .module(ModuleDefinition.builder("communications")
            .name("Communication Management")
            .description("Manage customer communications and interactions")
            .core(true)
            .permission("read", "View Communications", "View communication history")
            .permission("read_all", "View All Communications", "View all communications")
            .permission("create", "Create Communications", "Create new communications")
            .permission("update", "Edit Communications", "Modify communication content")
            .permission("delete", "Delete Communications", "Remove communications")
            .permission("export", "Export Communications", "Export communication data")
            .permission("send", "Send Communications", "Send communications to customers")
            .permission("schedule", "Schedule Communications", "Schedule future communications")
            .build())
        .module(ModuleDefinition.builder("calendar")
            .name("Calendar Management")
            .description("Manage appointments, meetings, and schedules")
            .core(true)
            .permission("read", "View Calendar", "View calendar events")
            .permission("read_all", "View All Events", "View all calendar events")
            .permission("create", "Create Events", "Create new calendar events")
            .permission("update", "Edit Events", "Modify event information")
            .permission("delete", "Delete Events", "Remove calendar events")
            .permission("export", "Export Calendar", "Export calendar data")
            .permission("import", "Import Events", "Import events from files")
            .permission("share", "Share Events", "Share events with others")
            .build())
        .module(ModuleDefinition.builder("ai_insights")
            .name("AI Insights & Analytics")
            .description("AI-powered insights and predictive analytics")
            .core(false)
            .permission("read", "View AI Insights", "View AI-generated insights")
            .permission("read_all", "View All Insights", "View all AI insights")
            .permission("generate", "Generate Insights", "Generate new AI insights")
            .permission("export", "Export Insights", "Export insight data")
            .permission("schedule", "Schedule Insights", "Schedule automated insights")
            .build())
        .module(ModuleDefinition.builder("dashboard")
            .name("CRM Dashboard")
            .description("CRM analytics and reporting dashboard")
            .core(true)
            .permission("view", "View Dashboard", "Access CRM dashboard")
            .permission("customize", "Customize Dashboard", "Customize dashboard layout and widgets")
            .permission("export", "Export Reports", "Export dashboard reports")
            .build())
        .module(ModuleDefinition.builder("form_builder")
            .name("Form Builder")
            .description("Create and manage dynamic form templates")
            .core(false)
            .permission("read", "View Forms", "View form templates and builder")
            .permission("read_all", "View All Forms", "View all form templates in organization")
            .permission("create", "Create Forms", "Create new form templates")
            .permission("update", "Edit Forms", "Modify existing form templates")
            .permission("delete", "Delete Forms", "Remove form templates")
            .permission("export", "Export Forms", "Export form template data")
            .permission("import", "Import Forms", "Import form templates from files")
            .permission("publish", "Publish Forms", "Publish forms for use")
            .permission("duplicate", "Duplicate Forms", "Duplicate existing form templates")
            .permission("view_analytics", "View Form Analytics", "View analytics for form submissions")
            .permission("manage_layout", "Manage Layout", "Manage form layout and design")
            .build())
        .module(ModuleDefinition.builder("analytics")
            .name("Analytics & Reporting")
            .description("Create and manage analytics formulas, calculations, and insights")
            .core(false)
            .permission("read", "View Analytics", "View analytics formulas and results")
            .permission("read_all", "View All Analytics", "View all analytics in organization")
            .permission("create", "Create Analytics", "Create new analytics formulas")
            .permission("update", "Edit Analytics", "Modify existing analytics formulas")
            .permission("delete", "Delete Analytics", "Remove analytics formulas")
            .permission("export", "Export Analytics", "Export analytics data and reports")
            .permission("calculate", "Calculate Analytics", "Execute analytics calculations")
            .permission("generate_formula", "Generate Formulas", "Generate formulas from descriptions using AI")
            .permission("validate_formula", "Validate Formulas", "Validate analytics formulas")
            .permission("suggest_metrics", "Suggest Metrics", "Get AI-suggested metrics for forms")
            .permission("generate_insights", "Generate Insights", "Generate insights from analytics results")
            .permission("manage_dashboards", "Manage Dashboards", "Create and manage analytics dashboard views")
            .permission("view_dashboards", "View Dashboards", "View analytics dashboard views")
            .build())
        .module(ModuleDefinition.builder("system")
            .name("System Configuration")
            .description("System administration and configuration management")
            .core(true)
            .permission("settings_read", "View Settings", "View system settings and configurations")
            .permission("settings_update", "Update Settings", "Update system settings")
            .permission("configurations_read", "View Configurations", "View system configurations")
            .permission("configurations_create", "Create Configurations", "Create new system configurations")
            .permission("configurations_update", "Update Configurations", "Update existing configurations")
            .permission("configurations_delete", "Delete Configurations", "Delete system configurations")
            .permission("tenant_config_read", "View Tenant Config", "View tenant-specific configurations")
            .permission("tenant_config_update", "Update Tenant Config", "Update tenant configurations")
            .permission("admin_tenants_read", "View All Tenants", "View and list all tenants in the system")
            .permission("credit_config_view", "View Credit Configurations", "View tenant credit configuration settings")
            .permission("credit_config_edit", "Edit Credit Configurations", "Edit tenant credit configuration settings")
            .permission("credit_config_reset", "Reset Credit Configurations", "Reset tenant configurations to global defaults")
            .permission("credit_config_bulk_update", "Bulk Update Credit Configurations", "Bulk update multiple credit configuration settings")
            .permission("system_config_read", "View System Config", "View system-level configurations")
            .permission("system_config_update", "Update System Config", "Update system-level configurations")
            .permission("dropdowns_read", "View Dropdowns", "View system dropdown values")
            .permission("dropdowns_create", "Create Dropdowns", "Create new dropdown values")
            .permission("dropdowns_update", "Update Dropdowns", "Update dropdown values")
            .permission("dropdowns_delete", "Delete Dropdowns", "Delete dropdown values")
            .permission("integrations_read", "View Integrations", "View system integrations")
            .permission("integrations_create", "Create Integrations", "Create new integrations")
            .permission("integrations_update", "Update Integrations", "Update existing integrations")
            .permission("integrations_delete", "Delete Integrations", "Delete integrations")
            .permission("backup_read", "View Backups", "View backup information and history")
            .permission("backup_create", "Create Backups", "Create system backups")
            .permission("backup_restore", "Restore Backups", "Restore system from backups")
            .permission("maintenance_read", "View Maintenance", "View maintenance schedules and status")
            .permission("maintenance_perform", "Perform Maintenance", "Execute maintenance operations")
            .permission("maintenance_schedule", "Schedule Maintenance", "Schedule maintenance operations")
            .permission("users_read", "View Users", "View user information")
            .permission("users_read_all", "View All Users", "View all users in organization")
            .permission("users_create", "Create Users", "Create new user accounts")
            .permission("users_update", "Edit Users", "Modify user information")
            .permission("users_delete", "Delete Users", "Remove user accounts")
            .permission("users_activate", "Activate Users", "Activate/deactivate users")
            .permission("users_reset_password", "Reset Passwords", "Reset user passwords")
            .permission("users_export", "Export Users", "Export user data")
            .permission("users_import", "Import Users", "Import users from files")
            .permission("roles_read", "View Roles", "View role information")
            .permission("roles_read_all", "View All Roles", "View all roles in organization")
            .permission("roles_create", "Create Roles", "Create new roles")
            .permission("roles_update", "Edit Roles", "Modify role information")
            .permission("roles_delete", "Delete Roles", "Remove roles")
            .permission("roles_assign", "Assign Roles", "Assign roles to users")
            .permission("roles_export", "Export Roles", "Export role data")
            .permission("reports_read", "View Reports", "View report information")
            .permission("reports_read_all", "View All Reports", "View all reports")
            .permission("reports_create", "Create Reports", "Create new reports")
            .permission("reports_update", "Edit Reports", "Modify existing reports")
            .permission("reports_delete", "Delete Reports", "Remove reports")
            .permission("reports_export", "Export Reports", "Export report data")
            .permission("reports_schedule", "Schedule Reports", "Schedule automated reports")
            .permission("audit_read", "View Audit Logs", "View basic audit log information")
            .permission("audit_read_all", "View All Audit Logs", "View all audit logs in organization")
            .permission("audit_export", "Export Audit Logs", "Export audit log data to various formats")
            .permission("audit_view_details", "View Audit Details", "View detailed audit log information")
            .permission("audit_filter", "Filter Audit Logs", "Filter audit logs by various criteria")
            .permission("audit_generate_reports", "Generate Reports", "Generate audit reports")
            .permission("audit_archive", "Archive Logs", "Archive old audit logs")
            .permission("audit_purge", "Purge Old Logs", "Purge old audit logs")
            .permission("activity_logs_read", "View Activity Logs", "View activity log information")
            .permission("activity_logs_read_all", "View All Activity Logs", "View all activity logs in organization")
            .permission("activity_logs_export", "Export Activity Logs", "Export activity log data")
            .permission("activity_logs_view_details", "View Activity Details", "View detailed activity information")
            .permission("activity_logs_filter", "Filter Activity Logs", "Filter activity logs by various criteria")
            .permission("activity_logs_generate_reports", "Generate Reports", "Generate activity log reports")
            .permission("activity_logs_archive", "Archive Logs", "Archive old activity logs")
            .permission("activity_logs_purge", "Purge Old Logs", "Purge old activity logs")
            .build())
        .build();

    private CrmApplication() {}
}
