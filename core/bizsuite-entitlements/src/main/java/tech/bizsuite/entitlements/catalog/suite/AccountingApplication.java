package tech.bizsuite.entitlements.catalog.suite;

import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;

/**
 * Financial accounting: general ledger, receivables, payables, banking, tax and reporting.
 *
 * <p>The legacy action map and the module access map are derived from this application.
 */
public final class AccountingApplication {

    public static final String APP_CODE = "accounting";

    public static final ApplicationDefinition INSTANCE = ApplicationDefinition.builder(APP_CODE)
        .name("Financial Accounting")
        .description("Complete financial accounting solution , GL, AR, AP, banking, tax, budgeting, payroll, inventory, fixed assets, compliance, and analytics")
        .icon("💰")
        .baseUrl("https://accounting.zopkit.com")
        .version("2.0.0")
        .core(true)
        .sortOrder(5)
        .module(ModuleDefinition.builder("dashboard")
            .name("Accounting Dashboard")
            .description("Main accounting dashboard with financial overview")
            .core(true)
            .permission("view", "View Dashboard", "Access accounting dashboard")
            .permission("customize", "Customize Dashboard", "Customize dashboard layout and widgets")
            .permission("export", "Export Dashboard", "Export dashboard reports")
            .build())
        .module(ModuleDefinition.builder("general_ledger")
            .name("General Ledger")
            .description("Core general ledger, trial balance, closing and adjusting entries")
            .core(true)
            .permission("read", "View General Ledger", "View general ledger entries and balances")
            .permission("create", "Create GL Entries", "Create new general ledger entries")
            .permission("update", "Edit GL Entries", "Modify general ledger entries")
            .permission("delete", "Delete GL Entries", "Remove general ledger entries")
            .permission("post", "Post GL Entries", "Post entries to the ledger")
            .permission("approve", "Approve GL Entries", "Approve general ledger entries")
            .permission("close_period", "Close Period", "Close accounting periods")
            .permission("export", "Export GL Data", "Export general ledger data")
            .build())
        .module(ModuleDefinition.builder("chart_of_accounts")
            .name("Chart of Accounts")
            .description("Manage the chart of accounts structure")
            .core(true)
            .permission("read", "View Chart of Accounts", "View accounts in the chart")
            .permission("create", "Create Accounts", "Add new accounts to the chart")
            .permission("update", "Edit Accounts", "Modify account information")
            .permission("delete", "Delete Accounts", "Remove accounts from the chart")
            .permission("import", "Import Accounts", "Import chart of accounts from files")
            .permission("export", "Export Accounts", "Export chart of accounts")
            .build())
        .module(ModuleDefinition.builder("journal_entries")
            .name("Journal Entries")
            .description("Create and manage journal entries")
            .core(true)
            .permission("read", "View Journal Entries", "View journal entry information")
            .permission("create", "Create Journal Entries", "Create new journal entries")
            .permission("update", "Edit Journal Entries", "Modify journal entries")
            .permission("delete", "Delete Journal Entries", "Remove journal entries")
            .permission("post", "Post Journal Entries", "Post journal entries to the ledger")
            .permission("approve", "Approve Journal Entries", "Approve journal entries for posting")
            .permission("reverse", "Reverse Journal Entries", "Create reversing journal entries")
            .permission("export", "Export Journal Entries", "Export journal entry data")
            .build())
        .module(ModuleDefinition.builder("invoices")
            .name("Customer Invoices")
            .description("Create and manage customer invoices")
            .core(true)
            .permission("read", "View Invoices", "View invoice information")
            .permission("read_all", "View All Invoices", "View all invoices in organization")
            .permission("create", "Create Invoices", "Create new invoices")
            .permission("update", "Edit Invoices", "Modify invoice information")
            .permission("delete", "Delete Invoices", "Remove invoices")
            .permission("send", "Send Invoices", "Send invoices to customers")
            .permission("post", "Post Invoices", "Post invoices to the ledger")
            .permission("export", "Export Invoices", "Export invoice data")
            .permission("import", "Import Invoices", "Import invoices from files")
            .permission("generate_pdf", "Generate PDF", "Generate PDF versions of invoices")
            .build())
        .module(ModuleDefinition.builder("customers")
            .name("Customer Management")
            .description("Manage customer accounts and contacts")
            .core(true)
            .permission("read", "View Customers", "View customer information")
            .permission("read_all", "View All Customers", "View all customers in organization")
            .permission("create", "Create Customers", "Add new customers")
            .permission("update", "Edit Customers", "Modify customer information")
            .permission("delete", "Delete Customers", "Remove customers")
            .permission("export", "Export Customers", "Export customer data")
            .permission("import", "Import Customers", "Import customers from files")
            .build())
        .module(ModuleDefinition.builder("credit_notes")
            .name("Credit Notes")
            .description("Create and manage customer credit notes")
            .core(true)
            .permission("read", "View Credit Notes", "View credit note information")
            .permission("create", "Create Credit Notes", "Create new credit notes")
            .permission("update", "Edit Credit Notes", "Modify credit note information")
            .permission("delete", "Delete Credit Notes", "Remove credit notes")
            .permission("apply", "Apply Credit Notes", "Apply credit notes to invoices")
            .permission("export", "Export Credit Notes", "Export credit note data")
            .build())
        .module(ModuleDefinition.builder("sales_orders")
            .name("Sales Orders")
            .description("Manage customer sales orders")
            .core(true)
            .permission("read", "View Sales Orders", "View sales order information")
            .permission("read_all", "View All Sales Orders", "View all sales orders")
            .permission("create", "Create Sales Orders", "Create new sales orders")
            .permission("update", "Edit Sales Orders", "Modify sales order information")
            .permission("delete", "Delete Sales Orders", "Remove sales orders")
            .permission("approve", "Approve Sales Orders", "Approve sales orders")
            .permission("convert", "Convert to Invoice", "Convert sales orders to invoices")
            .permission("export", "Export Sales Orders", "Export sales order data")
            .build())
        .module(ModuleDefinition.builder("estimates")
            .name("Estimates & Quotes")
            .description("Create and manage estimates and quotations")
            .core(true)
            .permission("read", "View Estimates", "View estimate information")
            .permission("create", "Create Estimates", "Create new estimates")
            .permission("update", "Edit Estimates", "Modify estimate information")
            .permission("delete", "Delete Estimates", "Remove estimates")
            .permission("send", "Send Estimates", "Send estimates to customers")
            .permission("convert", "Convert to Invoice", "Convert estimates to invoices")
            .permission("export", "Export Estimates", "Export estimate data")
            .permission("generate_pdf", "Generate PDF", "Generate PDF versions of estimates")
            .build())
        .module(ModuleDefinition.builder("bills")
            .name("Vendor Bills")
            .description("Manage vendor bills and payments")
            .core(true)
            .permission("read", "View Bills", "View bill information")
            .permission("read_all", "View All Bills", "View all bills in organization")
            .permission("create", "Create Bills", "Create new vendor bills")
            .permission("update", "Edit Bills", "Modify bill information")
            .permission("delete", "Delete Bills", "Remove bills")
            .permission("pay", "Pay Bills", "Process bill payments")
            .permission("approve", "Approve Bills", "Approve vendor bills for payment")
            .permission("export", "Export Bills", "Export bill data")
            .build())
        .module(ModuleDefinition.builder("vendors")
            .name("Vendor Management")
            .description("Manage vendor accounts and information")
            .core(true)
            .permission("read", "View Vendors", "View vendor information")
            .permission("read_all", "View All Vendors", "View all vendors in organization")
            .permission("create", "Create Vendors", "Add new vendors")
            .permission("update", "Edit Vendors", "Modify vendor information")
            .permission("delete", "Delete Vendors", "Remove vendors")
            .permission("export", "Export Vendors", "Export vendor data")
            .permission("import", "Import Vendors", "Import vendors from files")
            .build())
        .module(ModuleDefinition.builder("purchase_orders")
            .name("Purchase Orders")
            .description("Create and manage purchase orders")
            .core(true)
            .permission("read", "View Purchase Orders", "View purchase order information")
            .permission("read_all", "View All Purchase Orders", "View all purchase orders")
            .permission("create", "Create Purchase Orders", "Create new purchase orders")
            .permission("update", "Edit Purchase Orders", "Modify purchase order information")
            .permission("delete", "Delete Purchase Orders", "Remove purchase orders")
            .permission("approve", "Approve Purchase Orders", "Approve purchase orders")
            .permission("receive", "Receive Goods", "Record receipt of purchased goods")
            .permission("export", "Export Purchase Orders", "Export purchase order data")
            .build())
        .module(ModuleDefinition.builder("expense_reports")
            .name("Expense Reports")
            .description("Manage employee expense reports and reimbursements")
            .core(true)
            .permission("read", "View Expense Reports", "View expense report information")
            .permission("read_all", "View All Expense Reports", "View all expense reports")
            .permission("create", "Create Expense Reports", "Submit expense reports")
            .permission("update", "Edit Expense Reports", "Modify expense report information")
            .permission("delete", "Delete Expense Reports", "Remove expense reports")
            .permission("approve", "Approve Expense Reports", "Approve expense reports for payment")
            .permission("reimburse", "Process Reimbursement", "Process expense reimbursements")
            .permission("export", "Export Expense Reports", "Export expense report data")
            .build())
        .module(ModuleDefinition.builder("vendor_credits")
            .name("Vendor Credits")
            .description("Manage vendor credits and debit memos")
            .core(true)
            .permission("read", "View Vendor Credits", "View vendor credit information")
            .permission("create", "Create Vendor Credits", "Create new vendor credits")
            .permission("update", "Edit Vendor Credits", "Modify vendor credit information")
            .permission("delete", "Delete Vendor Credits", "Remove vendor credits")
            .permission("apply", "Apply Vendor Credits", "Apply vendor credits to bills")
            .permission("export", "Export Vendor Credits", "Export vendor credit data")
            .build())
        .module(ModuleDefinition.builder("banking")
            .name("Banking & Reconciliation")
            .description("Bank accounts, transactions, reconciliation, and cash flow management")
            .core(true)
            .permission("read", "View Banking", "View bank account and transaction information")
            .permission("read_all", "View All Banking", "View all bank data in organization")
            .permission("create", "Create Bank Entries", "Create bank transactions and accounts")
            .permission("update", "Edit Banking", "Modify bank information")
            .permission("delete", "Delete Banking", "Remove bank records")
            .permission("reconcile", "Reconcile Accounts", "Perform bank reconciliation")
            .permission("import_feeds", "Import Bank Feeds", "Import bank feed data")
            .permission("transfer", "Wire Transfers", "Process wire transfers")
            .permission("export", "Export Banking", "Export bank data")
            .build())
        .module(ModuleDefinition.builder("tax")
            .name("Tax Management")
            .description("Tax configuration, GST/TDS (India), VAT/Sales Tax, compliance")
            .core(true)
            .permission("read", "View Tax", "View tax information and rates")
            .permission("create", "Create Tax Records", "Create new tax records")
            .permission("update", "Edit Tax", "Modify tax information")
            .permission("delete", "Delete Tax Records", "Remove tax records")
            .permission("configure", "Configure Tax Rules", "Configure tax rates and rules")
            .permission("file_returns", "File Tax Returns", "File GST/VAT returns")
            .permission("reconcile", "Tax Reconciliation", "Reconcile tax records")
            .permission("export", "Export Tax Data", "Export tax reports and data")
            .build())
        .module(ModuleDefinition.builder("reports")
            .name("Financial Reports")
            .description("P&L, Balance Sheet, Cash Flow, Trial Balance, and other financial reports")
            .core(true)
            .permission("read", "View Reports", "View financial reports")
            .permission("read_all", "View All Reports", "View all reports in organization")
            .permission("create", "Create Reports", "Create custom financial reports")
            .permission("export", "Export Reports", "Export report data to various formats")
            .permission("schedule", "Schedule Reports", "Schedule automated report generation")
            .permission("generate_pdf", "Generate PDF", "Generate PDF versions of reports")
            .build())
        .module(ModuleDefinition.builder("analytics")
            .name("Analytics & Business Intelligence")
            .description("Financial dashboards, KPI monitoring, trend analysis, data visualization")
            .core(true)
            .permission("read", "View Analytics", "View analytics and metrics")
            .permission("read_all", "View All Analytics", "View all analytics data")
            .permission("create", "Create Analytics", "Create custom analytics views")
            .permission("export", "Export Analytics", "Export analytics data")
            .permission("schedule", "Schedule Analytics", "Schedule automated analytics")
            .permission("customize_dashboards", "Customize Dashboards", "Customize analytics dashboards")
            .build())
        .module(ModuleDefinition.builder("budgeting")
            .name("Budgeting & Financial Planning")
            .description("Budgets, forecasting, variance analysis, and capital budgeting")
            .core(false)
            .permission("read", "View Budgets", "View budget information")
            .permission("read_all", "View All Budgets", "View all budgets in organization")
            .permission("create", "Create Budgets", "Create new budgets")
            .permission("update", "Edit Budgets", "Modify budget information")
            .permission("delete", "Delete Budgets", "Remove budgets")
            .permission("approve", "Approve Budgets", "Approve budgets")
            .permission("forecast", "Create Forecasts", "Create financial forecasts")
            .permission("export", "Export Budgets", "Export budget data")
            .build())
        .module(ModuleDefinition.builder("cost_accounting")
            .name("Cost Accounting")
            .description("Cost centers, job costing, and activity-based costing")
            .core(false)
            .permission("read", "View Cost Accounting", "View cost accounting data")
            .permission("read_all", "View All Cost Data", "View all cost data in organization")
            .permission("create", "Create Cost Entries", "Create new cost entries")
            .permission("update", "Edit Cost Entries", "Modify cost entries")
            .permission("delete", "Delete Cost Entries", "Remove cost entries")
            .permission("allocate", "Allocate Costs", "Allocate costs to centers and jobs")
            .permission("export", "Export Cost Data", "Export cost accounting data")
            .build())
        .module(ModuleDefinition.builder("fixed_assets")
            .name("Fixed Asset Management")
            .description("Asset register, depreciation, disposal, transfers, and maintenance")
            .core(false)
            .permission("read", "View Fixed Assets", "View asset information")
            .permission("read_all", "View All Assets", "View all assets in organization")
            .permission("create", "Create Assets", "Register new assets")
            .permission("update", "Edit Assets", "Modify asset information")
            .permission("delete", "Delete Assets", "Remove assets")
            .permission("depreciate", "Run Depreciation", "Process depreciation calculations")
            .permission("dispose", "Dispose Assets", "Record asset disposals")
            .permission("transfer", "Transfer Assets", "Transfer assets between locations")
            .permission("export", "Export Assets", "Export asset data")
            .build())
        .module(ModuleDefinition.builder("payroll")
            .name("Payroll Management")
            .description("Employee payroll processing, tax management, benefits, and reports")
            .core(false)
            .permission("read", "View Payroll", "View payroll information")
            .permission("read_all", "View All Payroll", "View all payroll data")
            .permission("create", "Create Payroll", "Create payroll records")
            .permission("update", "Edit Payroll", "Modify payroll information")
            .permission("delete", "Delete Payroll", "Remove payroll records")
            .permission("run", "Run Payroll", "Process payroll calculations")
            .permission("approve", "Approve Payroll", "Approve payroll for processing")
            .permission("view_salary", "View Salary Details", "View employee salary information")
            .permission("export", "Export Payroll", "Export payroll data and reports")
            .build())
        .module(ModuleDefinition.builder("projects")
            .name("Project Accounting")
            .description("Project costing, billing, time tracking, resource allocation, profitability")
            .core(false)
            .permission("read", "View Projects", "View project information")
            .permission("read_all", "View All Projects", "View all projects in organization")
            .permission("create", "Create Projects", "Create new projects")
            .permission("update", "Edit Projects", "Modify project information")
            .permission("delete", "Delete Projects", "Remove projects")
            .permission("track_time", "Track Time", "Record time against projects")
            .permission("bill", "Bill Projects", "Generate project invoices")
            .permission("allocate_resources", "Allocate Resources", "Allocate resources to projects")
            .permission("export", "Export Projects", "Export project data")
            .build())
        .module(ModuleDefinition.builder("inventory")
            .name("Inventory Management")
            .description("Items, stock levels, locations, transactions, and stock alerts")
            .core(false)
            .permission("read", "View Inventory", "View inventory information")
            .permission("read_all", "View All Inventory", "View all inventory items")
            .permission("create", "Create Inventory Items", "Add new inventory items")
            .permission("update", "Edit Inventory", "Modify inventory information")
            .permission("delete", "Delete Inventory", "Remove inventory items")
            .permission("adjust", "Adjust Stock", "Adjust stock quantities")
            .permission("movement", "Track Movements", "Record stock movements and transfers")
            .permission("count", "Perform Stock Counts", "Perform inventory counts")
            .permission("export", "Export Inventory", "Export inventory data")
            .permission("import", "Import Inventory", "Import inventory from files")
            .build())
        .module(ModuleDefinition.builder("multi_entity")
            .name("Multi-Entity Management")
            .description("Entity management, consolidation, inter-company transactions, currency management")
            .core(false)
            .permission("read", "View Entities", "View entity information")
            .permission("read_all", "View All Entities", "View all entities in organization")
            .permission("create", "Create Entities", "Create new entities")
            .permission("update", "Edit Entities", "Modify entity information")
            .permission("delete", "Delete Entities", "Remove entities")
            .permission("consolidate", "Consolidate", "Perform financial consolidation")
            .permission("inter_company", "Inter-Company Transactions", "Manage inter-company transactions")
            .permission("manage_currency", "Manage Currency", "Manage multi-currency settings")
            .permission("export", "Export Entity Data", "Export multi-entity data")
            .build())
        .module(ModuleDefinition.builder("compliance")
            .name("Compliance & Audit")
            .description("Audit trail, internal controls, risk management, SOX, regulatory reports")
            .core(true)
            .permission("read", "View Compliance", "View compliance information")
            .permission("read_all", "View All Compliance", "View all compliance data")
            .permission("create", "Create Compliance Records", "Create compliance records")
            .permission("update", "Edit Compliance", "Modify compliance records")
            .permission("delete", "Delete Compliance Records", "Remove compliance records")
            .permission("manage_controls", "Manage Controls", "Manage internal controls")
            .permission("manage_risks", "Manage Risks", "Manage risk assessments")
            .permission("audit_trail", "View Audit Trail", "Access audit trail logs")
            .permission("export", "Export Compliance", "Export compliance and audit data")
            .build())
        .module(ModuleDefinition.builder("workflows")
            .name("Workflow Management")
            .description("Approval workflows, templates, and automation")
            .core(true)
            .permission("read", "View Workflows", "View workflow information")
            .permission("read_all", "View All Workflows", "View all workflows")
            .permission("create", "Create Workflows", "Create new workflow templates")
            .permission("update", "Edit Workflows", "Modify workflow definitions")
            .permission("delete", "Delete Workflows", "Remove workflows")
            .permission("approve", "Approve in Workflows", "Approve items in workflow queues")
            .permission("manage_templates", "Manage Templates", "Manage workflow templates")
            .permission("export", "Export Workflows", "Export workflow data")
            .build())
        .module(ModuleDefinition.builder("documents")
            .name("Document Management")
            .description("Financial document storage and management")
            .core(true)
            .permission("read", "View Documents", "View document information")
            .permission("read_all", "View All Documents", "View all documents")
            .permission("create", "Upload Documents", "Upload new documents")
            .permission("update", "Edit Documents", "Modify document metadata")
            .permission("delete", "Delete Documents", "Remove documents")
            .permission("download", "Download Documents", "Download document files")
            .permission("export", "Export Documents", "Export document data")
            .build())
        .module(ModuleDefinition.builder("integrations")
            .name("Integrations")
            .description("Third-party connections, API keys, webhooks, sync jobs")
            .core(false)
            .permission("read", "View Integrations", "View integration information")
            .permission("create", "Create Integrations", "Set up new integrations")
            .permission("update", "Edit Integrations", "Modify integration settings")
            .permission("delete", "Delete Integrations", "Remove integrations")
            .permission("manage_api_keys", "Manage API Keys", "Manage API keys")
            .permission("manage_webhooks", "Manage Webhooks", "Manage webhook endpoints")
            .permission("sync", "Run Sync Jobs", "Trigger data sync jobs")
            .permission("export", "Export Integration Logs", "Export integration logs")
            .build())
        .module(ModuleDefinition.builder("ai_insights")
            .name("AI-Powered Insights")
            .description("AI-powered financial insights, predictive analytics, anomaly detection")
            .core(false)
            .permission("read", "View AI Insights", "View AI-generated insights")
            .permission("read_all", "View All Insights", "View all AI insights")
            .permission("generate", "Generate Insights", "Generate new AI insights")
            .permission("export", "Export Insights", "Export insight data")
            .permission("configure", "Configure AI", "Configure AI models and parameters")
            .build())
        .module(ModuleDefinition.builder("security")
            .name("Security Management")
            .description("Encryption, MFA, SSO, threat intelligence, security policies")
            .core(false)
            .permission("read", "View Security", "View security information and settings")
            .permission("configure", "Configure Security", "Configure security settings")
            .permission("manage_mfa", "Manage MFA", "Manage multi-factor authentication")
            .permission("manage_sso", "Manage SSO", "Manage single sign-on settings")
            .permission("manage_policies", "Manage Policies", "Manage security policies")
            .permission("view_threats", "View Threats", "View threat intelligence")
            .permission("manage_alerts", "Manage Alerts", "Manage security alerts")
            .permission("export", "Export Security Data", "Export security reports")
            .build())
        .module(ModuleDefinition.builder("performance")
            .name("Performance & Monitoring")
            .description("System performance dashboards, cache management, job queues")
            .core(false)
            .permission("read", "View Performance", "View performance metrics")
            .permission("manage_cache", "Manage Cache", "Manage system cache")
            .permission("manage_jobs", "Manage Jobs", "Manage background job queues")
            .permission("configure_alerts", "Configure Alerts", "Configure performance alerts")
            .permission("export", "Export Metrics", "Export performance metrics")
            .build())
        .module(ModuleDefinition.builder("notifications")
            .name("Notifications")
            .description("System notifications and alerts")
            .core(true)
            .permission("read", "View Notifications", "View notifications")
            .permission("update", "Manage Notifications", "Update notification settings")
            .permission("manage_preferences", "Manage Preferences", "Manage notification preferences")
            .build())
        .module(ModuleDefinition.builder("system")
            .name("System Administration")
            .description("User management, roles & permissions, company settings, audit logs, backups")
            .core(true)
            .permission("settings_read", "View Settings", "View system settings")
            .permission("settings_update", "Update Settings", "Update system settings")
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
            .permission("roles_read_all", "View All Roles", "View all roles")
            .permission("roles_create", "Create Roles", "Create new roles")
            .permission("roles_update", "Edit Roles", "Modify role permissions")
            .permission("roles_delete", "Delete Roles", "Remove roles")
            .permission("roles_assign", "Assign Roles", "Assign roles to users")
            .permission("roles_export", "Export Roles", "Export role data")
            .permission("audit_read", "View Audit Logs", "View audit log information")
            .permission("audit_read_all", "View All Audit Logs", "View all audit logs")
            .permission("audit_export", "Export Audit Logs", "Export audit log data")
            .permission("tenant_config_read", "View Tenant Config", "View tenant-specific configurations")
            .permission("tenant_config_update", "Update Tenant Config", "Update tenant configurations")
            .permission("credit_config_view", "View Credit Config", "View credit configuration settings")
            .permission("credit_config_edit", "Edit Credit Config", "Edit credit configuration settings")
            .permission("backup_create", "Create Backups", "Create system backups")
            .permission("backup_restore", "Restore Backups", "Restore system from backups")
            .permission("dropdowns_read", "View Dropdowns", "View dropdown values")
            .permission("dropdowns_manage", "Manage Dropdowns", "Create/update/delete dropdown values")
            .permission("fiscal_year_manage", "Manage Fiscal Year", "Manage fiscal year setup")
            .permission("sequences_manage", "Manage Sequences", "Manage number sequences")
            .permission("wrapper_sync", "Wrapper Sync", "Trigger and view Wrapper tenant sync")
            .build())
        .build();

    private AccountingApplication() {}
}
