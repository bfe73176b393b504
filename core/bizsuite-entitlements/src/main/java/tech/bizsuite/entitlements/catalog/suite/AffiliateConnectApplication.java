package tech.bizsuite.entitlements.catalog.suite;

import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;

/**
 * Affiliate and influencer marketing platform.
 */
public final class AffiliateConnectApplication {

    public static final String APP_CODE = "affiliate_connect";

    public static final ApplicationDefinition INSTANCE = ApplicationDefinition.builder(APP_CODE)
        .name("Affiliate Connect Platform")
        .description("Comprehensive multi-tenant SaaS platform for affiliate and influencer marketing management")
        .icon("🤝")
        .baseUrl("https://affiliate-connect.railway.app")
        .version("1.0.0")
        .core(true)
        .sortOrder(3)
        .module(ModuleDefinition.builder("dashboard")
            .name("Dashboard & Analytics")
            .description("Main dashboard with analytics and performance metrics")
            .core(true)
            .permission("view_dashboard", "View Dashboard", "Access main dashboard interface")
            .permission("view_analytics", "View Analytics", "View performance analytics and metrics")
            .permission("view_reports", "View Reports", "Access reporting and insights")
            .permission("export_data", "Export Data", "Export dashboard data to various formats")
            .permission("view_all_tenants", "View All Tenants", "View analytics across all tenants (Super Admin)")
            .permission("view_tenant_analytics", "View Tenant Analytics", "View analytics for specific tenant")
            .permission("view_affiliate_analytics", "View Affiliate Analytics", "View affiliate-specific analytics")
            .permission("view_influencer_analytics", "View Influencer Analytics", "View influencer-specific analytics")
            .build())
        .module(ModuleDefinition.builder("products")
            .name("Product Management")
            .description("Product catalog management with commission settings")
            .core(true)
            .permission("read", "View Products", "View and browse product information")
            .permission("read_all", "View All Products", "View all products in organization")
            .permission("create", "Create Products", "Add new products to the catalog")
            .permission("update", "Edit Products", "Modify existing product information")
            .permission("delete", "Delete Products", "Remove products from the catalog")
            .permission("update_commission", "Update Commission", "Update product commission rates")
            .permission("upload_images", "Upload Images", "Upload product images")
            .permission("export", "Export Products", "Export product data")
            .permission("import", "Import Products", "Import products from external files")
            .permission("manage_categories", "Manage Categories", "Manage product categories")
            .build())
        .module(ModuleDefinition.builder("affiliates")
            .name("Affiliate Management")
            .description("Affiliate onboarding, management, and tier assignment")
            .core(true)
            .permission("read", "View Affiliates", "View and browse affiliate information")
            .permission("read_all", "View All Affiliates", "View all affiliates in organization")
            .permission("create", "Create Affiliates", "Add new affiliates to the system")
            .permission("update", "Edit Affiliates", "Modify existing affiliate information")
            .permission("delete", "Delete Affiliates", "Remove affiliates from the system")
            .permission("invite", "Invite Affiliates", "Send affiliate invitations via email")
            .permission("approve", "Approve Affiliates", "Approve affiliate applications")
            .permission("reject", "Reject Affiliates", "Reject affiliate applications")
            .permission("assign_tier", "Assign Tier", "Assign commission tiers to affiliates")
            .permission("view_pending", "View Pending", "View pending affiliate applications")
            .permission("view_details", "View Details", "View detailed affiliate information")
            .permission("update_details", "Update Details", "Update affiliate profile details")
            .permission("view_commissions", "View Commissions", "View affiliate commission data")
            .permission("update_commissions", "Update Commissions", "Update affiliate commission settings")
            .build())
        .module(ModuleDefinition.builder("tracking")
            .name("Link Tracking & Analytics")
            .description("Affiliate link generation, tracking, and conversion analytics")
            .core(true)
            .permission("read", "View Tracking Links", "View and browse tracking links")
            .permission("read_all", "View All Tracking Links", "View all tracking links in organization")
            .permission("create", "Create Tracking Links", "Generate new tracking links")
            .permission("update", "Edit Tracking Links", "Modify existing tracking links")
            .permission("delete", "Delete Tracking Links", "Remove tracking links")
            .permission("track_clicks", "Track Clicks", "Track link click events")
            .permission("track_conversions", "Track Conversions", "Track conversion events")
            .permission("view_analytics", "View Analytics", "View tracking analytics and reports")
            .permission("export_analytics", "Export Analytics", "Export tracking analytics data")
            .permission("manage_utm", "Manage UTM", "Manage UTM parameters for links")
            .build())
        .module(ModuleDefinition.builder("commissions")
            .name("Commission Management")
            .description("Commission structure, tiers, and rule management")
            .core(true)
            .permission("read_tiers", "View Commission Tiers", "View commission tier information")
            .permission("create_tiers", "Create Commission Tiers", "Create new commission tiers")
            .permission("update_tiers", "Edit Commission Tiers", "Modify commission tier settings")
            .permission("delete_tiers", "Delete Commission Tiers", "Remove commission tiers")
            .permission("read_rules", "View Commission Rules", "View commission rule configurations")
            .permission("create_rules", "Create Commission Rules", "Create new commission rules")
            .permission("update_rules", "Edit Commission Rules", "Modify commission rules")
            .permission("delete_rules", "Delete Commission Rules", "Remove commission rules")
            .permission("view_products", "View Product Commissions", "View product-specific commission rates")
            .permission("update_products", "Update Product Commissions", "Update product commission rates")
            .permission("calculate_commissions", "Calculate Commissions", "Calculate commission amounts")
            .permission("view_affiliate_commissions", "View Affiliate Commissions", "View affiliate commission data")
            .build())
        .module(ModuleDefinition.builder("campaigns")
            .name("Campaign Management")
            .description("Marketing campaign creation, management, and influencer participation")
            .core(true)
            .permission("read", "View Campaigns", "View and browse campaign information")
            .permission("read_all", "View All Campaigns", "View all campaigns in organization")
            .permission("create", "Create Campaigns", "Create new marketing campaigns")
            .permission("update", "Edit Campaigns", "Modify existing campaign information")
            .permission("delete", "Delete Campaigns", "Remove campaigns from the system")
            .permission("join_campaign", "Join Campaign", "Join campaigns as influencer")
            .permission("view_participants", "View Participants", "View campaign participants")
            .permission("manage_participants", "Manage Participants", "Manage campaign participants")
            .permission("view_progress", "View Progress", "View campaign progress and metrics")
            .permission("submit_content", "Submit Content", "Submit campaign content")
            .permission("approve_content", "Approve Content", "Approve submitted content")
            .permission("view_contract", "View Contract", "View campaign contracts")
            .permission("accept_contract", "Accept Contract", "Accept campaign contracts")
            .permission("manage_versions", "Manage Versions", "Manage campaign versions")
            .permission("view_analytics", "View Campaign Analytics", "View campaign performance analytics")
            .build())
        .module(ModuleDefinition.builder("influencers")
            .name("Influencer Management")
            .description("Influencer profiles, social media integration, and analytics")
            .core(true)
            .permission("read", "View Influencers", "View and browse influencer information")
            .permission("read_all", "View All Influencers", "View all influencers in organization")
            .permission("create", "Create Influencers", "Add new influencers to the system")
            .permission("update", "Edit Influencers", "Modify existing influencer information")
            .permission("delete", "Delete Influencers", "Remove influencers from the system")
            .permission("connect_instagram", "Connect Instagram", "Connect Instagram accounts for analytics")
            .permission("connect_youtube", "Connect YouTube", "Connect YouTube accounts for analytics")
            .permission("connect_twitter", "Connect Twitter", "Connect Twitter accounts for analytics")
            .permission("view_analytics", "View Analytics", "View social media analytics")
            .permission("view_media_kit", "View Media Kit", "View influencer media kits")
            .permission("update_media_kit", "Update Media Kit", "Update media kit information")
            .permission("view_ratings", "View Ratings", "View influencer ratings and reviews")
            .permission("manage_ratings", "Manage Ratings", "Manage rating and review system")
            .build())
        .module(ModuleDefinition.builder("payments")
            .name("Payment Processing")
            .description("Payment processing, payouts, and transaction management")
            .core(true)
            .permission("read_payouts", "View Payouts", "View payout information and history")
            .permission("create_payouts", "Create Payouts", "Create new payout transactions")
            .permission("update_payouts", "Update Payouts", "Update payout status and information")
            .permission("view_methods", "View Payment Methods", "View payment method information")
            .permission("add_methods", "Add Payment Methods", "Add new payment methods")
            .permission("update_methods", "Update Payment Methods", "Update payment method details")
            .permission("delete_methods", "Delete Payment Methods", "Remove payment methods")
            .permission("view_history", "View Payment History", "View payment transaction history")
            .permission("process_payments", "Process Payments", "Process payment transactions")
            .permission("view_affiliate_payments", "View Affiliate Payments", "View affiliate payment information")
            .build())
        .module(ModuleDefinition.builder("analytics")
            .name("Analytics & Reporting")
            .description("Performance analytics, custom reports, and data visualization")
            .core(true)
            .permission("view_dashboard", "View Dashboard Analytics", "View dashboard analytics and metrics")
            .permission("view_campaign_analytics", "View Campaign Analytics", "View campaign performance analytics")
            .permission("view_affiliate_analytics", "View Affiliate Analytics", "View affiliate performance analytics")
            .permission("view_revenue_analytics", "View Revenue Analytics", "View revenue and financial analytics")
            .permission("create_reports", "Create Custom Reports", "Create custom analytics reports")
            .permission("view_reports", "View Reports", "View existing analytics reports")
            .permission("export_analytics", "Export Analytics", "Export analytics data")
            .permission("view_all_tenants", "View All Tenants Analytics", "View analytics across all tenants")
            .permission("view_tenant_analytics", "View Tenant Analytics", "View tenant-specific analytics")
            .build())
        .module(ModuleDefinition.builder("fraud")
            .name("Fraud Prevention")
            .description("Fraud detection, monitoring, and prevention systems")
            .core(false)
            .permission("read_rules", "View Fraud Rules", "View fraud detection rules")
            .permission("create_rules", "Create Fraud Rules", "Create new fraud detection rules")
            .permission("update_rules", "Edit Fraud Rules", "Modify fraud detection rules")
            .permission("delete_rules", "Delete Fraud Rules", "Remove fraud detection rules")
            .permission("view_alerts", "View Fraud Alerts", "View fraud detection alerts")
            .permission("update_alerts", "Update Alert Status", "Update fraud alert status")
            .permission("view_monitoring", "View Fraud Monitoring", "View fraud monitoring dashboard")
            .permission("manage_detection", "Manage Detection", "Manage fraud detection settings")
            .build())
        .module(ModuleDefinition.builder("communications")
            .name("Communications & Notifications")
            .description("Email templates, notifications, and messaging system")
            .core(false)
            .permission("read_templates", "View Templates", "View notification templates")
            .permission("create_templates", "Create Templates", "Create new notification templates")
            .permission("update_templates", "Edit Templates", "Modify notification templates")
            .permission("delete_templates", "Delete Templates", "Remove notification templates")
            .permission("send_notifications", "Send Notifications", "Send notifications to users")
            .permission("view_notifications", "View Notifications", "View notification history")
            .permission("update_notification_status", "Update Notification Status", "Update notification status")
            .permission("manage_messaging", "Manage Messaging", "Manage messaging system settings")
            .build())
        .module(ModuleDefinition.builder("integrations")
            .name("Third-party Integrations")
            .description("API keys, webhooks, and external service integrations")
            .core(false)
            .permission("read_api_keys", "View API Keys", "View API key information")
            .permission("create_api_keys", "Create API Keys", "Create new API keys")
            .permission("update_api_keys", "Update API Keys", "Update API key settings")
            .permission("delete_api_keys", "Delete API Keys", "Remove API keys")
            .permission("read_webhooks", "View Webhooks", "View webhook configurations")
            .permission("create_webhooks", "Create Webhooks", "Create new webhook endpoints")
            .permission("update_webhooks", "Update Webhooks", "Update webhook settings")
            .permission("delete_webhooks", "Delete Webhooks", "Remove webhook endpoints")
            .permission("manage_integrations", "Manage Integrations", "Manage third-party integrations")
            .build())
        .module(ModuleDefinition.builder("settings")
            .name("System Settings")
            .description("Tenant settings, user management, and system configuration")
            .core(true)
            .permission("read_tenant_settings", "View Tenant Settings", "View tenant configuration settings")
            .permission("update_tenant_settings", "Update Tenant Settings", "Update tenant configuration")
            .permission("read_users", "View Users", "View user information")
            .permission("create_users", "Create Users", "Create new user accounts")
            .permission("update_users", "Update Users", "Update user information")
            .permission("delete_users", "Delete Users", "Remove user accounts")
            .permission("read_roles", "View Roles", "View role information")
            .permission("create_roles", "Create Roles", "Create new user roles")
            .permission("update_roles", "Update Roles", "Update role permissions")
            .permission("delete_roles", "Delete Roles", "Remove user roles")
            .permission("manage_permissions", "Manage Permissions", "Manage role-based permissions")
            .build())
        .module(ModuleDefinition.builder("support")
            .name("Customer Support")
            .description("Support ticket management and knowledge base")
            .core(false)
            .permission("read_tickets", "View Support Tickets", "View support ticket information")
            .permission("create_tickets", "Create Support Tickets", "Create new support tickets")
            .permission("update_tickets", "Update Support Tickets", "Update support ticket status")
            .permission("view_knowledge_base", "View Knowledge Base", "Access knowledge base articles")
            .permission("search_knowledge_base", "Search Knowledge Base", "Search knowledge base content")
            .permission("manage_tickets", "Manage Tickets", "Manage support ticket workflow")
            .permission("view_all_tickets", "View All Tickets", "View all support tickets (Admin)")
            .build())
        .build();

    private AffiliateConnectApplication() {}
}
