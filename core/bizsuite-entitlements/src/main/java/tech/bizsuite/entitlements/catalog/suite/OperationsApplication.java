package tech.bizsuite.entitlements.catalog.suite;

import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;

/**
 * Operations management: inventory, procurement, logistics, orders and fulfillment.
 */
public final class OperationsApplication {

    public static final String APP_CODE = "operations";

    public static final ApplicationDefinition INSTANCE = ApplicationDefinition.builder(APP_CODE)
        .name("Operations Management")
        .description("End-to-end operations: inventory, procurement, suppliers, logistics, orders, fulfillments, and analytics")
        .icon("📦")
        .baseUrl("https://ops.zopkit.com")
        .version("1.0.0")
        .core(true)
        .sortOrder(4)
        .module(ModuleDefinition.builder("dashboard")
            .name("Operations Dashboard")
            .description("Operations overview and analytics dashboard")
            .core(true)
            .permission("view", "View Dashboard", "Access operations dashboard")
            .permission("customize", "Customize Dashboard", "Customize dashboard layout and widgets")
            .permission("export", "Export Reports", "Export dashboard reports")
            .build())
        .module(ModuleDefinition.builder("inventory")
            .name("Inventory Management")
            .description("Manage inventory, stock levels, and movements")
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
        .module(ModuleDefinition.builder("warehouse")
            .name("Warehouse Management")
            .description("Warehouse operations, cycle counts, and pick paths")
            .core(true)
            .permission("read", "View Warehouse", "View warehouse and location information")
            .permission("read_all", "View All Warehouses", "View all warehouses")
            .permission("create", "Create Warehouse", "Add new warehouses or locations")
            .permission("update", "Edit Warehouse", "Modify warehouse information")
            .permission("delete", "Delete Warehouse", "Remove warehouses")
            .permission("cycle_count", "Cycle Count", "Perform cycle counts")
            .permission("pick_path", "Manage Pick Paths", "Manage pick paths and routing")
            .build())
        .module(ModuleDefinition.builder("procurement")
            .name("Procurement Management")
            .description("Requisitions, purchase orders, and procurement workflow")
            .core(true)
            .permission("read", "View Procurement", "View requisitions and purchase orders")
            .permission("read_all", "View All Procurement", "View all procurement in organization")
            .permission("create", "Create Requisition", "Create new requisitions")
            .permission("update", "Edit Procurement", "Modify requisitions and POs")
            .permission("delete", "Delete Procurement", "Remove requisitions or POs")
            .permission("approve", "Approve Requisition", "Approve procurement requests")
            .permission("export", "Export Procurement", "Export procurement data")
            .build())
        .module(ModuleDefinition.builder("suppliers")
            .name("Supplier Management")
            .description("Manage suppliers, performance, and risk assessments")
            .core(true)
            .permission("read", "View Suppliers", "View supplier information")
            .permission("read_all", "View All Suppliers", "View all suppliers in organization")
            .permission("create", "Create Suppliers", "Add new suppliers")
            .permission("update", "Edit Suppliers", "Modify supplier information")
            .permission("delete", "Delete Suppliers", "Remove suppliers")
            .permission("view_performance", "View Supplier Performance", "View supplier performance metrics")
            .permission("view_risk", "View Risk Assessments", "View supplier risk assessments")
            .permission("export", "Export Suppliers", "Export supplier data")
            .build())
        .module(ModuleDefinition.builder("transportation")
            .name("Transportation & Logistics")
            .description("Transportation orders, logistics, and shipping")
            .core(true)
            .permission("read", "View Transportation", "View transportation and logistics data")
            .permission("read_all", "View All Transportation", "View all transportation orders")
            .permission("create", "Create Transportation Order", "Create transportation orders")
            .permission("update", "Edit Transportation", "Modify transportation information")
            .permission("delete", "Delete Transportation", "Remove transportation orders")
            .permission("export", "Export Transportation", "Export transportation data")
            .build())
        .module(ModuleDefinition.builder("orders")
            .name("Order Management")
            .description("Manage orders, fulfillment, and shipments")
            .core(true)
            .permission("read", "View Orders", "View order information")
            .permission("read_all", "View All Orders", "View all orders in organization")
            .permission("create", "Create Orders", "Create new orders")
            .permission("update", "Edit Orders", "Modify order information")
            .permission("delete", "Delete Orders", "Remove orders")
            .permission("process", "Process Orders", "Process and fulfill orders")
            .permission("export", "Export Orders", "Export order data")
            .build())
        .module(ModuleDefinition.builder("fulfillments")
            .name("Fulfillment Management")
            .description("Order fulfillment and shipment tracking")
            .core(true)
            .permission("read", "View Fulfillments", "View fulfillment information")
            .permission("read_all", "View All Fulfillments", "View all fulfillments")
            .permission("create", "Create Fulfillment", "Create fulfillments")
            .permission("update", "Edit Fulfillment", "Modify fulfillment status")
            .permission("delete", "Delete Fulfillment", "Remove fulfillments")
            .permission("export", "Export Fulfillments", "Export fulfillment data")
            .build())
        .module(ModuleDefinition.builder("shipments")
            .name("Shipment Management")
            .description("Shipment tracking and carrier management")
            .core(true)
            .permission("read", "View Shipments", "View shipment information")
            .permission("read_all", "View All Shipments", "View all shipments")
            .permission("create", "Create Shipment", "Create new shipments")
            .permission("update", "Edit Shipment", "Modify shipment information")
            .permission("delete", "Delete Shipment", "Remove shipments")
            .permission("track", "Track Shipments", "Track shipment status")
            .permission("export", "Export Shipments", "Export shipment data")
            .build())
        .module(ModuleDefinition.builder("catalog")
            .name("Product Catalog")
            .description("Product catalog and categories")
            .core(true)
            .permission("read", "View Catalog", "View product catalog")
            .permission("read_all", "View All Catalog", "View all catalog items")
            .permission("create", "Create Catalog Items", "Add catalog products")
            .permission("update", "Edit Catalog", "Modify catalog information")
            .permission("delete", "Delete Catalog Items", "Remove catalog items")
            .permission("export", "Export Catalog", "Export catalog data")
            .build())
        .module(ModuleDefinition.builder("quality")
            .name("Quality Management")
            .description("Quality checks and compliance")
            .core(true)
            .permission("read", "View Quality", "View quality data")
            .permission("read_all", "View All Quality", "View all quality records")
            .permission("create", "Create Quality Record", "Add quality records")
            .permission("update", "Edit Quality", "Modify quality information")
            .permission("delete", "Delete Quality", "Remove quality records")
            .permission("export", "Export Quality", "Export quality data")
            .build())
        .module(ModuleDefinition.builder("rfx")
            .name("RFx & Sourcing")
            .description("RFQ, RFP, and sourcing events")
            .core(true)
            .permission("read", "View RFx", "View RFx and sourcing events")
            .permission("read_all", "View All RFx", "View all RFx in organization")
            .permission("create", "Create RFx", "Create new RFx events")
            .permission("update", "Edit RFx", "Modify RFx information")
            .permission("delete", "Delete RFx", "Remove RFx events")
            .permission("submit_response", "Submit Response", "Submit vendor responses")
            .permission("evaluate", "Evaluate Responses", "Evaluate RFx responses")
            .permission("export", "Export RFx", "Export RFx data")
            .build())
        .module(ModuleDefinition.builder("finance")
            .name("Finance & Invoices")
            .description("Invoices and financial operations")
            .core(true)
            .permission("read", "View Finance", "View invoice and finance data")
            .permission("read_all", "View All Finance", "View all finance records")
            .permission("create", "Create Invoice", "Create invoices")
            .permission("update", "Edit Finance", "Modify finance records")
            .permission("delete", "Delete Finance", "Remove finance records")
            .permission("export", "Export Finance", "Export finance data")
            .build())
        .module(ModuleDefinition.builder("tax_compliance")
            .name("Tax Compliance")
            .description("Tax compliance and reporting")
            .core(true)
            .permission("read", "View Tax Compliance", "View tax compliance data")
            .permission("read_all", "View All Tax", "View all tax records")
            .permission("create", "Create Tax Record", "Create tax records")
            .permission("update", "Edit Tax", "Modify tax information")
            .permission("export", "Export Tax", "Export tax compliance data")
            .build())
        .module(ModuleDefinition.builder("supply_chain")
            .name("Supply Chain")
            .description("Supply chain planning and demand")
            .core(true)
            .permission("read", "View Supply Chain", "View supply chain data")
            .permission("read_all", "View All Supply Chain", "View all supply chain data")
            .permission("create", "Create Supply Chain", "Create supply chain records")
            .permission("update", "Edit Supply Chain", "Modify supply chain information")
            .permission("export", "Export Supply Chain", "Export supply chain data")
            .build())
        .module(ModuleDefinition.builder("analytics")
            .name("Analytics & Reporting")
            .description("Operations analytics and reports")
            .core(true)
            .permission("read", "View Analytics", "View analytics and reports")
            .permission("read_all", "View All Analytics", "View all analytics in organization")
            .permission("create", "Create Reports", "Create custom reports")
            .permission("export", "Export Analytics", "Export analytics data")
            .permission("schedule", "Schedule Reports", "Schedule automated reports")
            .build())
        .module(ModuleDefinition.builder("contracts")
            .name("Contract Management")
            .description("Vendor and service contracts")
            .core(true)
            .permission("read", "View Contracts", "View contract information")
            .permission("read_all", "View All Contracts", "View all contracts")
            .permission("create", "Create Contract", "Create new contracts")
            .permission("update", "Edit Contract", "Modify contract information")
            .permission("delete", "Delete Contract", "Remove contracts")
            .permission("export", "Export Contracts", "Export contract data")
            .build())
        .module(ModuleDefinition.builder("service_appointments")
            .name("Service Appointments")
            .description("Service bookings and appointments")
            .core(true)
            .permission("read", "View Appointments", "View service appointments")
            .permission("read_all", "View All Appointments", "View all appointments")
            .permission("create", "Create Appointment", "Create new appointments")
            .permission("update", "Edit Appointment", "Modify appointment information")
            .permission("delete", "Delete Appointment", "Remove appointments")
            .permission("export", "Export Appointments", "Export appointment data")
            .build())
        .module(ModuleDefinition.builder("notifications")
            .name("Notifications")
            .description("Notifications and alerts")
            .core(true)
            .permission("read", "View Notifications", "View notifications")
            .permission("read_all", "View All Notifications", "View all notifications")
            .permission("create", "Create Notification", "Create notifications")
            .permission("update", "Edit Notification", "Modify notification settings")
            .permission("manage_preferences", "Manage Preferences", "Manage notification preferences")
            .build())
        .module(ModuleDefinition.builder("system")
            .name("System Configuration")
            .description("Operations system settings and user management")
            .core(true)
            .permission("settings_read", "View Settings", "View system settings")
            .permission("settings_update", "Update Settings", "Update system settings")
            .permission("users_read", "View Users", "View user information")
            .permission("users_read_all", "View All Users", "View all users in organization")
            .permission("users_create", "Create Users", "Create new user accounts")
            .permission("users_update", "Edit Users", "Modify user information")
            .permission("users_delete", "Delete Users", "Remove user accounts")
            .permission("roles_read", "View Roles", "View role information")
            .permission("roles_read_all", "View All Roles", "View all roles in organization")
            .permission("roles_create", "Create Roles", "Create new roles")
            .permission("roles_update", "Edit Roles", "Modify role permissions")
            .permission("roles_delete", "Delete Roles", "Remove roles")
            .permission("wrapper_sync", "Wrapper Sync", "Trigger and view Wrapper tenant sync")
            .build())
        .module(ModuleDefinition.builder("marketing")
            .name("Marketing")
            .description("Marketing campaigns and cart recovery")
            .core(false)
            .permission("read", "View Marketing", "View marketing campaigns and data")
            .permission("read_all", "View All Marketing", "View all marketing data")
            .permission("create", "Create Campaigns", "Create marketing campaigns")
            .permission("update", "Edit Campaigns", "Modify marketing campaigns")
            .permission("delete", "Delete Campaigns", "Remove marketing campaigns")
            .permission("export", "Export Marketing", "Export marketing data")
            .build())
        .module(ModuleDefinition.builder("customers")
            .name("Customer Management")
            .description("Manage customers, profiles, and communication")
            .core(false)
            .permission("read", "View Customers", "View customer information")
            .permission("read_all", "View All Customers", "View all customers")
            .permission("create", "Create Customer", "Add new customers")
            .permission("update", "Edit Customer", "Modify customer information")
            .permission("delete", "Delete Customer", "Remove customers")
            .permission("export", "Export Customers", "Export customer data")
            .build())
        .module(ModuleDefinition.builder("returns")
            .name("Returns Management")
            .description("Process and track product returns")
            .core(false)
            .permission("read", "View Returns", "View return requests")
            .permission("read_all", "View All Returns", "View all return requests")
            .permission("create", "Create Return", "Initiate a return")
            .permission("update", "Edit Return", "Modify return information")
            .permission("delete", "Delete Return", "Remove return records")
            .permission("approve", "Approve Return", "Approve return requests")
            .permission("export", "Export Returns", "Export return data")
            .build())
        .module(ModuleDefinition.builder("customer_portal")
            .name("Customer Portal")
            .description("Customer-facing portal: shop, services, bookings, payments, wishlist")
            .core(false)
            .permission("read", "View Customer Portal", "Access customer portal")
            .permission("read_all", "View All Portal Data", "View all portal data")
            .permission("manage_shop", "Manage Shop", "Manage customer shop settings")
            .permission("manage_services", "Manage Services", "Manage customer service bookings")
            .permission("manage_orders", "Manage Orders", "Manage customer orders")
            .permission("manage_bookings", "Manage Bookings", "Manage customer bookings")
            .permission("manage_payments", "Manage Payments", "Manage customer payments")
            .permission("manage_wishlist", "Manage Wishlist", "Manage customer wishlists")
            .permission("manage_preferences", "Manage Preferences", "Manage customer preferences")
            .permission("export", "Export Portal Data", "Export customer portal data")
            .build())
        .module(ModuleDefinition.builder("vendor_management")
            .name("Multi-Vendor Management")
            .description("Vendor profiles, products, ratings, policies, and analytics")
            .core(false)
            .permission("read", "View Vendors", "View vendor information")
            .permission("read_all", "View All Vendors", "View all vendors")
            .permission("create", "Create Vendor", "Add new vendors")
            .permission("update", "Edit Vendor", "Modify vendor information")
            .permission("delete", "Delete Vendor", "Remove vendors")
            .permission("manage_products", "Manage Vendor Products", "Manage vendor product listings")
            .permission("manage_ratings", "Manage Ratings", "Manage vendor ratings and reviews")
            .permission("manage_policies", "Manage Policies", "Manage vendor policies")
            .permission("manage_communication", "Manage Communication", "Manage vendor communication")
            .permission("view_analytics", "View Analytics", "View vendor analytics")
            .permission("manage_certifications", "Manage Certifications", "Manage vendor certifications")
            .permission("manage_portfolios", "Manage Portfolios", "Manage vendor portfolios")
            .permission("export", "Export Vendors", "Export vendor data")
            .build())
        .module(ModuleDefinition.builder("service_providers")
            .name("Service Provider Portal")
            .description("Service provider catalog, pricing, promotions, and bundles")
            .core(false)
            .permission("read", "View Providers", "View service providers")
            .permission("read_all", "View All Providers", "View all service providers")
            .permission("create", "Create Provider", "Add service providers")
            .permission("update", "Edit Provider", "Modify provider information")
            .permission("delete", "Delete Provider", "Remove service providers")
            .permission("manage_catalog", "Manage Catalog", "Manage service catalog")
            .permission("manage_pricing", "Manage Pricing", "Manage pricing rules")
            .permission("manage_promotions", "Manage Promotions", "Manage promotions and bundles")
            .permission("view_analytics", "View Analytics", "View pricing analytics")
            .permission("export", "Export Providers", "Export provider data")
            .build())
        .build();

    private OperationsApplication() {}
}
