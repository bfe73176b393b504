package tech.bizsuite.entitlements.catalog.suite;

import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;

/**
 * Human resources: employee records, payroll and leave.
 */
public final class HrApplication {

    public static final String APP_CODE = "hr";

    public static final ApplicationDefinition INSTANCE = ApplicationDefinition.builder(APP_CODE)
        .name("Human Resources Management")
        .description("Complete HR solution for employee management and payroll")
        .icon("👥")
        .baseUrl("http://localhost:3003")
        .version("1.5.0")
        .core(true)
        .sortOrder(2)
        .module(ModuleDefinition.builder("employees")
            .name("Employee Management")
            .description("Manage employee records and information")
            .core(true)
            .permission("read", "View Employees", "View employee information")
            .permission("read_all", "View All Employees", "View all employees in organization")
            .permission("create", "Add Employees", "Add new employees to the system")
            .permission("update", "Edit Employees", "Modify employee information")
            .permission("delete", "Remove Employees", "Remove employees from system")
            .permission("view_salary", "View Salary Information", "Access employee salary details")
            .permission("export", "Export Employee Data", "Export employee data")
            .build())
        .module(ModuleDefinition.builder("payroll")
            .name("Payroll Management")
            .description("Process payroll and manage compensation")
            .core(true)
            .permission("read", "View Payroll", "View payroll information")
            .permission("process", "Process Payroll", "Run payroll calculations")
            .permission("approve", "Approve Payroll", "Approve payroll for processing")
            .permission("export", "Export Payroll", "Export payroll reports")
            .permission("generate_reports", "Generate Reports", "Generate payroll reports")
            .build())
        .module(ModuleDefinition.builder("leave")
            .name("Leave Management")
            .description("Manage employee leave requests and approvals")
            .core(true)
            .permission("read", "View Leave Requests", "View leave request information")
            .permission("create", "Create Leave Requests", "Submit leave requests")
            .permission("approve", "Approve Leave", "Approve leave requests")
            .permission("reject", "Reject Leave", "Reject leave requests")
            .permission("cancel", "Cancel Leave", "Cancel leave requests")
            .permission("export", "Export Leave Data", "Export leave reports")
            .build())
        .module(ModuleDefinition.builder("dashboard")
            .name("HR Dashboard")
            .description("HR analytics and reporting dashboard")
            .core(true)
            .permission("view", "View Dashboard", "Access HR dashboard")
            .permission("customize", "Customize Dashboard", "Customize dashboard layout")
            .permission("export", "Export Reports", "Export HR reports")
            .build())
        .build();

    private HrApplication() {}
}
