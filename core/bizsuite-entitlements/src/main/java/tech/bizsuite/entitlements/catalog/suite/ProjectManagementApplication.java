package tech.bizsuite.entitlements.catalog.suite;

import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;

/**
 * Project management: projects, tasks, sprints, time tracking and team collaboration.
 */
public final class ProjectManagementApplication {

    public static final String APP_CODE = "project_management";

    public static final ApplicationDefinition INSTANCE = ApplicationDefinition.builder(APP_CODE)
        .name("Project Management")
        .description("Complete project management solution for managing projects, tasks, teams, and workflows")
        .icon("📋")
        .baseUrl("https://prm.zopkit.com")
        .version("1.0.0")
        .core(true)
        .sortOrder(2)
        .module(ModuleDefinition.builder("projects")
            .name("Project Management")
            .description("Manage projects, timelines, and budgets")
            .core(true)
            .permission("read", "View Projects", "View and browse project information")
            .permission("read_all", "View All Projects", "View all projects in organization")
            .permission("create", "Create Projects", "Create new projects")
            .permission("update", "Edit Projects", "Modify existing project information")
            .permission("delete", "Delete Projects", "Remove projects from the system")
            .permission("export", "Export Projects", "Export project data to various formats")
            .permission("import", "Import Projects", "Import projects from external files")
            .permission("assign", "Assign Projects", "Assign projects to team members")
            .permission("archive", "Archive Projects", "Archive completed or inactive projects")
            .permission("restore", "Restore Projects", "Restore archived projects")
            .permission("manage_budget", "Manage Budget", "Manage project budgets and financials")
            .permission("manage_timeline", "Manage Timeline", "Manage project timelines and milestones")
            .permission("manage_settings", "Manage Settings", "Manage project settings and configurations")
            .build())
        .module(ModuleDefinition.builder("tasks")
            .name("Task Management")
            .description("Manage tasks, subtasks, and assignments")
            .core(true)
            .permission("read", "View Tasks", "View and browse task information")
            .permission("read_all", "View All Tasks", "View all tasks in organization")
            .permission("create", "Create Tasks", "Create new tasks")
            .permission("update", "Edit Tasks", "Modify existing task information")
            .permission("delete", "Delete Tasks", "Remove tasks from the system")
            .permission("export", "Export Tasks", "Export task data to various formats")
            .permission("import", "Import Tasks", "Import tasks from external files")
            .permission("assign", "Assign Tasks", "Assign tasks to team members")
            .permission("reassign", "Reassign Tasks", "Reassign tasks to different team members")
            .permission("change_status", "Change Status", "Change task status (todo, in progress, done, etc.)")
            .permission("change_priority", "Change Priority", "Change task priority levels")
            .permission("add_subtasks", "Add Subtasks", "Add subtasks to existing tasks")
            .permission("manage_dependencies", "Manage Dependencies", "Manage task dependencies and relationships")
            .permission("add_attachments", "Add Attachments", "Add attachments to tasks")
            .permission("add_comments", "Add Comments", "Add comments to tasks")
            .permission("time_track", "Track Time", "Track time spent on tasks")
            .build())
        .module(ModuleDefinition.builder("sprints")
            .name("Sprint Management")
            .description("Manage agile sprints and iterations")
            .core(true)
            .permission("read", "View Sprints", "View and browse sprint information")
            .permission("read_all", "View All Sprints", "View all sprints in organization")
            .permission("create", "Create Sprints", "Create new sprints")
            .permission("update", "Edit Sprints", "Modify existing sprint information")
            .permission("delete", "Delete Sprints", "Remove sprints from the system")
            .permission("export", "Export Sprints", "Export sprint data")
            .permission("start", "Start Sprints", "Start sprint execution")
            .permission("complete", "Complete Sprints", "Mark sprints as completed")
            .permission("cancel", "Cancel Sprints", "Cancel active sprints")
            .permission("manage_capacity", "Manage Capacity", "Manage sprint capacity and velocity")
            .permission("assign_tasks", "Assign Tasks", "Assign tasks to sprints")
            .permission("view_burndown", "View Burndown", "View sprint burndown charts")
            .build())
        .module(ModuleDefinition.builder("time_tracking")
            .name("Time Tracking")
            .description("Track time spent on projects and tasks")
            .core(true)
            .permission("read", "View Time Entries", "View time entry information")
            .permission("read_all", "View All Time Entries", "View all time entries in organization")
            .permission("create", "Create Time Entries", "Create new time entries")
            .permission("update", "Edit Time Entries", "Modify existing time entries")
            .permission("delete", "Delete Time Entries", "Remove time entries")
            .permission("export", "Export Time Entries", "Export time tracking data")
            .permission("import", "Import Time Entries", "Import time entries from files")
            .permission("approve", "Approve Time Entries", "Approve time entries for billing")
            .permission("reject", "Reject Time Entries", "Reject time entries")
            .permission("view_reports", "View Reports", "View time tracking reports and analytics")
            .permission("manage_billable", "Manage Billable Hours", "Mark time entries as billable/non-billable")
            .permission("bulk_approve", "Bulk Approve", "Approve multiple time entries at once")
            .build())
        .module(ModuleDefinition.builder("team")
            .name("Team Management")
            .description("Manage team members and assignments")
            .core(true)
            .permission("read", "View Team Members", "View team member information")
            .permission("read_all", "View All Team Members", "View all team members in organization")
            .permission("create", "Add Team Members", "Add new team members to projects")
            .permission("update", "Edit Team Members", "Modify team member information")
            .permission("delete", "Remove Team Members", "Remove team members from projects")
            .permission("export", "Export Team Data", "Export team member data")
            .permission("import", "Import Team Members", "Import team members from files")
            .permission("assign_roles", "Assign Roles", "Assign roles to team members")
            .permission("manage_permissions", "Manage Permissions", "Manage team member permissions")
            .permission("view_performance", "View Performance", "View team member performance metrics")
            .permission("manage_availability", "Manage Availability", "Manage team member availability and capacity")
            .build())
        .module(ModuleDefinition.builder("backlog")
            .name("Backlog Management")
            .description("Manage product backlog and user stories")
            .core(true)
            .permission("read", "View Backlog", "View backlog items and user stories")
            .permission("read_all", "View All Backlog", "View all backlog items in organization")
            .permission("create", "Create Backlog Items", "Create new backlog items and stories")
            .permission("update", "Edit Backlog Items", "Modify existing backlog items")
            .permission("delete", "Delete Backlog Items", "Remove backlog items")
            .permission("export", "Export Backlog", "Export backlog data")
            .permission("import", "Import Backlog", "Import backlog items from files")
            .permission("prioritize", "Prioritize Items", "Prioritize backlog items")
            .permission("estimate", "Estimate Items", "Add story points and estimates")
            .permission("move_to_sprint", "Move to Sprint", "Move backlog items to sprints")
            .permission("manage_epics", "Manage Epics", "Manage epics and feature groups")
            .build())
        .module(ModuleDefinition.builder("documents")
            .name("Document Management")
            .description("Manage project documents and files")
            .core(true)
            .permission("read", "View Documents", "View document information")
            .permission("read_all", "View All Documents", "View all documents in organization")
            .permission("create", "Upload Documents", "Upload new documents")
            .permission("update", "Edit Documents", "Modify document information and metadata")
            .permission("delete", "Delete Documents", "Remove documents from the system")
            .permission("export", "Export Documents", "Export document data")
            .permission("download", "Download Documents", "Download document files")
            .permission("share", "Share Documents", "Share documents with team members")
            .permission("version_control", "Manage Versions", "Manage document versions")
            .permission("add_comments", "Add Comments", "Add comments to documents")
            .permission("approve", "Approve Documents", "Approve documents for use")
            .permission("manage_permissions", "Manage Permissions", "Manage document access permissions")
            .build())
        .module(ModuleDefinition.builder("analytics")
            .name("Analytics & Reporting")
            .description("View project analytics and generate reports")
            .core(true)
            .permission("read", "View Analytics", "View analytics and metrics")
            .permission("read_all", "View All Analytics", "View all analytics in organization")
            .permission("create", "Create Reports", "Create custom reports")
            .permission("update", "Edit Reports", "Modify existing reports")
            .permission("delete", "Delete Reports", "Remove reports")
            .permission("export", "Export Reports", "Export report data")
            .permission("schedule", "Schedule Reports", "Schedule automated reports")
            .permission("view_dashboards", "View Dashboards", "View analytics dashboards")
            .permission("customize_dashboards", "Customize Dashboards", "Customize dashboard layouts")
            .permission("view_project_health", "View Project Health", "View project health scores and metrics")
            .permission("view_team_performance", "View Team Performance", "View team performance analytics")
            .permission("view_burndown", "View Burndown Charts", "View sprint and project burndown charts")
            .permission("view_velocity", "View Velocity", "View team velocity metrics")
            .build())
        .module(ModuleDefinition.builder("reports")
            .name("Report Management")
            .description("Create and manage project reports")
            .core(true)
            .permission("read", "View Reports", "View report information")
            .permission("read_all", "View All Reports", "View all reports in organization")
            .permission("create", "Create Reports", "Create new reports")
            .permission("update", "Edit Reports", "Modify existing reports")
            .permission("delete", "Delete Reports", "Remove reports")
            .permission("export", "Export Reports", "Export report data to various formats")
            .permission("schedule", "Schedule Reports", "Schedule automated report generation")
            .permission("share", "Share Reports", "Share reports with team members")
            .permission("generate_pdf", "Generate PDF", "Generate PDF versions of reports")
            .permission("customize", "Customize Reports", "Customize report templates and layouts")
            .build())
        .module(ModuleDefinition.builder("chat")
            .name("Project Chat")
            .description("Team communication and collaboration")
            .core(true)
            .permission("read", "View Messages", "View chat messages and conversations")
            .permission("read_all", "View All Messages", "View all messages in organization")
            .permission("create", "Send Messages", "Send messages in project chats")
            .permission("update", "Edit Messages", "Edit own messages")
            .permission("delete", "Delete Messages", "Delete own messages")
            .permission("create_channels", "Create Channels", "Create new chat channels")
            .permission("manage_channels", "Manage Channels", "Manage channel settings and members")
            .permission("delete_channels", "Delete Channels", "Delete chat channels")
            .permission("mention_users", "Mention Users", "Mention users in messages")
            .permission("share_files", "Share Files", "Share files in chat")
            .permission("pin_messages", "Pin Messages", "Pin important messages")
            .build())
        .module(ModuleDefinition.builder("calendar")
            .name("Calendar Management")
            .description("Manage project events, meetings, and schedules")
            .core(true)
            .permission("read", "View Calendar", "View calendar events")
            .permission("read_all", "View All Events", "View all calendar events in organization")
            .permission("create", "Create Events", "Create new calendar events")
            .permission("update", "Edit Events", "Modify event information")
            .permission("delete", "Delete Events", "Remove calendar events")
            .permission("export", "Export Calendar", "Export calendar data")
            .permission("import", "Import Events", "Import events from files")
            .permission("share", "Share Events", "Share events with team members")
            .permission("manage_recurring", "Manage Recurring Events", "Create and manage recurring events")
            .build())
        .module(ModuleDefinition.builder("kanban")
            .name("Kanban Board")
            .description("Manage tasks using Kanban boards")
            .core(true)
            .permission("read", "View Kanban Boards", "View Kanban board information")
            .permission("read_all", "View All Boards", "View all Kanban boards in organization")
            .permission("create", "Create Boards", "Create new Kanban boards")
            .permission("update", "Edit Boards", "Modify board settings and columns")
            .permission("delete", "Delete Boards", "Remove Kanban boards")
            .permission("move_cards", "Move Cards", "Move task cards between columns")
            .permission("manage_columns", "Manage Columns", "Add, edit, and remove board columns")
            .permission("manage_filters", "Manage Filters", "Create and manage board filters")
            .permission("export", "Export Boards", "Export board data")
            .build())
        .module(ModuleDefinition.builder("dashboard")
            .name("Project Dashboard")
            .description("Project overview and analytics dashboard")
            .core(true)
            .permission("view", "View Dashboard", "Access project dashboard")
            .permission("customize", "Customize Dashboard", "Customize dashboard layout and widgets")
            .permission("export", "Export Dashboard", "Export dashboard data and reports")
            .permission("share", "Share Dashboard", "Share dashboard views with others")
            .permission("create_widgets", "Create Widgets", "Create custom dashboard widgets")
            .permission("manage_widgets", "Manage Widgets", "Manage dashboard widget settings")
            .build())
        .module(ModuleDefinition.builder("notifications")
            .name("Notification Management")
            .description("Manage notifications and alerts")
            .core(true)
            .permission("read", "View Notifications", "View notification information")
            .permission("read_all", "View All Notifications", "View all notifications in organization")
            .permission("create", "Create Notifications", "Create custom notifications")
            .permission("update", "Edit Notifications", "Modify notification settings")
            .permission("delete", "Delete Notifications", "Remove notifications")
            .permission("manage_preferences", "Manage Preferences", "Manage notification preferences")
            .permission("mark_read", "Mark as Read", "Mark notifications as read")
            .permission("bulk_actions", "Bulk Actions", "Perform bulk actions on notifications")
            .build())
        .module(ModuleDefinition.builder("workspace")
            .name("Workspace Management")
            .description("Manage workspaces and team collaboration spaces")
            .core(true)
            .permission("read", "View Workspaces", "View workspace information")
            .permission("read_all", "View All Workspaces", "View all workspaces in organization")
            .permission("create", "Create Workspaces", "Create new workspaces")
            .permission("update", "Edit Workspaces", "Modify workspace settings")
            .permission("delete", "Delete Workspaces", "Remove workspaces")
            .permission("manage_members", "Manage Members", "Add and remove workspace members")
            .permission("manage_roles", "Manage Roles", "Assign roles to workspace members")
            .permission("manage_settings", "Manage Settings", "Manage workspace settings and configurations")
            .permission("export", "Export Workspace Data", "Export workspace data")
            .permission("archive", "Archive Workspaces", "Archive inactive workspaces")
            .permission("restore", "Restore Workspaces", "Restore archived workspaces")
            .build())
        .module(ModuleDefinition.builder("workflow")
            .name("Workflow Management")
            .description("Manage automated workflows and processes")
            .core(false)
            .permission("read", "View Workflows", "View workflow information")
            .permission("read_all", "View All Workflows", "View all workflows in organization")
            .permission("create", "Create Workflows", "Create new workflows")
            .permission("update", "Edit Workflows", "Modify workflow definitions")
            .permission("delete", "Delete Workflows", "Remove workflows")
            .permission("activate", "Activate Workflows", "Activate workflows for execution")
            .permission("deactivate", "Deactivate Workflows", "Deactivate workflows")
            .permission("view_executions", "View Executions", "View workflow execution history")
            .permission("manage_rules", "Manage Rules", "Manage workflow rules and conditions")
            .permission("manage_actions", "Manage Actions", "Manage workflow actions and triggers")
            .permission("export", "Export Workflows", "Export workflow definitions")
            .permission("import", "Import Workflows", "Import workflows from files")
            .build())
        .module(ModuleDefinition.builder("system")
            .name("System Configuration")
            .description("System administration and configuration management")
            .core(true)
            .permission("settings_read", "View Settings", "View system settings and configurations")
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
            .permission("roles_read_all", "View All Roles", "View all roles in organization")
            .permission("roles_create", "Create Roles", "Create new roles")
            .permission("roles_update", "Edit Roles", "Modify role information")
            .permission("roles_delete", "Delete Roles", "Remove roles")
            .permission("roles_assign", "Assign Roles", "Assign roles to users")
            .permission("roles_export", "Export Roles", "Export role data")
            .permission("integrations_read", "View Integrations", "View system integrations")
            .permission("integrations_create", "Create Integrations", "Create new integrations")
            .permission("integrations_update", "Update Integrations", "Update existing integrations")
            .permission("integrations_delete", "Delete Integrations", "Delete integrations")
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

    private ProjectManagementApplication() {}
}
