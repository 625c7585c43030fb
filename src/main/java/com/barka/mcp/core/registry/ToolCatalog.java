package com.barka.mcp.core.registry;

import com.barka.mcp.core.command.AnalyticsCommand;
import com.barka.mcp.core.command.AssignmentCommand;
import com.barka.mcp.core.command.ProjectCommand;
import com.barka.mcp.core.command.SearchCommand;
import com.barka.mcp.core.command.TaskCommand;
import com.barka.mcp.core.command.TeamCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.barka.mcp.core.registry.SchemaNode.arrayOf;
import static com.barka.mcp.core.registry.SchemaNode.bool;
import static com.barka.mcp.core.registry.SchemaNode.dateTime;
import static com.barka.mcp.core.registry.SchemaNode.enumOf;
import static com.barka.mcp.core.registry.SchemaNode.id;
import static com.barka.mcp.core.registry.SchemaNode.integer;
import static com.barka.mcp.core.registry.SchemaNode.number;
import static com.barka.mcp.core.registry.SchemaNode.object;
import static com.barka.mcp.core.registry.SchemaNode.string;

/**
 * The six project-management tools and their action contracts.
 */
public final class ToolCatalog {

    public static final String PROJECT_OPERATIONS = "project_operations";
    public static final String TASK_OPERATIONS = "task_operations";
    public static final String TEAM_OPERATIONS = "team_operations";
    public static final String SEARCH_OPERATIONS = "search_operations";
    public static final String ANALYTICS_OPERATIONS = "analytics_operations";
    public static final String ASSIGNMENT_OPERATIONS = "assignment_operations";

    private ToolCatalog() {}

    public static List<ToolDefinition> tools() {
        return List.of(projectOperations(), taskOperations(), teamOperations(), searchOperations(),
                analyticsOperations(), assignmentOperations());
    }

    static ToolDefinition projectOperations() {
        return ToolDefinition.builder(PROJECT_OPERATIONS,
                        "Comprehensive project management operations including create, read, update, delete, search, and team management")
                .field("project_id", id("Project ID (required for get, update, delete, get_tasks, add_team_member, get_status)"))
                .field("client_id", id("Client ID for scoping operations"))
                .field("organization_id", id("Organization ID for scoping operations"))
                .field("user_id", id("User ID performing the operation (required for create, update, delete, add_team_member)"))
                .field("project_data", object("Project data for create/update operations"))
                .field("team_member_id", id("Team member ID for add_team_member action"))
                .field("search_term", string("Search term for search action"))
                .field("page", page())
                .field("limit", limit())
                .field("filters", object("Additional filters for list action"))
                .mutating("create", ProjectCommand.Create.class, "project_data")
                .read("get", ProjectCommand.Get.class, "project_id")
                .read("list", ProjectCommand.ListAll.class)
                .mutating("update", ProjectCommand.Update.class, "project_id", "project_data")
                .mutating("delete", ProjectCommand.Delete.class, "project_id")
                .read("search", ProjectCommand.Search.class, "search_term")
                .read("get_tasks", ProjectCommand.GetTasks.class, "project_id")
                .mutating("add_team_member", ProjectCommand.AddTeamMember.class, "project_id", "team_member_id")
                .read("get_status", ProjectCommand.GetStatus.class, "project_id")
                .build();
    }

    static ToolDefinition taskOperations() {
        return ToolDefinition.builder(TASK_OPERATIONS,
                        "Comprehensive task management operations including create, read, update, delete, assign, comment, and status updates")
                .field("task_id", id("Task ID (required for get, update, delete, assign, add_comment, update_status)"))
                .field("client_id", id("Client ID for scoping operations"))
                .field("organization_id", id("Organization ID for scoping operations"))
                .field("project_id", id("Project ID for filtering tasks"))
                .field("user_id", id("User ID performing the operation (required for create, update, delete, assign, add_comment, update_status)"))
                .field("task_data", object("Task data for create/update operations"))
                .field("team_member_id", id("Team member ID for assign action"))
                .field("comment_content", string("Comment content for add_comment action"))
                .field("new_status", string("New status for update_status action"))
                .field("status_comment", string("Optional comment for status update"))
                .field("search_term", string("Search term for search action"))
                .field("assignee_id", id("Filter tasks by assignee"))
                .field("status", string("Filter tasks by status"))
                .field("page", page())
                .field("limit", limit())
                .field("filters", object("Additional filters for list action"))
                .mutating("create", TaskCommand.Create.class, "task_data")
                .read("get", TaskCommand.Get.class, "task_id")
                .read("list", TaskCommand.ListAll.class)
                .mutating("update", TaskCommand.Update.class, "task_id", "task_data")
                .mutating("delete", TaskCommand.Delete.class, "task_id")
                .mutating("assign", TaskCommand.Assign.class, "task_id", "team_member_id")
                .mutating("add_comment", TaskCommand.AddComment.class, "task_id", "comment_content")
                .mutating("update_status", TaskCommand.UpdateStatus.class, "task_id", "new_status")
                .read("search", TaskCommand.Search.class, "search_term")
                .build();
    }

    static ToolDefinition teamOperations() {
        Map<String, SchemaNode> expertiseProps = new LinkedHashMap<>();
        expertiseProps.put("skill", string("Skill name").required());
        expertiseProps.put("level", enumOf("Proficiency", "beginner", "intermediate", "advanced", "expert").required());
        SchemaNode expertise = object("Skill with proficiency level", expertiseProps);
        return ToolDefinition.builder(TEAM_OPERATIONS,
                        "Comprehensive team member management operations including create, read, update, delete, availability, skills, and workload management")
                .field("member_id", id("Team member ID (required for get, update, delete, update_skills, get_workload)"))
                .field("client_id", id("Client ID for scoping operations"))
                .field("organization_id", id("Organization ID for scoping operations"))
                .field("user_id", id("User ID performing the operation (required for create, update, delete, update_skills)"))
                .field("member_data", object("Team member data for create/update operations"))
                .field("skills", arrayOf(string("Skill"), "Skills array for update_skills action"))
                .field("expertise", arrayOf(expertise, "Expertise array for update_skills action"))
                .field("skill_required", string("Required skill for get_available action"))
                .field("role", string("Filter by role"))
                .field("status", string("Filter by status"))
                .field("availability", string("Filter by availability type"))
                .field("page", page())
                .field("limit", limit())
                .field("filters", object("Additional filters for list action"))
                .mutating("create", TeamCommand.Create.class, "member_data")
                .read("get", TeamCommand.Get.class, "member_id")
                .read("list", TeamCommand.ListAll.class)
                .mutating("update", TeamCommand.Update.class, "member_id", "member_data")
                .mutating("delete", TeamCommand.Delete.class, "member_id")
                .read("get_available", TeamCommand.GetAvailable.class)
                .mutating("update_skills", TeamCommand.UpdateSkills.class, "member_id")
                .read("get_workload", TeamCommand.GetWorkload.class, "member_id")
                .build();
    }

    static ToolDefinition searchOperations() {
        return ToolDefinition.builder(SEARCH_OPERATIONS,
                        "Advanced search operations across projects, tasks, and team members with cross-entity search, filtering, and related items discovery")
                .actionDescription("The search operation to perform")
                .field("search_term", string("Search term for cross_search action"))
                .field("entity_types", arrayOf(enumOf("Entity type", "projects", "tasks", "team_members"),
                        "Entity types to search in: projects, tasks, team_members (default: all)"))
                .field("client_id", id("Client ID for scoping search"))
                .field("organization_id", id("Organization ID for scoping search"))
                .field("filters", object("Advanced filters for advanced_filter action"))
                .field("entity_id", id("Entity ID for related_items action"))
                .field("entity_type", enumOf("Entity type for related_items action", "project", "task", "team_member"))
                .field("include_dependencies", bool("Include task dependencies in related items"))
                .field("page", integer("Page number (default: 1)").withRange(1, Integer.MAX_VALUE))
                .field("limit", integer("Items per page (default: 20)").withRange(1, 100))
                .read("cross_search", SearchCommand.CrossSearch.class, "search_term")
                .read("advanced_filter", SearchCommand.AdvancedFilter.class, "filters")
                .read("related_items", SearchCommand.RelatedItems.class, "entity_id", "entity_type")
                .build();
    }

    static ToolDefinition analyticsOperations() {
        Map<String, SchemaNode> rangeProps = new LinkedHashMap<>();
        rangeProps.put("start_date", dateTime("Range start").required());
        rangeProps.put("end_date", dateTime("Range end").required());
        SchemaNode dateRange = object("Date range for analytics (start_date, end_date)", rangeProps);
        return ToolDefinition.builder(ANALYTICS_OPERATIONS,
                        "Analytics and reporting operations for project progress, team performance, deadline tracking, and risk analysis")
                .actionDescription("The analytics operation to perform")
                .field("client_id", id("Client ID for scoping analytics"))
                .field("organization_id", id("Organization ID for scoping analytics"))
                .field("project_id", id("Project ID for project-specific analytics"))
                .field("team_member_id", id("Team member ID for individual performance analytics"))
                .field("date_range", dateRange)
                .field("include_historical", bool("Include historical data in analytics"))
                .field("group_by", enumOf("Group analytics by: day, week, month, quarter", "day", "week", "month", "quarter"))
                .read("project_progress", AnalyticsCommand.ProjectProgress.class)
                .read("team_performance", AnalyticsCommand.TeamPerformance.class)
                .read("deadline_tracking", AnalyticsCommand.DeadlineTracking.class)
                .read("risk_analysis", AnalyticsCommand.RiskAnalysis.class)
                .build();
    }

    static ToolDefinition assignmentOperations() {
        return ToolDefinition.builder(ASSIGNMENT_OPERATIONS,
                        "Intelligent task assignment operations with skill-based matching, workload balancing, and capacity planning")
                .actionDescription("The assignment operation to perform")
                .field("task_id", id("Task ID for skill_based_assignment"))
                .field("client_id", id("Client ID for scoping operations"))
                .field("organization_id", id("Organization ID for scoping operations"))
                .field("required_skills", arrayOf(string("Skill"), "Required skills for task assignment"))
                .field("priority_level", enumOf("Priority level for assignment (low, medium, high, urgent)", "low", "medium", "high", "urgent"))
                .field("estimated_hours", number("Estimated hours for the task").withMinimum(0))
                .field("due_date", dateTime("Due date for the task (ISO string)"))
                .field("team_member_ids", arrayOf(id("Team member ID"), "Specific team member IDs to consider for assignment"))
                .field("max_utilization", number("Maximum utilization percentage for workload balancing (default: 90)").withRange(0, 100))
                .field("planning_horizon", enumOf("Planning horizon for capacity planning (week, month, quarter)", "week", "month", "quarter"))
                .readAnyOf("skill_based_assignment", AssignmentCommand.SkillBasedAssignment.class, "task_id", "required_skills")
                .read("workload_balancing", AssignmentCommand.WorkloadBalancing.class)
                .read("capacity_planning", AssignmentCommand.CapacityPlanning.class)
                .build();
    }

    private static SchemaNode page() {
        return integer("Page number for list action (default: 1)").withRange(1, Integer.MAX_VALUE);
    }

    private static SchemaNode limit() {
        return integer("Items per page for list action (default: 20)").withRange(1, 100);
    }
}
