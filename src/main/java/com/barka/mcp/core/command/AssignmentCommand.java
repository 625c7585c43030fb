package com.barka.mcp.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public sealed interface AssignmentCommand extends ToolCommand {

    record SkillBasedAssignment(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("required_skills") List<String> requiredSkills,
            @JsonProperty("priority_level") String priorityLevel,
            @JsonProperty("estimated_hours") Double estimatedHours,
            @JsonProperty("due_date") String dueDate,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            @JsonProperty("team_member_ids") List<String> teamMemberIds
    ) implements AssignmentCommand, Scoped {}

    record WorkloadBalancing(
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            @JsonProperty("max_utilization") Double maxUtilization
    ) implements AssignmentCommand, Scoped {}

    record CapacityPlanning(
            @JsonProperty("planning_horizon") String planningHorizon,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements AssignmentCommand, Scoped {}
}
