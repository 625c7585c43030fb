package com.barka.mcp.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public sealed interface TaskCommand extends ToolCommand {

    record Create(
            @JsonProperty("task_data") Map<String, Object> taskData,
            @JsonProperty("user_id") String userId
    ) implements TaskCommand {}

    record Get(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements TaskCommand, Scoped {}

    record ListAll(
            Integer page,
            Integer limit,
            Map<String, Object> filters,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("assignee_id") String assigneeId,
            String status
    ) implements TaskCommand, Scoped, Paged {}

    record Update(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("task_data") Map<String, Object> taskData,
            @JsonProperty("user_id") String userId
    ) implements TaskCommand {}

    record Delete(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("user_id") String userId
    ) implements TaskCommand {}

    record Assign(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("team_member_id") String teamMemberId,
            @JsonProperty("user_id") String userId
    ) implements TaskCommand {}

    record AddComment(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("comment_content") String commentContent,
            @JsonProperty("user_id") String userId
    ) implements TaskCommand {}

    record UpdateStatus(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("new_status") String newStatus,
            @JsonProperty("status_comment") String statusComment,
            @JsonProperty("user_id") String userId
    ) implements TaskCommand {}

    record Search(
            @JsonProperty("search_term") String searchTerm,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements TaskCommand, Scoped {}
}
