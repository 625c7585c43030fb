package com.barka.mcp.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public sealed interface ProjectCommand extends ToolCommand {

    record Create(
            @JsonProperty("project_data") Map<String, Object> projectData,
            @JsonProperty("user_id") String userId
    ) implements ProjectCommand {}

    record Get(
            @JsonProperty("project_id") String projectId,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements ProjectCommand, Scoped {}

    record ListAll(
            Integer page,
            Integer limit,
            Map<String, Object> filters,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements ProjectCommand, Scoped, Paged {}

    record Update(
            @JsonProperty("project_id") String projectId,
            @JsonProperty("project_data") Map<String, Object> projectData,
            @JsonProperty("user_id") String userId
    ) implements ProjectCommand {}

    record Delete(
            @JsonProperty("project_id") String projectId,
            @JsonProperty("user_id") String userId
    ) implements ProjectCommand {}

    record Search(
            @JsonProperty("search_term") String searchTerm,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements ProjectCommand, Scoped {}

    record GetTasks(@JsonProperty("project_id") String projectId) implements ProjectCommand {}

    record AddTeamMember(
            @JsonProperty("project_id") String projectId,
            @JsonProperty("team_member_id") String teamMemberId,
            @JsonProperty("user_id") String userId
    ) implements ProjectCommand {}

    record GetStatus(@JsonProperty("project_id") String projectId) implements ProjectCommand {}
}
