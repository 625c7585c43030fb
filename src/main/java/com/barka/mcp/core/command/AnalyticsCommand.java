package com.barka.mcp.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public sealed interface AnalyticsCommand extends ToolCommand {

    record ProjectProgress(
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("date_range") Map<String, Object> dateRange,
            @JsonProperty("group_by") String groupBy
    ) implements AnalyticsCommand, Scoped {}

    record TeamPerformance(
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            @JsonProperty("team_member_id") String teamMemberId,
            @JsonProperty("date_range") Map<String, Object> dateRange
    ) implements AnalyticsCommand, Scoped {}

    record DeadlineTracking(
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements AnalyticsCommand, Scoped {}

    record RiskAnalysis(
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements AnalyticsCommand, Scoped {}
}
