package com.barka.mcp.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public sealed interface TeamCommand extends ToolCommand {

    record Create(
            @JsonProperty("member_data") Map<String, Object> memberData,
            @JsonProperty("user_id") String userId
    ) implements TeamCommand {}

    record Get(
            @JsonProperty("member_id") String memberId,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements TeamCommand, Scoped {}

    record ListAll(
            Integer page,
            Integer limit,
            Map<String, Object> filters,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            String role,
            String status,
            String availability
    ) implements TeamCommand, Scoped, Paged {}

    record Update(
            @JsonProperty("member_id") String memberId,
            @JsonProperty("member_data") Map<String, Object> memberData,
            @JsonProperty("user_id") String userId
    ) implements TeamCommand {}

    record Delete(
            @JsonProperty("member_id") String memberId,
            @JsonProperty("user_id") String userId
    ) implements TeamCommand {}

    record GetAvailable(
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            @JsonProperty("skill_required") String skillRequired
    ) implements TeamCommand, Scoped {}

    record UpdateSkills(
            @JsonProperty("member_id") String memberId,
            List<String> skills,
            List<Map<String, Object>> expertise,
            @JsonProperty("user_id") String userId
    ) implements TeamCommand {}

    record GetWorkload(@JsonProperty("member_id") String memberId) implements TeamCommand {}
}
