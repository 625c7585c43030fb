package com.barka.mcp.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public sealed interface SearchCommand extends ToolCommand {

    record CrossSearch(
            @JsonProperty("search_term") String searchTerm,
            @JsonProperty("entity_types") List<String> entityTypes,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId,
            Integer page,
            Integer limit
    ) implements SearchCommand, Scoped, Paged {}

    record AdvancedFilter(
            Map<String, Object> filters,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("organization_id") String organizationId
    ) implements SearchCommand, Scoped {}

    record RelatedItems(
            @JsonProperty("entity_id") String entityId,
            @JsonProperty("entity_type") String entityType,
            @JsonProperty("include_dependencies") Boolean includeDependencies
    ) implements SearchCommand {}
}
