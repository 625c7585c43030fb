package com.barka.mcp.domain;

import java.util.List;
import java.util.Map;

public interface SearchService {

    /**
     * @param entityTypes subset of {@code projects, tasks, team_members}; null searches all of them
     */
    Map<String, Object> crossSearch(String searchTerm, List<String> entityTypes, Scope scope, PageRequest pageRequest);

    Map<String, Object> advancedFilter(Map<String, Object> filters, Scope scope);

    Map<String, Object> relatedItems(String entityId, String entityType, Boolean includeDependencies);
}
