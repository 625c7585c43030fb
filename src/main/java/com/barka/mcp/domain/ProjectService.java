package com.barka.mcp.domain;

import java.util.List;
import java.util.Map;

/**
 * Project persistence and queries. Implementations throw
 * {@link com.barka.mcp.core.error.DomainException} for business failures.
 */
public interface ProjectService {

    Map<String, Object> create(Map<String, Object> projectData, String userId);

    Map<String, Object> get(String projectId, Scope scope);

    PagedResult<Map<String, Object>> list(PageRequest pageRequest, Map<String, Object> filters, Scope scope);

    Map<String, Object> update(String projectId, Map<String, Object> changes, String userId);

    Map<String, Object> delete(String projectId, String userId);

    List<Map<String, Object>> search(String searchTerm, Scope scope);

    List<Map<String, Object>> getTasks(String projectId);

    Map<String, Object> addTeamMember(String projectId, String teamMemberId, String userId);

    Map<String, Object> getStatus(String projectId);
}
