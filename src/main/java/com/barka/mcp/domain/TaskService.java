package com.barka.mcp.domain;

import java.util.List;
import java.util.Map;

public interface TaskService {

    Map<String, Object> create(Map<String, Object> taskData, String userId);

    Map<String, Object> get(String taskId, Scope scope);

    PagedResult<Map<String, Object>> list(PageRequest pageRequest, Map<String, Object> filters, Scope scope,
                                          String projectId, String assigneeId, String status);

    Map<String, Object> update(String taskId, Map<String, Object> changes, String userId);

    Map<String, Object> delete(String taskId, String userId);

    Map<String, Object> assign(String taskId, String teamMemberId, String userId);

    Map<String, Object> addComment(String taskId, String userId, String content);

    Map<String, Object> updateStatus(String taskId, String newStatus, String userId, String comment);

    List<Map<String, Object>> search(String searchTerm, Scope scope);
}
