package com.barka.mcp.domain;

import java.util.List;
import java.util.Map;

public interface TeamMemberService {

    Map<String, Object> create(Map<String, Object> memberData, String userId);

    Map<String, Object> get(String memberId, Scope scope);

    PagedResult<Map<String, Object>> list(PageRequest pageRequest, Map<String, Object> filters, Scope scope,
                                          String role, String status, String availability);

    Map<String, Object> update(String memberId, Map<String, Object> changes, String userId);

    Map<String, Object> delete(String memberId, String userId);

    List<Map<String, Object>> getAvailable(Scope scope, String skillRequired);

    /**
     * Replaces the member's skills and expertise. Null lists are stored as empty.
     */
    Map<String, Object> updateSkills(String memberId, List<String> skills, List<Map<String, Object>> expertise,
                                     String userId);

    Map<String, Object> getWorkload(String memberId);
}
