package com.barka.mcp.domain;

import java.util.List;
import java.util.Map;

public interface AssignmentService {

    Map<String, Object> skillBasedAssignment(String taskId, List<String> requiredSkills, String priorityLevel,
                                             Double estimatedHours, String dueDate, Scope scope,
                                             List<String> teamMemberIds);

    Map<String, Object> workloadBalancing(Scope scope, Double maxUtilization);

    Map<String, Object> capacityPlanning(String planningHorizon, Scope scope);
}
