package com.barka.mcp.domain;

import java.util.Map;

public interface AnalyticsService {

    Map<String, Object> projectProgress(Scope scope, String projectId, Map<String, Object> dateRange, String groupBy);

    Map<String, Object> teamPerformance(Scope scope, String teamMemberId, Map<String, Object> dateRange);

    Map<String, Object> deadlineTracking(Scope scope);

    Map<String, Object> riskAnalysis(Scope scope);
}
