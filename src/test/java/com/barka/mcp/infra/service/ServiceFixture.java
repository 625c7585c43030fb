package com.barka.mcp.infra.service;

import com.barka.mcp.domain.Scope;
import com.barka.mcp.infra.db.H2Store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All six services over one fresh {@link H2Store}, plus shorthands for seeding entities.
 */
final class ServiceFixture {
    static final String ORG = "65a1b2c3d4e5f6a7b8c9d0e1";
    static final String OTHER_ORG = "65a1b2c3d4e5f6a7b8c9d0e2";
    static final String USER = "507f191e810c19729de860ea";
    static final Scope SCOPE = new Scope(null, ORG);

    final H2Store store = H2Store.open();
    final JdbcProjectService projects = new JdbcProjectService(store.repo);
    final JdbcTaskService tasks = new JdbcTaskService(store.repo);
    final JdbcTeamMemberService members = new JdbcTeamMemberService(store.repo);
    final JdbcSearchService search = new JdbcSearchService(store.repo);
    final JdbcAnalyticsService analytics = new JdbcAnalyticsService(store.repo);
    final JdbcAssignmentService assignment = new JdbcAssignmentService(store.repo);

    /** ISO timestamp {@code days} after the store's start instant. */
    static String inDays(double days) {
        return H2Store.START.plus(Duration.ofMinutes(Math.round(days * 24 * 60))).toString();
    }

    static String id(Map<String, Object> doc) {
        return (String) doc.get("id");
    }

    Map<String, Object> project(String name, String org, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("description", name + " description");
        data.put("organization", org);
        data.putAll(extra);
        return projects.create(data, USER);
    }

    Map<String, Object> project(String name) {
        return project(name, ORG, Map.of());
    }

    Map<String, Object> task(String projectId, String name, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("description", name + " description");
        data.put("project", projectId);
        data.put("organization", ORG);
        data.putAll(extra);
        return tasks.create(data, USER);
    }

    Map<String, Object> member(String name, String role, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("email", name.toLowerCase().replace(' ', '.') + "@barka.test");
        data.put("organization", ORG);
        data.put("role", role);
        data.putAll(extra);
        return members.create(data, USER);
    }

    /** An open task of {@code hours} assigned to {@code memberId}. */
    Map<String, Object> assignedTask(String projectId, String memberId, double hours, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>(extra);
        data.put("assignedTo", memberId);
        data.put("estimatedHours", hours);
        return task(projectId, "Work for " + memberId.substring(18), data);
    }

    static Map<String, Object> with(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> obj(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> objs(Object value) {
        return new ArrayList<>((List<Map<String, Object>>) value);
    }

    static List<Object> ids(Object docs) {
        List<Object> res = new ArrayList<>();
        for (Map<String, Object> d : objs(docs)) {
            res.add(d.get("id"));
        }
        return res;
    }
}
