package com.barka.mcp.infra.service;

import com.barka.mcp.core.error.DomainException;
import com.barka.mcp.domain.PageRequest;
import com.barka.mcp.domain.PagedResult;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.domain.SearchService;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.StoredEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JdbcSearchService extends AbstractDocumentService implements SearchService {
    static final List<String> ALL_TYPES = List.of("projects", "tasks", "team_members");

    public JdbcSearchService(EntityRepository repo) {
        super(repo);
    }

    @Override
    public Map<String, Object> crossSearch(String searchTerm, List<String> entityTypes, Scope scope,
                                           PageRequest pageRequest) {
        List<String> types = entityTypes == null ? ALL_TYPES : entityTypes;
        int page = pageRequest.pageOrDefault();
        int limit = pageRequest.limitOrDefault();
        List<StoredEntity> tasks = allTasks();

        Map<String, Object> byType = new LinkedHashMap<>();
        int total = 0;
        if (types.contains("projects")) {
            List<Map<String, Object>> items = new ArrayList<>();
            for (StoredEntity p : slice(matching(EntityKind.PROJECT, scope, searchTerm,
                    "name", "description", "tags"), page, limit)) {
                Map<String, Object> item = summary(p, "project");
                item.put("description", p.body().get("description"));
                item.put("priority", p.body().get("priority"));
                item.put("progress", projectCompletion(tasks, p.id()));
                item.put("dueDate", p.body().get("dueDate"));
                item.put("teamSize", list(p.body(), "teamMembers").size());
                items.add(item);
            }
            byType.put("projects", group(items));
            total += items.size();
        }
        if (types.contains("tasks")) {
            List<Map<String, Object>> items = new ArrayList<>();
            for (StoredEntity t : slice(matching(EntityKind.TASK, scope, searchTerm,
                    "name", "description", "tags", "category"), page, limit)) {
                Map<String, Object> item = summary(t, "task");
                item.put("description", t.body().get("description"));
                item.put("priority", t.body().get("priority"));
                item.put("progress", completion(t.body()));
                item.put("dueDate", t.body().get("dueDate"));
                item.put("assignedTo", t.body().get("assignedToName"));
                item.put("project", t.body().get("project"));
                item.put("estimatedHours", t.body().get("estimatedHours"));
                items.add(item);
            }
            byType.put("tasks", group(items));
            total += items.size();
        }
        if (types.contains("team_members")) {
            List<Map<String, Object>> items = new ArrayList<>();
            for (StoredEntity m : slice(matching(EntityKind.TEAM_MEMBER, scope, searchTerm,
                    "name", "email", "department", "title", "skills"), page, limit)) {
                Map<String, Object> item = summary(m, "team_member");
                item.put("email", m.body().get("email"));
                item.put("role", m.body().get("role"));
                item.put("department", m.body().get("department"));
                item.put("title", m.body().get("title"));
                item.put("skills", m.body().get("skills"));
                item.put("utilization", Workload.of(m, tasks).utilizationPercentage());
                items.add(item);
            }
            byType.put("team_members", group(items));
            total += items.size();
        }

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("search_term", searchTerm);
        res.put("total_results", total);
        res.put("page", page);
        res.put("limit", limit);
        res.put("results_by_type", byType);
        return res;
    }

    private List<StoredEntity> matching(EntityKind kind, Scope scope, String term, String... keys) {
        List<StoredEntity> res = new ArrayList<>();
        for (StoredEntity e : all(kind, scope)) {
            if (anyContains(e.body(), term, keys)) {
                res.add(e);
            }
        }
        return res;
    }

    private static List<StoredEntity> slice(List<StoredEntity> all, int page, int limit) {
        int from = PagedResult.offset(page, limit, all.size());
        return all.subList(from, (int) Math.min((long) from + limit, all.size()));
    }

    private static Map<String, Object> summary(StoredEntity e, String type) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", e.id());
        item.put("type", type);
        item.put("name", e.body().get("name"));
        item.put("status", e.body().get("status"));
        return item;
    }

    private static Map<String, Object> group(List<Map<String, Object>> items) {
        Map<String, Object> g = new LinkedHashMap<>();
        g.put("count", items.size());
        g.put("items", items);
        return g;
    }

    @Override
    public Map<String, Object> advancedFilter(Map<String, Object> filters, Scope scope) {
        List<Object> types = filters.get("entity_types") instanceof List<?> ? list(filters, "entity_types") : null;
        List<StoredEntity> tasks = allTasks();
        Map<String, Object> results = new LinkedHashMap<>();

        if (types == null || types.contains("projects")) {
            Map<String, Object> range = map(filters, "date_range");
            Map<String, Object> progressRange = map(filters, "progress_range");
            Instant start = instant(range.get("start_date"));
            Instant end = instant(range.get("end_date"));
            List<Map<String, Object>> projects = new ArrayList<>();
            for (StoredEntity p : all(EntityKind.PROJECT, scope)) {
                Map<String, Object> b = p.body();
                if (!equalIfSet(b, filters, "status") || !equalIfSet(b, filters, "priority")) {
                    continue;
                }
                if (start != null && !onOrAfter(instant(b.get("startDate")), start)) {
                    continue;
                }
                if (end != null && !onOrBefore(instant(b.get("dueDate")), end)) {
                    continue;
                }
                if (!progressRange.isEmpty()) {
                    int completion = projectCompletion(tasks, p.id());
                    if (!within(completion, progressRange)) {
                        continue;
                    }
                }
                projects.add(p.toDocument());
            }
            results.put("projects", projects);
        }
        if (types == null || types.contains("tasks")) {
            List<Map<String, Object>> matched = new ArrayList<>();
            for (StoredEntity t : all(EntityKind.TASK, scope)) {
                Map<String, Object> b = t.body();
                if (equalIfSet(b, filters, "status") && equalIfSet(b, filters, "priority")
                        && equalIfSet(b, filters, "assignedTo") && equalIfSet(b, filters, "project")
                        && equalIfSet(b, filters, "complexity")) {
                    matched.add(t.toDocument());
                }
            }
            results.put("tasks", matched);
        }
        if (types == null || types.contains("team_members")) {
            Map<String, Object> utilizationRange = map(filters, "utilization_range");
            Object skills = filters.get("skills");
            List<Map<String, Object>> members = new ArrayList<>();
            for (StoredEntity m : all(EntityKind.TEAM_MEMBER, scope)) {
                Map<String, Object> b = m.body();
                if (!equalIfSet(b, filters, "role") || !equalIfSet(b, filters, "status")
                        || !equalIfSet(b, filters, "department")) {
                    continue;
                }
                if (skills != null && !sharesAny(list(b, "skills"), skills)) {
                    continue;
                }
                if (!utilizationRange.isEmpty()
                        && !within(Workload.of(m, tasks).utilizationPercentage(), utilizationRange)) {
                    continue;
                }
                members.add(m.toDocument());
            }
            results.put("team_members", members);
        }

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("filters_applied", filters);
        res.put("results", results);
        return res;
    }

    private static boolean equalIfSet(Map<String, Object> body, Map<String, Object> filters, String key) {
        Object wanted = filters.get(key);
        return wanted == null || sameValue(body.get(key), wanted);
    }

    private static boolean within(double value, Map<String, Object> range) {
        return value >= number(range.get("min"), 0) && value <= number(range.get("max"), 100);
    }

    private static boolean sharesAny(List<Object> have, Object wanted) {
        List<?> wantedList = wanted instanceof List<?> l ? l : List.of(wanted);
        for (Object w : wantedList) {
            if (have.contains(w)) {
                return true;
            }
        }
        return false;
    }

    private static boolean onOrAfter(Instant value, Instant bound) {
        return value != null && !value.isBefore(bound);
    }

    private static boolean onOrBefore(Instant value, Instant bound) {
        return value != null && !value.isAfter(bound);
    }

    @Override
    public Map<String, Object> relatedItems(String entityId, String entityType, Boolean includeDependencies) {
        Map<String, Object> related = new LinkedHashMap<>();
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("entity_id", entityId);
        res.put("entity_type", entityType);
        List<StoredEntity> tasks = allTasks();

        switch (entityType) {
            case "project" -> {
                StoredEntity project = require(EntityKind.PROJECT, entityId, "Project not found");
                res.put("entity", project.toDocument());
                related.put("tasks", documents(tasksWhere(tasks, "project", entityId)));
                related.put("team_members", documentsByIds(EntityKind.TEAM_MEMBER, list(project.body(), "teamMembers")));
            }
            case "task" -> {
                StoredEntity task = require(EntityKind.TASK, entityId, "Task not found");
                res.put("entity", task.toDocument());
                related.put("project", documentById(EntityKind.PROJECT, str(task.body(), "project")));
                related.put("assignee", documentById(EntityKind.TEAM_MEMBER, str(task.body(), "assignedTo")));
                if (Boolean.TRUE.equals(includeDependencies)) {
                    related.put("dependencies", documentsByIds(EntityKind.TASK, list(task.body(), "dependsOn")));
                    List<StoredEntity> blocking = new ArrayList<>();
                    for (StoredEntity t : tasks) {
                        if (list(t.body(), "dependsOn").contains(entityId)) {
                            blocking.add(t);
                        }
                    }
                    related.put("blocking_tasks", documents(blocking));
                    related.put("subtasks", documents(tasksWhere(tasks, "parentTask", entityId)));
                }
            }
            case "team_member" -> {
                StoredEntity member = require(EntityKind.TEAM_MEMBER, entityId, "Team member not found");
                res.put("entity", member.toDocument());
                related.put("tasks", documents(tasksWhere(tasks, "assignedTo", entityId)));
                List<StoredEntity> projects = new ArrayList<>();
                for (StoredEntity p : all(EntityKind.PROJECT, Scope.unscoped())) {
                    if (list(p.body(), "teamMembers").contains(entityId)) {
                        projects.add(p);
                    }
                }
                related.put("projects", documents(projects));
            }
            default -> throw new DomainException("Unsupported entity type: " + entityType);
        }
        res.put("related_items", related);
        return res;
    }

    private Map<String, Object> documentById(EntityKind kind, String id) {
        if (id == null) {
            return null;
        }
        Optional<StoredEntity> e = repo.findActive(kind, id);
        return e.map(StoredEntity::toDocument).orElse(null);
    }

    private List<Map<String, Object>> documentsByIds(EntityKind kind, List<Object> ids) {
        List<Map<String, Object>> docs = new ArrayList<>();
        for (Object id : ids) {
            if (id != null) {
                repo.findActive(kind, id.toString()).ifPresent(e -> docs.add(e.toDocument()));
            }
        }
        return docs;
    }
}
