package com.barka.mcp.infra.service;

import com.barka.mcp.core.error.DomainException;
import com.barka.mcp.domain.PageRequest;
import com.barka.mcp.domain.PagedResult;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.domain.TaskService;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.StoredEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class JdbcTaskService extends AbstractDocumentService implements TaskService {
    private static final Logger log = LoggerFactory.getLogger(JdbcTaskService.class);

    static final List<String> STATUSES =
            List.of("not_started", "in_progress", "blocked", "under_review", "completed", "cancelled");

    public JdbcTaskService(EntityRepository repo) {
        super(repo);
    }

    @Override
    public Map<String, Object> create(Map<String, Object> taskData, String userId) {
        Map<String, Object> body = writable(taskData);
        requireFields(body, "name", "description", "project", "organization");
        requireIds(body, "project", "organization", "client");
        body.putIfAbsent("status", "not_started");
        body.putIfAbsent("priority", "medium");
        body.putIfAbsent("complexity", "medium");
        body.putIfAbsent("comments", new ArrayList<>());
        body.putIfAbsent("statusHistory", new ArrayList<>());
        body.put("createdBy", userId);
        body.put("lastModifiedBy", userId);
        StoredEntity saved = repo.insert(EntityKind.TASK, body);
        log.info("Task created: id={} project={}", saved.id(), body.get("project"));
        return saved.toDocument();
    }

    @Override
    public Map<String, Object> get(String taskId, Scope scope) {
        return findScoped(EntityKind.TASK, taskId, scope)
                .map(StoredEntity::toDocument)
                .orElseThrow(() -> new DomainException("Task not found or access denied"));
    }

    @Override
    public PagedResult<Map<String, Object>> list(PageRequest pageRequest, Map<String, Object> filters, Scope scope,
                                                 String projectId, String assigneeId, String status) {
        List<Map<String, Object>> matching = new ArrayList<>();
        for (StoredEntity t : all(EntityKind.TASK, scope)) {
            Map<String, Object> body = t.body();
            if ((projectId == null || projectId.equals(str(body, "project")))
                    && (assigneeId == null || assigneeId.equals(str(body, "assignedTo")))
                    && (status == null || status.equals(str(body, "status")))) {
                Map<String, Object> doc = t.toDocument();
                if (matches(doc, filters)) {
                    matching.add(doc);
                }
            }
        }
        return PagedResult.of(matching, pageRequest);
    }

    @Override
    public Map<String, Object> update(String taskId, Map<String, Object> changes, String userId) {
        StoredEntity task = require(EntityKind.TASK, taskId, "Task not found");
        Map<String, Object> body = merged(task.body(), changes);
        requireIds(body, "project", "organization", "client");
        body.put("lastModifiedBy", userId);
        log.info("Updating task {}", taskId);
        return repo.update(task, body).toDocument();
    }

    @Override
    public Map<String, Object> delete(String taskId, String userId) {
        StoredEntity task = require(EntityKind.TASK, taskId, "Task not found");
        int dependents = 0;
        for (StoredEntity t : allTasks()) {
            if (list(t.body(), "dependsOn").contains(taskId)) {
                dependents++;
            }
        }
        if (dependents > 0) {
            throw new DomainException("Cannot delete task: " + dependents + " tasks depend on this task");
        }
        softDelete(task, userId, "Task not found");
        log.info("Task deleted: {}", taskId);
        return JdbcProjectService.deleted(taskId);
    }

    @Override
    public Map<String, Object> assign(String taskId, String teamMemberId, String userId) {
        StoredEntity task = require(EntityKind.TASK, taskId, "Task not found");
        StoredEntity member = require(EntityKind.TEAM_MEMBER, teamMemberId, "Team member not found");
        Map<String, Object> body = new LinkedHashMap<>(task.body());
        body.put("assignedTo", teamMemberId);
        body.put("assignedToName", member.body().get("name"));
        body.put("lastModifiedBy", userId);
        log.info("Task {} assigned to {}", taskId, teamMemberId);
        return repo.update(task, body).toDocument();
    }

    @Override
    public Map<String, Object> addComment(String taskId, String userId, String content) {
        StoredEntity task = require(EntityKind.TASK, taskId, "Task not found");
        Map<String, Object> comment = new LinkedHashMap<>();
        comment.put("author", userId);
        comment.put("content", content);
        comment.put("createdAt", repo.now().toString());
        List<Object> comments = list(task.body(), "comments");
        comments.add(comment);
        Map<String, Object> body = new LinkedHashMap<>(task.body());
        body.put("comments", comments);
        return repo.update(task, body).toDocument();
    }

    @Override
    public Map<String, Object> updateStatus(String taskId, String newStatus, String userId, String comment) {
        if (!STATUSES.contains(newStatus)) {
            throw new DomainException("Invalid status '" + newStatus + "'. Expected one of: " + String.join(", ", STATUSES));
        }
        StoredEntity task = require(EntityKind.TASK, taskId, "Task not found");
        String now = repo.now().toString();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("status", newStatus);
        entry.put("timestamp", now);
        entry.put("changedBy", userId);
        entry.put("comment", comment == null ? "" : comment);
        List<Object> history = list(task.body(), "statusHistory");
        history.add(entry);

        Map<String, Object> body = new LinkedHashMap<>(task.body());
        body.put("statusHistory", history);
        body.put("status", newStatus);
        if ("completed".equals(newStatus)) {
            body.put("completedAt", now);
            Map<String, Object> progress = new LinkedHashMap<>(map(task.body(), "progress"));
            progress.put("completionPercentage", 100);
            body.put("progress", progress);
        }
        body.put("lastModifiedBy", userId);
        log.info("Task {} status changed to {}", taskId, newStatus);
        return repo.update(task, body).toDocument();
    }

    @Override
    public List<Map<String, Object>> search(String searchTerm, Scope scope) {
        List<Map<String, Object>> res = new ArrayList<>();
        for (StoredEntity t : all(EntityKind.TASK, scope)) {
            if (anyContains(t.body(), searchTerm, "name", "description", "tags", "category")) {
                res.add(t.toDocument());
                if (res.size() == 50) {
                    break;
                }
            }
        }
        return res;
    }
}
