package com.barka.mcp.infra.service;

import com.barka.mcp.core.error.DomainException;
import com.barka.mcp.domain.PageRequest;
import com.barka.mcp.domain.PagedResult;
import com.barka.mcp.domain.ProjectService;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.StoredEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class JdbcProjectService extends AbstractDocumentService implements ProjectService {
    private static final Logger log = LoggerFactory.getLogger(JdbcProjectService.class);

    public JdbcProjectService(EntityRepository repo) {
        super(repo);
    }

    @Override
    public Map<String, Object> create(Map<String, Object> projectData, String userId) {
        Map<String, Object> body = writable(projectData);
        requireFields(body, "name", "description", "organization");
        requireIds(body, "organization", "client");
        body.putIfAbsent("status", "planning");
        body.putIfAbsent("priority", "medium");
        body.putIfAbsent("teamMembers", new ArrayList<>());
        body.put("createdBy", userId);
        body.put("lastModifiedBy", userId);
        StoredEntity saved = repo.insert(EntityKind.PROJECT, body);
        log.info("Project created: id={} name={}", saved.id(), body.get("name"));
        return saved.toDocument();
    }

    @Override
    public Map<String, Object> get(String projectId, Scope scope) {
        return findScoped(EntityKind.PROJECT, projectId, scope)
                .map(StoredEntity::toDocument)
                .orElseThrow(() -> new DomainException("Project not found or access denied"));
    }

    @Override
    public PagedResult<Map<String, Object>> list(PageRequest pageRequest, Map<String, Object> filters, Scope scope) {
        List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> doc : documents(all(EntityKind.PROJECT, scope))) {
            if (matches(doc, filters)) {
                matching.add(doc);
            }
        }
        return PagedResult.of(matching, pageRequest);
    }

    @Override
    public Map<String, Object> update(String projectId, Map<String, Object> changes, String userId) {
        StoredEntity project = require(EntityKind.PROJECT, projectId, "Project not found");
        Map<String, Object> body = merged(project.body(), changes);
        requireIds(body, "organization", "client");
        body.put("lastModifiedBy", userId);
        log.info("Updating project {}", projectId);
        return repo.update(project, body).toDocument();
    }

    @Override
    public Map<String, Object> delete(String projectId, String userId) {
        StoredEntity project = require(EntityKind.PROJECT, projectId, "Project not found");
        softDelete(project, userId, "Project not found");
        log.info("Project deleted: {}", projectId);
        return deleted(projectId);
    }

    @Override
    public List<Map<String, Object>> search(String searchTerm, Scope scope) {
        List<Map<String, Object>> res = new ArrayList<>();
        for (StoredEntity p : all(EntityKind.PROJECT, scope)) {
            if (anyContains(p.body(), searchTerm, "name", "description", "tags")) {
                res.add(p.toDocument());
                if (res.size() == 50) {
                    break;
                }
            }
        }
        return res;
    }

    @Override
    public List<Map<String, Object>> getTasks(String projectId) {
        return documents(tasksWhere(allTasks(), "project", projectId));
    }

    @Override
    public Map<String, Object> addTeamMember(String projectId, String teamMemberId, String userId) {
        StoredEntity project = require(EntityKind.PROJECT, projectId, "Project not found");
        require(EntityKind.TEAM_MEMBER, teamMemberId, "Team member not found");
        List<Object> members = list(project.body(), "teamMembers");
        if (members.contains(teamMemberId)) {
            throw new DomainException("Team member already assigned to project");
        }
        members.add(teamMemberId);
        Map<String, Object> body = new LinkedHashMap<>(project.body());
        body.put("teamMembers", members);
        body.put("lastModifiedBy", userId);
        log.info("Team member {} added to project {}", teamMemberId, projectId);
        return repo.update(project, body).toDocument();
    }

    @Override
    public Map<String, Object> getStatus(String projectId) {
        StoredEntity project = require(EntityKind.PROJECT, projectId, "Project not found");
        List<StoredEntity> tasks = tasksWhere(allTasks(), "project", projectId);
        Instant now = repo.now();
        int overdue = 0;
        for (StoredEntity t : tasks) {
            Instant due = instant(t.body().get("dueDate"));
            if (due != null && due.isBefore(now) && !"completed".equals(str(t.body(), "status"))) {
                overdue++;
            }
        }
        Instant due = instant(project.body().get("dueDate"));
        Long daysRemaining = due == null ? null : daysUntil(now, due);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("project", project.toDocument());
        status.put("progress", progress(tasks));
        status.put("deadlineStatus", deadlineStatus(daysRemaining));
        status.put("daysRemaining", daysRemaining);
        status.put("overdueTasks", overdue);
        status.put("totalTasks", tasks.size());
        status.put("teamSize", list(project.body(), "teamMembers").size());
        return status;
    }

    static Map<String, Object> progress(List<StoredEntity> tasks) {
        int completed = 0;
        int inProgress = 0;
        int notStarted = 0;
        for (StoredEntity t : tasks) {
            String s = str(t.body(), "status");
            if ("completed".equals(s)) completed++;
            else if ("in_progress".equals(s)) inProgress++;
            else if ("not_started".equals(s)) notStarted++;
        }
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("completionPercentage", tasks.isEmpty() ? 0 : (int) Math.round(completed * 100.0 / tasks.size()));
        p.put("totalTasks", tasks.size());
        p.put("completedTasks", completed);
        p.put("inProgressTasks", inProgress);
        p.put("notStartedTasks", notStarted);
        return p;
    }

    static String deadlineStatus(Long daysRemaining) {
        if (daysRemaining == null) return "unknown";
        if (daysRemaining < 0) return "overdue";
        if (daysRemaining == 0) return "due_today";
        if (daysRemaining <= 7) return "due_soon";
        return "on_track";
    }

    static Map<String, Object> deleted(String id) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("deleted", true);
        return m;
    }
}
