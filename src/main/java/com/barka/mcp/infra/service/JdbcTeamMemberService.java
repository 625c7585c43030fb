package com.barka.mcp.infra.service;

import com.barka.mcp.core.error.DomainException;
import com.barka.mcp.domain.PageRequest;
import com.barka.mcp.domain.PagedResult;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.domain.TeamMemberService;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.StoredEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class JdbcTeamMemberService extends AbstractDocumentService implements TeamMemberService {
    private static final Logger log = LoggerFactory.getLogger(JdbcTeamMemberService.class);

    public JdbcTeamMemberService(EntityRepository repo) {
        super(repo);
    }

    @Override
    public Map<String, Object> create(Map<String, Object> memberData, String userId) {
        Map<String, Object> body = writable(memberData);
        requireFields(body, "name", "email", "organization", "role");
        requireIds(body, "organization", "client");
        body.putIfAbsent("status", "active");
        body.putIfAbsent("skills", new ArrayList<>());
        body.putIfAbsent("expertise", new ArrayList<>());
        if (!(body.get("capacity") instanceof Map<?, ?>)) {
            Map<String, Object> capacity = new LinkedHashMap<>();
            capacity.put("hoursPerWeek", DEFAULT_HOURS_PER_WEEK);
            body.put("capacity", capacity);
        }
        body.put("createdBy", userId);
        body.put("lastModifiedBy", userId);
        StoredEntity saved = repo.insert(EntityKind.TEAM_MEMBER, body);
        log.info("Team member created: id={} role={}", saved.id(), body.get("role"));
        return saved.toDocument();
    }

    @Override
    public Map<String, Object> get(String memberId, Scope scope) {
        return findScoped(EntityKind.TEAM_MEMBER, memberId, scope)
                .map(StoredEntity::toDocument)
                .orElseThrow(() -> new DomainException("Team member not found or access denied"));
    }

    @Override
    public PagedResult<Map<String, Object>> list(PageRequest pageRequest, Map<String, Object> filters, Scope scope,
                                                 String role, String status, String availability) {
        List<Map<String, Object>> matching = new ArrayList<>();
        for (StoredEntity m : all(EntityKind.TEAM_MEMBER, scope)) {
            Map<String, Object> body = m.body();
            if ((role == null || role.equals(str(body, "role")))
                    && (status == null || status.equals(str(body, "status")))
                    && (availability == null || availability.equals(str(map(body, "capacity"), "availabilityType")))) {
                Map<String, Object> doc = m.toDocument();
                if (matches(doc, filters)) {
                    matching.add(doc);
                }
            }
        }
        return PagedResult.of(matching, pageRequest);
    }

    @Override
    public Map<String, Object> update(String memberId, Map<String, Object> changes, String userId) {
        StoredEntity member = require(EntityKind.TEAM_MEMBER, memberId, "Team member not found");
        Map<String, Object> body = merged(member.body(), changes);
        requireIds(body, "organization", "client");
        body.put("lastModifiedBy", userId);
        log.info("Updating team member {}", memberId);
        return repo.update(member, body).toDocument();
    }

    @Override
    public Map<String, Object> delete(String memberId, String userId) {
        StoredEntity member = require(EntityKind.TEAM_MEMBER, memberId, "Team member not found");
        softDelete(member, userId, "Team member not found");
        log.info("Team member deleted: {}", memberId);
        return JdbcProjectService.deleted(memberId);
    }

    @Override
    public List<Map<String, Object>> getAvailable(Scope scope, String skillRequired) {
        List<StoredEntity> tasks = allTasks();
        List<Map<String, Object>> res = new ArrayList<>();
        for (StoredEntity m : all(EntityKind.TEAM_MEMBER, scope)) {
            if (!"active".equals(str(m.body(), "status"))) {
                continue;
            }
            Workload w = Workload.of(m, tasks);
            if (w.utilizationPercentage() >= 100) {
                continue;
            }
            if (skillRequired != null && !hasSkill(m.body(), skillRequired)) {
                continue;
            }
            Map<String, Object> doc = m.toDocument();
            doc.put("workload", w.toMap());
            res.add(doc);
        }
        res.sort(Comparator.comparingInt(d -> (Integer) ((Map<?, ?>) d.get("workload")).get("utilizationPercentage")));
        return res;
    }

    static boolean hasSkill(Map<String, Object> body, String skill) {
        if (containsIgnoreCase(body.get("skills"), skill)) {
            return true;
        }
        for (Object e : list(body, "expertise")) {
            if (e instanceof Map<?, ?> m && containsIgnoreCase(m.get("skill"), skill)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Map<String, Object> updateSkills(String memberId, List<String> skills, List<Map<String, Object>> expertise,
                                            String userId) {
        StoredEntity member = require(EntityKind.TEAM_MEMBER, memberId, "Team member not found");
        Map<String, Object> body = new LinkedHashMap<>(member.body());
        body.put("skills", skills == null ? List.of() : skills);
        body.put("expertise", expertise == null ? List.of() : expertise);
        body.put("lastModifiedBy", userId);
        log.info("Skills updated for team member {}", memberId);
        return repo.update(member, body).toDocument();
    }

    @Override
    public Map<String, Object> getWorkload(String memberId) {
        StoredEntity member = require(EntityKind.TEAM_MEMBER, memberId, "Team member not found");
        List<StoredEntity> tasks = allTasks();
        Workload w = Workload.of(member, tasks);

        List<StoredEntity> assigned = new ArrayList<>();
        for (StoredEntity t : tasksWhere(tasks, "assignedTo", memberId)) {
            if (isOpen(t)) {
                assigned.add(t);
            }
        }
        assigned.sort(Comparator.comparing((StoredEntity t) -> str(t.body(), "dueDate"),
                Comparator.nullsLast(Comparator.naturalOrder())));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", member.id());
        summary.put("name", member.body().get("name"));
        summary.put("email", member.body().get("email"));
        summary.put("role", member.body().get("role"));

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("teamMember", summary);
        res.put("workload", w.toMap());
        res.put("capacity", map(member.body(), "capacity"));
        res.put("availabilityStatus", w.availabilityStatus());
        res.put("assignedTasks", documents(assigned));
        return res;
    }
}
