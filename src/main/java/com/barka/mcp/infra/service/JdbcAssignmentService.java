package com.barka.mcp.infra.service;

import com.barka.mcp.domain.AssignmentService;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.StoredEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class JdbcAssignmentService extends AbstractDocumentService implements AssignmentService {
    static final double DEFAULT_MAX_UTILIZATION = 90;
    static final double DEFAULT_TASK_HOURS = 8;
    private static final List<String> PRIORITY_ORDER = List.of("urgent", "high", "medium", "low");

    public JdbcAssignmentService(EntityRepository repo) {
        super(repo);
    }

    @Override
    public Map<String, Object> skillBasedAssignment(String taskId, List<String> requiredSkills, String priorityLevel,
                                                    Double estimatedHours, String dueDate, Scope scope,
                                                    List<String> teamMemberIds) {
        List<String> skills = requiredSkills == null ? List.of() : requiredSkills;
        String priority = priorityLevel == null ? "medium" : priorityLevel;
        double hours = estimatedHours == null ? 0 : estimatedHours;
        StoredEntity task = taskId == null ? null : require(EntityKind.TASK, taskId, "Task not found");

        List<StoredEntity> tasks = allTasks();
        List<Map<String, Object>> recommendations = new ArrayList<>();
        for (StoredEntity m : all(EntityKind.TEAM_MEMBER, scope)) {
            if (!"active".equals(str(m.body(), "status"))) {
                continue;
            }
            if (teamMemberIds != null && !teamMemberIds.isEmpty() && !teamMemberIds.contains(m.id())) {
                continue;
            }
            recommendations.add(recommend(m, Workload.of(m, tasks), skills, priority, hours));
        }
        recommendations.sort(Comparator.comparingInt((Map<String, Object> r) -> (Integer) r.get("score")).reversed());

        Map<String, Object> taskInfo = new LinkedHashMap<>();
        if (task != null) {
            taskInfo.put("id", task.id());
            taskInfo.put("name", task.body().get("name"));
            taskInfo.put("project", task.body().get("project"));
        }
        taskInfo.put("required_skills", skills);
        taskInfo.put("estimated_hours", hours);
        taskInfo.put("priority", priority);
        taskInfo.put("due_date", dueDate);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_candidates", recommendations.size());
        summary.put("highly_recommended", countWith(recommendations, "highly_recommended"));
        summary.put("recommended", countWith(recommendations, "recommended"));
        summary.put("possible", countWith(recommendations, "possible"));

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("task_info", taskInfo);
        res.put("recommendations", new ArrayList<>(recommendations.subList(0, Math.min(10, recommendations.size()))));
        res.put("summary", summary);
        return res;
    }

    /**
     * Scores a candidate out of 100: skills up to 40, availability up to 30, capacity up to 20
     * and delivery record up to 10, less 10 for an overloaded member on an urgent task.
     */
    static Map<String, Object> recommend(StoredEntity member, Workload workload, List<String> requiredSkills,
                                         String priority, double estimatedHours) {
        Map<String, Object> b = member.body();
        int score = 0;
        List<String> factors = new ArrayList<>();

        if (!requiredSkills.isEmpty()) {
            int match = 0;
            int bonus = 0;
            for (String skill : requiredSkills) {
                if (containsSkill(list(b, "skills"), skill)) {
                    match += 10;
                    factors.add("Has skill: " + skill);
                }
                Map<?, ?> expertise = expertiseFor(list(b, "expertise"), skill);
                if (expertise != null) {
                    String level = String.valueOf(expertise.get("level"));
                    bonus += switch (level) {
                        case "expert" -> 5;
                        case "advanced" -> 3;
                        case "intermediate" -> 2;
                        case "beginner" -> 1;
                        default -> 0;
                    };
                    factors.add(level + " in " + skill);
                }
            }
            score += Math.min(40, match + bonus);
        } else {
            score += 20;
        }

        int utilization = workload.utilizationPercentage();
        if (utilization < 60) {
            score += 30;
            factors.add("Low utilization (available)");
        } else if (utilization < 80) {
            score += 20;
            factors.add("Moderate utilization");
        } else if (utilization < 95) {
            score += 10;
            factors.add("High utilization");
        } else {
            factors.add("Overutilized");
        }

        double remaining = workload.remainingHours();
        if (estimatedHours > 0) {
            if (remaining >= estimatedHours) {
                score += 20;
                factors.add("Sufficient capacity");
            } else if (remaining >= estimatedHours * 0.5) {
                score += 10;
                factors.add("Partial capacity");
            } else {
                factors.add("Insufficient capacity");
            }
        } else {
            score += 10;
        }

        double onTime = number(map(b, "performance").get("onTimeDeliveryRate"), 80);
        if (onTime >= 90) {
            score += 10;
            factors.add("Excellent delivery record");
        } else if (onTime >= 80) {
            score += 7;
            factors.add("Good delivery record");
        } else if (onTime >= 70) {
            score += 5;
            factors.add("Average delivery record");
        } else {
            score += 2;
            factors.add("Below average delivery record");
        }

        if ("urgent".equals(priority) && utilization > 90) {
            score -= 10;
        }

        Map<String, Object> candidate = new LinkedHashMap<>();
        candidate.put("id", member.id());
        candidate.put("name", b.get("name"));
        candidate.put("email", b.get("email"));
        candidate.put("role", b.get("role"));
        candidate.put("skills", b.get("skills"));
        candidate.put("utilization", utilization);
        candidate.put("capacity", remaining);

        Map<String, Object> r = new LinkedHashMap<>();
        r.put("member", candidate);
        r.put("score", score);
        r.put("factors", factors);
        r.put("recommendation", score >= 70 ? "highly_recommended"
                : score >= 50 ? "recommended"
                : score >= 30 ? "possible" : "not_recommended");
        return r;
    }

    private static boolean containsSkill(List<Object> skills, String skill) {
        String needle = skill.toLowerCase(Locale.ROOT);
        for (Object s : skills) {
            if (s != null && s.toString().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static Map<?, ?> expertiseFor(List<Object> expertise, String skill) {
        for (Object e : expertise) {
            if (e instanceof Map<?, ?> m && containsIgnoreCase(m.get("skill"), skill)) {
                return m;
            }
        }
        return null;
    }

    private static long countWith(List<Map<String, Object>> recommendations, String level) {
        return recommendations.stream().filter(r -> level.equals(r.get("recommendation"))).count();
    }

    @Override
    public Map<String, Object> workloadBalancing(Scope scope, Double maxUtilization) {
        double max = maxUtilization == null ? DEFAULT_MAX_UTILIZATION : maxUtilization;
        List<StoredEntity> tasks = allTasks();

        List<Map<String, Object>> over = new ArrayList<>();
        List<Map<String, Object>> optimal = new ArrayList<>();
        List<Map<String, Object>> under = new ArrayList<>();
        for (StoredEntity m : all(EntityKind.TEAM_MEMBER, scope)) {
            if (!"active".equals(str(m.body(), "status"))) {
                continue;
            }
            Workload w = Workload.of(m, tasks);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", m.id());
            data.put("name", m.body().get("name"));
            data.put("role", m.body().get("role"));
            data.put("utilization", w.utilizationPercentage());
            data.put("current_tasks", w.currentTasks());
            data.put("capacity", w.hoursPerWeek());
            if (w.utilizationPercentage() > max) {
                over.add(data);
            } else if (w.utilizationPercentage() >= 60) {
                optimal.add(data);
            } else {
                under.add(data);
            }
        }

        List<Map<String, Object>> suggestions = new ArrayList<>();
        if (!over.isEmpty() && !under.isEmpty()) {
            for (Map<String, Object> from : over) {
                List<StoredEntity> memberTasks = new ArrayList<>();
                for (StoredEntity t : tasksWhere(tasks, "assignedTo", (String) from.get("id"))) {
                    if (isOpen(t)) {
                        memberTasks.add(t);
                    }
                }
                memberTasks.sort(byPriorityThenDue());
                for (StoredEntity t : memberTasks.subList(0, Math.min(3, memberTasks.size()))) {
                    List<Map<String, Object>> candidates = new ArrayList<>();
                    for (Map<String, Object> c : under) {
                        Object role = c.get("role");
                        if (sameValue(role, from.get("role")) || "developer".equals(role) || "qa_engineer".equals(role)) {
                            candidates.add(projected(c, t));
                            if (candidates.size() == 2) {
                                break;
                            }
                        }
                    }
                    if (!candidates.isEmpty()) {
                        Map<String, Object> fromInfo = new LinkedHashMap<>();
                        fromInfo.put("id", from.get("id"));
                        fromInfo.put("name", from.get("name"));
                        fromInfo.put("current_utilization", from.get("utilization"));
                        Map<String, Object> s = new LinkedHashMap<>();
                        s.put("task", taskSummary(t));
                        s.put("from", fromInfo);
                        s.put("to_candidates", candidates);
                        suggestions.add(s);
                    }
                }
            }
        }

        List<StoredEntity> unassigned = new ArrayList<>();
        for (StoredEntity t : all(EntityKind.TASK, scope)) {
            if (t.body().get("assignedTo") == null && isOpen(t)) {
                unassigned.add(t);
            }
        }
        List<Map<String, Object>> pool = new ArrayList<>(under);
        for (Map<String, Object> m : optimal) {
            if ((Integer) m.get("utilization") < 80) {
                pool.add(m);
            }
        }
        pool.sort(Comparator.comparingInt(m -> (Integer) m.get("utilization")));
        List<Map<String, Object>> best = pool.subList(0, Math.min(3, pool.size()));
        List<Map<String, Object>> recommendations = new ArrayList<>();
        if (!best.isEmpty()) {
            for (StoredEntity t : unassigned.subList(0, Math.min(10, unassigned.size()))) {
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("task", taskSummary(t));
                r.put("suggested_assignees", new ArrayList<>(best));
                recommendations.add(r);
            }
        }

        Map<String, Object> utilization = new LinkedHashMap<>();
        utilization.put("overutilized", over);
        utilization.put("optimal", optimal);
        utilization.put("underutilized", under);

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("max_utilization", max);
        res.put("team_utilization", utilization);
        res.put("rebalancing_suggestions", suggestions);
        res.put("unassigned_tasks", unassigned.size());
        res.put("recommendations", recommendations);
        return res;
    }

    private static Map<String, Object> projected(Map<String, Object> candidate, StoredEntity task) {
        double hours = number(task.body().get("estimatedHours"), DEFAULT_TASK_HOURS);
        double capacity = number(candidate.get("capacity"), DEFAULT_HOURS_PER_WEEK);
        double current = number(candidate.get("utilization"), 0);
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("id", candidate.get("id"));
        c.put("name", candidate.get("name"));
        c.put("current_utilization", candidate.get("utilization"));
        c.put("projected_utilization", round1(current + hours / capacity * 100));
        return c;
    }

    private static Map<String, Object> taskSummary(StoredEntity t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", t.id());
        m.put("name", t.body().get("name"));
        m.put("project", t.body().get("project"));
        m.put("priority", t.body().get("priority"));
        m.put("estimated_hours", t.body().get("estimatedHours"));
        return m;
    }

    private static Comparator<StoredEntity> byPriorityThenDue() {
        return Comparator.comparingInt((StoredEntity t) -> {
                    int i = PRIORITY_ORDER.indexOf(str(t.body(), "priority"));
                    return i < 0 ? PRIORITY_ORDER.size() : i;
                })
                .thenComparing(t -> str(t.body(), "dueDate"), Comparator.nullsLast(Comparator.naturalOrder()));
    }

    @Override
    public Map<String, Object> capacityPlanning(String planningHorizon, Scope scope) {
        String horizon = planningHorizon == null ? "month" : planningHorizon;
        int days;
        int weeks;
        switch (horizon) {
            case "week" -> {
                days = 7;
                weeks = 1;
            }
            case "quarter" -> {
                days = 90;
                weeks = 12;
            }
            default -> {
                days = 30;
                weeks = 4;
            }
        }
        Instant now = repo.now();
        Instant end = now.plus(Duration.ofDays(days));
        List<StoredEntity> tasks = allTasks();

        List<StoredEntity> members = new ArrayList<>();
        for (StoredEntity m : all(EntityKind.TEAM_MEMBER, scope)) {
            if ("active".equals(str(m.body(), "status"))) {
                members.add(m);
            }
        }
        List<StoredEntity> upcoming = new ArrayList<>();
        for (StoredEntity t : all(EntityKind.TASK, scope)) {
            Instant due = instant(t.body().get("dueDate"));
            if (due != null && !due.isBefore(now) && !due.isAfter(end) && isOpen(t)) {
                upcoming.add(t);
            }
        }
        int projectsDue = 0;
        for (StoredEntity p : all(EntityKind.PROJECT, scope)) {
            Instant due = instant(p.body().get("dueDate"));
            String status = str(p.body(), "status");
            if (due != null && !due.isBefore(now) && !due.isAfter(end)
                    && ("planning".equals(status) || "active".equals(status))) {
                projectsDue++;
            }
        }

        double available = 0;
        double allocated = 0;
        Map<String, double[]> roles = new LinkedHashMap<>();
        Map<String, String> roleOfMember = new LinkedHashMap<>();
        for (StoredEntity m : members) {
            Workload w = Workload.of(m, tasks);
            available += w.hoursPerWeek() * weeks;
            allocated += w.totalHoursAllocated();
            String role = String.valueOf(str(m.body(), "role"));
            roleOfMember.put(m.id(), role);
            double[] r = roles.computeIfAbsent(role, k -> new double[4]);
            r[0]++;
            r[1] += w.hoursPerWeek() * weeks;
            r[2] += w.totalHoursAllocated();
        }
        double needed = 0;
        for (StoredEntity t : upcoming) {
            double h = number(t.body().get("estimatedHours"), DEFAULT_TASK_HOURS);
            needed += h;
            String role = roleOfMember.getOrDefault(str(t.body(), "assignedTo"), "developer");
            double[] r = roles.get(role);
            if (r != null) {
                r[3] += h;
            }
        }

        Map<String, Object> capacity = new LinkedHashMap<>();
        capacity.put("total_members", members.size());
        capacity.put("total_hours_available", available);
        capacity.put("total_hours_allocated", allocated);
        capacity.put("utilization_percentage", available > 0 ? Math.round(allocated / available * 100) : 0);

        Map<String, Object> demand = new LinkedHashMap<>();
        demand.put("upcoming_tasks", upcoming.size());
        demand.put("estimated_hours_needed", needed);
        demand.put("projects_due", projectsDue);

        List<Map<String, Object>> gaps = new ArrayList<>();
        double remaining = available - allocated;
        if (needed > remaining) {
            Map<String, Object> gap = new LinkedHashMap<>();
            gap.put("type", "overall_capacity_shortage");
            gap.put("shortage_hours", needed - remaining);
            gap.put("severity", needed > remaining * 1.5 ? "high" : "medium");
            gaps.add(gap);
        }

        List<Map<String, Object>> recommendations = new ArrayList<>();
        roles.forEach((role, r) -> {
            double free = r[1] - r[2];
            Map<String, Object> rec = new LinkedHashMap<>();
            if (r[3] > free) {
                rec.put("type", "hire_additional_staff");
                rec.put("role", role);
                rec.put("current_members", (int) r[0]);
                rec.put("shortage_hours", r[3] - free);
                rec.put("suggested_additional_members", (int) Math.ceil((r[3] - free) / DEFAULT_HOURS_PER_WEEK));
                recommendations.add(rec);
            } else if (free > r[3] * 1.5) {
                rec.put("type", "redistribute_workload");
                rec.put("role", role);
                rec.put("excess_capacity", free - r[3]);
                rec.put("suggestion", "Consider cross-training or project reallocation");
                recommendations.add(rec);
            }
        });

        Map<String, Object> period = new LinkedHashMap<>();
        period.put("start_date", now.toString());
        period.put("end_date", end.toString());

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("planning_horizon", horizon);
        res.put("period", period);
        res.put("team_capacity", capacity);
        res.put("demand_forecast", demand);
        res.put("capacity_gaps", gaps);
        res.put("recommendations", recommendations);
        return res;
    }
}
