package com.barka.mcp.infra.service;

import com.barka.mcp.domain.AnalyticsService;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.StoredEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregates over projects, tasks and members. Progress and utilization are derived
 * from the current tasks on every call.
 */
public class JdbcAnalyticsService extends AbstractDocumentService implements AnalyticsService {

    public JdbcAnalyticsService(EntityRepository repo) {
        super(repo);
    }

    @Override
    public Map<String, Object> projectProgress(Scope scope, String projectId, Map<String, Object> dateRange,
                                               String groupBy) {
        List<StoredEntity> tasks = allTasks();
        List<StoredEntity> projects = new ArrayList<>();
        for (StoredEntity p : all(EntityKind.PROJECT, scope)) {
            if (projectId == null || projectId.equals(p.id())) {
                projects.add(p);
            }
        }
        Instant now = repo.now();

        int active = 0;
        int completed = 0;
        int overdue = 0;
        double completionSum = 0;
        Map<String, List<StoredEntity>> byStatus = new LinkedHashMap<>();
        Map<String, List<StoredEntity>> byPriority = new LinkedHashMap<>();
        Map<String, Integer> distribution = new LinkedHashMap<>();
        distribution.put("not_started", 0);
        distribution.put("in_progress", 0);
        distribution.put("near_completion", 0);
        distribution.put("completed", 0);

        for (StoredEntity p : projects) {
            String status = str(p.body(), "status");
            int completion = projectCompletion(tasks, p.id());
            completionSum += completion;
            if ("active".equals(status)) active++;
            if ("completed".equals(status)) completed++;
            Instant due = instant(p.body().get("dueDate"));
            if (due != null && due.isBefore(now) && !"completed".equals(status)) overdue++;
            byStatus.computeIfAbsent(String.valueOf(status), k -> new ArrayList<>()).add(p);
            byPriority.computeIfAbsent(String.valueOf(str(p.body(), "priority")), k -> new ArrayList<>()).add(p);
            String bucket = completion == 0 ? "not_started"
                    : completion < 80 ? "in_progress"
                    : completion < 100 ? "near_completion" : "completed";
            distribution.merge(bucket, 1, Integer::sum);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_projects", projects.size());
        summary.put("active_projects", active);
        summary.put("completed_projects", completed);
        summary.put("overdue_projects", overdue);
        summary.put("average_completion", projects.isEmpty() ? 0.0 : round1(completionSum / projects.size()));

        Map<String, Object> statusGroups = new LinkedHashMap<>();
        byStatus.forEach((status, group) -> {
            List<Map<String, Object>> items = new ArrayList<>();
            double sum = 0;
            for (StoredEntity p : group) {
                int c = projectCompletion(tasks, p.id());
                sum += c;
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("id", p.id());
                item.put("name", p.body().get("name"));
                item.put("completion", c);
                item.put("dueDate", p.body().get("dueDate"));
                items.add(item);
            }
            Map<String, Object> g = new LinkedHashMap<>();
            g.put("count", group.size());
            g.put("average_completion", round1(sum / group.size()));
            g.put("projects", items);
            statusGroups.put(status, g);
        });

        Map<String, Object> priorityGroups = new LinkedHashMap<>();
        byPriority.forEach((priority, group) -> {
            double sum = 0;
            for (StoredEntity p : group) {
                sum += projectCompletion(tasks, p.id());
            }
            Map<String, Object> g = new LinkedHashMap<>();
            g.put("count", group.size());
            g.put("average_completion", round1(sum / group.size()));
            priorityGroups.put(priority, g);
        });

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("summary", summary);
        res.put("by_status", statusGroups);
        res.put("by_priority", priorityGroups);
        res.put("progress_distribution", distribution);
        res.put("group_by", groupBy == null ? "week" : groupBy);
        if (dateRange != null) {
            res.put("date_range", dateRange);
        }
        return res;
    }

    @Override
    public Map<String, Object> teamPerformance(Scope scope, String teamMemberId, Map<String, Object> dateRange) {
        List<StoredEntity> tasks = allTasks();
        List<StoredEntity> members = new ArrayList<>();
        for (StoredEntity m : all(EntityKind.TEAM_MEMBER, scope)) {
            if (teamMemberId == null || teamMemberId.equals(m.id())) {
                members.add(m);
            }
        }

        int activeMembers = 0;
        double utilizationSum = 0;
        int completedTotal = 0;
        int under = 0;
        int optimal = 0;
        int over = 0;
        Map<String, List<Map<String, Object>>> byRole = new LinkedHashMap<>();
        List<Map<String, Object>> metrics = new ArrayList<>();

        for (StoredEntity m : members) {
            int utilization = Workload.of(m, tasks).utilizationPercentage();
            int completed = completedBy(m.id(), tasks);
            double onTime = number(map(m.body(), "performance").get("onTimeDeliveryRate"), 0);
            if ("active".equals(str(m.body(), "status"))) activeMembers++;
            utilizationSum += utilization;
            completedTotal += completed;
            if (utilization < 60) under++;
            else if (utilization <= 90) optimal++;
            else over++;

            Map<String, Object> metric = new LinkedHashMap<>();
            metric.put("id", m.id());
            metric.put("name", m.body().get("name"));
            metric.put("role", m.body().get("role"));
            metric.put("utilization", utilization);
            metric.put("tasks_completed", completed);
            metric.put("on_time_delivery", onTime);
            metrics.add(metric);
            byRole.computeIfAbsent(String.valueOf(str(m.body(), "role")), k -> new ArrayList<>()).add(metric);
        }

        Map<String, Object> roles = new LinkedHashMap<>();
        byRole.forEach((role, group) -> {
            double util = 0;
            double perf = 0;
            for (Map<String, Object> metric : group) {
                util += number(metric.get("utilization"), 0);
                perf += number(metric.get("on_time_delivery"), 0);
            }
            Map<String, Object> g = new LinkedHashMap<>();
            g.put("count", group.size());
            g.put("average_utilization", round1(util / group.size()));
            g.put("average_performance", round1(perf / group.size()));
            roles.put(role, g);
        });

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_members", members.size());
        summary.put("active_members", activeMembers);
        summary.put("average_utilization", members.isEmpty() ? 0.0 : round1(utilizationSum / members.size()));
        summary.put("total_tasks_completed", completedTotal);

        Map<String, Object> buckets = new LinkedHashMap<>();
        buckets.put("underutilized", under);
        buckets.put("optimal", optimal);
        buckets.put("overutilized", over);

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("summary", summary);
        res.put("by_role", roles);
        res.put("by_utilization", buckets);
        res.put("performance_metrics", metrics);
        if (dateRange != null) {
            res.put("date_range", dateRange);
        }
        return res;
    }

    private static int completedBy(String memberId, List<StoredEntity> tasks) {
        int n = 0;
        for (StoredEntity t : tasksWhere(tasks, "assignedTo", memberId)) {
            if ("completed".equals(str(t.body(), "status"))) {
                n++;
            }
        }
        return n;
    }

    @Override
    public Map<String, Object> deadlineTracking(Scope scope) {
        Instant now = repo.now();
        Instant week = now.plus(Duration.ofDays(7));
        Instant month = now.plus(Duration.ofDays(30));

        Map<String, Object> projects = buckets(all(EntityKind.PROJECT, scope), now, week, month);
        Map<String, Object> tasks = buckets(all(EntityKind.TASK, scope), now, week, month);

        Map<String, Object> critical = new LinkedHashMap<>();
        critical.put("overdue_projects", overdueItems(all(EntityKind.PROJECT, scope), now, false));
        critical.put("overdue_tasks", overdueItems(all(EntityKind.TASK, scope), now, true));

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("projects", projects);
        res.put("tasks", tasks);
        res.put("critical_items", critical);
        return res;
    }

    private static Map<String, Object> buckets(List<StoredEntity> entities, Instant now, Instant week, Instant month) {
        int overdue = 0;
        int thisWeek = 0;
        int thisMonth = 0;
        int upcoming = 0;
        for (StoredEntity e : entities) {
            Instant due = instant(e.body().get("dueDate"));
            if (due == null) {
                continue;
            }
            if (due.isBefore(now)) {
                if (!"completed".equals(str(e.body(), "status"))) overdue++;
            } else if (!due.isAfter(week)) {
                thisWeek++;
            } else if (!due.isAfter(month)) {
                thisMonth++;
            } else {
                upcoming++;
            }
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("overdue", overdue);
        m.put("due_this_week", thisWeek);
        m.put("due_this_month", thisMonth);
        m.put("upcoming", upcoming);
        return m;
    }

    private static List<Map<String, Object>> overdueItems(List<StoredEntity> entities, Instant now, boolean tasks) {
        List<Map<String, Object>> res = new ArrayList<>();
        for (StoredEntity e : entities) {
            Instant due = instant(e.body().get("dueDate"));
            if (due == null || !due.isBefore(now) || "completed".equals(str(e.body(), "status"))) {
                continue;
            }
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", e.id());
            item.put("name", e.body().get("name"));
            item.put("dueDate", e.body().get("dueDate"));
            item.put("daysOverdue", -daysUntil(now, due));
            item.put("priority", e.body().get("priority"));
            if (tasks) {
                item.put("project", e.body().get("project"));
                item.put("assignedTo", e.body().get("assignedToName"));
            }
            res.add(item);
        }
        return res;
    }

    @Override
    public Map<String, Object> riskAnalysis(Scope scope) {
        Instant now = repo.now();
        List<StoredEntity> tasks = allTasks();
        List<StoredEntity> projects = all(EntityKind.PROJECT, scope);
        List<StoredEntity> members = all(EntityKind.TEAM_MEMBER, scope);

        List<Map<String, Object>> highRisk = new ArrayList<>();
        for (StoredEntity p : projects) {
            Map<String, Object> risk = projectRisk(p, projectCompletion(tasks, p.id()), now);
            if ((Integer) risk.get("riskScore") >= 20) {
                highRisk.add(risk);
            }
        }

        List<Map<String, Object>> resourceRisks = new ArrayList<>();
        int highResourceIssues = 0;
        for (StoredEntity m : members) {
            int utilization = Workload.of(m, tasks).utilizationPercentage();
            String type = null;
            String severity = null;
            if (utilization > 95) {
                type = "overutilization";
                severity = "high";
                highResourceIssues++;
            } else if (utilization < 30 && "active".equals(str(m.body(), "status"))) {
                type = "underutilization";
                severity = "medium";
            }
            if (type != null) {
                Map<String, Object> member = new LinkedHashMap<>();
                member.put("id", m.id());
                member.put("name", m.body().get("name"));
                member.put("role", m.body().get("role"));
                member.put("utilization", utilization);
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("type", type);
                r.put("member", member);
                r.put("severity", severity);
                resourceRisks.add(r);
            }
        }

        double overall = Math.min(100,
                (double) highRisk.size() / Math.max(projects.size(), 1) * 50
                        + (double) highResourceIssues / Math.max(members.size(), 1) * 50);

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("high_risk_projects", highRisk);
        res.put("resource_risks", resourceRisks);
        res.put("overall_risk_score", round1(overall));
        return res;
    }

    /**
     * Scores one project: overdue +30, or due within a week under 80% complete +20; active
     * under 20% complete +15; no team +25, or a single member +10.
     */
    static Map<String, Object> projectRisk(StoredEntity project, int completion, Instant now) {
        Map<String, Object> b = project.body();
        String status = str(b, "status");
        Instant due = instant(b.get("dueDate"));
        int score = 0;
        List<String> factors = new ArrayList<>();
        if (due != null && due.isBefore(now) && !"completed".equals(status)) {
            score += 30;
            factors.add("Overdue");
        } else if (due != null && daysUntil(now, due) <= 7 && completion < 80) {
            score += 20;
            factors.add("Tight deadline with low completion");
        }
        if (completion < 20 && "active".equals(status)) {
            score += 15;
            factors.add("Low progress");
        }
        int teamSize = list(b, "teamMembers").size();
        if (teamSize == 0) {
            score += 25;
            factors.add("No team members assigned");
        } else if (teamSize == 1) {
            score += 10;
            factors.add("Single point of failure");
        }
        Map<String, Object> r = new LinkedHashMap<>();
        r.put("id", project.id());
        r.put("name", b.get("name"));
        r.put("riskScore", score);
        r.put("riskFactors", factors);
        r.put("status", status);
        r.put("completion", completion);
        r.put("dueDate", b.get("dueDate"));
        return r;
    }
}
