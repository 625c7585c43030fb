package com.barka.mcp.infra.service;

import com.barka.mcp.core.error.DomainException;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.H2Store;
import com.barka.mcp.infra.db.StoredEntity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.barka.mcp.infra.service.ServiceFixture.ORG;
import static com.barka.mcp.infra.service.ServiceFixture.SCOPE;
import static com.barka.mcp.infra.service.ServiceFixture.id;
import static com.barka.mcp.infra.service.ServiceFixture.inDays;
import static com.barka.mcp.infra.service.ServiceFixture.obj;
import static com.barka.mcp.infra.service.ServiceFixture.objs;
import static com.barka.mcp.infra.service.ServiceFixture.with;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcAssignmentServiceTest {
    private final ServiceFixture f = new ServiceFixture();

    private static StoredEntity member(Map<String, Object> body) {
        return new StoredEntity("507f1f77bcf86cd799439011", EntityKind.TEAM_MEMBER, ORG, null, true, body,
                H2Store.START, H2Store.START);
    }

    @Test
    void strongCandidateIsHighlyRecommended() {
        StoredEntity m = member(with("name", "Ada", "skills", List.of("Java", "Spring"),
                "expertise", List.of(with("skill", "java", "level", "expert")),
                "performance", with("onTimeDeliveryRate", 95)));

        Map<String, Object> r = JdbcAssignmentService.recommend(m, new Workload(1, 10, 25, 40),
                List.of("java"), "medium", 8);

        assertEquals(75, r.get("score"));
        assertEquals("highly_recommended", r.get("recommendation"));
        assertEquals(List.of("Has skill: java", "expert in java", "Low utilization (available)",
                "Sufficient capacity", "Excellent delivery record"), r.get("factors"));
        assertEquals(30.0, obj(r.get("member")).get("capacity"));
    }

    @Test
    void overloadedMemberIsPenalizedForUrgentWork() {
        StoredEntity m = member(with("name", "Bob"));

        Map<String, Object> r = JdbcAssignmentService.recommend(m, new Workload(4, 40, 100, 40),
                List.of(), "urgent", 0);

        assertEquals(27, r.get("score"));
        assertEquals("not_recommended", r.get("recommendation"));
    }

    @Test
    void partialCapacityAndAverageRecord() {
        StoredEntity m = member(with("name", "Cy", "skills", List.of("go"),
                "performance", with("onTimeDeliveryRate", 72)));

        Map<String, Object> r = JdbcAssignmentService.recommend(m, new Workload(2, 34, 85, 40),
                List.of("go"), "high", 10);

        assertEquals(35, r.get("score"));
        assertEquals("possible", r.get("recommendation"));
        assertTrue(((List<?>) r.get("factors")).contains("Partial capacity"));
    }

    @Test
    void skillScoreIsCapped() {
        List<String> skills = List.of("a1", "b2", "c3", "d4", "e5");
        List<Object> expertise = List.of(with("skill", "a1", "level", "expert"), with("skill", "b2", "level", "expert"));
        StoredEntity m = member(with("name", "Dee", "skills", skills, "expertise", expertise,
                "performance", with("onTimeDeliveryRate", 50)));

        Map<String, Object> r = JdbcAssignmentService.recommend(m, new Workload(0, 0, 0, 40), skills, "low", 0);

        // 40 skills + 30 availability + 10 no estimate + 2 record
        assertEquals(82, r.get("score"));
    }

    @Test
    void skillBasedAssignmentRanksActiveCandidates() {
        String ada = id(f.member("Ada", "developer", with("skills", List.of("java"))));
        String bob = id(f.member("Bob", "developer", Map.of()));
        f.member("Away", "developer", with("status", "inactive", "skills", List.of("java")));

        Map<String, Object> res = f.assignment.skillBasedAssignment(null, List.of("java"), null, 8.0, null, SCOPE, null);

        List<Map<String, Object>> recs = objs(res.get("recommendations"));
        assertEquals(2, recs.size());
        assertEquals(ada, obj(recs.get(0).get("member")).get("id"));
        assertEquals(bob, obj(recs.get(1).get("member")).get("id"));
        assertEquals(2, obj(res.get("summary")).get("total_candidates"));
        assertEquals("medium", obj(res.get("task_info")).get("priority"));
    }

    @Test
    void skillBasedAssignmentHonoursMemberListAndTask() {
        String project = id(f.project("Apollo"));
        String task = id(f.task(project, "Build API", Map.of()));
        f.member("Ada", "developer", Map.of());
        String bob = id(f.member("Bob", "developer", Map.of()));

        Map<String, Object> res = f.assignment.skillBasedAssignment(task, null, "high", null, inDays(5), SCOPE,
                List.of(bob));

        assertEquals(List.of(bob), objs(res.get("recommendations")).stream()
                .map(r -> obj(r.get("member")).get("id")).toList());
        Map<String, Object> info = obj(res.get("task_info"));
        assertEquals(task, info.get("id"));
        assertEquals("Build API", info.get("name"));
        assertEquals(List.of(), info.get("required_skills"));
    }

    @Test
    void skillBasedAssignmentRejectsUnknownTask() {
        DomainException e = assertThrows(DomainException.class, () -> f.assignment.skillBasedAssignment(
                "ffffffffffffffffffffffff", null, null, null, null, SCOPE, null));

        assertEquals("Task not found", e.getMessage());
    }

    @Test
    void workloadBalancingSuggestsMovesAndAssignees() {
        String project = id(f.project("Apollo"));
        String busy = id(f.member("Busy", "developer", Map.of()));
        String idle = id(f.member("Idle", "qa_engineer", Map.of()));
        String mid = id(f.member("Mid", "designer", Map.of()));
        String high = id(f.assignedTask(project, busy, 24, with("priority", "high")));
        String urgent = id(f.assignedTask(project, busy, 16, with("priority", "urgent")));
        f.assignedTask(project, mid, 28, Map.of());
        String open = id(f.task(project, "Nobody yet", Map.of()));

        Map<String, Object> res = f.assignment.workloadBalancing(SCOPE, null);

        assertEquals(90.0, res.get("max_utilization"));
        Map<String, Object> util = obj(res.get("team_utilization"));
        assertEquals(List.of(busy), ServiceFixture.ids(util.get("overutilized")));
        assertEquals(List.of(mid), ServiceFixture.ids(util.get("optimal")));
        assertEquals(List.of(idle), ServiceFixture.ids(util.get("underutilized")));

        List<Map<String, Object>> moves = objs(res.get("rebalancing_suggestions"));
        assertEquals(List.of(urgent, high), moves.stream().map(s -> obj(s.get("task")).get("id")).toList());
        Map<String, Object> candidate = objs(moves.get(0).get("to_candidates")).get(0);
        assertEquals(idle, candidate.get("id"));
        assertEquals(40.0, candidate.get("projected_utilization"));
        assertEquals(100, obj(moves.get(0).get("from")).get("current_utilization"));

        assertEquals(1, res.get("unassigned_tasks"));
        List<Map<String, Object>> recs = objs(res.get("recommendations"));
        assertEquals(open, obj(recs.get(0).get("task")).get("id"));
        assertEquals(List.of(idle, mid), ServiceFixture.ids(recs.get(0).get("suggested_assignees")));
    }

    @Test
    void overallocatedMembersKeepTheirRealUtilization() {
        String project = id(f.project("Apollo"));
        String heavy = id(f.member("Heavy", "developer", Map.of()));
        String heavier = id(f.member("Heavier", "developer", Map.of()));
        f.assignedTask(project, heavy, 60, Map.of());
        f.assignedTask(project, heavier, 80, Map.of());

        Map<String, Object> res = f.assignment.workloadBalancing(SCOPE, null);

        List<Map<String, Object>> over = objs(obj(res.get("team_utilization")).get("overutilized"));
        assertEquals(List.of(150, 200), over.stream()
                .filter(m -> heavy.equals(m.get("id")) || heavier.equals(m.get("id")))
                .map(m -> m.get("utilization")).sorted().toList());
    }

    @Test
    void workloadBalancingThresholdIsConfigurable() {
        String project = id(f.project("Apollo"));
        String m = id(f.member("Ada", "developer", Map.of()));
        f.assignedTask(project, m, 30, Map.of());

        Map<String, Object> res = f.assignment.workloadBalancing(SCOPE, 70.0);

        assertEquals(List.of(m), ServiceFixture.ids(obj(res.get("team_utilization")).get("overutilized")));
        assertTrue(objs(res.get("rebalancing_suggestions")).isEmpty());
    }

    @Test
    void weeklyPlanFlagsShortageByRole() {
        String project = id(f.project("Apollo"));
        f.project("Due soon", ORG, with("dueDate", inDays(5), "status", "active"));
        f.member("Ada", "developer", Map.of());
        f.task(project, "Big push", with("dueDate", inDays(3), "estimatedHours", 60));
        f.task(project, "Next month", with("dueDate", inDays(20), "estimatedHours", 8));

        Map<String, Object> res = f.assignment.capacityPlanning("week", SCOPE);

        assertEquals("week", res.get("planning_horizon"));
        Map<String, Object> capacity = obj(res.get("team_capacity"));
        assertEquals(1, capacity.get("total_members"));
        assertEquals(40.0, capacity.get("total_hours_available"));
        Map<String, Object> demand = obj(res.get("demand_forecast"));
        assertEquals(1, demand.get("upcoming_tasks"));
        assertEquals(60.0, demand.get("estimated_hours_needed"));
        assertEquals(1, demand.get("projects_due"));
        Map<String, Object> gap = objs(res.get("capacity_gaps")).get(0);
        assertEquals(20.0, gap.get("shortage_hours"));
        assertEquals("medium", gap.get("severity"));
        Map<String, Object> hire = objs(res.get("recommendations")).get(0);
        assertEquals("hire_additional_staff", hire.get("type"));
        assertEquals("developer", hire.get("role"));
        assertEquals(1, hire.get("suggested_additional_members"));
    }

    @Test
    void quarterPlanUsesTwelveWeeksAndDefaultHours() {
        String project = id(f.project("Apollo"));
        f.member("Ada", "developer", Map.of());
        f.task(project, "Big push", with("dueDate", inDays(3), "estimatedHours", 60));
        f.task(project, "Unsized", with("dueDate", inDays(45)));

        Map<String, Object> res = f.assignment.capacityPlanning("quarter", SCOPE);

        assertEquals(480.0, obj(res.get("team_capacity")).get("total_hours_available"));
        assertEquals(68.0, obj(res.get("demand_forecast")).get("estimated_hours_needed"));
        assertTrue(objs(res.get("capacity_gaps")).isEmpty());
        Map<String, Object> rec = objs(res.get("recommendations")).get(0);
        assertEquals("redistribute_workload", rec.get("type"));
        assertEquals(412.0, rec.get("excess_capacity"));
    }

    @Test
    void horizonDefaultsToMonth() {
        assertEquals("month", f.assignment.capacityPlanning(null, SCOPE).get("planning_horizon"));
    }
}
