package com.barka.mcp.core.dispatch;

import com.barka.mcp.core.command.AssignmentCommand;
import com.barka.mcp.core.command.ProjectCommand;
import com.barka.mcp.core.command.ToolCommand;
import com.barka.mcp.core.error.ValidationException;
import com.barka.mcp.core.registry.ToolCatalog;
import com.barka.mcp.core.registry.ToolRegistry;
import com.barka.mcp.core.validation.ToolCallValidator;
import com.barka.mcp.domain.AnalyticsService;
import com.barka.mcp.domain.AssignmentService;
import com.barka.mcp.domain.PageRequest;
import com.barka.mcp.domain.PagedResult;
import com.barka.mcp.domain.ProjectService;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.domain.SearchService;
import com.barka.mcp.domain.TaskService;
import com.barka.mcp.domain.TeamMemberService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActionRouterTest {
    private static final String ID = "507f1f77bcf86cd799439011";
    private static final String ORG = "65a1b2c3d4e5f6a7b8c9d0e1";

    @Mock
    private ProjectService projects;
    @Mock
    private TaskService tasks;
    @Mock
    private TeamMemberService members;
    @Mock
    private SearchService search;
    @Mock
    private AnalyticsService analytics;
    @Mock
    private AssignmentService assignment;

    private final ToolRegistry registry = new ToolRegistry(ToolCatalog.tools());
    private final ToolCallValidator validator = new ToolCallValidator();
    private ActionRouter router;

    @BeforeEach
    void setUp() {
        router = new ActionRouter(projects, tasks, members, search, analytics, assignment, Schedulers.immediate());
    }

    private ToolCallRequest request(String tool, Map<String, Object> args) {
        return validator.validate(registry.get(tool).orElseThrow(), args);
    }

    @Test
    void everyCatalogActionHasAHandler() {
        router.verifyCoverage(registry.definitions());
    }

    @Test
    void bindDropsFieldsTheActionDoesNotUse() {
        ToolCommand command = router.bind(request(ToolCatalog.PROJECT_OPERATIONS,
                Map.of("action", "get", "project_id", ID, "search_term", "ignored", "organization_id", ORG)));

        ProjectCommand.Get get = assertInstanceOf(ProjectCommand.Get.class, command);
        assertEquals(ID, get.projectId());
        assertEquals(new Scope(null, ORG), get.scope());
    }

    @Test
    void unbindableValueIsAValidationError() {
        ToolCallRequest request = new ToolCallRequest(ToolCatalog.PROJECT_OPERATIONS, "list",
                Map.of("action", "list", "page", 3_000_000_000L),
                registry.get(ToolCatalog.PROJECT_OPERATIONS).orElseThrow().contract("list").orElseThrow());

        ValidationException e = assertThrows(ValidationException.class, () -> router.bind(request));

        assertEquals(List.of("page: value cannot be bound"), e.violations());
    }

    @Test
    void scopeAndPagingPassThroughUnchanged() {
        PagedResult<Map<String, Object>> page = new PagedResult<>(List.of(), 0, 1, 20, false);
        when(projects.list(any(), any(), any())).thenReturn(page);

        StepVerifier.create(router.route(request(ToolCatalog.PROJECT_OPERATIONS,
                        Map.of("action", "list", "organization_id", ORG))))
                .expectNext(page)
                .verifyComplete();

        verify(projects).list(new PageRequest(null, null), null, new Scope(null, ORG));
    }

    @Test
    void crossSearchWithoutEntityTypesSearchesEverything() {
        when(search.crossSearch(eq("alpha"), eq(null), any(), any())).thenReturn(Map.of("total_results", 0));

        StepVerifier.create(router.route(request(ToolCatalog.SEARCH_OPERATIONS,
                        Map.of("action", "cross_search", "search_term", "alpha", "page", 2))))
                .expectNext(Map.of("total_results", 0))
                .verifyComplete();

        verify(search).crossSearch("alpha", null, Scope.unscoped(), new PageRequest(2, null));
    }

    @Test
    void integralHoursBindToDouble() {
        ToolCommand command = router.bind(request(ToolCatalog.ASSIGNMENT_OPERATIONS,
                Map.of("action", "skill_based_assignment", "required_skills", List.of("java"), "estimated_hours", 12)));

        AssignmentCommand.SkillBasedAssignment c = assertInstanceOf(AssignmentCommand.SkillBasedAssignment.class, command);
        assertEquals(12.0, c.estimatedHours());
        assertNull(c.priorityLevel());
    }

    @Test
    void mutatingCallPassesUserThrough() {
        when(tasks.updateStatus(ID, "blocked", ORG, "waiting on infra")).thenReturn(Map.of("status", "blocked"));

        StepVerifier.create(router.route(request(ToolCatalog.TASK_OPERATIONS, Map.of("action", "update_status",
                        "task_id", ID, "user_id", ORG, "new_status", "blocked", "status_comment", "waiting on infra"))))
                .expectNext(Map.of("status", "blocked"))
                .verifyComplete();
    }

    @Test
    void serviceFailureSurfacesAsError() {
        when(members.getWorkload(ID)).thenThrow(new IllegalStateException("boom"));

        StepVerifier.create(router.route(request(ToolCatalog.TEAM_OPERATIONS,
                        Map.of("action", "get_workload", "member_id", ID))))
                .expectErrorMessage("boom")
                .verify();
    }
}
