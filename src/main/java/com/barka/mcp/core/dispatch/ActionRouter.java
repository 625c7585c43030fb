package com.barka.mcp.core.dispatch;

import com.barka.mcp.core.command.AnalyticsCommand;
import com.barka.mcp.core.command.AssignmentCommand;
import com.barka.mcp.core.command.ProjectCommand;
import com.barka.mcp.core.command.SearchCommand;
import com.barka.mcp.core.command.TaskCommand;
import com.barka.mcp.core.command.TeamCommand;
import com.barka.mcp.core.command.ToolCommand;
import com.barka.mcp.core.error.ValidationException;
import com.barka.mcp.core.registry.ActionContract;
import com.barka.mcp.core.registry.ToolDefinition;
import com.barka.mcp.domain.AnalyticsService;
import com.barka.mcp.domain.AssignmentService;
import com.barka.mcp.domain.ProjectService;
import com.barka.mcp.domain.SearchService;
import com.barka.mcp.domain.TaskService;
import com.barka.mcp.domain.TeamMemberService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps each {@code (tool, action)} to exactly one domain service call. Handlers read the typed
 * payload bound from the validated fields and pass scoping and paging values through as given.
 */
public class ActionRouter {
    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Map<Class<? extends ToolCommand>, Function<ToolCommand, Object>> routes = new HashMap<>();
    private final Scheduler scheduler;

    public ActionRouter(ProjectService projects, TaskService tasks, TeamMemberService members,
                        SearchService search, AnalyticsService analytics, AssignmentService assignment) {
        this(projects, tasks, members, search, analytics, assignment, Schedulers.boundedElastic());
    }

    public ActionRouter(ProjectService projects, TaskService tasks, TeamMemberService members,
                        SearchService search, AnalyticsService analytics, AssignmentService assignment,
                        Scheduler scheduler) {
        this.scheduler = scheduler;

        on(ProjectCommand.Create.class, c -> projects.create(c.projectData(), c.userId()));
        on(ProjectCommand.Get.class, c -> projects.get(c.projectId(), c.scope()));
        on(ProjectCommand.ListAll.class, c -> projects.list(c.pageRequest(), c.filters(), c.scope()));
        on(ProjectCommand.Update.class, c -> projects.update(c.projectId(), c.projectData(), c.userId()));
        on(ProjectCommand.Delete.class, c -> projects.delete(c.projectId(), c.userId()));
        on(ProjectCommand.Search.class, c -> projects.search(c.searchTerm(), c.scope()));
        on(ProjectCommand.GetTasks.class, c -> projects.getTasks(c.projectId()));
        on(ProjectCommand.AddTeamMember.class, c -> projects.addTeamMember(c.projectId(), c.teamMemberId(), c.userId()));
        on(ProjectCommand.GetStatus.class, c -> projects.getStatus(c.projectId()));

        on(TaskCommand.Create.class, c -> tasks.create(c.taskData(), c.userId()));
        on(TaskCommand.Get.class, c -> tasks.get(c.taskId(), c.scope()));
        on(TaskCommand.ListAll.class, c -> tasks.list(c.pageRequest(), c.filters(), c.scope(),
                c.projectId(), c.assigneeId(), c.status()));
        on(TaskCommand.Update.class, c -> tasks.update(c.taskId(), c.taskData(), c.userId()));
        on(TaskCommand.Delete.class, c -> tasks.delete(c.taskId(), c.userId()));
        on(TaskCommand.Assign.class, c -> tasks.assign(c.taskId(), c.teamMemberId(), c.userId()));
        on(TaskCommand.AddComment.class, c -> tasks.addComment(c.taskId(), c.userId(), c.commentContent()));
        on(TaskCommand.UpdateStatus.class, c -> tasks.updateStatus(c.taskId(), c.newStatus(), c.userId(), c.statusComment()));
        on(TaskCommand.Search.class, c -> tasks.search(c.searchTerm(), c.scope()));

        on(TeamCommand.Create.class, c -> members.create(c.memberData(), c.userId()));
        on(TeamCommand.Get.class, c -> members.get(c.memberId(), c.scope()));
        on(TeamCommand.ListAll.class, c -> members.list(c.pageRequest(), c.filters(), c.scope(),
                c.role(), c.status(), c.availability()));
        on(TeamCommand.Update.class, c -> members.update(c.memberId(), c.memberData(), c.userId()));
        on(TeamCommand.Delete.class, c -> members.delete(c.memberId(), c.userId()));
        on(TeamCommand.GetAvailable.class, c -> members.getAvailable(c.scope(), c.skillRequired()));
        on(TeamCommand.UpdateSkills.class, c -> members.updateSkills(c.memberId(), c.skills(), c.expertise(), c.userId()));
        on(TeamCommand.GetWorkload.class, c -> members.getWorkload(c.memberId()));

        on(SearchCommand.CrossSearch.class, c -> search.crossSearch(c.searchTerm(), c.entityTypes(), c.scope(), c.pageRequest()));
        on(SearchCommand.AdvancedFilter.class, c -> search.advancedFilter(c.filters(), c.scope()));
        on(SearchCommand.RelatedItems.class, c -> search.relatedItems(c.entityId(), c.entityType(), c.includeDependencies()));

        on(AnalyticsCommand.ProjectProgress.class, c -> analytics.projectProgress(c.scope(), c.projectId(), c.dateRange(), c.groupBy()));
        on(AnalyticsCommand.TeamPerformance.class, c -> analytics.teamPerformance(c.scope(), c.teamMemberId(), c.dateRange()));
        on(AnalyticsCommand.DeadlineTracking.class, c -> analytics.deadlineTracking(c.scope()));
        on(AnalyticsCommand.RiskAnalysis.class, c -> analytics.riskAnalysis(c.scope()));

        on(AssignmentCommand.SkillBasedAssignment.class, c -> assignment.skillBasedAssignment(c.taskId(),
                c.requiredSkills(), c.priorityLevel(), c.estimatedHours(), c.dueDate(), c.scope(), c.teamMemberIds()));
        on(AssignmentCommand.WorkloadBalancing.class, c -> assignment.workloadBalancing(c.scope(), c.maxUtilization()));
        on(AssignmentCommand.CapacityPlanning.class, c -> assignment.capacityPlanning(c.planningHorizon(), c.scope()));
    }

    private <C extends ToolCommand> void on(Class<C> type, Function<C, Object> handler) {
        routes.put(type, command -> handler.apply(type.cast(command)));
    }

    /**
     * Fails when a declared action has no handler, so a gap in the table surfaces at startup
     * rather than on the first call.
     */
    public void verifyCoverage(Collection<ToolDefinition> tools) {
        List<String> unrouted = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            for (ActionContract c : tool.actions()) {
                if (!routes.containsKey(c.payloadType())) {
                    unrouted.add(c.tool() + "/" + c.action());
                }
            }
        }
        if (!unrouted.isEmpty()) {
            throw new IllegalStateException("No handler for: " + String.join(", ", unrouted));
        }
    }

    ToolCommand bind(ToolCallRequest request) {
        try {
            return om.convertValue(request.fields(), request.contract().payloadType());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(List.of(fieldOf(e) + ": value cannot be bound"));
        }
    }

    private static String fieldOf(IllegalArgumentException e) {
        if (e.getCause() instanceof JsonMappingException jme && !jme.getPath().isEmpty()) {
            String name = jme.getPath().get(jme.getPath().size() - 1).getFieldName();
            if (name != null) {
                return name;
            }
        }
        return "arguments";
    }

    /**
     * Binds the request and invokes its handler. The service call runs on the router's
     * scheduler; nothing else here blocks.
     */
    public Mono<Object> route(ToolCallRequest request) {
        ToolCommand command = bind(request);
        Function<ToolCommand, Object> handler = routes.get(command.getClass());
        if (handler == null) {
            return Mono.error(new IllegalStateException(
                    "No handler for " + request.tool() + "/" + request.action()));
        }
        return Mono.fromCallable(() -> handler.apply(command)).subscribeOn(scheduler);
    }
}
