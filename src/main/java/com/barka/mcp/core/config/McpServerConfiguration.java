package com.barka.mcp.core.config;

import com.barka.mcp.core.connection.ConnectionManager;
import com.barka.mcp.core.connection.ConnectionMonitor;
import com.barka.mcp.core.connection.StoreDriver;
import com.barka.mcp.core.connection.StoreLifecycle;
import com.barka.mcp.core.dispatch.ActionRouter;
import com.barka.mcp.core.dispatch.ToolDispatcher;
import com.barka.mcp.core.registry.ToolCatalog;
import com.barka.mcp.core.registry.ToolRegistry;
import com.barka.mcp.core.validation.ToolCallValidator;
import com.barka.mcp.domain.AnalyticsService;
import com.barka.mcp.domain.AssignmentService;
import com.barka.mcp.domain.ProjectService;
import com.barka.mcp.domain.SearchService;
import com.barka.mcp.domain.TaskService;
import com.barka.mcp.domain.TeamMemberService;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.JdbcStoreDriver;
import com.barka.mcp.infra.service.JdbcAnalyticsService;
import com.barka.mcp.infra.service.JdbcAssignmentService;
import com.barka.mcp.infra.service.JdbcProjectService;
import com.barka.mcp.infra.service.JdbcSearchService;
import com.barka.mcp.infra.service.JdbcTaskService;
import com.barka.mcp.infra.service.JdbcTeamMemberService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties({StoreProperties.class, DispatchProperties.class})
public class McpServerConfiguration {

    /**
     * The pool is built unstarted; the first connection is taken by the store lifecycle, so a
     * bad URI fails startup there with the store's own message.
     */
    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(StoreProperties props) {
        HikariDataSource ds = new HikariDataSource();
        ds.setPoolName("barka-store");
        ds.setJdbcUrl(props.jdbcUrl());
        ds.setUsername(props.getUsername());
        ds.setPassword(props.getPassword());
        ds.setMaximumPoolSize(props.getMaxPoolSize());
        ds.setConnectionTimeout(props.getConnectTimeoutMs());
        if (props.isPostgres()) {
            ds.addDataSourceProperty("connectTimeout", String.valueOf(Math.max(1, props.getConnectTimeoutMs() / 1000)));
            ds.addDataSourceProperty("socketTimeout", String.valueOf(Math.max(1, props.getSocketTimeoutMs() / 1000)));
        }
        return ds;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StoreDriver storeDriver(DataSource dataSource, StoreProperties props) {
        return new JdbcStoreDriver(dataSource, (int) Math.max(1, props.getConnectTimeoutMs() / 1000));
    }

    @Bean
    public ConnectionManager connectionManager(StoreDriver driver) {
        return new ConnectionManager(driver);
    }

    @Bean
    public ConnectionMonitor connectionMonitor(StoreDriver driver, ConnectionManager manager) {
        return new ConnectionMonitor(driver, manager);
    }

    @Bean
    public StoreLifecycle storeLifecycle(ConnectionManager manager) {
        return new StoreLifecycle(manager);
    }

    @Bean
    public EntityRepository entityRepository(JdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        return new EntityRepository(jdbc, objectMapper, clock);
    }

    @Bean
    public ProjectService projectService(EntityRepository repo) {
        return new JdbcProjectService(repo);
    }

    @Bean
    public TaskService taskService(EntityRepository repo) {
        return new JdbcTaskService(repo);
    }

    @Bean
    public TeamMemberService teamMemberService(EntityRepository repo) {
        return new JdbcTeamMemberService(repo);
    }

    @Bean
    public SearchService searchService(EntityRepository repo) {
        return new JdbcSearchService(repo);
    }

    @Bean
    public AnalyticsService analyticsService(EntityRepository repo) {
        return new JdbcAnalyticsService(repo);
    }

    @Bean
    public AssignmentService assignmentService(EntityRepository repo) {
        return new JdbcAssignmentService(repo);
    }

    @Bean
    public ToolRegistry toolRegistry() {
        return new ToolRegistry(ToolCatalog.tools());
    }

    @Bean
    public ToolCallValidator toolCallValidator() {
        return new ToolCallValidator();
    }

    @Bean
    public ActionRouter actionRouter(ToolRegistry registry, ProjectService projects, TaskService tasks,
                                     TeamMemberService members, SearchService search,
                                     AnalyticsService analytics, AssignmentService assignment) {
        ActionRouter router = new ActionRouter(projects, tasks, members, search, analytics, assignment);
        router.verifyCoverage(registry.definitions());
        return router;
    }

    @Bean
    public ToolDispatcher toolDispatcher(ToolRegistry registry, ToolCallValidator validator, ActionRouter router,
                                         ConnectionManager connection, DispatchProperties dispatch) {
        return new ToolDispatcher(registry, validator, router, connection, dispatch.getTimeout());
    }
}
