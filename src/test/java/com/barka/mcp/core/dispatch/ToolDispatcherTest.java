package com.barka.mcp.core.dispatch;

import com.barka.mcp.core.connection.ConnectionManager;
import com.barka.mcp.core.connection.StoreDriver;
import com.barka.mcp.core.error.DomainException;
import com.barka.mcp.core.registry.ActionContract;
import com.barka.mcp.core.registry.ToolCatalog;
import com.barka.mcp.core.registry.ToolDefinition;
import com.barka.mcp.core.registry.ToolRegistry;
import com.barka.mcp.core.response.ErrorKind;
import com.barka.mcp.core.response.McpResponse;
import com.barka.mcp.core.validation.ToolCallValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolDispatcherTest {
    private static final String ID = "507f1f77bcf86cd799439011";
    private static final ToolRegistry REGISTRY = new ToolRegistry(ToolCatalog.tools());

    @Mock
    private ActionRouter router;

    private final FakeDriver driver = new FakeDriver();
    private ConnectionManager connection;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        connection = new ConnectionManager(driver);
        connection.connect();
        dispatcher = new ToolDispatcher(REGISTRY, new ToolCallValidator(), router, connection, Duration.ofMillis(50));
    }

    private McpResponse<Object> call(String tool, Map<String, Object> args) {
        return dispatcher.dispatch(tool, args).block(Duration.ofSeconds(5));
    }

    @Test
    void listToolsReturnsTheRegistryListing() {
        assertEquals(REGISTRY.list(), dispatcher.listTools());
    }

    @Test
    void unknownToolNeverReachesTheRouter() {
        McpResponse<Object> r = call("billing_operations", Map.of("action", "create"));

        assertEquals(McpResponse.ERROR, r.status());
        assertEquals(ErrorKind.UNKNOWN_TOOL, r.errorKind());
        assertEquals("Unknown tool: billing_operations", r.errorMessage());
        assertNull(r.data());
        verifyNoInteractions(router);
    }

    @Test
    void unknownActionNeverReachesTheRouter() {
        McpResponse<Object> r = call(ToolCatalog.PROJECT_OPERATIONS, Map.of("action", "archive"));

        assertEquals(ErrorKind.UNKNOWN_ACTION, r.errorKind());
        verifyNoInteractions(router);
    }

    static Stream<Arguments> mutatingActions() {
        return REGISTRY.definitions().stream()
                .flatMap(t -> t.actions().stream())
                .filter(ActionContract::mutating)
                .map(c -> Arguments.of(c.tool(), c.action()));
    }

    @ParameterizedTest(name = "{0}/{1}")
    @MethodSource("mutatingActions")
    void mutatingActionWithoutUserIdIsRejected(String tool, String action) {
        ToolDefinition def = REGISTRY.get(tool).orElseThrow();
        ActionContract contract = def.contract(action).orElseThrow();
        Map<String, Object> args = new HashMap<>();
        args.put("action", action);
        for (String field : contract.requiredFields()) {
            if (!field.equals(ActionContract.USER_ID)) {
                args.put(field, sampleValue(field));
            }
        }

        McpResponse<Object> r = call(tool, args);

        assertEquals(ErrorKind.MISSING_FIELDS, r.errorKind());
        assertEquals("Missing required fields for action '" + action + "': user_id", r.errorMessage());
        verifyNoInteractions(router);
    }

    @Test
    void unhealthyConnectionIsReportedBeforeLookup() {
        connection.onDisconnected();

        McpResponse<Object> r = call("no_such_tool", Map.of());

        assertEquals(ErrorKind.CONNECTION_UNAVAILABLE, r.errorKind());
        assertTrue(r.errorMessage().toLowerCase().contains("connection"));
        verifyNoInteractions(router);
    }

    @Test
    void callsSucceedAgainAfterReconnect() {
        when(router.route(any())).thenReturn(Mono.just(Map.of("id", ID)));
        connection.onDisconnected();
        connection.onReconnected();

        McpResponse<Object> r = call(ToolCatalog.PROJECT_OPERATIONS, Map.of("action", "get", "project_id", ID));

        assertEquals(McpResponse.SUCCESS, r.status());
        assertEquals(Map.of("id", ID), r.data());
    }

    @Test
    void domainErrorMessageReachesTheCaller() {
        when(router.route(any())).thenReturn(Mono.error(new DomainException("Project not found or access denied")));

        McpResponse<Object> r = call(ToolCatalog.PROJECT_OPERATIONS, Map.of("action", "get", "project_id", ID));

        assertEquals(ErrorKind.DOMAIN, r.errorKind());
        assertEquals("Project not found or access denied", r.errorMessage());
    }

    @Test
    void unexpectedFailureIsWrapped() {
        when(router.route(any())).thenReturn(Mono.error(new IllegalStateException("driver exploded\nstack")));

        McpResponse<Object> r = call(ToolCatalog.TASK_OPERATIONS, Map.of("action", "get", "task_id", ID));

        assertEquals(ErrorKind.UNEXPECTED, r.errorKind());
        assertEquals("Tool execution failed: driver exploded stack", r.errorMessage());
    }

    @Test
    void routerThatThrowsSynchronouslyIsStillAnEnvelope() {
        when(router.route(any())).thenThrow(new IllegalArgumentException("bad payload"));

        McpResponse<Object> r = call(ToolCatalog.TASK_OPERATIONS, Map.of("action", "get", "task_id", ID));

        assertEquals(ErrorKind.UNEXPECTED, r.errorKind());
        assertEquals("Tool execution failed: bad payload", r.errorMessage());
    }

    @Test
    void slowCallTimesOut() {
        when(router.route(any())).thenReturn(Mono.never());

        McpResponse<Object> r = call(ToolCatalog.ANALYTICS_OPERATIONS, Map.of("action", "risk_analysis"));

        assertEquals(ErrorKind.TIMEOUT, r.errorKind());
        assertEquals("Tool execution timed out after 50 ms", r.errorMessage());
    }

    @Test
    void successWrapsTheServiceResult() {
        when(router.route(any())).thenReturn(Mono.just(List.of(Map.of("name", "Apollo"))));

        McpResponse<Object> r = call(ToolCatalog.PROJECT_OPERATIONS, Map.of("action", "search", "search_term", "apo"));

        assertEquals(McpResponse.SUCCESS, r.status());
        assertEquals(List.of(Map.of("name", "Apollo")), r.data());
        assertNull(r.errorMessage());
        assertNull(r.errorKind());
    }

    @Test
    void emptyResultStillCarriesData() {
        when(router.route(any())).thenReturn(Mono.empty());

        McpResponse<Object> r = call(ToolCatalog.ANALYTICS_OPERATIONS, Map.of("action", "deadline_tracking"));

        assertEquals(McpResponse.SUCCESS, r.status());
        assertEquals(Map.of(), r.data());
    }

    @Test
    void taskCreateWithoutUserIdIsRejected() {
        McpResponse<Object> r = call(ToolCatalog.TASK_OPERATIONS,
                Map.of("action", "create", "task_data", Map.of("name", "Write docs")));

        assertEquals(ErrorKind.MISSING_FIELDS, r.errorKind());
        assertTrue(r.errorMessage().contains("user_id"));
        verifyNoInteractions(router);
    }

    private static Object sampleValue(String field) {
        if (field.endsWith("_data")) {
            return Map.of("name", "x");
        }
        if (field.endsWith("_id")) {
            return ID;
        }
        return "value";
    }

    private static final class FakeDriver implements StoreDriver {
        @Override
        public void open() {
        }

        @Override
        public void close() {
        }

        @Override
        public boolean ping() {
            return true;
        }
    }
}
