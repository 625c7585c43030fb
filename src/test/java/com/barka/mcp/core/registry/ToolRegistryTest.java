package com.barka.mcp.core.registry;

import com.barka.mcp.core.command.ProjectCommand;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {
    private final ToolRegistry registry = new ToolRegistry(ToolCatalog.tools());

    @Test
    void listsTheSixToolsInOrder() {
        List<Object> names = registry.list().stream().map(t -> t.get("name")).toList();

        assertEquals(List.of("project_operations", "task_operations", "team_operations",
                "search_operations", "analytics_operations", "assignment_operations"), names);
    }

    @Test
    void everyToolHasANonEmptyInputSchema() {
        for (Map<String, Object> tool : registry.list()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> schema = (Map<String, Object>) tool.get("inputSchema");
            assertEquals("object", schema.get("type"));
            assertFalse(((Map<?, ?>) schema.get("properties")).isEmpty(), tool.get("name") + " has no properties");
            assertEquals(List.of("action"), schema.get("required"));
        }
    }

    @Test
    void listingSerializesIdenticallyEveryTime() throws Exception {
        ObjectMapper om = new ObjectMapper();

        String first = om.writeValueAsString(registry.list());
        String second = om.writeValueAsString(registry.list());
        String rebuilt = om.writeValueAsString(new ToolRegistry(ToolCatalog.tools()).list());

        assertEquals(first, second);
        assertEquals(first, rebuilt);
    }

    @Test
    void actionEnumMatchesContracts() {
        for (ToolDefinition tool : registry.definitions()) {
            Map<String, Object> action = tool.inputSchema().properties().get(ToolDefinition.ACTION).toJsonSchema();
            assertEquals(tool.actionNames(), action.get("enum"));
        }
    }

    @Test
    void mutatingActionsRequireUserId() {
        int mutating = 0;
        for (ToolDefinition tool : registry.definitions()) {
            for (ActionContract c : tool.actions()) {
                if (c.mutating()) {
                    mutating++;
                    assertTrue(c.requiredFields().contains(ActionContract.USER_ID), c.tool() + "/" + c.action());
                }
            }
        }
        assertEquals(14, mutating);
    }

    @Test
    void lookupIsNullSafe() {
        assertTrue(registry.get(null).isEmpty());
        assertTrue(registry.get("unknown_operations").isEmpty());
        assertTrue(registry.get("task_operations").isPresent());
    }

    @Test
    void duplicateNamesAreRejected() {
        ToolDefinition projects = ToolCatalog.projectOperations();

        assertThrows(IllegalArgumentException.class, () -> new ToolRegistry(List.of(projects, projects)));
    }

    @Test
    void mutatingContractWithoutUserIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ActionContract("t", "a", Set.of(), List.of(),
                true, ProjectCommand.Delete.class));
    }
}
