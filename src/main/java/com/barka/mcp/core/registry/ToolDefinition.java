package com.barka.mcp.core.registry;

import com.barka.mcp.core.command.ToolCommand;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One externally callable tool. The input schema is the union of every action's fields;
 * per-action requirements live in the {@link ActionContract}s.
 */
public record ToolDefinition(
        String name,
        String description,
        SchemaNode inputSchema,
        List<ActionContract> actions
) {
    public static final String ACTION = "action";

    public ToolDefinition {
        actions = List.copyOf(actions);
    }

    public List<String> actionNames() {
        return actions.stream().map(ActionContract::action).toList();
    }

    public Optional<ActionContract> contract(String action) {
        return actions.stream().filter(a -> a.action().equals(action)).findFirst();
    }

    /** The wire form used by {@code list_tools}. */
    public Map<String, Object> describe() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("description", description);
        m.put("inputSchema", inputSchema.toJsonSchema());
        return m;
    }

    public static Builder builder(String name, String description) {
        return new Builder(name, description);
    }

    public static final class Builder {
        private final String name;
        private final String description;
        private final Map<String, SchemaNode> fields = new LinkedHashMap<>();
        private final List<ActionContract> actions = new ArrayList<>();
        private String actionDescription = "The operation to perform";

        private Builder(String name, String description) {
            this.name = name;
            this.description = description;
        }

        public Builder actionDescription(String text) {
            this.actionDescription = text;
            return this;
        }

        public Builder field(String field, SchemaNode node) {
            fields.put(field, node);
            return this;
        }

        public Builder read(String action, Class<? extends ToolCommand> payload, String... required) {
            actions.add(new ActionContract(name, action, Set.of(required), List.of(), false, payload));
            return this;
        }

        public Builder mutating(String action, Class<? extends ToolCommand> payload, String... required) {
            Set<String> all = new HashSet<>(Arrays.asList(required));
            all.add(ActionContract.USER_ID);
            actions.add(new ActionContract(name, action, all, List.of(), true, payload));
            return this;
        }

        public Builder readAnyOf(String action, Class<? extends ToolCommand> payload, String... oneOf) {
            actions.add(new ActionContract(name, action, Set.of(), List.of(Set.of(oneOf)), false, payload));
            return this;
        }

        public ToolDefinition build() {
            Map<String, SchemaNode> props = new LinkedHashMap<>();
            String[] names = actions.stream().map(ActionContract::action).toArray(String[]::new);
            props.put(ACTION, SchemaNode.enumOf(actionDescription, names).required());
            props.putAll(fields);
            for (ActionContract c : actions) {
                for (String f : c.requiredFields()) {
                    if (!props.containsKey(f)) {
                        throw new IllegalStateException(name + "/" + c.action() + " requires undeclared field " + f);
                    }
                }
            }
            SchemaNode schema = SchemaNode.object(description, Collections.unmodifiableMap(props));
            return new ToolDefinition(name, description, schema, actions);
        }
    }
}
