package com.barka.mcp.core.registry;

import com.barka.mcp.core.command.ToolCommand;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semantic rule for one {@code (tool, action)} pair: which fields must be present and non-empty,
 * and which typed payload the fields are bound to before routing.
 *
 * @param requiredFields every one of these must be non-empty
 * @param anyOf          groups of which at least one member must be non-empty
 * @param mutating       mutating actions always require {@code user_id}
 */
public record ActionContract(
        String tool,
        String action,
        Set<String> requiredFields,
        List<Set<String>> anyOf,
        boolean mutating,
        Class<? extends ToolCommand> payloadType
) {
    public static final String USER_ID = "user_id";

    public ActionContract {
        requiredFields = Set.copyOf(requiredFields);
        anyOf = List.copyOf(anyOf);
        if (mutating && !requiredFields.contains(USER_ID)) {
            throw new IllegalArgumentException("Mutating action " + tool + "/" + action + " must require " + USER_ID);
        }
    }

    /**
     * Returns the missing fields in a stable order: declared required fields sorted by name,
     * then one {@code "one of a, b"} entry per unsatisfied group.
     */
    public List<String> missingFields(Map<String, Object> fields) {
        List<String> missing = new ArrayList<>();
        requiredFields.stream()
                .sorted()
                .filter(f -> isEmpty(fields.get(f)))
                .forEach(missing::add);
        for (Set<String> group : anyOf) {
            boolean satisfied = group.stream().anyMatch(f -> !isEmpty(fields.get(f)));
            if (!satisfied) {
                missing.add("one of " + String.join(", ", group.stream().sorted().toList()));
            }
        }
        return missing;
    }

    static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }
}
