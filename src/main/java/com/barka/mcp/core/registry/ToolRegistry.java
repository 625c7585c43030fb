package com.barka.mcp.core.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup over the tool definitions, built once at startup.
 */
public class ToolRegistry {
    private final Map<String, ToolDefinition> tools;

    public ToolRegistry(List<ToolDefinition> definitions) {
        Map<String, ToolDefinition> m = new LinkedHashMap<>();
        for (ToolDefinition d : definitions) {
            if (m.putIfAbsent(d.name(), d) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + d.name());
            }
        }
        this.tools = Collections.unmodifiableMap(m);
    }

    public List<Map<String, Object>> list() {
        List<Map<String, Object>> res = new ArrayList<>();
        for (ToolDefinition d : tools.values()) {
            res.add(d.describe());
        }
        return res;
    }

    public Optional<ToolDefinition> get(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public List<ToolDefinition> definitions() {
        return List.copyOf(tools.values());
    }
}
