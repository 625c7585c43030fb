package com.barka.mcp.core.validation;

import com.barka.mcp.core.dispatch.ToolCallRequest;
import com.barka.mcp.core.error.MissingFieldsException;
import com.barka.mcp.core.error.UnknownActionException;
import com.barka.mcp.core.error.ValidationException;
import com.barka.mcp.core.registry.ActionContract;
import com.barka.mcp.core.registry.ToolDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a raw argument map in a fixed order: action membership, then the structural pass
 * against the tool's schema, then the action's required fields. The first failing stage
 * throws; later stages do not run.
 */
public class ToolCallValidator {

    public ToolCallRequest validate(ToolDefinition tool, Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        Object action = args.get(ToolDefinition.ACTION);
        if (action == null) {
            throw UnknownActionException.missing(tool.name());
        }
        ActionContract contract = action instanceof String a ? tool.contract(a).orElse(null) : null;
        if (contract == null) {
            throw UnknownActionException.unknown(tool.name(), action, tool.actionNames());
        }

        List<String> violations = tool.inputSchema().validateArguments(args);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        List<String> missing = contract.missingFields(args);
        if (!missing.isEmpty()) {
            throw new MissingFieldsException(contract.action(), missing);
        }

        return new ToolCallRequest(tool.name(), contract.action(),
                Collections.unmodifiableMap(new LinkedHashMap<>(args)), contract);
    }
}
