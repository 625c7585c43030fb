package com.barka.mcp.core.dispatch;

import com.barka.mcp.core.registry.ActionContract;

import java.util.Map;

/**
 * A call that passed both validation passes, paired with the contract it was checked against.
 */
public record ToolCallRequest(String tool, String action, Map<String, Object> fields, ActionContract contract) {
}
