package com.barka.mcp.core.error;

import com.barka.mcp.core.response.ErrorKind;

import java.util.List;

public class MissingFieldsException extends McpToolException {
    private final String action;
    private final List<String> missing;

    public MissingFieldsException(String action, List<String> missing) {
        super(ErrorKind.MISSING_FIELDS,
                "Missing required fields for action '" + action + "': " + String.join(", ", missing));
        this.action = action;
        this.missing = List.copyOf(missing);
    }

    public String action() {
        return action;
    }

    public List<String> missing() {
        return missing;
    }
}
