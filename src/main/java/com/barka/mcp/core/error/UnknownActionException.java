package com.barka.mcp.core.error;

import com.barka.mcp.core.response.ErrorKind;

import java.util.Collection;

public class UnknownActionException extends McpToolException {

    private UnknownActionException(String message) {
        super(ErrorKind.UNKNOWN_ACTION, message);
    }

    public static UnknownActionException missing(String tool) {
        return new UnknownActionException("Missing action for tool " + tool);
    }

    public static UnknownActionException unknown(String tool, Object action, Collection<String> allowed) {
        return new UnknownActionException("Unknown action '" + action + "' for tool " + tool
                + ". Expected one of: " + String.join(", ", allowed));
    }
}
