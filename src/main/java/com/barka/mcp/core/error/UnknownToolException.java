package com.barka.mcp.core.error;

import com.barka.mcp.core.response.ErrorKind;

public class UnknownToolException extends McpToolException {
    private final String tool;

    public UnknownToolException(String tool) {
        super(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + tool);
        this.tool = tool;
    }

    public String tool() {
        return tool;
    }
}
