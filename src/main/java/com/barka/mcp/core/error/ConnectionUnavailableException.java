package com.barka.mcp.core.error;

import com.barka.mcp.core.response.ErrorKind;

public class ConnectionUnavailableException extends McpToolException {

    public ConnectionUnavailableException() {
        super(ErrorKind.CONNECTION_UNAVAILABLE, "Database connection not available");
    }
}
