package com.barka.mcp.core.error;

import com.barka.mcp.core.response.ErrorKind;

/**
 * Base of every failure the dispatcher knows how to classify. Anything else reaching the
 * dispatch boundary is reported as {@link ErrorKind#UNEXPECTED}.
 */
public abstract class McpToolException extends RuntimeException {
    private final ErrorKind kind;

    protected McpToolException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected McpToolException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * True for malformed client input, which is reported back but not treated as an incident.
     */
    public boolean isClientError() {
        return kind == ErrorKind.UNKNOWN_TOOL
                || kind == ErrorKind.UNKNOWN_ACTION
                || kind == ErrorKind.VALIDATION
                || kind == ErrorKind.MISSING_FIELDS;
    }
}
