package com.barka.mcp.core.response;

/**
 * Stable classification of a failed tool call. Callers should match on this rather than on
 * {@code error_message}, which is free text.
 */
public enum ErrorKind {
    UNKNOWN_TOOL,
    UNKNOWN_ACTION,
    VALIDATION,
    MISSING_FIELDS,
    CONNECTION_UNAVAILABLE,
    DOMAIN,
    TIMEOUT,
    UNEXPECTED
}
