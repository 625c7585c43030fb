package com.barka.mcp.core.error;

import com.barka.mcp.core.response.ErrorKind;

/**
 * Raised by a domain service ("not found", "access denied", business rule violations).
 * The message reaches the caller as is.
 */
public class DomainException extends McpToolException {

    public DomainException(String message) {
        super(ErrorKind.DOMAIN, message);
    }

    public DomainException(String message, Throwable cause) {
        super(ErrorKind.DOMAIN, message, cause);
    }
}
