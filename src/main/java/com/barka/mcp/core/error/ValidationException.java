package com.barka.mcp.core.error;

import com.barka.mcp.core.response.ErrorKind;

import java.util.List;

/**
 * Structural validation failure. Carries every violation found, not only the first.
 */
public class ValidationException extends McpToolException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(ErrorKind.VALIDATION, "Validation failed: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
