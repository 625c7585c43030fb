package com.barka.mcp.domain;

/**
 * Tenant scoping identifiers as supplied by the caller. Either may be null, meaning the
 * service does not narrow on it.
 */
public record Scope(String clientId, String organizationId) {

    public static Scope unscoped() {
        return new Scope(null, null);
    }
}
