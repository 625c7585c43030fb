package com.barka.mcp.infra.db;

public enum EntityKind {
    PROJECT("project"),
    TASK("task"),
    TEAM_MEMBER("team_member");

    private final String code;

    EntityKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
