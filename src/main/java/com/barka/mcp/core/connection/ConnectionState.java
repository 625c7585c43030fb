package com.barka.mcp.core.connection;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTED;

    public boolean isHealthy() {
        return this == CONNECTED || this == RECONNECTED;
    }
}
