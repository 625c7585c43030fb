package com.barka.mcp.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Store connection settings, bound from {@code mcp.store.*}.
 */
@ConfigurationProperties(prefix = "mcp.store")
public class StoreProperties {
    private String uri = "jdbc:postgresql://localhost:5432/barka";
    private String username = "barka";
    private String password = "";
    private int maxPoolSize = 10;
    private long connectTimeoutMs = 5000;
    private long socketTimeoutMs = 45000;
    private long healthCheckIntervalMs = 5000;

    /**
     * The configured URI as a JDBC URL. Accepts {@code postgres://} and {@code postgresql://}
     * connection strings as well.
     */
    public String jdbcUrl() {
        if (uri.startsWith("jdbc:")) {
            return uri;
        }
        if (uri.startsWith("postgres://")) {
            return "jdbc:postgresql://" + uri.substring("postgres://".length());
        }
        return "jdbc:" + uri;
    }

    public boolean isPostgres() {
        return jdbcUrl().startsWith("jdbc:postgresql:");
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getSocketTimeoutMs() {
        return socketTimeoutMs;
    }

    public void setSocketTimeoutMs(long socketTimeoutMs) {
        this.socketTimeoutMs = socketTimeoutMs;
    }

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
        this.healthCheckIntervalMs = healthCheckIntervalMs;
    }
}
