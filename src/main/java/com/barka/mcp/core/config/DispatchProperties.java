package com.barka.mcp.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "mcp.dispatch")
public class DispatchProperties {
    /** Deadline for one tool call. Zero or negative disables it. */
    private Duration timeout = Duration.ofSeconds(30);

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
