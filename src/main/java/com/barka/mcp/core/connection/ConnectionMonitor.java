package com.barka.mcp.core.connection;

import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically probes the store and turns the outcome into connectivity events for the
 * {@link ConnectionManager}. The JDBC pool raises no such events itself.
 */
public class ConnectionMonitor {
    private final StoreDriver driver;
    private final ConnectionManager manager;

    public ConnectionMonitor(StoreDriver driver, ConnectionManager manager) {
        this.driver = driver;
        this.manager = manager;
    }

    @Scheduled(fixedDelayString = "${mcp.store.health-check-interval-ms:5000}")
    public void probe() {
        if (!manager.isEstablished()) return;
        boolean reachable;
        try {
            reachable = driver.ping();
        } catch (RuntimeException e) {
            manager.onError(e);
            return;
        }
        if (reachable) {
            manager.onReconnected();
        } else {
            manager.onDisconnected();
        }
    }
}
