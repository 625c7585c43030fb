package com.barka.mcp.core.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Connects to the store as the application context starts and releases it on close. A failed
 * connect aborts startup.
 */
public class StoreLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);

    private final ConnectionManager manager;
    private volatile boolean running;

    public StoreLifecycle(ConnectionManager manager) {
        this.manager = manager;
    }

    @Override
    public void start() {
        manager.connect();
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        try {
            manager.disconnect();
        } catch (RuntimeException e) {
            // already logged by the manager; the context keeps closing
            log.warn("Store disconnect failed during context stop: {}", e.getMessage());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        // ahead of the web server, so no call is served before the store is up
        return Integer.MIN_VALUE + 1000;
    }
}
