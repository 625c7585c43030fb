package com.barka.mcp.core.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Single source of truth for store connectivity. {@link #connect()} and {@link #disconnect()}
 * are idempotent; driver events move the state between healthy and unhealthy without a restart.
 * <p>
 * Events received before the first successful connect, or after an explicit disconnect, are
 * ignored.
 */
public class ConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final StoreDriver driver;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private volatile boolean established;

    public ConnectionManager(StoreDriver driver) {
        this.driver = driver;
    }

    public synchronized void connect() {
        ConnectionState current = state.get();
        if (current.isHealthy()) {
            log.info("Database already connected");
            return;
        }
        state.set(ConnectionState.CONNECTING);
        try {
            driver.open();
        } catch (RuntimeException e) {
            state.set(ConnectionState.DISCONNECTED);
            log.error("Failed to connect to database", e);
            throw e;
        }
        established = true;
        state.set(ConnectionState.CONNECTED);
        log.info("Connected to database successfully");
    }

    public synchronized void disconnect() {
        if (!established) {
            return;
        }
        try {
            driver.close();
        } catch (RuntimeException e) {
            log.error("Error disconnecting from database", e);
            throw e;
        }
        established = false;
        state.set(ConnectionState.DISCONNECTED);
        log.info("Disconnected from database");
    }

    public boolean isHealthy() {
        return state.get().isHealthy();
    }

    public ConnectionState state() {
        return state.get();
    }

    /** True once connected and until an explicit disconnect, whatever the current health. */
    public boolean isEstablished() {
        return established;
    }

    public void onDisconnected() {
        if (established && state.get().isHealthy()) {
            state.set(ConnectionState.DISCONNECTED);
            log.warn("Database disconnected");
        }
    }

    public void onReconnected() {
        if (established && !state.get().isHealthy()) {
            state.set(ConnectionState.RECONNECTED);
            log.info("Database reconnected");
        }
    }

    public void onError(Throwable error) {
        if (established) {
            log.error("Database connection error", error);
            state.set(ConnectionState.DISCONNECTED);
        }
    }
}
