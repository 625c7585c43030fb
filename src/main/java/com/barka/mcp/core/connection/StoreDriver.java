package com.barka.mcp.core.connection;

/**
 * The backing store as seen by the {@link ConnectionManager}. Failures surface as
 * {@link StoreConnectionException}.
 */
public interface StoreDriver {

    /** Establishes the connection and prepares the store for use. */
    void open();

    /** Releases held connections. The driver may be opened again afterwards. */
    void close();

    /** Cheap liveness probe; false when the store cannot be reached. */
    boolean ping();
}
