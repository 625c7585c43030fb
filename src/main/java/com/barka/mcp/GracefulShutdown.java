package com.barka.mcp;

import com.barka.mcp.core.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.function.IntConsumer;

/**
 * Shutdown hook body: disconnects from the store, closes the context, then terminates with
 * 0, or 1 when the disconnect failed.
 */
public class GracefulShutdown implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(GracefulShutdown.class);

    private final ConnectionManager connection;
    private final ConfigurableApplicationContext context;
    private final IntConsumer terminator;

    public GracefulShutdown(ConnectionManager connection, ConfigurableApplicationContext context) {
        // halt, not exit: exit from inside a shutdown hook blocks forever
        this(connection, context, code -> Runtime.getRuntime().halt(code));
    }

    GracefulShutdown(ConnectionManager connection, ConfigurableApplicationContext context, IntConsumer terminator) {
        this.connection = connection;
        this.context = context;
        this.terminator = terminator;
    }

    @Override
    public void run() {
        terminator.accept(shutdown());
    }

    int shutdown() {
        log.info("Shutting down Barka MCP server");
        int code = 0;
        try {
            connection.disconnect();
        } catch (RuntimeException e) {
            log.error("Error during shutdown: {}", e.getMessage());
            code = 1;
        }
        context.close();
        return code;
    }
}
