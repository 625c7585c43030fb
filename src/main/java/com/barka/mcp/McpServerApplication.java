package com.barka.mcp;

import com.barka.mcp.core.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class McpServerApplication {
    private static final Logger log = LoggerFactory.getLogger(McpServerApplication.class);

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(McpServerApplication.class);
        // replaced by GracefulShutdown, which owns the exit code
        app.setRegisterShutdownHook(false);
        ConfigurableApplicationContext context;
        try {
            context = app.run(args);
        } catch (RuntimeException e) {
            log.error("Failed to start Barka MCP server: {}", e.getMessage());
            System.exit(1);
            return;
        }
        GracefulShutdown shutdown = new GracefulShutdown(context.getBean(ConnectionManager.class), context);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown, "mcp-shutdown"));
        log.info("Barka MCP server started");
    }
}
