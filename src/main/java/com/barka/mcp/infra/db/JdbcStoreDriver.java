package com.barka.mcp.infra.db;

import com.barka.mcp.core.connection.StoreConnectionException;
import com.barka.mcp.core.connection.StoreDriver;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * {@link StoreDriver} over a JDBC {@link DataSource}. Opening validates a connection and applies
 * the store schema; closing evicts pooled connections but leaves the pool usable.
 */
public class JdbcStoreDriver implements StoreDriver {
    static final String SCHEMA = "db/store-schema.sql";

    private final DataSource dataSource;
    private final int validationTimeoutSeconds;

    public JdbcStoreDriver(DataSource dataSource, int validationTimeoutSeconds) {
        this.dataSource = dataSource;
        this.validationTimeoutSeconds = Math.max(1, validationTimeoutSeconds);
    }

    @Override
    public void open() {
        try (Connection c = dataSource.getConnection()) {
            if (!c.isValid(validationTimeoutSeconds)) {
                throw new StoreConnectionException("Database connection failed validation");
            }
        } catch (SQLException e) {
            throw new StoreConnectionException("Failed to connect to database: " + e.getMessage(), e);
        }
        try {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA)).execute(dataSource);
        } catch (RuntimeException e) {
            throw new StoreConnectionException("Failed to apply store schema: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()
                && hikari.getHikariPoolMXBean() != null) {
            hikari.getHikariPoolMXBean().softEvictConnections();
        }
    }

    @Override
    public boolean ping() {
        try (Connection c = dataSource.getConnection()) {
            return c.isValid(validationTimeoutSeconds);
        } catch (SQLException e) {
            return false;
        }
    }
}
