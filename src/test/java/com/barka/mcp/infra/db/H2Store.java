package com.barka.mcp.infra.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.UUID;

/**
 * A fresh in-memory store per test, with the schema applied through {@link JdbcStoreDriver}.
 */
public final class H2Store {
    public static final Instant START = Instant.parse("2025-01-15T10:00:00Z");

    public final DataSource dataSource;
    public final JdbcTemplate jdbc;
    public final MutableClock clock;
    public final EntityRepository repo;
    public final JdbcStoreDriver driver;

    private H2Store() {
        this.dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        this.jdbc = new JdbcTemplate(dataSource);
        this.clock = new MutableClock(START);
        this.repo = new EntityRepository(jdbc, new ObjectMapper(), clock);
        this.driver = new JdbcStoreDriver(dataSource, 2);
    }

    public static H2Store open() {
        H2Store store = new H2Store();
        store.driver.open();
        return store;
    }
}
