package com.barka.mcp.infra.db;

import com.barka.mcp.core.connection.StoreConnectionException;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcStoreDriverTest {

    @Test
    void openAppliesSchemaAndIsRepeatable() {
        H2Store store = H2Store.open();

        store.driver.open();

        assertEquals(0, store.jdbc.queryForObject("SELECT COUNT(*) FROM pm_entity", Integer.class));
        assertTrue(store.driver.ping());
    }

    @Test
    void openFailsWhenNoConnectionCanBeMade() throws SQLException {
        DataSource ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new SQLException("Connection refused"));
        JdbcStoreDriver driver = new JdbcStoreDriver(ds, 1);

        StoreConnectionException e = assertThrows(StoreConnectionException.class, driver::open);

        assertTrue(e.getMessage().contains("Connection refused"));
    }

    @Test
    void pingIsFalseWhenNoConnectionCanBeMade() throws SQLException {
        DataSource ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new SQLException("Connection refused"));

        assertFalse(new JdbcStoreDriver(ds, 1).ping());
    }

    @Test
    void closeLeavesNonPooledSourceUsable() {
        H2Store store = H2Store.open();

        store.driver.close();

        assertTrue(store.driver.ping());
    }
}
