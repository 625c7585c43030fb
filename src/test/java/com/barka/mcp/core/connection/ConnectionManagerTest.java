package com.barka.mcp.core.connection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

    @Mock
    private StoreDriver driver;

    @Test
    void startsDisconnected() {
        ConnectionManager manager = new ConnectionManager(driver);

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertFalse(manager.isHealthy());
        assertFalse(manager.isEstablished());
    }

    @Test
    void connectIsIdempotent() {
        ConnectionManager manager = new ConnectionManager(driver);

        manager.connect();
        manager.connect();

        verify(driver, times(1)).open();
        assertEquals(ConnectionState.CONNECTED, manager.state());
        assertTrue(manager.isHealthy());
    }

    @Test
    void failedConnectLeavesManagerDisconnected() {
        StoreConnectionException failure = new StoreConnectionException("Failed to connect to database: refused");
        doThrow(failure).when(driver).open();
        ConnectionManager manager = new ConnectionManager(driver);

        StoreConnectionException thrown = assertThrows(StoreConnectionException.class, manager::connect);

        assertSame(failure, thrown);
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertFalse(manager.isEstablished());
    }

    @Test
    void disconnectBeforeConnectDoesNothing() {
        ConnectionManager manager = new ConnectionManager(driver);

        manager.disconnect();

        verify(driver, never()).close();
    }

    @Test
    void disconnectIsIdempotent() {
        ConnectionManager manager = new ConnectionManager(driver);
        manager.connect();

        manager.disconnect();
        manager.disconnect();

        verify(driver, times(1)).close();
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertFalse(manager.isEstablished());
    }

    @Test
    void failedDisconnectPropagates() {
        doThrow(new StoreConnectionException("close failed")).when(driver).close();
        ConnectionManager manager = new ConnectionManager(driver);
        manager.connect();

        assertThrows(StoreConnectionException.class, manager::disconnect);
        assertTrue(manager.isEstablished());
    }

    @Test
    void driverEventsMoveHealthBothWays() {
        ConnectionManager manager = new ConnectionManager(driver);
        manager.connect();

        manager.onDisconnected();
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertFalse(manager.isHealthy());
        assertTrue(manager.isEstablished());

        manager.onReconnected();
        assertEquals(ConnectionState.RECONNECTED, manager.state());
        assertTrue(manager.isHealthy());

        manager.onError(new IllegalStateException("socket reset"));
        assertFalse(manager.isHealthy());
    }

    @Test
    void eventsBeforeConnectAreIgnored() {
        ConnectionManager manager = new ConnectionManager(driver);

        manager.onReconnected();
        manager.onError(new IllegalStateException("early"));

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
    }

    @Test
    void reconnectEventAfterExplicitDisconnectIsIgnored() {
        ConnectionManager manager = new ConnectionManager(driver);
        manager.connect();
        manager.disconnect();

        manager.onReconnected();

        assertFalse(manager.isHealthy());
    }

    @Test
    void reconnectedCountsAsConnectedForConnect() {
        ConnectionManager manager = new ConnectionManager(driver);
        manager.connect();
        manager.onDisconnected();
        manager.onReconnected();

        manager.connect();

        verify(driver, times(1)).open();
    }
}
