package com.barka.mcp.core.connection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionMonitorTest {

    @Mock
    private StoreDriver driver;

    private ConnectionManager manager;
    private ConnectionMonitor monitor;

    @BeforeEach
    void setUp() {
        manager = new ConnectionManager(driver);
        monitor = new ConnectionMonitor(driver, manager);
    }

    @Test
    void probeIsSkippedUntilConnected() {
        monitor.probe();

        verify(driver, never()).ping();
    }

    @Test
    void failedPingMarksUnhealthyAndSuccessRecovers() {
        manager.connect();
        when(driver.ping()).thenReturn(false, true);

        monitor.probe();
        assertEquals(ConnectionState.DISCONNECTED, manager.state());

        monitor.probe();
        assertEquals(ConnectionState.RECONNECTED, manager.state());
    }

    @Test
    void healthyPingLeavesStateAlone() {
        manager.connect();
        when(driver.ping()).thenReturn(true);

        monitor.probe();

        assertEquals(ConnectionState.CONNECTED, manager.state());
    }

    @Test
    void pingErrorIsReportedToManager() {
        manager.connect();
        when(driver.ping()).thenThrow(new StoreConnectionException("pool closed"));

        monitor.probe();

        assertFalse(manager.isHealthy());
    }
}
