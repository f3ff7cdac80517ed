package com.devflow.syncclient;

import com.devflow.syncclient.connection.ConnectionState;
import com.devflow.syncclient.sync.DataType;
import com.devflow.syncclient.support.FakeSocket;
import com.devflow.syncclient.support.FakeSocketFactory;
import com.devflow.syncclient.support.ManualTaskScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncSessionTest {

    @Test
    @DisplayName("Wires connection and domain layer on one bus; close disconnects and stops the loop")
    void lifecycle() {
        ManualTaskScheduler scheduler = new ManualTaskScheduler();
        FakeSocketFactory sockets = new FakeSocketFactory();
        SyncSession session = new SyncSession(SyncClientConfig.builder("ws://h/ws", "t").build(), sockets, scheduler);

        session.connect();
        FakeSocket socket = sockets.last().open();
        session.sync().subscribeToDataType(DataType.DASHBOARD, Map.of("dashboardId", "d1"));
        socket.receive("subscription_confirmed", "{\"topic\":\"dashboard_updated\",\"filters\":{\"dashboardId\":\"d1\"}}");

        assertSame(session.events(), session.connection().events());
        assertEquals(1, session.sync().getConnectionStatus().subscriptionCount());

        session.close();

        assertEquals(ConnectionState.DISCONNECTED, session.connection().getConnectionState());
        assertEquals(1000, socket.getClientCloseCode());
        assertTrue(scheduler.isShutdown());
    }
}
