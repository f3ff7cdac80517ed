package com.devflow.syncclient;

import com.devflow.syncclient.connection.Subscription;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncMonitorAppTest {

    @Test
    @DisplayName("Parses config file and topics with filters")
    void parsesArguments() {
        SyncMonitorApp.MonitorArgs args = SyncMonitorApp.MonitorArgs.parse(
            new String[]{"tasks:teamId=t1,status=open", "--config", "sync.yaml", "metrics"});

        assertEquals(Path.of("sync.yaml"), args.configFile());
        assertEquals(List.of(
            Subscription.of("tasks", Map.of("teamId", "t1", "status", "open")),
            Subscription.of("metrics")), args.subscriptions());
    }

    @Test
    @DisplayName("No arguments means environment config and no topics")
    void empty() {
        SyncMonitorApp.MonitorArgs args = SyncMonitorApp.MonitorArgs.parse(new String[0]);

        assertNull(args.configFile());
        assertTrue(args.subscriptions().isEmpty());
    }

    @Test
    @DisplayName("A trailing colon means no filters")
    void trailingColon() {
        assertEquals(Subscription.of("tasks"), SyncMonitorApp.MonitorArgs.parseSubscription("tasks:"));
    }

    @Test
    @DisplayName("Rejects malformed arguments")
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class,
            () -> SyncMonitorApp.MonitorArgs.parse(new String[]{"--config"}));
        assertThrows(IllegalArgumentException.class,
            () -> SyncMonitorApp.MonitorArgs.parse(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class,
            () -> SyncMonitorApp.MonitorArgs.parseSubscription("tasks:teamId"));
        assertThrows(IllegalArgumentException.class,
            () -> SyncMonitorApp.MonitorArgs.parseSubscription(":teamId=1"));
    }
}
