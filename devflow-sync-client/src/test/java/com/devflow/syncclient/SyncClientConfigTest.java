package com.devflow.syncclient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncClientConfigTest {

    @Nested
    @DisplayName("Builder")
    class Building {

        @Test
        @DisplayName("Applies defaults, with heartbeat timeout at twice the interval")
        void defaults() {
            SyncClientConfig config = SyncClientConfig.builder("ws://h/ws", "t").build();

            assertEquals(5000, config.getReconnectInterval());
            assertEquals(10, config.getMaxReconnectAttempts());
            assertEquals(30000, config.getHeartbeatInterval());
            assertEquals(60000, config.getHeartbeatTimeout());
            assertEquals(1.5, config.getReconnectBackoffMultiplier());
            assertEquals(60000, config.getMaxReconnectInterval());
            assertEquals(5000, config.getSubscriptionTimeout());
            assertEquals(1000, config.getMaxQueueSize());
        }

        @Test
        @DisplayName("Rejects invalid values")
        void validation() {
            assertThrows(NullPointerException.class, () -> SyncClientConfig.builder(null, "t").build());
            assertThrows(NullPointerException.class, () -> SyncClientConfig.builder("ws://h", null).build());
            assertThrows(IllegalArgumentException.class, () -> SyncClientConfig.builder(" ", "t").build());
            assertThrows(IllegalArgumentException.class,
                () -> SyncClientConfig.builder("ws://h", "t").reconnectInterval(0).build());
            assertThrows(IllegalArgumentException.class,
                () -> SyncClientConfig.builder("ws://h", "t").maxReconnectAttempts(-1).build());
            assertThrows(IllegalArgumentException.class,
                () -> SyncClientConfig.builder("ws://h", "t").heartbeatInterval(0).build());
            assertThrows(IllegalArgumentException.class,
                () -> SyncClientConfig.builder("ws://h", "t").reconnectBackoffMultiplier(0.5).build());
            assertThrows(IllegalArgumentException.class,
                () -> SyncClientConfig.builder("ws://h", "t").maxQueueSize(0).build());
        }

        @Test
        @DisplayName("withToken copies everything else")
        void withToken() {
            SyncClientConfig config = SyncClientConfig.builder("ws://h/ws", "old")
                .reconnectInterval(250)
                .heartbeatInterval(1000)
                .build();

            SyncClientConfig refreshed = config.withToken("new");

            assertEquals("new", refreshed.getToken());
            assertEquals("old", config.getToken());
            assertEquals(250, refreshed.getReconnectInterval());
            assertEquals(2000, refreshed.getHeartbeatTimeout());
        }

        @Test
        @DisplayName("toString does not leak the token")
        void noTokenInToString() {
            String text = SyncClientConfig.builder("ws://h/ws", "s3cret").build().toString();
            assertTrue(text.contains("ws://h/ws"));
            assertFalse(text.contains("s3cret"));
        }
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("Reads environment variables and falls back to defaults")
        void fromEnvironment() {
            SyncClientConfig config = SyncClientConfig.load(Map.of(
                "DEVFLOW_SYNC_URL", "wss://sync.example.com/ws",
                "DEVFLOW_SYNC_TOKEN", "abc",
                "DEVFLOW_SYNC_MAX_RECONNECT_ATTEMPTS", "4"));

            assertEquals("wss://sync.example.com/ws", config.getUrl());
            assertEquals("abc", config.getToken());
            assertEquals(4, config.getMaxReconnectAttempts());
            assertEquals(5000, config.getReconnectInterval());
        }

        @Test
        @DisplayName("System properties win over environment variables")
        void systemPropertyWins() {
            System.setProperty("devflow.sync.reconnect_interval", "750");
            try {
                SyncClientConfig config = SyncClientConfig.load(Map.of("DEVFLOW_SYNC_RECONNECT_INTERVAL", "9000"));
                assertEquals(750, config.getReconnectInterval());
            } finally {
                System.clearProperty("devflow.sync.reconnect_interval");
            }
        }

        @Test
        @DisplayName("Uses the local server when nothing is set")
        void localDefault() {
            assertEquals("ws://localhost:3001/ws", SyncClientConfig.load(Map.of()).getUrl());
        }
    }

    @Nested
    @DisplayName("fromYaml")
    class Yaml {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Reads camelCase keys")
        void readsFile() throws IOException {
            Path file = dir.resolve("sync.yaml");
            Files.writeString(file, String.join("\n",
                "url: wss://sync.example.com/ws",
                "token: abc",
                "reconnectInterval: 2000",
                "maxReconnectAttempts: 5",
                "heartbeatInterval: 10000",
                "subscriptionTimeout: 3000",
                ""));

            SyncClientConfig config = SyncClientConfig.fromYaml(file);

            assertEquals("wss://sync.example.com/ws", config.getUrl());
            assertEquals(2000, config.getReconnectInterval());
            assertEquals(5, config.getMaxReconnectAttempts());
            assertEquals(20000, config.getHeartbeatTimeout());
            assertEquals(3000, config.getSubscriptionTimeout());
            assertEquals(1000, config.getMaxQueueSize());
        }

        @Test
        @DisplayName("Fails when url or token is missing")
        void missingRequired() throws IOException {
            Path file = dir.resolve("sync.yaml");
            Files.writeString(file, "url: wss://sync.example.com/ws\n");

            assertThrows(IOException.class, () -> SyncClientConfig.fromYaml(file));
        }
    }
}
