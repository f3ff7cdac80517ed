package com.devflow.syncclient.connection;

import com.devflow.syncclient.exception.MalformedEnvelopeException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();

    @Nested
    @DisplayName("Decoding inbound frames")
    class Decode {

        @Test
        @DisplayName("Reads type and data")
        void readsTypeAndData() throws Exception {
            Envelope envelope = codec.decode("{\"type\":\"pong\",\"data\":{\"timestamp\":42}}");

            assertEquals("pong", envelope.type());
            assertEquals(42, envelope.data().get("timestamp").asInt());
        }

        @Test
        @DisplayName("Missing data becomes an empty object")
        void missingDataIsEmptyObject() throws Exception {
            Envelope envelope = codec.decode("{\"type\":\"pong\"}");

            assertTrue(envelope.data().isObject());
            assertEquals(0, envelope.data().size());
        }

        @Test
        @DisplayName("Rejects text that is not JSON")
        void rejectsNonJson() {
            MalformedEnvelopeException e = assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode("not json at all"));
            assertTrue(e.getMessage().startsWith("Failed to parse message"));
        }

        @Test
        @DisplayName("Rejects JSON that is not an object or has no type")
        void rejectsWrongShape() {
            assertThrows(MalformedEnvelopeException.class, () -> codec.decode("[1,2,3]"));
            assertThrows(MalformedEnvelopeException.class, () -> codec.decode("{\"data\":{}}"));
            assertThrows(MalformedEnvelopeException.class, () -> codec.decode("{\"type\":7}"));
        }
    }

    @Test
    @DisplayName("Encodes a subscribe envelope with topic and filters")
    void encodesSubscribe() throws Exception {
        Subscription subscription = Subscription.of("tasks", Map.of("teamId", "t1"));

        String frame = codec.encode(Envelope.of(MessageType.SUBSCRIBE, codec.toTree(subscription)));
        JsonNode node = codec.getObjectMapper().readTree(frame);

        assertEquals("subscribe", node.get("type").asText());
        assertEquals("tasks", node.get("data").get("topic").asText());
        assertEquals("t1", node.get("data").get("filters").get("teamId").asText());
    }

    @Nested
    @DisplayName("Subscription identity")
    class Identity {

        @Test
        @DisplayName("Key ignores filter insertion order")
        void keyIgnoresOrder() {
            Map<String, Object> ab = new LinkedHashMap<>();
            ab.put("a", 1);
            ab.put("b", "x");
            Map<String, Object> ba = new LinkedHashMap<>();
            ba.put("b", "x");
            ba.put("a", 1);

            assertEquals(codec.keyOf(Subscription.of("t", ab)), codec.keyOf(Subscription.of("t", ba)));
        }

        @Test
        @DisplayName("A subscription read back from the wire has the same key")
        void wireRoundTripKeepsKey() throws Exception {
            Subscription original = Subscription.of("metrics", Map.of("userId", "u1", "limit", 10));
            JsonNode data = codec.getObjectMapper().readTree(
                "{\"topic\":\"metrics\",\"filters\":{\"limit\":10,\"userId\":\"u1\"}}");

            assertEquals(codec.keyOf(original), codec.keyOf(codec.toSubscription(data)));
        }

        @Test
        @DisplayName("Different topic or filters give different keys")
        void differentKeys() {
            String base = codec.keyOf(Subscription.of("tasks", Map.of("teamId", "t1")));

            assertNotEquals(base, codec.keyOf(Subscription.of("tasks", Map.of("teamId", "t2"))));
            assertNotEquals(base, codec.keyOf(Subscription.of("metrics", Map.of("teamId", "t1"))));
            assertNotEquals(base, codec.keyOf(Subscription.of("tasks")));
        }

        @Test
        @DisplayName("toSubscription returns null without a topic")
        void noTopic() throws Exception {
            assertNull(codec.toSubscription(codec.getObjectMapper().readTree("{\"filters\":{}}")));
        }
    }
}
