package com.devflow.syncclient.connection;

import com.devflow.syncclient.exception.MalformedEnvelopeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * JSON encoding of envelopes and of the values carried inside them.
 */
public class EnvelopeCodec {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EnvelopeCodec() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String encode(Envelope envelope) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", envelope.type());
        node.set("data", envelope.data());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // A tree built from JsonNodes always serializes
            throw new IllegalStateException("Failed to encode " + envelope.type(), e);
        }
    }

    /**
     * Parse one inbound frame.
     *
     * @throws MalformedEnvelopeException if the frame is not JSON, not an object, or has no type
     */
    public Envelope decode(String frame) throws MalformedEnvelopeException {
        JsonNode node;
        try {
            node = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Failed to parse message: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedEnvelopeException("Message is not a JSON object");
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            throw new MalformedEnvelopeException("Message missing type field");
        }
        return new Envelope(type.asText(), node.get("data"));
    }

    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    public Subscription toSubscription(JsonNode data) {
        String topic = data.path("topic").asText(null);
        if (topic == null) {
            return null;
        }
        JsonNode filters = data.get("filters");
        return new Subscription(topic, filters == null || !filters.isObject()
            ? Map.of()
            : objectMapper.convertValue(filters, MAP_TYPE));
    }

    /**
     * Canonical identity of a subscription: topic plus its filters serialized
     * with sorted keys, so that equal filters built in different orders or
     * parsed from the wire produce the same key.
     */
    public String keyOf(Subscription subscription) {
        try {
            Map<String, Object> canonical = objectMapper.convertValue(subscription.filters(), MAP_TYPE);
            return subscription.topic() + ":" + objectMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Filters of topic " + subscription.topic() + " are not serializable", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
