package com.devflow.syncclient.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * Wire message: {@code {"type": ..., "data": {...}}}.
 */
public record Envelope(String type, JsonNode data) {

    public Envelope {
        Objects.requireNonNull(type, "type");
        if (data == null || data.isNull() || data.isMissingNode()) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }

    public static Envelope of(MessageType type, JsonNode data) {
        return new Envelope(type.wireName(), data);
    }
}
