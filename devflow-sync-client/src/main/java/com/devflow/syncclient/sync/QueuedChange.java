package com.devflow.syncclient.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A local change waiting for the connection to come back.
 */
public record QueuedChange(String type, JsonNode data, Instant enqueuedAt) {
}
