package com.devflow.syncclient.sync;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Picks or merges the value to keep when a remote update collides with a
 * recent local change of the same record.
 */
@FunctionalInterface
public interface ConflictResolver {

    JsonNode resolve(JsonNode local, JsonNode remote);
}
