/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.bson.BsonTimestamp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Handles the two formats older checkpoint files were written in. A file with a single checkpoint holds the bare
 * {@code [name, position]} pair rather than a list of pairs, and checkpoints used to be keyed by the string form of the
 * stream identifier rather than the stream name.
 */
final class CheckpointCompatibility {

    /**
     * Read the checkpoints from the parsed content of a checkpoint file.
     *
     * @param root the parsed file content; may not be null
     * @return the checkpoints in file order; never null
     * @throws IllegalArgumentException if the content is not a pair or a list of pairs
     */
    static Map<String, BsonTimestamp> readEntries(JsonNode root) {
        if (!root.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array but found " + root.getNodeType());
        }
        Map<String, BsonTimestamp> entries = new LinkedHashMap<>();
        if (root.size() == 2 && root.get(0).isTextual()) {
            readPair(root, entries);
            return entries;
        }
        for (JsonNode pair : root) {
            readPair(pair, entries);
        }
        return entries;
    }

    private static void readPair(JsonNode pair, Map<String, BsonTimestamp> entries) {
        if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isTextual() || !pair.get(1).isIntegralNumber()) {
            throw new IllegalArgumentException("Expected a [name, position] pair but found " + pair);
        }
        entries.put(pair.get(0).asText(), Timestamps.fromLong(pair.get(1).asLong()));
    }

    /**
     * Build the file content for the given checkpoints, using the single pair format when there is exactly one.
     *
     * @param checkpoints the non-empty checkpoints; may not be null
     * @return the JSON content; never null
     */
    static JsonNode writeEntries(Map<String, BsonTimestamp> checkpoints) {
        ArrayNode pairs = JsonNodeFactory.instance.arrayNode();
        checkpoints.forEach((name, position) -> pairs.addArray().add(name).add(Timestamps.toLong(position)));
        return pairs.size() == 1 ? pairs.get(0) : pairs;
    }

    /**
     * Remove the checkpoint recorded under the legacy key of the given stream.
     *
     * @param checkpoints the mutable checkpoints; may not be null
     * @param streamId the legacy stream identifier; may not be null
     */
    static void migrateLegacyKey(Map<String, BsonTimestamp> checkpoints, Object streamId) {
        checkpoints.remove(String.valueOf(streamId));
    }

    static Optional<BsonTimestamp> read(Map<String, BsonTimestamp> checkpoints, Object streamId, String name) {
        BsonTimestamp position = checkpoints.get(name);
        if (position == null) {
            position = checkpoints.get(String.valueOf(streamId));
        }
        return Optional.ofNullable(position);
    }

    private CheckpointCompatibility() {
    }
}
