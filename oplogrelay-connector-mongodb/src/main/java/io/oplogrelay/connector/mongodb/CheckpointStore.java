/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.Map;
import java.util.Optional;

import org.bson.BsonTimestamp;

/**
 * Tracks the last oplog position applied for each replication stream, so that replication can resume where it left off.
 * Implementations must be safe for concurrent use by the stream workers and the {@link PeriodicCheckpointWriter}.
 */
public interface CheckpointStore {

    /**
     * Populate the checkpoints from durable storage. This may be called only once, before any other method.
     */
    void load();

    /**
     * Durably persist a snapshot of the current checkpoints.
     *
     * @throws CheckpointStoreException if persisting failed and the previously persisted checkpoints could not be restored
     */
    void save();

    /**
     * Record the latest position of a stream. Unset positions are ignored.
     *
     * @param streamId the legacy identifier of the stream, whose string form keyed checkpoints in older files; may not be null
     * @param name the name of the stream; may not be null
     * @param position the position; may be null
     */
    void updateCheckpoint(Object streamId, String name, BsonTimestamp position);

    /**
     * Read the latest position of a stream, falling back to the legacy key of the stream.
     *
     * @param streamId the legacy identifier of the stream; may not be null
     * @param name the name of the stream; may not be null
     * @return the position, or {@link Optional#empty()} if none was recorded
     */
    Optional<BsonTimestamp> readCheckpoint(Object streamId, String name);

    /**
     * Get a snapshot of all recorded checkpoints.
     *
     * @return the unmodifiable map of positions keyed by stream name; never null
     */
    Map<String, BsonTimestamp> checkpoints();
}
