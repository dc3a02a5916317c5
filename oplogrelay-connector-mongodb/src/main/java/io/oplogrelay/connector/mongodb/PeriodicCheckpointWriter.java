/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.oplogrelay.annotation.GuardedBy;
import io.oplogrelay.annotation.ThreadSafe;
import io.oplogrelay.config.Configuration;
import io.oplogrelay.config.Field;
import io.oplogrelay.util.Threads;

/**
 * Saves a {@link CheckpointStore} on a background thread at a fixed delay, and once more when stopped. A failed periodic
 * save is logged and retried at the next interval.
 */
@ThreadSafe
public class PeriodicCheckpointWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PeriodicCheckpointWriter.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 10_000L;

    public static final Field FLUSH_INTERVAL_MS = Field.create("checkpoint.flush.interval.ms")
            .withDisplayName("Checkpoint flush interval (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(1000L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time in milliseconds between two saves of the checkpoint file. Defaults to 1 second (1000 ms).");

    public static PeriodicCheckpointWriter from(CheckpointStore store, Configuration config, String id) {
        return new PeriodicCheckpointWriter(store, Duration.ofMillis(config.getLong(FLUSH_INTERVAL_MS)), id);
    }

    private final CheckpointStore store;
    private final Duration interval;
    private final String id;

    @GuardedBy("this")
    private ScheduledExecutorService executor;

    /**
     * @param store the store to save; may not be null
     * @param interval the delay between the end of one save and the start of the next; must be positive
     * @param id the identifier used in the name of the writer thread; may not be null
     */
    public PeriodicCheckpointWriter(CheckpointStore store, Duration interval, String id) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("The checkpoint flush interval must be positive but was " + interval);
        }
        this.store = store;
        this.interval = interval;
        this.id = id;
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Threads.newSingleThreadScheduledExecutor(PeriodicCheckpointWriter.class, id, "checkpoint-writer", true);
        executor.scheduleWithFixedDelay(this::flush, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info("Saving checkpoints every {} ms", interval.toMillis());
    }

    private void flush() {
        try {
            store.save();
        }
        catch (RuntimeException e) {
            LOGGER.error("Failed to save checkpoints, retrying in {} ms", interval.toMillis(), e);
        }
    }

    /**
     * Stop the background saves and save the checkpoints one last time.
     *
     * @throws CheckpointStoreException if the final save failed and the previous checkpoints could not be restored
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Checkpoint writer did not stop within {} ms", SHUTDOWN_TIMEOUT_MS);
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        finally {
            executor = null;
        }
        store.save();
        LOGGER.info("Stopped saving checkpoints");
    }

    @Override
    public void close() {
        stop();
    }
}
