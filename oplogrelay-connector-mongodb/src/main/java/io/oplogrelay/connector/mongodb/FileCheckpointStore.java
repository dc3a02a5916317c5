/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.bson.BsonTimestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.oplogrelay.annotation.GuardedBy;
import io.oplogrelay.annotation.ThreadSafe;
import io.oplogrelay.config.Configuration;
import io.oplogrelay.config.Field;
import io.oplogrelay.util.Strings;

/**
 * A {@link CheckpointStore} that persists checkpoints to a JSON file holding a list of {@code [name, position]} pairs,
 * where the position is the 64-bit form of the oplog timestamp.
 * <p>
 * Each {@link #save()} first moves the existing file aside to {@code <file>.backup}, writes the new content, and then
 * removes the backup. If writing fails the backup is copied back. A backup left behind by a process that died during a
 * save is used by {@link #load()} when the file itself is missing or empty.
 * <p>
 * Without a file every operation except persistence works normally; {@link #load()} and {@link #save()} do nothing.
 */
@ThreadSafe
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileCheckpointStore.class);

    public static final String BACKUP_SUFFIX = ".backup";

    public static final Field CHECKPOINT_FILE = Field.create("checkpoint.file")
            .withDisplayName("Checkpoint file")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withDescription("The path of the file where the last replicated oplog position of each stream is stored. "
                    + "When not set, positions are not persisted.");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Create a store for the file named by {@link #CHECKPOINT_FILE}.
     *
     * @param config the configuration; may not be null
     * @return the store; never null
     */
    public static FileCheckpointStore from(Configuration config) {
        String file = config.getString(CHECKPOINT_FILE);
        return new FileCheckpointStore(Strings.isNullOrBlank(file) ? null : Paths.get(file.trim()));
    }

    private final Path file;
    private final Path backupFile;
    private final AtomicBoolean loaded = new AtomicBoolean();
    private final Object saveLock = new Object();

    @GuardedBy("this")
    private final Map<String, BsonTimestamp> checkpoints = new LinkedHashMap<>();

    /**
     * @param file the checkpoint file, or null if checkpoints are not to be persisted
     */
    public FileCheckpointStore(Path file) {
        this.file = file;
        this.backupFile = file == null ? null : file.resolveSibling(file.getFileName() + BACKUP_SUFFIX);
    }

    public Path file() {
        return file;
    }

    public Path backupFile() {
        return backupFile;
    }

    /**
     * {@inheritDoc}
     * <p>
     * A file that cannot be parsed is reported and otherwise ignored, so replication starts without checkpoints.
     *
     * @throws IllegalStateException if the checkpoints were already loaded
     */
    @Override
    public void load() {
        if (!loaded.compareAndSet(false, true)) {
            throw new IllegalStateException("Checkpoints have already been loaded");
        }
        if (file == null) {
            return;
        }
        Path source = file;
        if (isMissingOrEmpty(file)) {
            if (isMissingOrEmpty(backupFile)) {
                LOGGER.info("No checkpoints found in '{}', replication will start without them", file);
                return;
            }
            LOGGER.warn("Checkpoint file '{}' is missing or empty, recovering checkpoints from '{}' left by an interrupted save",
                    file, backupFile);
            source = backupFile;
        }
        Map<String, BsonTimestamp> restored;
        try {
            JsonNode root = MAPPER.readTree(source.toFile());
            restored = CheckpointCompatibility.readEntries(root);
        }
        catch (IOException | IllegalArgumentException e) {
            LOGGER.error("Cannot read checkpoint file '{}'. It may be corrupt after an unclean shutdown. "
                    + "Recover it from '{}' if that file exists, or remove it to start replicating from the current oplog position",
                    source, backupFile, e);
            return;
        }
        synchronized (this) {
            checkpoints.putAll(restored);
        }
        LOGGER.info("Loaded {} checkpoint(s) from '{}'", restored.size(), source);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Saves are serialized with each other but never hold the monitor of the checkpoints during file I/O.
     */
    @Override
    public void save() {
        if (file == null) {
            return;
        }
        synchronized (saveLock) {
            saveSnapshot(checkpoints());
        }
    }

    @GuardedBy("saveLock")
    private void saveSnapshot(Map<String, BsonTimestamp> snapshot) {
        if (snapshot.isEmpty()) {
            return;
        }
        byte[] content;
        try {
            content = MAPPER.writeValueAsBytes(CheckpointCompatibility.writeEntries(snapshot));
        }
        catch (JsonProcessingException e) {
            throw new CheckpointStoreException("Unable to serialize checkpoints " + snapshot, e);
        }
        boolean backedUp = false;
        try {
            if (isMissingOrEmpty(file) && !isMissingOrEmpty(backupFile)) {
                // the backup left by an interrupted save is the only good copy
                backedUp = true;
            }
            else if (Files.exists(file)) {
                Files.move(file, backupFile, StandardCopyOption.REPLACE_EXISTING);
                backedUp = true;
            }
        }
        catch (IOException e) {
            throw new CheckpointStoreException("Unable to move checkpoint file '" + file + "' to '" + backupFile + "'", e);
        }
        try {
            writeCheckpointFile(file, content);
        }
        catch (IOException e) {
            LOGGER.error("Unable to write checkpoint file '{}', restoring the previous checkpoints", file, e);
            restore(backedUp);
            return;
        }
        deleteBackup();
        LOGGER.debug("Saved {} checkpoint(s) to '{}'", snapshot.size(), file);
    }

    /**
     * Write the content of the checkpoint file.
     *
     * @param target the checkpoint file; never null
     * @param content the content to write; never null
     * @throws IOException if the file could not be written
     */
    protected void writeCheckpointFile(Path target, byte[] content) throws IOException {
        Files.write(target, content);
    }

    private void restore(boolean backedUp) {
        try {
            if (backedUp) {
                Files.copy(backupFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
            else {
                Files.deleteIfExists(file);
            }
        }
        catch (IOException e) {
            throw new CheckpointStoreException("Unable to restore checkpoint file '" + file + "' from '" + backupFile + "'", e);
        }
        deleteBackup();
    }

    private void deleteBackup() {
        try {
            Files.deleteIfExists(backupFile);
        }
        catch (IOException e) {
            LOGGER.warn("Unable to remove checkpoint backup file '{}'", backupFile, e);
        }
    }

    private static boolean isMissingOrEmpty(Path path) {
        try {
            return !Files.exists(path) || Files.size(path) == 0L;
        }
        catch (IOException e) {
            LOGGER.warn("Unable to read the size of '{}', treating it as missing", path, e);
            return true;
        }
    }

    @Override
    public void updateCheckpoint(Object streamId, String name, BsonTimestamp position) {
        if (Timestamps.isUnset(position)) {
            LOGGER.debug("Ignoring unset position for stream '{}'", name);
            return;
        }
        synchronized (this) {
            CheckpointCompatibility.migrateLegacyKey(checkpoints, streamId);
            checkpoints.put(name, position);
        }
        LOGGER.debug("Checkpoint of stream '{}' is now {}", name, position);
    }

    @Override
    public synchronized Optional<BsonTimestamp> readCheckpoint(Object streamId, String name) {
        return CheckpointCompatibility.read(checkpoints, streamId, name);
    }

    @Override
    public synchronized Map<String, BsonTimestamp> checkpoints() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(checkpoints));
    }

    @Override
    public String toString() {
        return "FileCheckpointStore [" + file + "]";
    }
}
