/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import io.oplogrelay.annotation.Immutable;

/**
 * A simple identifier for a collection, i.e. a {@code <database>.<collection>} namespace.
 */
@Immutable
public final class CollectionId {

    /**
     * The collection name used by the synthetic namespace that carries database-level commands.
     */
    public static final String COMMAND_COLLECTION = "$cmd";

    /**
     * Get the database portion of a namespace, i.e. everything before the first period. A string without a period is
     * returned as is.
     *
     * @param namespace the namespace or namespace pattern; may not be null
     * @return the database name; never null
     */
    public static String databaseOf(String namespace) {
        final int dotPosition = namespace.indexOf('.');
        return dotPosition == -1 ? namespace : namespace.substring(0, dotPosition);
    }

    /**
     * Get the command namespace of the given database.
     *
     * @param dbName the database name; may not be null
     * @return the collection ID of {@code <dbName>.$cmd}; never null
     */
    public static CollectionId commandsOf(String dbName) {
        return new CollectionId(dbName, COMMAND_COLLECTION);
    }

    private final String dbName;
    private final String name;

    /**
     * Create a new collection identifier.
     *
     * @param dbName the name of the database; may not be null
     * @param collectionName the name of the collection; may not be null
     */
    public CollectionId(String dbName, String collectionName) {
        this.dbName = dbName;
        this.name = collectionName;
        assert this.dbName != null;
        assert this.name != null;
    }

    /**
     * Get the name of the collection.
     *
     * @return the collection's name; never null
     */
    public String name() {
        return name;
    }

    /**
     * Get the name of the database in which the collection exists.
     *
     * @return the database name; never null
     */
    public String dbName() {
        return dbName;
    }

    /**
     * Get the namespace of this collection, which is composed of the {@link #dbName database name} and {@link #name collection
     * name}.
     *
     * @return the namespace for this collection; never null
     */
    public String namespace() {
        return dbName + "." + name;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof CollectionId) {
            CollectionId that = (CollectionId) obj;
            return this.dbName.equals(that.dbName) && this.name.equals(that.name);
        }
        return false;
    }

    @Override
    public String toString() {
        return namespace();
    }
}
