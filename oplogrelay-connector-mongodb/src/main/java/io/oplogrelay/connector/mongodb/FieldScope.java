/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.oplogrelay.annotation.Immutable;
import io.oplogrelay.util.Collect;

/**
 * The fields of a document that are replicated: either an include list or an exclude list of field paths, never both.
 * <p>
 * The document key {@value #DOCUMENT_KEY} is always replicated, so it is added to every include list and dropped from
 * every exclude list.
 */
@Immutable
public final class FieldScope {

    private static final Logger LOGGER = LoggerFactory.getLogger(FieldScope.class);

    public static final String DOCUMENT_KEY = "_id";

    /**
     * The scope that places no restriction on the replicated fields.
     */
    public static final FieldScope NONE = new FieldScope(null, null);

    /**
     * Create a scope from the given include and exclude lists. A null or empty list is treated as absent.
     *
     * @param includeFields the field paths to replicate; may be null
     * @param excludeFields the field paths not to replicate; may be null
     * @return the scope; never null
     * @throws NamespaceMappingException if both lists are given
     */
    public static FieldScope of(Collection<String> includeFields, Collection<String> excludeFields) {
        boolean including = includeFields != null && !includeFields.isEmpty();
        boolean excluding = excludeFields != null && !excludeFields.isEmpty();
        if (including && excluding) {
            throw new NamespaceMappingException("Cannot define both include fields " + includeFields + " and exclude fields " + excludeFields);
        }
        if (including) {
            Set<String> fields = new LinkedHashSet<>();
            fields.add(DOCUMENT_KEY);
            fields.addAll(includeFields);
            return new FieldScope(Collect.unmodifiableOrderedSet(fields), null);
        }
        if (excluding) {
            Set<String> fields = new LinkedHashSet<>(excludeFields);
            if (fields.remove(DOCUMENT_KEY)) {
                LOGGER.warn("Field '{}' is always replicated and has been removed from the exclude fields", DOCUMENT_KEY);
            }
            return fields.isEmpty() ? NONE : new FieldScope(null, Collect.unmodifiableOrderedSet(fields));
        }
        return NONE;
    }

    private final Set<String> includeFields;
    private final Set<String> excludeFields;

    private FieldScope(Set<String> includeFields, Set<String> excludeFields) {
        this.includeFields = includeFields;
        this.excludeFields = excludeFields;
    }

    /**
     * Get the field paths to replicate.
     *
     * @return the unmodifiable include list, or null if this scope does not use one
     */
    public Set<String> includeFields() {
        return includeFields;
    }

    /**
     * Get the field paths not to replicate.
     *
     * @return the unmodifiable exclude list, or null if this scope does not use one
     */
    public Set<String> excludeFields() {
        return excludeFields;
    }

    public boolean hasIncludeFields() {
        return includeFields != null;
    }

    public boolean hasExcludeFields() {
        return excludeFields != null;
    }

    public boolean isEmpty() {
        return includeFields == null && excludeFields == null;
    }

    /**
     * Build the projection that applies this scope on top of a caller-supplied projection. Keys of the caller's projection
     * take precedence over the fields of this scope.
     *
     * @param projection the caller's projection; may be null
     * @return the combined projection, or the caller's projection if this scope is {@link #isEmpty() empty}
     */
    public Document applyTo(Document projection) {
        if (isEmpty()) {
            return projection;
        }
        Document result = new Document();
        if (includeFields != null) {
            includeFields.forEach(field -> result.put(field, 1));
        }
        else {
            excludeFields.forEach(field -> result.put(field, 0));
        }
        if (projection != null) {
            result.putAll(projection);
        }
        return result;
    }

    @Override
    public int hashCode() {
        return Objects.hash(includeFields, excludeFields);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof FieldScope) {
            FieldScope that = (FieldScope) obj;
            return Objects.equals(this.includeFields, that.includeFields)
                    && Objects.equals(this.excludeFields, that.excludeFields);
        }
        return false;
    }

    @Override
    public String toString() {
        if (includeFields != null) {
            return "include " + includeFields;
        }
        if (excludeFields != null) {
            return "exclude " + excludeFields;
        }
        return "all fields";
    }
}
