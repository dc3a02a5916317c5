/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.Objects;
import java.util.Set;

import io.oplogrelay.annotation.Immutable;

/**
 * The target of a namespace mapping: the namespace that changes are written to, plus the {@link FieldScope fields} that
 * are replicated. Before a wildcard mapping is resolved against a concrete namespace, the name is itself a pattern.
 */
@Immutable
public final class MappedNamespace {

    /**
     * Create a mapping to the given namespace with no field restriction.
     *
     * @param name the target namespace; may not be null
     * @return the mapping; never null
     */
    public static MappedNamespace of(String name) {
        return new MappedNamespace(name, FieldScope.NONE);
    }

    private final String name;
    private final FieldScope fields;

    public MappedNamespace(String name, FieldScope fields) {
        this.name = Objects.requireNonNull(name, "The target namespace may not be null");
        this.fields = fields != null ? fields : FieldScope.NONE;
    }

    public String name() {
        return name;
    }

    /**
     * Get the fields replicated for this namespace, not including any global defaults.
     *
     * @return the field scope; never null but possibly {@link FieldScope#isEmpty() empty}
     */
    public FieldScope fields() {
        return fields;
    }

    public Set<String> includeFields() {
        return fields.includeFields();
    }

    public Set<String> excludeFields() {
        return fields.excludeFields();
    }

    /**
     * Create a copy of this mapping with the given target namespace and the same fields.
     *
     * @param name the new target namespace; may not be null
     * @return the new mapping; never null
     */
    public MappedNamespace withName(String name) {
        return new MappedNamespace(name, fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof MappedNamespace) {
            MappedNamespace that = (MappedNamespace) obj;
            return this.name.equals(that.name) && this.fields.equals(that.fields);
        }
        return false;
    }

    @Override
    public String toString() {
        return fields.isEmpty() ? name : name + " (" + fields + ")";
    }
}
