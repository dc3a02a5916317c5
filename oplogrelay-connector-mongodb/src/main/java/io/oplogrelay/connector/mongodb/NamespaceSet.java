/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A set of namespaces mixing literals and {@link WildcardPattern wildcard patterns}. Literal membership is a hash lookup,
 * while patterns are tested one after the other.
 * <p>
 * Instances are not safe for concurrent mutation; once populated they may be shared for reads.
 */
public final class NamespaceSet {

    /**
     * Create a set from the given namespaces, partitioned by whether they contain a wildcard.
     *
     * @param namespaces the literal namespaces and patterns; may be null
     * @return the new set; never null
     * @throws NamespaceMappingException if one of the patterns contains more than one wildcard
     */
    public static NamespaceSet of(Collection<String> namespaces) {
        NamespaceSet set = new NamespaceSet();
        if (namespaces != null) {
            namespaces.forEach(set::add);
        }
        return set;
    }

    private final Set<String> literals = new HashSet<>();
    private final Map<String, WildcardPattern> patterns = new LinkedHashMap<>();

    private NamespaceSet() {
    }

    /**
     * Whether the given namespace is one of the literals or is matched by one of the patterns.
     *
     * @param namespace the concrete namespace; may not be null
     * @return {@code true} if the namespace belongs to this set
     */
    public boolean contains(String namespace) {
        if (literals.contains(namespace)) {
            return true;
        }
        for (WildcardPattern pattern : patterns.values()) {
            if (pattern.matches(namespace)) {
                return true;
            }
        }
        return false;
    }

    public void add(String namespace) {
        if (WildcardPattern.isWildcard(namespace)) {
            patterns.computeIfAbsent(namespace, WildcardPattern::compile);
        }
        else {
            literals.add(namespace);
        }
    }

    /**
     * Remove the given literal or pattern, if present.
     *
     * @param namespace the literal namespace or pattern exactly as it was added; may not be null
     */
    public void discard(String namespace) {
        if (WildcardPattern.isWildcard(namespace)) {
            patterns.remove(namespace);
        }
        else {
            literals.remove(namespace);
        }
    }

    public boolean isEmpty() {
        return literals.isEmpty() && patterns.isEmpty();
    }

    public int size() {
        return literals.size() + patterns.size();
    }

    @Override
    public String toString() {
        Set<String> all = new HashSet<>(literals);
        all.addAll(patterns.keySet());
        return all.toString();
    }
}
