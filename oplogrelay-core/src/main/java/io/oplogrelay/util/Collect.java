/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A set of utilities for more easily creating various kinds of collections.
 */
public class Collect {

    /**
     * Create an unmodifiable set that keeps the iteration order of the supplied values. Null values are skipped.
     *
     * @param values the values; may be null
     * @return the unmodifiable set, or null if {@code values} is null
     */
    public static <T> Set<T> unmodifiableOrderedSet(Collection<T> values) {
        if (values == null) {
            return null;
        }
        Set<T> newSet = new LinkedHashSet<>();
        for (T value : values) {
            if (value != null) {
                newSet.add(value);
            }
        }
        return Collections.unmodifiableSet(newSet);
    }

    private Collect() {
    }
}
