/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

import io.oplogrelay.annotation.ThreadSafe;

/**
 * String-related utility methods.
 */
@ThreadSafe
public final class Strings {

    /**
     * Generate the list of values that are included in the delimited input, with each element trimmed. Blank elements
     * are skipped.
     *
     * @param input the input string; may be null
     * @param delimiter the character used to delimit the items in the input
     * @param factory the factory for creating items from the trimmed strings; may not be null, and may return null for
     *            items that are to be skipped
     * @return the list of objects included in the input; never null
     */
    public static <T> List<T> listOfTrimmed(String input, char delimiter, Function<String, T> factory) {
        if (input == null) {
            return Collections.emptyList();
        }
        List<T> matches = new ArrayList<>();
        for (String item : input.split(Pattern.quote(String.valueOf(delimiter)))) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            T obj = factory.apply(trimmed);
            if (obj != null) {
                matches.add(obj);
            }
        }
        return matches;
    }

    /**
     * Returns a new String composed of the supplied values joined together with a copy of the specified {@code delimiter}.
     * All {@code null} values are simply ignored.
     *
     * @param delimiter the delimiter that separates each element
     * @param values the values to join together
     * @return a new {@code String} that is composed of the {@code values} separated by the {@code delimiter}
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values) {
        Objects.requireNonNull(delimiter);
        Objects.requireNonNull(values);
        StringBuilder sb = new StringBuilder();
        Iterator<T> iter = values.iterator();
        boolean delimit = false;
        while (iter.hasNext()) {
            T next = iter.next();
            if (next != null) {
                if (delimit) {
                    sb.append(delimiter);
                }
                sb.append(next);
                delimit = true;
            }
        }
        return sb.toString();
    }

    /**
     * Count the occurrences of the given character.
     *
     * @param str the string to examine; may not be null
     * @param ch the character to count
     * @return the number of occurrences
     */
    public static int count(String str, char ch) {
        int count = 0;
        for (int i = 0; i != str.length(); ++i) {
            if (str.charAt(i) == ch) {
                ++count;
            }
        }
        return count;
    }

    /**
     * Check if the string is blank (i.e. it's blank or only contains whitespace characters) or null.
     *
     * @param str the string to check
     * @return {@code true} if the string is blank or null
     */
    public static boolean isNullOrBlank(String str) {
        return str == null || str.trim().isEmpty();
    }

    private Strings() {
    }
}
