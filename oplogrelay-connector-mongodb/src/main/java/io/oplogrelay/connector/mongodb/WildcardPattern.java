/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.oplogrelay.annotation.Immutable;
import io.oplogrelay.util.Strings;

/**
 * A namespace that contains at most one {@value #WILDCARD} character, compiled into an anchored regular expression with a
 * single capturing group in place of the wildcard.
 * <p>
 * A wildcard that appears within the database segment (before the first period) never matches a period, since database
 * names cannot contain one. Anywhere else the wildcard matches any sequence of characters, periods included. The captured
 * text can be {@link #substitute(String, String) substituted} into another namespace pattern, which is how {@code db_*.foo}
 * mapped to {@code db_new_*.foo} turns {@code db_123.foo} into {@code db_new_123.foo}.
 */
@Immutable
public final class WildcardPattern {

    public static final char WILDCARD = '*';

    private static final String DATABASE_GROUP = "([^.]*)";
    private static final String ANY_GROUP = "(.*)";

    /**
     * Whether the given namespace contains a wildcard.
     *
     * @param namespace the namespace; may not be null
     * @return {@code true} if the namespace contains {@value #WILDCARD}
     */
    public static boolean isWildcard(String namespace) {
        return namespace.indexOf(WILDCARD) >= 0;
    }

    /**
     * Compile the given namespace.
     *
     * @param namespace the namespace, with zero or one wildcard; may not be null
     * @return the compiled pattern; never null
     * @throws NamespaceMappingException if the namespace contains more than one wildcard
     */
    public static WildcardPattern compile(String namespace) {
        int wildcards = Strings.count(namespace, WILDCARD);
        if (wildcards > 1) {
            throw new NamespaceMappingException("Namespace '" + namespace + "' may contain at most one '" + WILDCARD + "' wildcard");
        }
        if (wildcards == 0) {
            return new WildcardPattern(namespace, null);
        }
        int wildcardPosition = namespace.indexOf(WILDCARD);
        String group = wildcardPosition < namespace.indexOf('.') ? DATABASE_GROUP : ANY_GROUP;
        String regex = Pattern.quote(namespace.substring(0, wildcardPosition))
                + group
                + Pattern.quote(namespace.substring(wildcardPosition + 1));
        return new WildcardPattern(namespace, Pattern.compile(regex, Pattern.DOTALL));
    }

    /**
     * Replace the wildcard in the given namespace pattern with the supplied text.
     *
     * @param template the namespace pattern; may not be null
     * @param captured the text matched by a wildcard; may not be null
     * @return the resulting namespace; never null
     */
    public static String substitute(String template, String captured) {
        return template.replace(String.valueOf(WILDCARD), captured);
    }

    private final String namespace;
    private final Pattern pattern;

    private WildcardPattern(String namespace, Pattern pattern) {
        this.namespace = namespace;
        this.pattern = pattern;
    }

    /**
     * Get the namespace this pattern was compiled from.
     *
     * @return the namespace; never null
     */
    public String namespace() {
        return namespace;
    }

    /**
     * Whether this pattern was compiled from a namespace without a wildcard.
     *
     * @return {@code true} if this pattern only matches its own namespace
     */
    public boolean isLiteral() {
        return pattern == null;
    }

    /**
     * Whether this pattern matches the whole of the given namespace.
     *
     * @param candidate the namespace to test; may not be null
     * @return {@code true} if it matches
     */
    public boolean matches(String candidate) {
        return match(candidate).isPresent();
    }

    /**
     * Match the given namespace against this pattern.
     *
     * @param candidate the namespace to test; may not be null
     * @return the text captured by the wildcard, empty for a literal match, or {@link Optional#empty()} if there is no match
     */
    public Optional<String> match(String candidate) {
        if (pattern == null) {
            return namespace.equals(candidate) ? Optional.of("") : Optional.empty();
        }
        Matcher matcher = pattern.matcher(candidate);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Match the given namespace and substitute the captured text into another namespace pattern.
     *
     * @param candidate the namespace to test; may not be null
     * @param template the namespace pattern receiving the captured text; may not be null
     * @return the translated namespace, or {@link Optional#empty()} if the candidate does not match
     */
    public Optional<String> translate(String candidate, String template) {
        return match(candidate).map(captured -> substitute(template, captured));
    }

    @Override
    public int hashCode() {
        return namespace.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof WildcardPattern) {
            return namespace.equals(((WildcardPattern) obj).namespace);
        }
        return false;
    }

    @Override
    public String toString() {
        return namespace;
    }
}
