/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.oplogrelay.annotation.GuardedBy;
import io.oplogrelay.annotation.ThreadSafe;
import io.oplogrelay.config.Configuration;

/**
 * Decides, for every source namespace seen in the oplog, whether it is replicated, which target namespace it is written
 * to, and which fields are kept. The mapper is built from include and exclude lists of namespaces (literals or
 * {@link WildcardPattern patterns}), explicit renames with optional per-namespace fields, and global field defaults.
 * <p>
 * Concrete namespaces resolved through a wildcard mapping are remembered, so later lookups of the same namespace are plain
 * hash lookups and {@link #unmap(String)} can invert them. Every mapping must be injective: resolving two different source
 * namespaces to the same target namespace fails with a {@link NamespaceMappingException}.
 * <p>
 * Each mapping of a collection also registers the mapping of the database's command namespace ({@code db.$cmd}), so that
 * database-level operations can be routed to the target database.
 *
 * @see NamespaceMapperConfig
 */
@ThreadSafe
public final class NamespaceMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(NamespaceMapper.class);

    /**
     * Create a builder for a mapper.
     *
     * @return the builder; never null
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a mapper from the {@link NamespaceMapperConfig namespace mapping fields} of the given configuration.
     *
     * @param config the configuration; may not be null
     * @return the mapper; never null
     * @throws NamespaceMappingException if the configuration is not valid
     */
    public static NamespaceMapper from(Configuration config) {
        return new NamespaceMapperConfig(config).createMapper();
    }

    /**
     * A mapping whose source namespace is a wildcard pattern.
     */
    private static final class WildcardMapping {
        private final WildcardPattern source;
        private final WildcardPattern target;
        private final MappedNamespace mapped;

        private WildcardMapping(WildcardPattern source, MappedNamespace mapped) {
            this.source = source;
            this.target = WildcardPattern.compile(mapped.name());
            this.mapped = mapped;
        }
    }

    private final NamespaceSet excluded;
    private final FieldScope defaultFields;
    private final boolean passthrough;

    @GuardedBy("this")
    private final Map<String, MappedNamespace> plain = new HashMap<>();
    @GuardedBy("this")
    private final Map<String, String> reversePlain = new HashMap<>();
    @GuardedBy("this")
    private final Map<String, WildcardMapping> wildcards = new LinkedHashMap<>();
    @GuardedBy("this")
    private final Map<String, Set<String>> databaseFanout = new HashMap<>();

    private NamespaceMapper(Builder builder) {
        if (!builder.includedNamespaces.isEmpty() && !builder.excludedNamespaces.isEmpty()) {
            throw new NamespaceMappingException("Cannot define both an include list " + builder.includedNamespaces
                    + " and an exclude list " + builder.excludedNamespaces + " of namespaces");
        }
        this.excluded = NamespaceSet.of(builder.excludedNamespaces);
        this.defaultFields = FieldScope.of(builder.includeFields, builder.excludeFields);

        Map<String, Rule> rules = new LinkedHashMap<>(builder.rules);
        builder.includedNamespaces.forEach(namespace -> rules.putIfAbsent(namespace, new Rule(null, null, null)));
        rules.forEach(this::register);
        synchronized (this) {
            this.passthrough = plain.isEmpty() && wildcards.isEmpty();
            LOGGER.debug("Created namespace mapper with {} plain and {} wildcard mappings, excluding {}", plain.size(), wildcards.size(),
                    excluded);
        }
    }

    private void register(String source, Rule rule) {
        if (defaultFields.hasExcludeFields() && rule.includeFields != null && !rule.includeFields.isEmpty()) {
            throw new NamespaceMappingException("Cannot define include fields for namespace '" + source
                    + "' when exclude fields " + defaultFields.excludeFields() + " are defined for all namespaces");
        }
        if (defaultFields.hasIncludeFields() && rule.excludeFields != null && !rule.excludeFields.isEmpty()) {
            throw new NamespaceMappingException("Cannot define exclude fields for namespace '" + source
                    + "' when include fields " + defaultFields.includeFields() + " are defined for all namespaces");
        }
        String target = rule.rename != null ? rule.rename : source;
        if (WildcardPattern.isWildcard(target) && !WildcardPattern.isWildcard(source)) {
            throw new NamespaceMappingException("Namespace '" + source + "' cannot be renamed to the pattern '" + target + "'");
        }
        FieldScope fields = FieldScope.of(rule.includeFields, rule.excludeFields);
        add(source, new MappedNamespace(target, fields));
        add(CollectionId.commandsOf(CollectionId.databaseOf(source)).namespace(),
                MappedNamespace.of(CollectionId.commandsOf(CollectionId.databaseOf(target)).namespace()));
    }

    private synchronized void add(String source, MappedNamespace mapped) {
        if (WildcardPattern.isWildcard(source)) {
            wildcards.put(source, new WildcardMapping(WildcardPattern.compile(source), mapped));
        }
        else {
            addPlain(source, mapped);
        }
    }

    @GuardedBy("this")
    private void addPlain(String source, MappedNamespace mapped) {
        String target = mapped.name();
        String existingSource = reversePlain.get(target);
        if (existingSource != null && !existingSource.equals(source)) {
            throw new NamespaceMappingException("Source namespaces '" + existingSource + "' and '" + source
                    + "' cannot both be mapped to '" + target + "'");
        }
        MappedNamespace previous = plain.put(source, mapped);
        if (previous != null && !previous.name().equals(target)) {
            reversePlain.remove(previous.name(), source);
        }
        reversePlain.put(target, source);
        databaseFanout.computeIfAbsent(CollectionId.databaseOf(source), db -> new LinkedHashSet<>())
                .add(CollectionId.databaseOf(target));
    }

    /**
     * Whether changes in the given source namespace are replicated.
     *
     * @param sourceNamespace the concrete source namespace; may not be null
     * @return {@code true} if the namespace {@link #resolve(String) resolves} to a target
     * @throws NamespaceMappingException if resolving the namespace would break injectivity
     */
    public boolean isIncluded(String sourceNamespace) {
        return resolve(sourceNamespace).isPresent();
    }

    /**
     * Find where changes in the given source namespace are written, remembering the result if it came from a wildcard
     * mapping. Excluded namespaces never resolve; when no include list or mapping was configured every other namespace
     * maps to itself.
     *
     * @param sourceNamespace the concrete source namespace; may not be null
     * @return the mapping, or {@link Optional#empty()} if the namespace is not replicated
     * @throws NamespaceMappingException if the namespace matches a wildcard mapping whose result is already the target of
     *             another source namespace
     */
    public Optional<MappedNamespace> resolve(String sourceNamespace) {
        if (excluded.contains(sourceNamespace)) {
            return Optional.empty();
        }
        if (passthrough) {
            return Optional.of(MappedNamespace.of(sourceNamespace));
        }
        synchronized (this) {
            MappedNamespace existing = plain.get(sourceNamespace);
            if (existing != null) {
                return Optional.of(existing);
            }
            for (WildcardMapping mapping : wildcards.values()) {
                Optional<String> captured = mapping.source.match(sourceNamespace);
                if (captured.isPresent()) {
                    MappedNamespace learned = mapping.mapped.withName(WildcardPattern.substitute(mapping.mapped.name(), captured.get()));
                    addPlain(sourceNamespace, learned);
                    LOGGER.debug("Mapped namespace '{}' to '{}' using pattern '{}'", sourceNamespace, learned.name(), mapping.source);
                    return Optional.of(learned);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Get the target namespace for the given source namespace.
     *
     * @param sourceNamespace the concrete source namespace; may not be null
     * @return the target namespace, or {@link Optional#empty()} if the namespace is not replicated
     */
    public Optional<String> mapNamespace(String sourceNamespace) {
        return resolve(sourceNamespace).map(MappedNamespace::name);
    }

    /**
     * Get the target databases that collections of the given source database are written to.
     *
     * @param sourceDatabase the source database name; may not be null
     * @return the unmodifiable set of target database names; never null but possibly empty
     */
    public Set<String> mapDatabase(String sourceDatabase) {
        if (passthrough) {
            return Collections.singleton(sourceDatabase);
        }
        resolve(CollectionId.commandsOf(sourceDatabase).namespace());
        synchronized (this) {
            Set<String> targets = databaseFanout.get(sourceDatabase);
            return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(targets));
        }
    }

    /**
     * Find the source namespace that is written to the given target namespace. This never records new mappings.
     *
     * @param targetNamespace the concrete target namespace; may not be null
     * @return the source namespace, or {@link Optional#empty()} if no mapping produces the target
     */
    public Optional<String> unmap(String targetNamespace) {
        if (passthrough) {
            return Optional.of(targetNamespace);
        }
        synchronized (this) {
            String source = reversePlain.get(targetNamespace);
            if (source != null) {
                return Optional.of(source);
            }
            for (WildcardMapping mapping : wildcards.values()) {
                if (mapping.target.isLiteral()) {
                    continue;
                }
                Optional<String> captured = mapping.target.match(targetNamespace);
                if (captured.isPresent()) {
                    return Optional.of(WildcardPattern.substitute(mapping.source.namespace(), captured.get()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Get the fields replicated for the given source namespace, falling back to the global defaults when the namespace
     * has no fields of its own.
     *
     * @param sourceNamespace the concrete source namespace; may not be null
     * @return the field scope; never null, and {@link FieldScope#NONE} if the namespace is not replicated
     */
    public FieldScope fields(String sourceNamespace) {
        return resolve(sourceNamespace).map(this::fieldsOf).orElse(FieldScope.NONE);
    }

    /**
     * Build the projection used when reading documents of the given source namespace.
     *
     * @param sourceNamespace the concrete source namespace; may not be null
     * @param projection the caller's projection, whose keys win over the replicated fields; may be null
     * @return the projection, or null if the namespace is not replicated or neither fields nor a projection apply
     */
    public Document projection(String sourceNamespace, Document projection) {
        return resolve(sourceNamespace).map(mapped -> fieldsOf(mapped).applyTo(projection)).orElse(null);
    }

    /**
     * Get the fields that apply to namespaces without fields of their own.
     *
     * @return the default field scope; never null
     */
    public FieldScope defaultFields() {
        return defaultFields;
    }

    private FieldScope fieldsOf(MappedNamespace mapped) {
        return mapped.fields().isEmpty() ? defaultFields : mapped.fields();
    }

    @Override
    public synchronized String toString() {
        return "NamespaceMapper [plain=" + plain + ", wildcards=" + wildcards.keySet() + ", excluded=" + excluded + ", fields="
                + defaultFields + "]";
    }

    private static final class Rule {
        private final String rename;
        private final Collection<String> includeFields;
        private final Collection<String> excludeFields;

        private Rule(String rename, Collection<String> includeFields, Collection<String> excludeFields) {
            this.rename = rename;
            this.includeFields = includeFields;
            this.excludeFields = excludeFields;
        }
    }

    /**
     * A builder of {@link NamespaceMapper} instances. Mappings are tried in the order they are added.
     */
    public static final class Builder {

        private final Set<String> includedNamespaces = new LinkedHashSet<>();
        private final Set<String> excludedNamespaces = new LinkedHashSet<>();
        private final Map<String, Rule> rules = new LinkedHashMap<>();
        private Collection<String> includeFields;
        private Collection<String> excludeFields;

        private Builder() {
        }

        /**
         * Replicate only the given namespaces, in addition to those with an explicit mapping.
         *
         * @param namespaces literal namespaces or wildcard patterns; may be null
         * @return this builder so that methods can be chained together; never null
         */
        public Builder includeNamespaces(Collection<String> namespaces) {
            if (namespaces != null) {
                includedNamespaces.addAll(namespaces);
            }
            return this;
        }

        /**
         * Replicate every namespace except the given ones.
         *
         * @param namespaces literal namespaces or wildcard patterns; may be null
         * @return this builder so that methods can be chained together; never null
         */
        public Builder excludeNamespaces(Collection<String> namespaces) {
            if (namespaces != null) {
                excludedNamespaces.addAll(namespaces);
            }
            return this;
        }

        public Builder rename(String source, String target) {
            return map(source, target, null, null);
        }

        /**
         * Add a mapping for the given source namespace or pattern.
         *
         * @param source the source namespace or pattern; may not be null
         * @param target the target namespace or pattern, or null to keep the source name
         * @param includeFields the fields replicated for this namespace; may be null
         * @param excludeFields the fields not replicated for this namespace; may be null
         * @return this builder so that methods can be chained together; never null
         */
        public Builder map(String source, String target, Collection<String> includeFields, Collection<String> excludeFields) {
            rules.put(source, new Rule(target, includeFields, excludeFields));
            return this;
        }

        public Builder includeFields(Collection<String> fields) {
            this.includeFields = fields;
            return this;
        }

        public Builder excludeFields(Collection<String> fields) {
            this.excludeFields = fields;
            return this;
        }

        /**
         * Build the mapper.
         *
         * @return the mapper; never null
         * @throws NamespaceMappingException if the namespaces, patterns, or fields are inconsistent
         */
        public NamespaceMapper build() {
            return new NamespaceMapper(this);
        }
    }
}
