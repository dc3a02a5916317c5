/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.oplogrelay.config.Configuration;
import io.oplogrelay.config.Field;
import io.oplogrelay.config.Field.ValidationOutput;
import io.oplogrelay.util.Strings;

/**
 * The configuration properties that define a {@link NamespaceMapper}.
 */
public class NamespaceMapperConfig {

    protected static final String NAMESPACE_INCLUDE_LIST_ALREADY_SPECIFIED_ERROR_MSG = "Namespace include list is already specified.";
    protected static final String FIELD_INCLUDE_LIST_ALREADY_SPECIFIED_ERROR_MSG = "Field include list is already specified.";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * A comma-separated list of namespaces or wildcard patterns of the form {@code <databaseName>.<collectionName>} whose
     * changes are replicated. Must not be used with {@link #NAMESPACE_EXCLUDE_LIST}.
     */
    public static final Field NAMESPACE_INCLUDE_LIST = Field.create("namespace.include.list")
            .withDisplayName("Include namespaces")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withValidation(NamespaceMapperConfig::validateNamespaces)
            .withDescription("A comma-separated list of namespaces, optionally containing a single '*' wildcard, for which changes are to be replicated");

    /**
     * A comma-separated list of namespaces or wildcard patterns whose changes are not replicated. Must not be used with
     * {@link #NAMESPACE_INCLUDE_LIST}.
     */
    public static final Field NAMESPACE_EXCLUDE_LIST = Field.create("namespace.exclude.list")
            .withDisplayName("Exclude namespaces")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withValidation(NamespaceMapperConfig::validateNamespaces, NamespaceMapperConfig::validateNamespaceExcludeList)
            .withDescription("A comma-separated list of namespaces, optionally containing a single '*' wildcard, for which changes are to be excluded");

    /**
     * A JSON object keyed by source namespace or pattern. Each value is either the target namespace, or an object with an
     * optional {@code rename} target and either {@code fields} or {@code excludeFields}.
     */
    public static final Field NAMESPACE_MAPPING = Field.create("namespace.mapping")
            .withDisplayName("Namespace mapping")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withValidation(NamespaceMapperConfig::validateMapping)
            .withDescription("A JSON object mapping source namespaces or patterns to either a target namespace, or an object with "
                    + "'rename', 'fields' and 'excludeFields' properties");

    public static final Field FIELD_INCLUDE_LIST = Field.create("field.include.list")
            .withDisplayName("Include fields")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withDescription("A comma-separated list of the field paths replicated for namespaces that do not define their own fields");

    public static final Field FIELD_EXCLUDE_LIST = Field.create("field.exclude.list")
            .withDisplayName("Exclude fields")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withValidation(NamespaceMapperConfig::validateFieldExcludeList)
            .withDescription("A comma-separated list of the field paths not replicated for namespaces that do not define their own fields");

    public static final Field.Set ALL_FIELDS = Field.setOf(NAMESPACE_INCLUDE_LIST, NAMESPACE_EXCLUDE_LIST, NAMESPACE_MAPPING,
            FIELD_INCLUDE_LIST, FIELD_EXCLUDE_LIST);

    public static ConfigDef configDef() {
        ConfigDef config = new ConfigDef();
        Field.group(config, "Namespaces", NAMESPACE_INCLUDE_LIST, NAMESPACE_EXCLUDE_LIST, NAMESPACE_MAPPING);
        Field.group(config, "Fields", FIELD_INCLUDE_LIST, FIELD_EXCLUDE_LIST);
        return config;
    }

    private final Configuration config;

    public NamespaceMapperConfig(Configuration config) {
        this.config = config;
    }

    /**
     * Validate the configuration and build the mapper it describes.
     *
     * @return the mapper; never null
     * @throws NamespaceMappingException if the configuration is not valid
     */
    public NamespaceMapper createMapper() {
        List<String> problems = new ArrayList<>();
        if (!config.validateAndRecord(ALL_FIELDS, problems::add)) {
            throw new NamespaceMappingException("Invalid namespace mapping configuration: " + Strings.join("; ", problems));
        }
        NamespaceMapper.Builder builder = NamespaceMapper.builder()
                .includeNamespaces(config.getList(NAMESPACE_INCLUDE_LIST))
                .excludeNamespaces(config.getList(NAMESPACE_EXCLUDE_LIST))
                .includeFields(config.getList(FIELD_INCLUDE_LIST))
                .excludeFields(config.getList(FIELD_EXCLUDE_LIST));
        String mapping = config.getString(NAMESPACE_MAPPING);
        if (mapping != null) {
            applyMapping(mapping, builder);
        }
        return builder.build();
    }

    /**
     * Parse the JSON mapping document and add each of its mappings to the builder.
     *
     * @param json the JSON object; may not be null
     * @param builder the builder receiving the mappings; may not be null
     * @throws NamespaceMappingException if the document is not a JSON object of valid mappings
     */
    protected static void applyMapping(String json, NamespaceMapper.Builder builder) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        }
        catch (JsonProcessingException e) {
            throw new NamespaceMappingException(NAMESPACE_MAPPING.name(), json, "Not a valid JSON document: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new NamespaceMappingException(NAMESPACE_MAPPING.name(), json, "A JSON object is expected");
        }
        Iterator<Map.Entry<String, JsonNode>> mappings = root.fields();
        while (mappings.hasNext()) {
            Map.Entry<String, JsonNode> mapping = mappings.next();
            String source = mapping.getKey();
            JsonNode target = mapping.getValue();
            if (target.isTextual()) {
                builder.rename(source, target.asText());
            }
            else if (target.isObject()) {
                JsonNode rename = target.get("rename");
                if (rename != null && !rename.isTextual()) {
                    throw new NamespaceMappingException("The 'rename' of namespace '" + source + "' must be a string");
                }
                builder.map(source, rename != null ? rename.asText() : null, textValues(source, target, "fields"),
                        textValues(source, target, "excludeFields"));
            }
            else {
                throw new NamespaceMappingException("The mapping of namespace '" + source + "' must be a string or an object");
            }
        }
    }

    private static List<String> textValues(String source, JsonNode target, String property) {
        JsonNode node = target.get(property);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new NamespaceMappingException("The '" + property + "' of namespace '" + source + "' must be an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : node) {
            if (!value.isTextual()) {
                throw new NamespaceMappingException("The '" + property + "' of namespace '" + source + "' must be an array of strings");
            }
            values.add(value.asText());
        }
        return values;
    }

    private static int validateNamespaces(Configuration config, Field field, ValidationOutput problems) {
        int errors = 0;
        for (String namespace : config.getList(field)) {
            if (Strings.count(namespace, WildcardPattern.WILDCARD) > 1) {
                problems.accept(field, namespace, "A namespace may contain at most one '*' wildcard");
                ++errors;
            }
        }
        return errors;
    }

    private static int validateNamespaceExcludeList(Configuration config, Field field, ValidationOutput problems) {
        String includeList = config.getString(NAMESPACE_INCLUDE_LIST);
        String excludeList = config.getString(NAMESPACE_EXCLUDE_LIST);
        if (includeList != null && excludeList != null) {
            problems.accept(NAMESPACE_EXCLUDE_LIST, excludeList, NAMESPACE_INCLUDE_LIST_ALREADY_SPECIFIED_ERROR_MSG);
            return 1;
        }
        return 0;
    }

    private static int validateFieldExcludeList(Configuration config, Field field, ValidationOutput problems) {
        String includeList = config.getString(FIELD_INCLUDE_LIST);
        String excludeList = config.getString(FIELD_EXCLUDE_LIST);
        if (includeList != null && excludeList != null) {
            problems.accept(FIELD_EXCLUDE_LIST, excludeList, FIELD_INCLUDE_LIST_ALREADY_SPECIFIED_ERROR_MSG);
            return 1;
        }
        return 0;
    }

    private static int validateMapping(Configuration config, Field field, ValidationOutput problems) {
        String mapping = config.getString(field);
        if (mapping == null) {
            return 0;
        }
        try {
            NamespaceMapper.Builder builder = NamespaceMapper.builder();
            applyMapping(mapping, builder);
            builder.build();
        }
        catch (NamespaceMappingException e) {
            problems.accept(field, mapping, e.getMessage());
            return 1;
        }
        return 0;
    }
}
