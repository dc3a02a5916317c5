/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.config;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import io.oplogrelay.annotation.Immutable;
import io.oplogrelay.config.Field.ValidationOutput;
import io.oplogrelay.util.Strings;

/**
 * An immutable representation of a relay configuration. A {@link Configuration} instance can be obtained
 * {@link #from(Properties) from Properties} or {@link #from(Map) from a Map}, or built by first {@link #create() creating a
 * builder} and then using that builder to populate and {@link Builder#build() return} the immutable instance.
 * <p>
 * A Configuration object is basically a decorator around a {@link Properties} object. Values are read either by key or
 * through a {@link Field} definition, in which case the field's default value applies when the key is absent.
 */
@Immutable
public interface Configuration {

    /**
     * A builder of Configuration objects.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder() {
        }

        protected Builder(Properties props) {
            this.props.putAll(props);
        }

        /**
         * Associate the given value with the specified key. A null value removes the key.
         *
         * @param key the key
         * @param value the value
         * @return this builder object so methods can be chained together; never null
         */
        public Builder with(String key, Object value) {
            if (value == null) {
                props.remove(key);
            }
            else if (value instanceof Collection<?>) {
                props.setProperty(key, Strings.join(",", (Collection<?>) value));
            }
            else {
                props.setProperty(key, value.toString());
            }
            return this;
        }

        /**
         * Associate the given value with the key of the specified field.
         *
         * @param field the predefined field for the key
         * @param value the value
         * @return this builder object so methods can be chained together; never null
         */
        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        /**
         * Build and return the immutable configuration.
         *
         * @return the immutable configuration; never null
         */
        public Configuration build() {
            return Configuration.from(props);
        }
    }

    /**
     * Create a new {@link Builder configuration builder}.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Create a new {@link Builder configuration builder} that starts with a copy of the supplied configuration.
     *
     * @param config the configuration to copy; may be null
     * @return the configuration builder
     */
    static Builder copy(Configuration config) {
        return config != null ? new Builder(config.asProperties()) : new Builder();
    }

    /**
     * Obtain an empty configuration.
     *
     * @return an empty configuration; never null
     */
    static Configuration empty() {
        return from(new Properties());
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object. The supplied {@link Properties} object is
     * copied so that the resulting Configuration cannot be modified.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return props.toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and object values. Collection values are
     * joined into a comma-separated string.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        Builder builder = create();
        if (properties != null) {
            properties.forEach(builder::with);
        }
        return builder.build();
    }

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * Determine whether this configuration contains a key-value pair with the given key and the value is non-null
     *
     * @param key the key
     * @return true if the configuration contains the key, or false otherwise
     */
    default boolean hasKey(String key) {
        return getString(key) != null;
    }

    default boolean hasKey(Field field) {
        return hasKey(field.name());
    }

    default boolean isEmpty() {
        return keys().isEmpty();
    }

    /**
     * Get the string value associated with the given key, returning the default value if there is no such key-value pair.
     *
     * @param key the key for the configuration property
     * @param defaultValueSupplier the supplier of value that should be returned by default if there is no such key-value pair in
     *            the configuration; may be null and may return null
     * @return the configuration value, or the {@code defaultValue} if there is no such key-value pair in the configuration
     */
    default String getString(String key, Supplier<String> defaultValueSupplier) {
        String value = getString(key);
        return value != null ? value : (defaultValueSupplier != null ? defaultValueSupplier.get() : null);
    }

    /**
     * Get the string value associated with the given field, returning the field's default value if there is no such key-value
     * pair in this configuration.
     *
     * @param field the field; may not be null
     * @return the configuration's value for the field, or the field's {@link Field#defaultValue() default value} if there is no
     *         such key-value pair in the configuration
     */
    default String getString(Field field) {
        return getString(field.name(), field::defaultValueAsString);
    }

    /**
     * Get the trimmed, non-blank items of the comma-separated value associated with the given field.
     *
     * @param field the field; may not be null
     * @return the list of values; never null but empty if there is no value for the field
     */
    default List<String> getList(Field field) {
        return getList(field, Function.identity());
    }

    default <T> List<T> getList(Field field, Function<String, T> converter) {
        String value = getString(field);
        if (value == null) {
            return Collections.emptyList();
        }
        return Strings.listOfTrimmed(value, ',', converter);
    }

    /**
     * Get the long value associated with the given field, returning the field's default value if there is no such key-value
     * pair in this configuration.
     *
     * @param field the field; may not be null
     * @return the long value
     * @throws NumberFormatException if the value cannot be parsed as a long
     */
    default long getLong(Field field) {
        return Long.parseLong(getString(field).trim());
    }

    /**
     * Get a copy of these configuration properties as a Properties object.
     *
     * @return the properties object; never null
     */
    default Properties asProperties() {
        Properties props = new Properties();
        keys().forEach(key -> {
            String value = getString(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        });
        return props;
    }

    /**
     * Validate the supplied fields in this configuration. Extra fields not described by the supplied {@code fields} parameter
     * are not validated.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validate(Iterable<Field> fields, ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields in this configuration, recording each problem as a readable message.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept("The '" + f.name() + "' value is invalid: " + problem);
            }
            else {
                problems.accept("The '" + f.name() + "' value '" + v + "' is invalid: " + problem);
            }
        });
    }
}
