/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.junit.Before;
import org.junit.Test;

public class ConfigurationTest {

    private static final Field INTERVAL = Field.create("flush.interval.ms")
            .withType(Type.LONG)
            .withDefault(1000L)
            .withValidation(Field::isPositiveLong);

    private static final Field NAMES = Field.create("names")
            .withType(Type.LIST)
            .withDescription("Comma-separated names");

    private Configuration config;

    @Before
    public void beforeEach() {
        config = Configuration.create().with("A", "a")
                .with("B", "b")
                .with("1", 1)
                .build();
    }

    @Test
    public void shouldConvertFromProperties() {
        Properties props = new Properties();
        props.setProperty("A", "a");
        props.setProperty("B", "b");
        props.setProperty("1", "1");
        config = Configuration.from(props);
        assertThat(config.getString("A")).isEqualTo("a");
        assertThat(config.getString("B")).isEqualTo("b");
        assertThat(config.getString("1")).isEqualTo("1");
        assertThat(config.keys()).containsOnly("A", "B", "1");
    }

    @Test
    public void shouldNotBeModifiedAfterCreation() {
        Properties props = new Properties();
        props.setProperty("1", "one");
        config = Configuration.from(props);

        props.setProperty("1", "newValue");
        assertThat(config.getString("1")).isEqualTo("one");
    }

    @Test
    public void shouldJoinCollectionValuesFromMap() {
        Map<String, Object> values = new HashMap<>();
        values.put(NAMES.name(), Arrays.asList("db1.a", "db2.*"));
        config = Configuration.from(values);
        assertThat(config.getString(NAMES)).isEqualTo("db1.a,db2.*");
        assertThat(config.getList(NAMES)).containsExactly("db1.a", "db2.*");
    }

    @Test
    public void shouldReturnTrimmedListItemsAndSkipBlanks() {
        config = Configuration.create().with(NAMES, " a , b,, c ").build();
        assertThat(config.getList(NAMES)).containsExactly("a", "b", "c");
    }

    @Test
    public void shouldReturnEmptyListWhenFieldIsAbsent() {
        assertThat(config.getList(NAMES)).isEmpty();
        assertThat(config.hasKey(NAMES)).isFalse();
    }

    @Test
    public void shouldUseFieldDefaultWhenAbsent() {
        assertThat(config.getLong(INTERVAL)).isEqualTo(1000L);
        config = Configuration.copy(config).with(INTERVAL, 250).build();
        assertThat(config.getLong(INTERVAL)).isEqualTo(250L);
        assertThat(config.getString("A")).isEqualTo("a");
    }

    @Test
    public void shouldReportInvalidValues() {
        config = Configuration.create().with(INTERVAL, "-5").build();
        List<String> problems = new ArrayList<>();
        assertThat(config.validateAndRecord(Field.setOf(INTERVAL, NAMES), problems::add)).isFalse();
        assertThat(problems).hasSize(1);
        assertThat(problems.get(0)).contains("flush.interval.ms").contains("'-5'");

        problems.clear();
        config = Configuration.create().with(INTERVAL, "soon").build();
        assertThat(config.validateAndRecord(Field.setOf(INTERVAL), problems::add)).isFalse();
        assertThat(problems).anyMatch(p -> p.contains("A long value is expected"));
    }

    @Test
    public void shouldAcceptValidValues() {
        config = Configuration.create().with(INTERVAL, "10").with(NAMES, "x").build();
        assertThat(config.validateAndRecord(Field.setOf(INTERVAL, NAMES), problem -> {
            throw new AssertionError(problem);
        })).isTrue();
    }

    @Test
    public void shouldDefineFieldsInConfigDef() {
        ConfigDef configDef = Field.group(new ConfigDef(), "Test", INTERVAL, NAMES);
        assertThat(configDef.names()).containsOnly(INTERVAL.name(), NAMES.name());
        assertThat(configDef.configKeys().get(INTERVAL.name()).defaultValue).isEqualTo(1000L);
        assertThat(configDef.configKeys().get(NAMES.name()).type).isEqualTo(Type.LIST);
    }
}
