/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.config;

import static io.changestage.cache.RedoEventCacheConfig.ALL_FIELDS;
import static io.changestage.cache.RedoEventCacheConfig.CAPACITY_BYTES;
import static io.changestage.cache.RedoEventCacheConfig.DEFAULT_CAPACITY_BYTES;
import static io.changestage.cache.RedoEventCacheConfig.JOB_ID;
import static io.changestage.cache.RedoEventCacheConfig.METRICS_ENABLED;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

public class ConfigurationTest {

    @Test
    public void shouldReadTypedValues() {
        Configuration config = Configuration.create()
                .with(JOB_ID, "job-1")
                .with(CAPACITY_BYTES, 4096L)
                .with(METRICS_ENABLED, false)
                .build();

        assertThat(config.getString(JOB_ID)).isEqualTo("job-1");
        assertThat(config.getLong(CAPACITY_BYTES)).isEqualTo(4096L);
        assertThat(config.getBoolean(METRICS_ENABLED)).isFalse();
    }

    @Test
    public void shouldFallBackToDefaults() {
        Configuration config = Configuration.from(new Properties());

        assertThat(config.getString(JOB_ID)).isNull();
        assertThat(config.getString(CAPACITY_BYTES)).isEqualTo(Long.toString(DEFAULT_CAPACITY_BYTES));
        assertThat(config.getLong(CAPACITY_BYTES)).isEqualTo(DEFAULT_CAPACITY_BYTES);
        assertThat(config.getBoolean(METRICS_ENABLED)).isTrue();
    }

    @Test
    public void shouldFallBackToDefaultsForUnparsableValues() {
        Configuration config = Configuration.create()
                .with(CAPACITY_BYTES, "lots")
                .with(METRICS_ENABLED, "maybe")
                .build();

        assertThat(config.getLong(CAPACITY_BYTES)).isEqualTo(DEFAULT_CAPACITY_BYTES);
        assertThat(config.getBoolean(METRICS_ENABLED)).isTrue();
    }

    @Test
    public void shouldCopyProperties() {
        Properties props = new Properties();
        props.setProperty(JOB_ID.name(), "job-1");
        props.setProperty(CAPACITY_BYTES.name(), " 512 ");
        Configuration config = Configuration.from(props);
        props.setProperty(JOB_ID.name(), "changed");

        assertThat(config.getString(JOB_ID)).isEqualTo("job-1");
        assertThat(config.getLong(CAPACITY_BYTES)).isEqualTo(512L);
    }

    @Test
    public void shouldUnsetValueWithNull() {
        Configuration config = Configuration.create()
                .with(JOB_ID, "job-1")
                .with(JOB_ID, (String) null)
                .build();

        assertThat(config.getString(JOB_ID)).isNull();
    }

    @Test
    public void shouldReportEveryInvalidField() {
        Configuration config = Configuration.create()
                .with(CAPACITY_BYTES, 0L)
                .with(METRICS_ENABLED, "yes")
                .build();
        List<String> problems = new ArrayList<>();

        assertThat(config.validateAndRecord(ALL_FIELDS, problems::add)).isFalse();
        assertThat(problems).containsExactly(
                "The 'redo.event.cache.job.id' value is invalid: A value is required",
                "The 'redo.event.cache.capacity.bytes' value '0' is invalid: A positive, non-zero long value is expected",
                "The 'redo.event.cache.metrics.enabled' value 'yes' is invalid: Either 'true' or 'false' is expected");
    }

    @Test
    public void shouldReportNonNumericLongOnce() {
        Configuration config = Configuration.create()
                .with(JOB_ID, "job-1")
                .with(CAPACITY_BYTES, "ten")
                .build();
        List<String> problems = new ArrayList<>();

        assertThat(config.validateAndRecord(ALL_FIELDS, problems::add)).isFalse();
        assertThat(problems).containsExactly("The 'redo.event.cache.capacity.bytes' value 'ten' is invalid: A long value is expected");
    }

    @Test
    public void shouldAcceptValidConfiguration() {
        Configuration config = Configuration.create()
                .with(JOB_ID, "job-1")
                .with(CAPACITY_BYTES, 1L)
                .build();

        assertThat(config.validateAndRecord(ALL_FIELDS, problem -> {
            throw new AssertionError(problem);
        })).isTrue();
    }

    @Test
    public void shouldRejectBlankRequiredValue() {
        Configuration config = Configuration.create()
                .with(JOB_ID, "  ")
                .build();
        List<String> problems = new ArrayList<>();

        assertThat(config.validateAndRecord(Field.setOf(JOB_ID), problems::add)).isFalse();
        assertThat(problems).containsExactly("The 'redo.event.cache.job.id' value '  ' is invalid: A value is required");
    }

    @Test
    public void shouldCompareFieldsByName() {
        assertThat(Field.create(JOB_ID.name())).isEqualTo(JOB_ID).hasSameHashCodeAs(JOB_ID);
        assertThat(ALL_FIELDS).containsExactly(JOB_ID, CAPACITY_BYTES, METRICS_ENABLED);
    }
}
