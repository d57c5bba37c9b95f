/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.cache;

import java.util.ArrayList;
import java.util.List;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.changestage.ChangeStageException;
import io.changestage.config.Configuration;
import io.changestage.config.Field;
import io.changestage.metrics.DefaultEventCacheMetrics;
import io.changestage.metrics.EventCacheMetrics;

/**
 * Configuration of a {@link RedoEventCache}.
 */
public class RedoEventCacheConfig {

    public static final long DEFAULT_CAPACITY_BYTES = 64L * 1024L * 1024L;

    public static final Field JOB_ID = Field.create("redo.event.cache.job.id")
            .withDisplayName("Replication job identifier")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDescription("Identifier of the replication job owning the cache, used in log messages and as the JMX name of its metrics.")
            .required();

    public static final Field CAPACITY_BYTES = Field.create("redo.event.cache.capacity.bytes")
            .withDisplayName("Redo event cache capacity in bytes")
            .withType(Type.LONG)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withDescription("Maximum number of bytes of change events staged across all tables of the job. "
                    + "Once reached, a table whose next admission does not fit is marked as overflowed. Defaults to "
                    + DEFAULT_CAPACITY_BYTES + ".")
            .withDefault(DEFAULT_CAPACITY_BYTES)
            .withValidation(Field::isPositiveLong);

    public static final Field METRICS_ENABLED = Field.create("redo.event.cache.metrics.enabled")
            .withDisplayName("Expose cache metrics")
            .withType(Type.BOOLEAN)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Whether the number of cached bytes is exposed as a JMX MBean. Defaults to true.")
            .withDefault(true);

    public static final Field.Set ALL_FIELDS = Field.setOf(JOB_ID, CAPACITY_BYTES, METRICS_ENABLED);

    private final Configuration config;

    public RedoEventCacheConfig(Configuration config) {
        this.config = config;
    }

    public static ConfigDef configDef() {
        return Field.group(new ConfigDef(), "Redo event cache", JOB_ID, CAPACITY_BYTES, METRICS_ENABLED);
    }

    /**
     * Validate all fields of this configuration.
     *
     * @throws ChangeStageException listing every problem if at least one field is invalid
     */
    public void validateAndThrow() {
        List<String> problems = new ArrayList<>();
        if (!config.validateAndRecord(ALL_FIELDS, problems::add)) {
            throw new ChangeStageException("Invalid redo event cache configuration: " + String.join("; ", problems));
        }
    }

    public String getJobId() {
        return config.getString(JOB_ID);
    }

    public long getCapacityBytes() {
        return config.getLong(CAPACITY_BYTES);
    }

    public boolean isMetricsEnabled() {
        return config.getBoolean(METRICS_ENABLED);
    }

    /**
     * Create the metrics sink for a cache using this configuration, registering it over JMX when enabled.
     *
     * @return the metrics; never null
     */
    public EventCacheMetrics createMetrics() {
        if (!isMetricsEnabled()) {
            return EventCacheMetrics.NOOP;
        }
        DefaultEventCacheMetrics metrics = new DefaultEventCacheMetrics(getJobId(), getCapacityBytes());
        metrics.register();
        return metrics;
    }
}
