/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.metrics;

/**
 * Metrics exposed over JMX for one redo event cache.
 */
public interface EventCacheMetricsMXBean {

    /**
     * @return the bytes currently staged across all tables
     */
    long getCachedBytes();

    long getCapacityBytes();

    /**
     * @return the total bytes ever admitted since the last reset
     */
    long getAdmittedBytes();

    /**
     * @return the total bytes ever released, by retrieval, overflow recovery or table removal, since the last reset
     */
    long getReleasedBytes();

    void reset();
}
