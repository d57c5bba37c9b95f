/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.metrics;

/**
 * Receives the changes of the number of bytes held by a redo event cache. Implementations behave like a
 * gauge: every admission adds to it and every release subtracts from it.
 */
public interface EventCacheMetrics extends AutoCloseable {

    /**
     * A sink that ignores every update.
     */
    EventCacheMetrics NOOP = new EventCacheMetrics() {
        @Override
        public void add(long bytes) {
        }

        @Override
        public void subtract(long bytes) {
        }
    };

    /**
     * Record that the given number of bytes were admitted into the cache.
     *
     * @param bytes the admitted bytes; never negative
     */
    void add(long bytes);

    /**
     * Record that the given number of bytes were released from the cache.
     *
     * @param bytes the released bytes; never negative
     */
    void subtract(long bytes);

    /**
     * Release any resources held by this sink, such as a JMX registration.
     */
    @Override
    default void close() {
    }
}
