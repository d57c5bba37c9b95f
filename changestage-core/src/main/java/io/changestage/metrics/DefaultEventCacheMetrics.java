/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.metrics;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import io.changestage.annotation.ThreadSafe;

/**
 * JMX backed {@link EventCacheMetrics} of the redo event cache of one job.
 */
@ThreadSafe
public class DefaultEventCacheMetrics extends Metrics implements EventCacheMetrics, EventCacheMetricsMXBean {

    public static final String CONTEXT_NAME = "redo-event-cache";

    private final long capacity;
    private final AtomicLong cachedBytes = new AtomicLong();
    private final LongAdder admittedBytes = new LongAdder();
    private final LongAdder releasedBytes = new LongAdder();

    public DefaultEventCacheMetrics(String jobId, long capacity) {
        super(CONTEXT_NAME, Collections.singletonMap("job", jobId));
        this.capacity = capacity;
    }

    @Override
    public void add(long bytes) {
        cachedBytes.addAndGet(bytes);
        admittedBytes.add(bytes);
    }

    @Override
    public void subtract(long bytes) {
        cachedBytes.addAndGet(-bytes);
        releasedBytes.add(bytes);
    }

    @Override
    public long getCachedBytes() {
        return cachedBytes.get();
    }

    @Override
    public long getCapacityBytes() {
        return capacity;
    }

    @Override
    public long getAdmittedBytes() {
        return admittedBytes.sum();
    }

    @Override
    public long getReleasedBytes() {
        return releasedBytes.sum();
    }

    @Override
    public void reset() {
        admittedBytes.reset();
        releasedBytes.reset();
    }

    @Override
    public void close() {
        unregister();
    }
}
