/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.changestage.annotation.GuardedBy;
import io.changestage.annotation.ThreadSafe;
import io.changestage.metrics.EventCacheMetrics;
import io.changestage.pipeline.ChangeEvent;
import io.changestage.pipeline.Position;
import io.changestage.relational.TableId;

/**
 * Stages the change events fetched for the tables of one replication job until they are written to the redo log.
 * <p>
 * Every table has its own {@link EventAppender}, created on first use. All appenders share one byte budget: a push
 * reserves its bytes with a compare-and-set loop on a single counter, so that pushes of different tables never wait
 * on each other, and {@link #pop} returns the bytes of the retrieved events. The structural lock only guards the
 * membership of the table map and is never held while events are copied.
 * <p>
 * When the budget is exhausted, the appender whose push did not fit becomes broken and rejects every later push. The
 * caller is expected to read those events from the upstream source instead and to call
 * {@link EventAppender#cleanBrokenEvents()} once it wants to use the cache again.
 *
 * @param <T> the type of the events
 */
@ThreadSafe
public class RedoEventCache<T extends ChangeEvent> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedoEventCache.class);

    private final String jobId;
    private final long capacity;
    private final AtomicLong allocated = new AtomicLong();
    private final EventCacheMetrics metrics;

    private final Lock lock = new ReentrantLock();
    @GuardedBy("lock")
    private final Map<TableId, EventAppender<T>> tables = new HashMap<>();

    public RedoEventCache(String jobId, long capacity) {
        this(jobId, capacity, EventCacheMetrics.NOOP);
    }

    public RedoEventCache(String jobId, long capacity, EventCacheMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("The capacity of the redo event cache must be positive: " + capacity);
        }
        this.jobId = Objects.requireNonNull(jobId, "The job identifier may not be null");
        this.capacity = capacity;
        this.metrics = Objects.requireNonNull(metrics, "The metrics may not be null");
        LOGGER.info("Created redo event cache of job '{}' with a capacity of {} bytes", jobId, capacity);
    }

    /**
     * Create a cache from a validated configuration, together with the metrics it asks for. The metrics are released
     * by {@link #close()}.
     *
     * @param config the configuration; may not be null
     */
    public RedoEventCache(RedoEventCacheConfig config) {
        this(validated(config).getJobId(), config.getCapacityBytes(), config.createMetrics());
    }

    private static RedoEventCacheConfig validated(RedoEventCacheConfig config) {
        config.validateAndThrow();
        return config;
    }

    public String jobId() {
        return jobId;
    }

    public long capacity() {
        return capacity;
    }

    /**
     * @return the number of bytes currently reserved across all tables
     */
    public long allocatedBytes() {
        return allocated.get();
    }

    public int tableCount() {
        lock.lock();
        try {
            return tables.size();
        }
        finally {
            lock.unlock();
        }
    }

    public boolean contains(TableId tableId) {
        lock.lock();
        try {
            return tables.containsKey(tableId);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Get the appender used to push events of the given table, creating it if the table has none.
     * <p>
     * An appender drained to empty by {@link #pop} leaves the cache. A producer still holding it may keep pushing,
     * which puts it back into the cache unless the table got a new appender in the meantime.
     *
     * @param tableId the table; may not be null
     * @return the appender; never null
     */
    public EventAppender<T> getAppender(TableId tableId) {
        Objects.requireNonNull(tableId, "The table identifier may not be null");
        lock.lock();
        try {
            return tables.computeIfAbsent(tableId, id -> new EventAppender<>(id, this));
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Retrieve and remove all ready events of the given table.
     *
     * @param tableId the table; may not be null
     * @return the retrieved events, or an {@link PopResult#empty() empty result} if the table has no ready events
     */
    public PopResult<T> pop(TableId tableId) {
        return pop(tableId, null);
    }

    /**
     * Retrieve and remove the ready events of the given table whose position is not after the given bound. If the
     * table is left without any event, it is removed from the cache. Only one thread may pop a given table at a time.
     *
     * @param tableId the table; may not be null
     * @param upperBound the greatest position to retrieve; may be null to retrieve all ready events
     * @return the retrieved events, or an {@link PopResult#empty() empty result} if nothing is ready up to the bound
     */
    public PopResult<T> pop(TableId tableId, Position upperBound) {
        Objects.requireNonNull(tableId, "The table identifier may not be null");
        EventAppender<T> appender;
        lock.lock();
        try {
            appender = tables.get(tableId);
        }
        finally {
            lock.unlock();
        }
        if (appender == null) {
            return PopResult.empty();
        }

        PopResult<T> result = appender.pop(upperBound);
        if (!result.isEmpty()) {
            release(result.size());
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("Popped {} events of table '{}' up to {}", result.events().size(), tableId, result.lastPosition());
            }
        }
        return result;
    }

    /**
     * Stop tracking the given table: its appender leaves the cache, its events are discarded and their bytes are
     * returned to the budget. Pushes to the removed appender are rejected from now on.
     *
     * @param tableId the table; may not be null
     * @return the number of bytes the discarded events held
     */
    public long removeTable(TableId tableId) {
        Objects.requireNonNull(tableId, "The table identifier may not be null");
        EventAppender<T> appender;
        lock.lock();
        try {
            appender = tables.remove(tableId);
        }
        finally {
            lock.unlock();
        }
        if (appender == null) {
            return 0L;
        }

        long discarded = appender.discardAll();
        release(discarded);
        LOGGER.info("Removed table '{}' from redo event cache of job '{}', {} bytes released", tableId, jobId, discarded);
        return discarded;
    }

    /**
     * Remove all tables and release the metrics of this cache.
     */
    @Override
    public void close() {
        List<TableId> tableIds;
        lock.lock();
        try {
            tableIds = new ArrayList<>(tables.keySet());
        }
        finally {
            lock.unlock();
        }
        tableIds.forEach(this::removeTable);
        metrics.close();
        LOGGER.info("Closed redo event cache of job '{}'", jobId);
    }

    /**
     * Reserve the given number of bytes unless they do not fit into the remaining budget.
     */
    boolean tryAllocate(long size) {
        while (true) {
            long current = allocated.get();
            if (size > capacity - current) {
                return false;
            }
            if (allocated.compareAndSet(current, current + size)) {
                reportAdmitted(size);
                return true;
            }
        }
    }

    /**
     * Return the given number of bytes to the budget.
     */
    void release(long size) {
        if (size == 0L) {
            return;
        }
        long remaining = allocated.addAndGet(-size);
        assert remaining >= 0 : "More bytes released than allocated in redo event cache of job '" + jobId + "'";
        reportReleased(size);
    }

    /**
     * Called by an appender holding its lock once its last event was popped.
     */
    void drained(EventAppender<T> appender) {
        lock.lock();
        try {
            if (tables.remove(appender.tableId(), appender)) {
                LOGGER.debug("Table '{}' drained from redo event cache of job '{}'", appender.tableId(), jobId);
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Put back an appender that was drained but is pushed to again by a producer still holding it. Called with the
     * appender's lock held.
     *
     * @return {@code false} if the table got a new appender in the meantime
     */
    boolean reattach(EventAppender<T> appender) {
        lock.lock();
        try {
            EventAppender<T> existing = tables.putIfAbsent(appender.tableId(), appender);
            return existing == null || existing == appender;
        }
        finally {
            lock.unlock();
        }
    }

    private void reportAdmitted(long size) {
        try {
            metrics.add(size);
        }
        catch (RuntimeException e) {
            LOGGER.warn("Failed to record {} admitted bytes in the metrics of redo event cache of job '{}'", size, jobId, e);
        }
    }

    private void reportReleased(long size) {
        try {
            metrics.subtract(size);
        }
        catch (RuntimeException e) {
            LOGGER.warn("Failed to record {} released bytes in the metrics of redo event cache of job '{}'", size, jobId, e);
        }
    }

    @Override
    public String toString() {
        return "RedoEventCache [jobId=" + jobId + ", capacity=" + capacity + ", allocated=" + allocated.get() + "]";
    }
}
