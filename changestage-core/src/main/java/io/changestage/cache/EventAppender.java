/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.cache;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.changestage.annotation.GuardedBy;
import io.changestage.annotation.ThreadSafe;
import io.changestage.pipeline.ChangeEvent;
import io.changestage.pipeline.Position;
import io.changestage.relational.TableId;
import io.changestage.util.FunctionalReadWriteLock;

/**
 * The buffer of one table within a {@link RedoEventCache}.
 * <p>
 * Events are appended at the tail by {@link #push} and consumed from the head by {@link RedoEventCache#pop}. Only the
 * events of transactions that were completely pushed are <em>ready</em>; the ones behind them are <em>pending</em> and
 * never retrieved. Each push reserves its bytes from the budget shared by all tables of the cache. A push that does not
 * fit marks the appender as broken, and every later push is rejected until {@link #cleanBrokenEvents()} drops the
 * pending events.
 * <p>
 * At most one producer thread pushes and at most one consumer thread pops at a time. Pushing and cleaning take the
 * exclusive lock, popping takes the shared one although it moves the head, which is safe only as long as there is a
 * single consumer.
 *
 * @param <T> the type of the events
 */
@ThreadSafe
public final class EventAppender<T extends ChangeEvent> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventAppender.class);

    private static final int INITIAL_CAPACITY = 16;

    private final TableId tableId;
    private final RedoEventCache<T> cache;
    private final FunctionalReadWriteLock lock = FunctionalReadWriteLock.reentrant();

    @GuardedBy("lock")
    private Object[] events = new Object[INITIAL_CAPACITY];
    @GuardedBy("lock")
    private long[] sizes = new long[INITIAL_CAPACITY];
    // 1 for the first event of a push call, 0 for the other events of the same source record
    @GuardedBy("lock")
    private byte[] pushCounts = new byte[INITIAL_CAPACITY];
    @GuardedBy("lock")
    private int head;
    @GuardedBy("lock")
    private int length;
    @GuardedBy("lock")
    private int readyCount;
    // false once drained to empty and dropped from the table map, until the next push puts it back
    @GuardedBy("lock")
    private boolean attached = true;

    private volatile boolean broken;
    private volatile boolean detached;

    EventAppender(TableId tableId, RedoEventCache<T> cache) {
        this.tableId = tableId;
        this.cache = cache;
    }

    public TableId tableId() {
        return tableId;
    }

    /**
     * Push one event of a source record, together with the other events produced from the same record.
     *
     * @param event the first event of the source record; may not be null
     * @param size the number of bytes charged for the whole source record
     * @param txnFinished whether the record completes its transaction, making every buffered event ready
     * @param eventsInSameBatch the other events produced from the same source record; they are charged no bytes
     * @return {@code true} if the events were buffered, or {@code false} if the cache has no room for them
     *         ({@link #isBroken()}), or this appender no longer belongs to the cache ({@link #isDetached()}), in
     *         which case pushes have to go to the appender returned by {@link RedoEventCache#getAppender}
     */
    @SafeVarargs
    public final boolean push(T event, long size, boolean txnFinished, T... eventsInSameBatch) {
        return doPush(event, size, txnFinished, Arrays.asList(eventsInSameBatch));
    }

    /**
     * Push one event charging its estimated {@link ChangeEvent#objectSize() object size}.
     *
     * @see #push(ChangeEvent, long, boolean, ChangeEvent...)
     */
    public boolean push(T event, boolean txnFinished) {
        if (broken || detached) {
            return false;
        }
        return doPush(event, event.objectSize(), txnFinished, Collections.emptyList());
    }

    /**
     * Push all events produced from one source record. The first event carries the size, the others are pushed
     * along with it.
     *
     * @param events the events of the source record; may be empty
     * @param size the number of bytes charged for the whole source record
     * @param txnFinished whether the record completes its transaction
     * @return {@code true} if the events were buffered or there were none, {@code false} otherwise
     */
    public boolean pushBatch(List<T> events, long size, boolean txnFinished) {
        if (events.isEmpty()) {
            return true;
        }
        return doPush(events.get(0), size, txnFinished, events.subList(1, events.size()));
    }

    private boolean doPush(T event, long size, boolean txnFinished, List<T> eventsInSameBatch) {
        if (broken || detached) {
            return false;
        }
        if (event == null) {
            throw new NullPointerException("The event may not be null");
        }
        if (size < 0) {
            throw new IllegalArgumentException("The size of an event may not be negative: " + size);
        }

        if (!cache.tryAllocate(size)) {
            broken = true;
            LOGGER.debug("Redo event cache of job '{}' is full, table '{}' can not buffer {} more bytes", cache.jobId(), tableId, size);
            return false;
        }

        boolean appended = lock.write(() -> {
            if (detached) {
                return false;
            }
            if (!attached) {
                if (!cache.reattach(this)) {
                    // drained and replaced by a newer appender of the same table
                    detached = true;
                    return false;
                }
                attached = true;
            }
            append(event, size, (byte) 1);
            for (T other : eventsInSameBatch) {
                append(other, 0L, (byte) 0);
            }
            if (txnFinished) {
                readyCount = length;
            }
            return true;
        });
        if (!appended) {
            // removed while the bytes were being reserved, or replaced by a newer appender of the same table
            cache.release(size);
        }
        return appended;
    }

    @GuardedBy("lock")
    private void append(T event, long size, byte pushCount) {
        ensureRoomForOneMore();
        int index = head + length;
        events[index] = event;
        sizes[index] = size;
        pushCounts[index] = pushCount;
        length++;
    }

    @GuardedBy("lock")
    private void ensureRoomForOneMore() {
        if (head + length < events.length) {
            return;
        }
        if (head > 0 && length < events.length / 2) {
            // enough consumed slots at the front, shift the live events back to the start
            System.arraycopy(events, head, events, 0, length);
            System.arraycopy(sizes, head, sizes, 0, length);
            System.arraycopy(pushCounts, head, pushCounts, 0, length);
            Arrays.fill(events, length, head + length, null);
            head = 0;
            return;
        }
        int newCapacity = events.length + (events.length >> 1);
        Object[] newEvents = new Object[newCapacity];
        long[] newSizes = new long[newCapacity];
        byte[] newPushCounts = new byte[newCapacity];
        System.arraycopy(events, head, newEvents, 0, length);
        System.arraycopy(sizes, head, newSizes, 0, length);
        System.arraycopy(pushCounts, head, newPushCounts, 0, length);
        events = newEvents;
        sizes = newSizes;
        pushCounts = newPushCounts;
        head = 0;
    }

    /**
     * Drop the pending events that were buffered after the last completed transaction and clear the broken state.
     * Ready events stay available for retrieval.
     *
     * @return the number of bytes returned to the cache
     */
    public long cleanBrokenEvents() {
        long pendingSize = lock.write(() -> {
            long pending = 0L;
            int from = head + readyCount;
            int to = head + length;
            for (int i = from; i < to; i++) {
                pending += sizes[i];
                events[i] = null;
            }
            length = readyCount;
            if (length == 0) {
                head = 0;
            }
            broken = false;
            return pending;
        });
        cache.release(pendingSize);
        if (pendingSize > 0) {
            LOGGER.info("Dropped {} bytes of pending events of table '{}' from redo event cache of job '{}'", pendingSize, tableId, cache.jobId());
        }
        return pendingSize;
    }

    /**
     * Remove the ready events at the head, at most up to the given bound. Called by the single consumer of this table.
     *
     * @param upperBound the greatest position to retrieve; may be null to retrieve all ready events
     * @return the result; never null
     */
    @SuppressWarnings("unchecked")
    PopResult<T> pop(Position upperBound) {
        return lock.read(() -> {
            if (length == 0 || readyCount == 0) {
                return PopResult.<T> empty();
            }
            int fetchCount = readyCount;
            if (upperBound != null) {
                fetchCount = countNotAfter(upperBound);
                if (fetchCount == 0) {
                    return PopResult.<T> empty();
                }
            }

            List<T> fetched = new ArrayList<>(fetchCount);
            long size = 0L;
            int pushCount = 0;
            for (int i = head; i < head + fetchCount; i++) {
                fetched.add((T) events[i]);
                size += sizes[i];
                pushCount += pushCounts[i];
                events[i] = null;
            }
            Position lastPosition = fetched.get(fetchCount - 1).position();

            head += fetchCount;
            length -= fetchCount;
            readyCount -= fetchCount;
            if (length == 0) {
                head = 0;
                attached = false;
                cache.drained(this);
            }
            return new PopResult<>(fetched, size, lastPosition, pushCount);
        });
    }

    /**
     * Binary search for the number of leading ready events whose position is not after the bound. Valid because
     * events are pushed in non-decreasing position order.
     */
    @GuardedBy("lock")
    @SuppressWarnings("unchecked")
    private int countNotAfter(Position upperBound) {
        int low = 0;
        int high = readyCount;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (((T) events[head + mid]).position().compareTo(upperBound) > 0) {
                high = mid;
            }
            else {
                low = mid + 1;
            }
        }
        return low;
    }

    /**
     * Discard every buffered event and reject all later pushes. Called once the appender is no longer part of the cache.
     *
     * @return the number of bytes the discarded events held
     */
    long discardAll() {
        return lock.write(() -> {
            detached = true;
            long discarded = 0L;
            for (int i = head; i < head + length; i++) {
                discarded += sizes[i];
            }
            events = new Object[INITIAL_CAPACITY];
            sizes = new long[INITIAL_CAPACITY];
            pushCounts = new byte[INITIAL_CAPACITY];
            head = 0;
            length = 0;
            readyCount = 0;
            return discarded;
        });
    }

    /**
     * @return whether a push did not fit into the cache and pushes are rejected until {@link #cleanBrokenEvents()}
     */
    public boolean isBroken() {
        return broken;
    }

    /**
     * @return whether this appender was removed from its cache by {@link RedoEventCache#removeTable(TableId)}, or
     *         was drained and replaced by a newer appender of the same table; every later push is rejected
     */
    public boolean isDetached() {
        return detached;
    }

    /**
     * @return the number of buffered events, ready or pending
     */
    public int size() {
        return lock.read(() -> length);
    }

    public int readyCount() {
        return lock.read(() -> readyCount);
    }

    public int pendingCount() {
        return lock.read(() -> length - readyCount);
    }

    /**
     * @return the number of bytes reserved by the buffered events
     */
    public long bufferedBytes() {
        return lock.read(() -> {
            long total = 0L;
            for (int i = head; i < head + length; i++) {
                total += sizes[i];
            }
            return total;
        });
    }

    @Override
    public String toString() {
        return "EventAppender [table=" + tableId + ", broken=" + broken + ", detached=" + detached + "]";
    }
}
