/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.cache;

import java.util.Collections;
import java.util.List;

import io.changestage.annotation.Immutable;
import io.changestage.pipeline.ChangeEvent;
import io.changestage.pipeline.Position;

/**
 * The ready events retrieved from one table by {@link RedoEventCache#pop(io.changestage.relational.TableId)}.
 *
 * @param <T> the type of the events
 */
@Immutable
public final class PopResult<T extends ChangeEvent> {

    private static final PopResult<?> EMPTY = new PopResult<>(Collections.emptyList(), 0L, Position.ZERO, 0);

    private final List<T> events;
    private final long size;
    private final Position lastPosition;
    private final int pushCount;

    PopResult(List<T> events, long size, Position lastPosition, int pushCount) {
        this.events = events;
        this.size = size;
        this.lastPosition = lastPosition;
        this.pushCount = pushCount;
    }

    @SuppressWarnings("unchecked")
    public static <T extends ChangeEvent> PopResult<T> empty() {
        return (PopResult<T>) EMPTY;
    }

    /**
     * @return the retrieved events in the order they were pushed; never null
     */
    public List<T> events() {
        return events;
    }

    /**
     * @return the number of bytes the retrieved events held in the cache
     */
    public long size() {
        return size;
    }

    /**
     * @return the position of the last retrieved event, or {@link Position#ZERO} if nothing was retrieved
     */
    public Position lastPosition() {
        return lastPosition;
    }

    /**
     * @return the number of push calls the retrieved events originate from, which is lower than the number of
     *         events whenever a call pushed several events of the same source record
     */
    public int pushCount() {
        return pushCount;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public String toString() {
        return "PopResult [events=" + events.size() + ", size=" + size + ", lastPosition=" + lastPosition + ", pushCount=" + pushCount + "]";
    }
}
