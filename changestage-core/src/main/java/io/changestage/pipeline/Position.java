/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.pipeline;

import java.util.Objects;

import io.changestage.annotation.Immutable;

/**
 * The place of a change event within a table's change stream, made of the commit sequence of the transaction
 * the event belongs to and the sequence at which that transaction started. Positions are ordered by commit
 * sequence first and start sequence second.
 */
@Immutable
public final class Position implements Comparable<Position> {

    /**
     * The position returned when nothing was retrieved.
     */
    public static final Position ZERO = new Position(0L, 0L);

    private final long commitSequence;
    private final long startSequence;

    private Position(long commitSequence, long startSequence) {
        this.commitSequence = commitSequence;
        this.startSequence = startSequence;
    }

    public static Position of(long commitSequence, long startSequence) {
        if (commitSequence == 0L && startSequence == 0L) {
            return ZERO;
        }
        return new Position(commitSequence, startSequence);
    }

    public long commitSequence() {
        return commitSequence;
    }

    public long startSequence() {
        return startSequence;
    }

    public boolean isZero() {
        return commitSequence == 0L && startSequence == 0L;
    }

    @Override
    public int compareTo(Position that) {
        int diff = Long.compare(this.commitSequence, that.commitSequence);
        if (diff != 0) {
            return diff;
        }
        return Long.compare(this.startSequence, that.startSequence);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Position) {
            Position that = (Position) obj;
            return this.commitSequence == that.commitSequence && this.startSequence == that.startSequence;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(commitSequence, startSequence);
    }

    @Override
    public String toString() {
        return "Position [commitSequence=" + commitSequence + ", startSequence=" + startSequence + "]";
    }
}
